package org.example.sysmlapi.generate;

import org.example.sysmlapi.model.Element;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Picks the requirement-related elements out of a commit and summarizes the
 * commit's element types alongside them.
 */
public final class RequirementsReport {

    /** Type tags treated as requirement-related. */
    public static final Set<String> REQUIREMENT_TYPES = Set.of(
        "RequirementUsage",
        "RequirementDefinition",
        "ConcernUsage",
        "ConcernDefinition",
        "ConstraintUsage",
        "ConstraintDefinition",
        "ObjectiveMembership",
        "StakeholderMembership",
        "SubjectMembership",
        "RequirementConstraintMembership",
        "RequirementVerificationMembership",
        "SatisfyRequirementUsage",
        "AssertConstraintUsage"
    );

    private final Element project;
    private final Element commit;
    private final Map<String, Integer> elementsSummary;
    private final List<Element> requirements;

    private RequirementsReport(Element project, Element commit, Map<String, Integer> elementsSummary,
                               List<Element> requirements) {
        this.project = project;
        this.commit = commit;
        this.elementsSummary = elementsSummary;
        this.requirements = requirements;
    }

    public static RequirementsReport of(Element project, Element commit, Collection<Element> elements) {
        Map<String, Integer> counts = new TreeMap<>();
        for (Element element : elements) {
            counts.merge(element.type() != null ? element.type() : "Unknown", 1, Integer::sum);
        }
        Map<String, Integer> summary = new LinkedHashMap<>();
        counts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
            .forEach(e -> summary.put(e.getKey(), e.getValue()));

        List<Element> requirements = elements.stream()
            .filter(RequirementsReport::isRequirement)
            .collect(Collectors.toList());
        return new RequirementsReport(project, commit, summary, requirements);
    }

    public static boolean isRequirement(Element element) {
        return REQUIREMENT_TYPES.contains(element.simpleType());
    }

    public List<Element> requirements() {
        return requirements;
    }

    /** Full type tag to count, by descending count. */
    public Map<String, Integer> elementsSummary() {
        return elementsSummary;
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("project", new JSONObject()
            .put("id", nullable(project.id()))
            .put("name", nullable(project.name()))
            .put("created", nullable(project.string("created"))));
        json.put("commit", new JSONObject()
            .put("id", nullable(commit.id()))
            .put("name", nullable(commit.name()))
            .put("description", nullable(commit.string("description")))
            .put("created", nullable(commit.string("created"))));

        JSONObject summary = new JSONObject();
        elementsSummary.forEach(summary::put);
        json.put("elementsSummary", summary);

        JSONArray list = new JSONArray();
        for (Element req : requirements) {
            list.put(new JSONObject()
                .put("type", nullable(req.type()))
                .put("id", nullable(req.id()))
                .put("name", nullable(req.name()))
                .put("qualifiedName", nullable(req.qualifiedName()))
                .put("shortName", nullable(req.shortName())));
        }
        json.put("requirements", list);
        return json;
    }

    /** Type summary table followed by one block per requirement. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Element Types Summary\n");
        sb.append("─".repeat(60)).append('\n');
        sb.append(String.format("%-40s | %s%n", "Type", "Count"));
        elementsSummary.forEach((type, count) -> sb.append(String.format("%-40s | %d%n", type, count)));

        sb.append("\nRequirements Found\n");
        sb.append("─".repeat(60)).append('\n');
        if (requirements.isEmpty()) {
            sb.append("No requirement-type elements found in this project.\n");
            sb.append("Requirement types searched for:\n");
            REQUIREMENT_TYPES.stream().sorted().forEach(t -> sb.append("  - ").append(t).append('\n'));
            return sb.toString();
        }
        for (int i = 0; i < requirements.size(); i++) {
            Element req = requirements.get(i);
            sb.append(String.format("%n--- Requirement %d ---%n", i + 1));
            sb.append(String.format("Type:           %s%n", req.type()));
            sb.append(String.format("ID:             %s%n", req.id()));
            sb.append(String.format("Name:           %s%n", orNa(req.name())));
            sb.append(String.format("Short Name:     %s%n", orNa(req.shortName())));
            sb.append(String.format("Qualified Name: %s%n", orNa(req.qualifiedName())));
        }
        return sb.toString();
    }

    private static Object nullable(String value) {
        return value != null ? value : JSONObject.NULL;
    }

    private static String orNa(String value) {
        return value != null ? value : "N/A";
    }
}
