package org.example.sysmlapi.generate;

import org.example.sysmlapi.model.Element;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.example.sysmlapi.testutil.Elements.element;
import static org.junit.jupiter.api.Assertions.*;

class RequirementsReportTest {

    private final Element project = Element.parse("{\"@id\":\"p1\",\"name\":\"Drone\",\"created\":\"2024-01-01\"}");
    private final Element commit = Element.parse("{\"@id\":\"c1\",\"created\":\"2024-02-02\"}");

    @Test
    void selectsRequirementTypes() {
        Element req = Element.parse("{\"@id\":\"r1\",\"@type\":\"sysml.RequirementUsage\",\"name\":\"MaxSpeed\","
            + "\"declaredShortName\":\"R1\",\"qualifiedName\":\"Drone::MaxSpeed\"}");
        List<Element> elements = List.of(
            req,
            element("s", "SatisfyRequirementUsage", null),
            element("p", "PartUsage", "frame"),
            element("q", "PartUsage", "arm"));

        RequirementsReport report = RequirementsReport.of(project, commit, elements);

        assertEquals(List.of(req, elements.get(1)), report.requirements());
        assertEquals(List.of("PartUsage", "SatisfyRequirementUsage", "sysml.RequirementUsage"),
            List.copyOf(report.elementsSummary().keySet()));
        assertEquals(2, report.elementsSummary().get("PartUsage"));
    }

    @Test
    void jsonHasProjectCommitSummaryAndRequirements() {
        Element req = Element.parse("{\"@id\":\"r1\",\"@type\":\"RequirementDefinition\",\"name\":\"Safety\"}");

        JSONObject json = RequirementsReport.of(project, commit, List.of(req)).toJson();

        assertEquals("Drone", json.getJSONObject("project").getString("name"));
        assertEquals("c1", json.getJSONObject("commit").getString("id"));
        assertTrue(json.getJSONObject("commit").isNull("name"));
        assertEquals(1, json.getJSONObject("elementsSummary").getInt("RequirementDefinition"));
        JSONArray reqs = json.getJSONArray("requirements");
        assertEquals(1, reqs.length());
        assertEquals("Safety", reqs.getJSONObject(0).getString("name"));
        assertTrue(reqs.getJSONObject(0).isNull("shortName"));
    }

    @Test
    void renderWithoutRequirementsListsSearchedTypes() {
        String text = RequirementsReport.of(project, commit, List.of(element("p", "PartUsage", "x"))).render();

        assertTrue(text.contains("No requirement-type elements found"));
        assertTrue(text.contains("  - ConcernUsage"));
    }

    @Test
    void renderNumbersRequirements() {
        String text = RequirementsReport.of(project, commit, List.of(
            element("r1", "RequirementUsage", "A"), element("r2", "ConstraintUsage", null))).render();

        assertTrue(text.contains("--- Requirement 1 ---"));
        assertTrue(text.contains("--- Requirement 2 ---"));
        assertTrue(text.contains("Name:           N/A"));
    }
}
