package org.example.sysmlapi.generate;

import org.example.sysmlapi.model.Element;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Source to target relationships between cached elements.
 *
 * <p>A relationship is recorded when one of the {@link #RELATION_KEYS} of the
 * source references a target that is itself in the element map; references
 * to anything else are ignored. The grid view is limited to the first
 * {@link #MAX_TYPES} types (alphabetically) and the first
 * {@link #MAX_PER_TYPE} elements of each.
 */
public final class TraceabilityMatrix {

    public static final List<String> RELATION_KEYS = List.of(
        "ownedMember", "ownedFeature", "client", "supplier", "source", "target",
        "satisfiedRequirement", "satisfyingFeature");

    public static final int MAX_TYPES = 10;
    public static final int MAX_PER_TYPE = 10;

    private static final int CELL_WIDTH = 10;
    private static final int HEADER_WIDTH = 24;

    private final Map<String, Element> elements;
    private final Map<String, Map<String, List<String>>> relations;
    private final List<String> axis;

    private TraceabilityMatrix(Map<String, Element> elements, Map<String, Map<String, List<String>>> relations,
                               List<String> axis) {
        this.elements = elements;
        this.relations = relations;
        this.axis = axis;
    }

    public static TraceabilityMatrix of(Map<String, Element> elements) {
        Map<String, Map<String, List<String>>> relations = new LinkedHashMap<>();
        Map<String, List<String>> byType = new TreeMap<>();

        for (Map.Entry<String, Element> entry : elements.entrySet()) {
            String id = entry.getKey();
            Element element = entry.getValue();
            byType.computeIfAbsent(element.simpleType(), t -> new ArrayList<>()).add(id);

            Map<String, List<String>> targets = new LinkedHashMap<>();
            for (String key : RELATION_KEYS) {
                for (String targetId : element.references(key)) {
                    if (!elements.containsKey(targetId)) continue;
                    List<String> kinds = targets.computeIfAbsent(targetId, t -> new ArrayList<>());
                    if (!kinds.contains(key)) kinds.add(key);
                }
            }
            relations.put(id, targets);
        }

        List<String> axis = new ArrayList<>();
        byType.values().stream()
            .limit(MAX_TYPES)
            .forEach(ids -> axis.addAll(ids.subList(0, Math.min(MAX_PER_TYPE, ids.size()))));
        return new TraceabilityMatrix(elements, relations, axis);
    }

    /** Row ids of the grid; the columns are the same ids. */
    public List<String> rows() {
        return Collections.unmodifiableList(axis);
    }

    public List<String> columns() {
        return rows();
    }

    /** Relationship keys from {@code sourceId} to {@code targetId}; empty if none. */
    public List<String> relation(String sourceId, String targetId) {
        return relations.getOrDefault(sourceId, Map.of()).getOrDefault(targetId, List.of());
    }

    /** Number of related (source, target) pairs over all elements. */
    public int relationshipCount() {
        return relations.values().stream().mapToInt(Map::size).sum();
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Elements: %d | Relationships: %d | Rows: %d | Columns: %d%n%n",
            elements.size(), relationshipCount(), axis.size(), axis.size()));

        sb.append(pad("", HEADER_WIDTH));
        for (String col : axis) sb.append(' ').append(pad(label(col), CELL_WIDTH));
        sb.append('\n');
        for (String row : axis) {
            sb.append(pad(label(row), HEADER_WIDTH));
            for (String col : axis) {
                sb.append(' ').append(pad(relation(row, col).isEmpty() ? "." : "X", CELL_WIDTH));
            }
            sb.append('\n');
        }

        sb.append("\nRelationships\n");
        for (String row : axis) {
            for (String col : axis) {
                List<String> kinds = relation(row, col);
                if (kinds.isEmpty()) continue;
                sb.append(String.format("  %s --[%s]--> %s%n", label(row), String.join(",", kinds), label(col)));
            }
        }
        return sb.toString();
    }

    public JSONObject toJson() {
        JSONArray rows = new JSONArray();
        for (String id : axis) {
            rows.put(new JSONObject().put("id", id).put("name", label(id)).put("type", elements.get(id).simpleType()));
        }
        JSONArray cells = new JSONArray();
        for (String row : axis) {
            for (String col : axis) {
                List<String> kinds = relation(row, col);
                if (kinds.isEmpty()) continue;
                cells.put(new JSONObject().put("source", row).put("target", col).put("kinds", new JSONArray(kinds)));
            }
        }
        return new JSONObject()
            .put("elements", elements.size())
            .put("relationships", relationshipCount())
            .put("axis", rows)
            .put("cells", cells);
    }

    private String label(String id) {
        Element element = elements.get(id);
        return element != null ? element.displayName() : id;
    }

    private static String pad(String text, int width) {
        if (text.length() > width) return text.substring(0, width - 1) + "~";
        return text + " ".repeat(width - text.length());
    }
}
