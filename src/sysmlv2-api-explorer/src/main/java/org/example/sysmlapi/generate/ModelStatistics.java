package org.example.sysmlapi.generate;

import org.example.sysmlapi.cache.ElementLookup;
import org.example.sysmlapi.model.Element;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Composition statistics over a set of elements: how many of each type, which
 * properties are in use, and how deep the ownership tree goes.
 */
public final class ModelStatistics {

    static final int TOP_N = 10;
    private static final int BAR_SCALE = 2;

    private final int totalElements;
    private final int rootElements;
    private final int maxDepth;
    private final Map<String, Integer> typeCounts;
    private final Map<String, Integer> propertyUsage;
    private final double averageProperties;

    private ModelStatistics(int totalElements, int rootElements, int maxDepth, Map<String, Integer> typeCounts,
                            Map<String, Integer> propertyUsage, double averageProperties) {
        this.totalElements = totalElements;
        this.rootElements = rootElements;
        this.maxDepth = maxDepth;
        this.typeCounts = typeCounts;
        this.propertyUsage = propertyUsage;
        this.averageProperties = averageProperties;
    }

    /**
     * @param elements     every element to count
     * @param rootElements number of commit roots, reported as-is
     * @param maxDepth     deepest ownership level, or -1 when unknown
     */
    public static ModelStatistics of(Collection<Element> elements, int rootElements, int maxDepth) {
        Map<String, Integer> types = new HashMap<>();
        Map<String, Integer> properties = new HashMap<>();
        long propertyTotal = 0;

        for (Element element : elements) {
            types.merge(element.simpleType(), 1, Integer::sum);
            for (String key : element.keys()) {
                if (!key.startsWith("@")) properties.merge(key, 1, Integer::sum);
            }
            propertyTotal += element.keys().size();
        }

        double average = elements.isEmpty() ? 0.0 : (double) propertyTotal / elements.size();
        return new ModelStatistics(elements.size(), rootElements, maxDepth,
            sortedByCount(types), sortedByCount(properties), average);
    }

    /**
     * Deepest ownership level reachable from {@code roots} through cached
     * children; roots are level 0. Uncached children and cycles end a branch.
     */
    public static int maxDepth(List<Element> roots, ElementLookup lookup) {
        record Level(Element element, int depth) {}

        int max = roots.isEmpty() ? -1 : 0;
        Set<String> seen = new HashSet<>();
        Deque<Level> queue = new ArrayDeque<>();
        for (Element root : roots) {
            if (root.id() == null || seen.add(root.id())) queue.add(new Level(root, 0));
        }
        while (!queue.isEmpty()) {
            Level current = queue.poll();
            max = Math.max(max, current.depth());
            for (String childId : current.element().childReferenceIds()) {
                if (!seen.add(childId)) continue;
                lookup.find(childId).ifPresent(child -> queue.add(new Level(child, current.depth() + 1)));
            }
        }
        return max;
    }

    public int totalElements()              { return totalElements; }
    public int rootElements()               { return rootElements; }
    public int maxDepth()                   { return maxDepth; }
    public double averageProperties()       { return averageProperties; }

    /** Simple type to count, by descending count then name. */
    public Map<String, Integer> typeCounts()    { return typeCounts; }

    /** Non-{@code @} property name to number of elements using it, same order. */
    public Map<String, Integer> propertyUsage() { return propertyUsage; }

    public int uniqueTypes() {
        return typeCounts.size();
    }

    /** Text report with bar charts for the ten most common types. */
    public String report(String projectName, String projectId, String commitId) {
        StringBuilder sb = new StringBuilder();
        sb.append("Model Statistics Report\n");
        sb.append("─".repeat(60)).append('\n');
        sb.append("Project:    ").append(projectName).append('\n');
        sb.append("Project ID: ").append(projectId).append('\n');
        sb.append("Commit ID:  ").append(commitId).append("\n\n");

        sb.append("Overview\n");
        sb.append(String.format(Locale.ROOT, "  Total Elements:    %d%n", totalElements));
        sb.append(String.format(Locale.ROOT, "  Root Elements:     %d%n", rootElements));
        sb.append(String.format(Locale.ROOT, "  Unique Types:      %d%n", uniqueTypes()));
        sb.append(String.format(Locale.ROOT, "  Maximum Depth:     %s%n", maxDepth < 0 ? "n/a" : String.valueOf(maxDepth)));
        sb.append(String.format(Locale.ROOT, "  Properties Used:   %d%n", propertyUsage.size()));

        sb.append("\nElement Type Distribution\n");
        int rank = 0;
        for (Map.Entry<String, Integer> entry : typeCounts.entrySet()) {
            if (rank++ == TOP_N) break;
            double pct = percent(entry.getValue());
            sb.append(String.format(Locale.ROOT, "  %2d. %-25s %4d (%5.1f%%) %s%n", rank, entry.getKey(), entry.getValue(), pct,
                "█".repeat((int) (pct / BAR_SCALE))));
        }

        sb.append("\nMost Common Properties\n");
        int shown = 0;
        for (Map.Entry<String, Integer> entry : propertyUsage.entrySet()) {
            if (shown++ == TOP_N) break;
            sb.append(String.format(Locale.ROOT, "  %-25s %4d elements (%5.1f%%)%n", entry.getKey(), entry.getValue(),
                percent(entry.getValue())));
        }

        sb.append("\nComplexity Metrics\n");
        sb.append(String.format(Locale.ROOT, "  Avg Properties/Element: %.2f%n", averageProperties));

        sb.append("\nElement Types (complete list)\n");
        typeCounts.forEach((type, count) -> sb.append(String.format(Locale.ROOT, "  %-40s %d%n", type, count)));
        return sb.toString();
    }

    private double percent(int count) {
        return totalElements == 0 ? 0.0 : count * 100.0 / totalElements;
    }

    private static Map<String, Integer> sortedByCount(Map<String, Integer> counts) {
        Map<String, Integer> sorted = new LinkedHashMap<>();
        counts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
            .forEach(e -> sorted.put(e.getKey(), e.getValue()));
        return sorted;
    }
}
