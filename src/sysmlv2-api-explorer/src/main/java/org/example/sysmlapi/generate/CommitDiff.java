package org.example.sysmlapi.generate;

import org.example.sysmlapi.model.Element;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Compares the element maps (id to element) of two commits.
 *
 * <p>Every id in the union falls in exactly one category: only in the base
 * commit is removed, only in the compared commit is added, and an id present
 * in both is modified or unchanged according to the {@link ModificationPolicy}.
 */
public final class CommitDiff {

    public static final int MODIFIED_REPORT_LIMIT = 50;

    public enum Change { ADDED, REMOVED, MODIFIED, UNCHANGED }

    private final Map<String, Element> base;
    private final Map<String, Element> compare;
    private final SortedSet<String> added = new TreeSet<>();
    private final SortedSet<String> removed = new TreeSet<>();
    private final SortedSet<String> modified = new TreeSet<>();
    private final SortedSet<String> unchanged = new TreeSet<>();

    private CommitDiff(Map<String, Element> base, Map<String, Element> compare, ModificationPolicy policy) {
        this.base = Map.copyOf(base);
        this.compare = Map.copyOf(compare);

        Set<String> ids = new LinkedHashSet<>(base.keySet());
        ids.addAll(compare.keySet());
        for (String id : ids) {
            Element before = base.get(id);
            Element after = compare.get(id);
            if (before == null) {
                added.add(id);
            } else if (after == null) {
                removed.add(id);
            } else if (policy.isModified(before, after)) {
                modified.add(id);
            } else {
                unchanged.add(id);
            }
        }
    }

    public static CommitDiff compare(Map<String, Element> base, Map<String, Element> compare) {
        return compare(base, compare, ModificationPolicy.STRUCTURAL);
    }

    public static CommitDiff compare(Map<String, Element> base, Map<String, Element> compare,
                                     ModificationPolicy policy) {
        return new CommitDiff(base, compare, policy);
    }

    public SortedSet<String> added()     { return Collections.unmodifiableSortedSet(added); }
    public SortedSet<String> removed()   { return Collections.unmodifiableSortedSet(removed); }
    public SortedSet<String> modified()  { return Collections.unmodifiableSortedSet(modified); }
    public SortedSet<String> unchanged() { return Collections.unmodifiableSortedSet(unchanged); }

    public int total() {
        return added.size() + removed.size() + modified.size() + unchanged.size();
    }

    public Change changeOf(String id) {
        if (added.contains(id)) return Change.ADDED;
        if (removed.contains(id)) return Change.REMOVED;
        if (modified.contains(id)) return Change.MODIFIED;
        if (unchanged.contains(id)) return Change.UNCHANGED;
        throw new IllegalArgumentException("Element " + id + " is in neither commit");
    }

    public boolean hasChanges() {
        return !added.isEmpty() || !removed.isEmpty() || !modified.isEmpty();
    }

    /**
     * Plain-text report: both commit ids, summary counts, then the sorted
     * added, removed and modified entries as {@code name (Type)} lines.
     */
    public String report(String baseCommitId, String compareCommitId) {
        StringBuilder sb = new StringBuilder();
        sb.append("Commit Diff\n");
        sb.append("─".repeat(60)).append('\n');
        sb.append("Base commit:    ").append(baseCommitId).append('\n');
        sb.append("Compare commit: ").append(compareCommitId).append("\n\n");

        sb.append("Summary\n");
        sb.append(String.format("Added:     %d elements%n", added.size()));
        sb.append(String.format("Removed:   %d elements%n", removed.size()));
        sb.append(String.format("Modified:  %d elements%n", modified.size()));
        sb.append(String.format("Unchanged: %d elements%n", unchanged.size()));
        sb.append(String.format("Total:     %d elements%n", total()));

        appendSection(sb, "Added Elements", '+', labels(added, compare), Integer.MAX_VALUE);
        appendSection(sb, "Removed Elements", '-', labels(removed, base), Integer.MAX_VALUE);
        appendSection(sb, "Modified Elements", '~', labels(modified, compare), MODIFIED_REPORT_LIMIT);
        return sb.toString();
    }

    private static List<String> labels(Set<String> ids, Map<String, Element> source) {
        return ids.stream()
            .map(id -> {
                Element e = source.get(id);
                return e.displayName() + " (" + e.simpleType() + ")";
            })
            .sorted()
            .collect(Collectors.toList());
    }

    private static void appendSection(StringBuilder sb, String title, char marker, List<String> lines, int limit) {
        if (lines.isEmpty()) return;
        sb.append('\n').append(title).append('\n');
        int shown = 0;
        for (String line : lines) {
            if (shown++ == limit) break;
            sb.append(marker).append(' ').append(line).append('\n');
        }
        if (lines.size() > limit) {
            sb.append(String.format("... and %d more%n", lines.size() - limit));
        }
    }
}
