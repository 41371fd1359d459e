package org.example.sysmlapi.tree;

import org.example.sysmlapi.model.Element;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * A node of the lazily materialized element tree.
 *
 * <p>A node whose element has child references starts {@link State#UNEXPANDED}
 * with exactly one placeholder child. Expansion replaces the placeholder with
 * the real (possibly empty) child list in one atomic swap, so readers on any
 * thread see either the placeholder or the complete list, never a mix.
 * A node without child references is born {@link State#EXPANDED} with no children.
 * While a node is {@link State#EXPANDING} its snapshot carries the running
 * expansion, so other callers can wait for the real slots.
 */
public final class ElementTreeNode {

    public enum State { UNEXPANDED, EXPANDING, EXPANDED }

    public static final String PLACEHOLDER_LABEL = "Loading...";

    private static final ElementTreeNode PLACEHOLDER = new ElementTreeNode(null, PLACEHOLDER_LABEL,
        new Snapshot(State.EXPANDED, List.of(), List.of(), null));

    private record Snapshot(State state, List<ElementTreeNode> children, List<ChildSlot> slots,
                            CompletableFuture<List<ChildSlot>> running) {}

    private final Element element;
    private final String label;
    private final AtomicReference<Snapshot> snapshot;

    private ElementTreeNode(Element element, String label, Snapshot initial) {
        this.element = element;
        this.label = label;
        this.snapshot = new AtomicReference<>(initial);
    }

    static ElementTreeNode forElement(Element element) {
        Snapshot initial = element.hasChildReferences()
            ? new Snapshot(State.UNEXPANDED, List.of(PLACEHOLDER), List.of(), null)
            : new Snapshot(State.EXPANDED, List.of(), List.of(), null);
        return new ElementTreeNode(element, null, initial);
    }

    /** A synthetic, already expanded node that groups other nodes (e.g. the project root). */
    static ElementTreeNode group(String label, List<ChildSlot> slots, List<ElementTreeNode> children) {
        return new ElementTreeNode(null, label, new Snapshot(State.EXPANDED, List.copyOf(children), List.copyOf(slots), null));
    }

    // -------------------------------------------------------------------------
    // State transitions (driven by TreeMaterializer)
    // -------------------------------------------------------------------------

    /**
     * UNEXPANDED to EXPANDING. Returns the future this call must complete, or
     * null if the node was not UNEXPANDED or another caller won the race.
     */
    CompletableFuture<List<ChildSlot>> beginExpansion() {
        Snapshot current = snapshot.get();
        if (current.state() != State.UNEXPANDED) return null;
        CompletableFuture<List<ChildSlot>> running = new CompletableFuture<>();
        Snapshot next = new Snapshot(State.EXPANDING, current.children(), current.slots(), running);
        return snapshot.compareAndSet(current, next) ? running : null;
    }

    /** The expansion in progress, or null when the node is not EXPANDING. */
    CompletableFuture<List<ChildSlot>> runningExpansion() {
        return snapshot.get().running();
    }

    void completeExpansion(List<ChildSlot> slots, List<ElementTreeNode> children) {
        Snapshot done = new Snapshot(State.EXPANDED, List.copyOf(children), List.copyOf(slots), null);
        CompletableFuture<List<ChildSlot>> running = snapshot.getAndSet(done).running();
        if (running != null) running.complete(done.slots());
    }

    /** Returns an EXPANDING node to UNEXPANDED, keeping its placeholder, and fails the waiters. */
    void abortExpansion(Throwable cause) {
        Snapshot current = snapshot.get();
        if (current.state() != State.EXPANDING) return;
        Snapshot reset = new Snapshot(State.UNEXPANDED, current.children(), current.slots(), null);
        if (snapshot.compareAndSet(current, reset)) {
            current.running().completeExceptionally(cause);
        }
    }

    // -------------------------------------------------------------------------
    // Accessors
    // -------------------------------------------------------------------------

    /** The wrapped element, or {@code null} for the placeholder and synthetic group nodes. */
    public Element element() {
        return element;
    }

    public State state() {
        return snapshot.get().state();
    }

    public boolean isExpanded() {
        return state() == State.EXPANDED;
    }

    public List<ElementTreeNode> children() {
        return snapshot.get().children();
    }

    public int childCount() {
        return children().size();
    }

    public boolean isPlaceholder() {
        return this == PLACEHOLDER;
    }

    /** True iff the only child is the placeholder, i.e. the node has not been expanded yet. */
    public boolean hasPlaceholder() {
        List<ElementTreeNode> children = children();
        return children.size() == 1 && children.get(0).isPlaceholder();
    }

    /** Every child reference with its outcome, in reference order; empty until expanded. */
    public List<ChildSlot> slots() {
        return snapshot.get().slots();
    }

    public List<ChildSlot> failedSlots() {
        return slots().stream().filter(ChildSlot::isFailed).collect(Collectors.toList());
    }

    public String label() {
        if (label != null) return label;
        return element.displayName() + " [" + element.simpleType() + "]";
    }

    @Override
    public String toString() {
        return label();
    }
}
