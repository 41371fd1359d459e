package org.example.sysmlapi.tree;

import org.example.sysmlapi.Logger;
import org.example.sysmlapi.cache.ElementCache;
import org.example.sysmlapi.model.Element;
import org.example.sysmlapi.model.ElementType;
import org.example.sysmlapi.session.Cancellation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;
import java.util.stream.Collectors;

/**
 * Builds and expands {@link ElementTreeNode}s on demand, resolving child
 * references through an {@link ElementCache} on a bounded worker pool.
 *
 * <p>Expansion never fails as a whole: a child whose fetch throws is recorded
 * as a {@link ChildSlot.Kind#FAILED} slot and left out of the children.
 */
public class TreeMaterializer implements AutoCloseable {

    public static final int DEFAULT_THREADS = 8;
    public static final String PROJECT_ROOT_LABEL = "Project";

    private final ElementCache cache;
    private final ExecutorService pool;
    private final boolean ownsPool;

    public TreeMaterializer(ElementCache cache) {
        this(cache, DEFAULT_THREADS);
    }

    public TreeMaterializer(ElementCache cache, int threads) {
        this(cache, Executors.newFixedThreadPool(threads, daemonThreads()), true);
    }

    /** Uses a caller-owned pool; {@link #close()} leaves it running. */
    public TreeMaterializer(ElementCache cache, ExecutorService pool) {
        this(cache, pool, false);
    }

    private TreeMaterializer(ElementCache cache, ExecutorService pool, boolean ownsPool) {
        this.cache = cache;
        this.pool = pool;
        this.ownsPool = ownsPool;
    }

    public ElementTreeNode createNode(Element element) {
        return ElementTreeNode.forElement(element);
    }

    /**
     * Caches {@code roots} and returns a synthetic, expanded "Project" node
     * whose children are the roots' owned members. Members that cannot be
     * loaded are logged and skipped.
     */
    public ElementTreeNode buildProjectTree(List<Element> roots) {
        cache.putAll(roots);
        List<String> memberIds = new ArrayList<>();
        for (Element root : roots) {
            memberIds.addAll(root.ownedMemberIds());
        }

        List<ChildSlot> slots = resolveAll(memberIds);
        List<ElementTreeNode> children = new ArrayList<>();
        for (ChildSlot slot : slots) {
            if (slot.isFailed()) continue;
            children.add(createNode(slot.element()));
        }
        Logger.info("Project tree built: %d top-level element(s) from %d root(s)", children.size(), roots.size());
        return ElementTreeNode.group(PROJECT_ROOT_LABEL, slots, children);
    }

    /**
     * Expands {@code node} if it is still unexpanded and returns its slots.
     * Expanding an expanded node changes nothing; if another thread is
     * expanding it, this call waits for that expansion and returns its slots.
     */
    public List<ChildSlot> expand(ElementTreeNode node) {
        expandOrAwait(node);
        return node.slots();
    }

    /**
     * Depth-first expansion of every unexpanded node below {@code root}.
     * {@code cancellation} is checked before each node; expansions already
     * running finish, no new ones start.
     *
     * @param progress receives the running count after each expansion; may be null
     * @return the number of nodes this call expanded
     */
    public int expandAll(ElementTreeNode root, Cancellation cancellation, IntConsumer progress) {
        return expandToDepth(root, Integer.MAX_VALUE, cancellation, progress);
    }

    /** Like {@link #expandAll} but stops {@code maxDepth} levels below {@code root}. */
    public int expandToDepth(ElementTreeNode root, int maxDepth, Cancellation cancellation, IntConsumer progress) {
        record Pending(ElementTreeNode node, int depth) {}

        int expanded = 0;
        Deque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending(root, 0));
        while (!stack.isEmpty()) {
            if (cancellation.isCancelled()) {
                Logger.info("Expansion cancelled after %d node(s)", expanded);
                break;
            }
            Pending current = stack.pop();
            ElementTreeNode node = current.node();
            if (node.isPlaceholder()) continue;

            if (!node.isExpanded() && current.depth() < maxDepth && expandOrAwait(node)) {
                expanded++;
                if (progress != null) progress.accept(expanded);
            }
            if (current.depth() >= maxDepth) continue;

            List<ElementTreeNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Pending(children.get(i), current.depth() + 1));
            }
        }
        return expanded;
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    /** Returns true if this call ran the expansion, false if it was done or done elsewhere. */
    private boolean expandOrAwait(ElementTreeNode node) {
        while (!node.isExpanded()) {
            CompletableFuture<List<ChildSlot>> running = node.runningExpansion();
            if (running != null) {
                awaitExpansion(running);
                return false;
            }
            if (node.beginExpansion() != null) {
                runExpansion(node);
                return true;
            }
        }
        return false;
    }

    private void runExpansion(ElementTreeNode node) {
        Element element = node.element();
        try {
            List<ChildSlot> slots = resolveAll(element.childReferenceIds()).stream()
                .map(TreeMaterializer::classify)
                .collect(Collectors.toList());
            List<ElementTreeNode> children = slots.stream()
                .filter(ChildSlot::isLoaded)
                .map(slot -> createNode(slot.element()))
                .collect(Collectors.toList());
            node.completeExpansion(slots, children);

            if (Logger.isDebugEnabled()) {
                long failed = slots.stream().filter(ChildSlot::isFailed).count();
                Logger.debug("Expanded %s: %d child(ren), %d filtered, %d failed", element.displayName(),
                    children.size(), slots.size() - children.size() - failed, failed);
            }
        } catch (RuntimeException | Error e) {
            node.abortExpansion(e);
            throw e;
        }
    }

    private static void awaitExpansion(CompletableFuture<List<ChildSlot>> running) {
        try {
            running.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            if (e.getCause() instanceof Error err) throw err;
            throw e;
        }
    }

    /** Fetches every id in parallel; the result is in {@code ids} order. */
    private List<ChildSlot> resolveAll(List<String> ids) {
        List<CompletableFuture<ChildSlot>> futures = ids.stream()
            .map(id -> CompletableFuture.supplyAsync(() -> resolve(id), pool))
            .collect(Collectors.toList());
        return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }

    private ChildSlot resolve(String id) {
        try {
            return ChildSlot.loaded(id, cache.getOrFetch(id));
        } catch (RuntimeException e) {
            Logger.warn("Failed to load child %s: %s", id, e.getMessage());
            return ChildSlot.failed(id, e.getMessage());
        }
    }

    private static ChildSlot classify(ChildSlot slot) {
        if (slot.isLoaded() && !ElementType.isDisplayable(slot.element())) {
            return ChildSlot.filtered(slot.id(), slot.element());
        }
        return slot;
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "tree-expansion-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        if (!ownsPool) return;
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
