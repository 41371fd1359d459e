package org.example.sysmlapi.cache;

import org.example.sysmlapi.Logger;
import org.example.sysmlapi.model.Element;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Element id to last fetched element, in first-insertion order.
 *
 * Entries are never evicted; a later store under the same id overwrites.
 * Concurrent {@link #getOrFetch} calls for the same missing id share a single
 * fetch, and a failed fetch leaves no entry behind. {@link #clear()} also
 * discards results of fetches that were still running when it was called.
 */
public class ElementCache implements ElementLookup {

    private final ElementFetcher fetcher;
    private final Map<String, Element> entries = Collections.synchronizedMap(new LinkedHashMap<>());
    private final ConcurrentHashMap<String, CompletableFuture<Element>> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong generation = new AtomicLong();

    public ElementCache(ElementFetcher fetcher) {
        this.fetcher = fetcher;
    }

    /** Pure lookup, never fetches. */
    public Optional<Element> get(String elementId) {
        return Optional.ofNullable(entries.get(elementId));
    }

    @Override
    public Optional<Element> find(String elementId) {
        return get(elementId);
    }

    public boolean contains(String elementId) {
        return entries.containsKey(elementId);
    }

    /**
     * Returns the cached element, or fetches, stores and returns it.
     *
     * @throws RuntimeException whatever the fetcher threw; nothing is cached, and
     *         callers waiting on the same fetch get the same failure
     */
    public Element getOrFetch(String elementId) {
        Element cached = entries.get(elementId);
        if (cached != null) return cached;

        CompletableFuture<Element> mine = new CompletableFuture<>();
        CompletableFuture<Element> running = inFlight.putIfAbsent(elementId, mine);
        if (running != null) return await(running);

        long gen = generation.get();
        try {
            Element element = entries.get(elementId);
            if (element == null) {
                element = fetcher.fetch(elementId);
                if (element == null) throw new NotFoundInCacheException(elementId, null);
                if (generation.get() == gen) entries.put(elementId, element);
            }
            mine.complete(element);
            return element;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(elementId, mine);
        }
    }

    /** Like {@link #getOrFetch} but wraps any failure as {@link NotFoundInCacheException}. */
    public Element require(String elementId) {
        try {
            return getOrFetch(elementId);
        } catch (NotFoundInCacheException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new NotFoundInCacheException(elementId, e);
        }
    }

    public void put(Element element) {
        String id = element.id();
        if (id == null) {
            Logger.warn("Ignoring element without @id: %s", element);
            return;
        }
        entries.put(id, element);
    }

    /** Stores each element unless its id is already cached. */
    public void putAllAbsent(Collection<Element> elements) {
        for (Element element : elements) {
            String id = element.id();
            if (id != null) entries.putIfAbsent(id, element);
        }
    }

    public void putAll(Collection<Element> elements) {
        elements.forEach(this::put);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public void clear() {
        generation.incrementAndGet();
        entries.clear();
    }

    /** Copy of all entries in insertion order. */
    public Map<String, Element> snapshot() {
        synchronized (entries) {
            return new LinkedHashMap<>(entries);
        }
    }

    private static Element await(CompletableFuture<Element> running) {
        try {
            return running.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            if (e.getCause() instanceof Error err) throw err;
            throw e;
        }
    }
}
