package org.example.sysmlapi.cache;

import org.example.sysmlapi.model.Element;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ElementCacheTest {

    private static Element element(String id) {
        return Element.parse("{\"@id\":\"" + id + "\",\"@type\":\"PartUsage\",\"name\":\"" + id + "\"}");
    }

    @Test
    @DisplayName("getOrFetch fetches once and then serves from the cache")
    void fetchesOnce() {
        AtomicInteger calls = new AtomicInteger();
        ElementCache cache = new ElementCache(id -> {
            calls.incrementAndGet();
            return element(id);
        });

        Element first = cache.getOrFetch("a");
        Element second = cache.getOrFetch("a");

        assertSame(first, second);
        assertEquals(1, calls.get());
        assertTrue(cache.contains("a"));
    }

    @Test
    void getNeverFetches() {
        ElementCache cache = new ElementCache(id -> fail("must not fetch"));
        assertTrue(cache.get("a").isEmpty());
    }

    @Test
    @DisplayName("a failed fetch leaves no entry and the next call retries")
    void failureNotCached() {
        AtomicInteger calls = new AtomicInteger();
        ElementCache cache = new ElementCache(id -> {
            if (calls.incrementAndGet() == 1) throw new IllegalStateException("boom");
            return element(id);
        });

        assertThrows(IllegalStateException.class, () -> cache.getOrFetch("a"));
        assertFalse(cache.contains("a"));
        assertEquals("a", cache.getOrFetch("a").id());
        assertEquals(2, calls.get());
    }

    @Test
    void requireWrapsFetchFailures() {
        ElementCache cache = new ElementCache(id -> {
            throw new IllegalStateException("server down");
        });
        NotFoundInCacheException e = assertThrows(NotFoundInCacheException.class, () -> cache.require("x"));
        assertEquals("x", e.getElementId());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void nullFromFetcherIsNotFound() {
        ElementCache cache = new ElementCache(id -> null);
        assertThrows(NotFoundInCacheException.class, () -> cache.getOrFetch("x"));
        assertEquals(0, cache.size());
    }

    @Test
    void clearForcesRefetch() {
        AtomicInteger calls = new AtomicInteger();
        ElementCache cache = new ElementCache(id -> {
            calls.incrementAndGet();
            return element(id);
        });
        cache.getOrFetch("a");
        cache.clear();

        assertTrue(cache.isEmpty());
        cache.getOrFetch("a");
        assertEquals(2, calls.get());
    }

    @Test
    void putOverwritesAndPutAllAbsentDoesNot() {
        ElementCache cache = new ElementCache(id -> fail("must not fetch"));
        Element v1 = Element.parse("{\"@id\":\"a\",\"name\":\"v1\"}");
        Element v2 = Element.parse("{\"@id\":\"a\",\"name\":\"v2\"}");
        Element v3 = Element.parse("{\"@id\":\"a\",\"name\":\"v3\"}");

        cache.put(v1);
        cache.put(v2);
        assertEquals("v2", cache.getOrFetch("a").name());

        cache.putAllAbsent(List.of(v3, element("b")));
        assertEquals("v2", cache.getOrFetch("a").name());
        assertTrue(cache.contains("b"));
    }

    @Test
    void elementWithoutIdIsIgnored() {
        ElementCache cache = new ElementCache(id -> null);
        cache.put(Element.parse("{\"name\":\"orphan\"}"));
        assertEquals(0, cache.size());
    }

    @Test
    void snapshotKeepsInsertionOrder() {
        ElementCache cache = new ElementCache(id -> null);
        cache.putAll(List.of(element("c"), element("a"), element("b")));
        assertEquals(List.of("c", "a", "b"), List.copyOf(cache.snapshot().keySet()));
    }

    @Test
    @DisplayName("concurrent requests for the same id share one fetch")
    void singleFlight() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        ElementCache cache = new ElementCache(id -> {
            calls.incrementAndGet();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return element(id);
        });

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Element>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> cache.getOrFetch("shared")));
            }
            Thread.sleep(200);
            release.countDown();
            for (Future<Element> f : futures) {
                assertEquals("shared", f.get(5, TimeUnit.SECONDS).id());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("an Error thrown by the fetch reaches every waiter instead of hanging them")
    void errorReachesWaiters() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ElementCache cache = new ElementCache(id -> {
            calls.incrementAndGet();
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new OutOfMemoryError("simulated");
        });

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Element> owner = pool.submit(() -> cache.getOrFetch("a"));
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            Future<Element> waiter = pool.submit(() -> cache.getOrFetch("a"));
            Thread.sleep(200);
            release.countDown();

            ExecutionException ownerFailure = assertThrows(ExecutionException.class,
                () -> owner.get(5, TimeUnit.SECONDS));
            assertInstanceOf(OutOfMemoryError.class, ownerFailure.getCause());
            ExecutionException waiterFailure = assertThrows(ExecutionException.class,
                () -> waiter.get(5, TimeUnit.SECONDS));
            assertInstanceOf(OutOfMemoryError.class, waiterFailure.getCause());
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, calls.get());
        assertFalse(cache.contains("a"));
    }

    @Test
    void lookupOverMap() {
        ElementLookup lookup = ElementLookup.of(Map.of("a", element("a")));
        assertTrue(lookup.find("a").isPresent());
        assertTrue(lookup.find("b").isEmpty());
    }
}
