package org.example.sysmlapi.client;

import org.example.sysmlapi.Logger;
import org.example.sysmlapi.model.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Checks many projects for read access in parallel. Some servers list projects
 * whose commits the current user may not read; those are filtered out.
 */
public class AccessibilityProbe implements AutoCloseable {

    private final SysMLApiClient client;
    private final ExecutorService pool;

    public AccessibilityProbe(SysMLApiClient client, int threads) {
        this.client = client;
        this.pool = Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "project-probe");
            thread.setDaemon(true);
            return thread;
        });
    }

    /** The accessible subset of {@code projects}, in input order. */
    public List<Element> accessible(List<Element> projects) {
        Logger.info("Checking accessibility of %d projects...", projects.size());
        List<CompletableFuture<Boolean>> checks = projects.stream()
            .map(p -> CompletableFuture.supplyAsync(() -> p.id() != null && client.isProjectAccessible(p.id()), pool))
            .collect(Collectors.toList());

        List<Element> result = new ArrayList<>();
        for (int i = 0; i < projects.size(); i++) {
            if (checks.get(i).join()) result.add(projects.get(i));
        }
        Logger.info("Found %d accessible projects", result.size());
        return result;
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) pool.shutdownNow();
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
