package org.example.sysmlapi.session;

import org.example.sysmlapi.Logger;
import org.example.sysmlapi.cache.ElementCache;
import org.example.sysmlapi.client.ApiException;
import org.example.sysmlapi.client.SysMLApiClient;
import org.example.sysmlapi.model.Element;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One project at one commit, with its own element cache.
 *
 * Every lookup is scoped by the session, so switching project or commit means
 * opening a new session; the old cache is simply dropped with the old session.
 */
public final class Session {

    private final SysMLApiClient client;
    private final String projectId;
    private final String commitId;
    private final ElementCache cache;

    private Session(SysMLApiClient client, String projectId, String commitId) {
        this.client = Objects.requireNonNull(client, "client");
        this.projectId = Objects.requireNonNull(projectId, "projectId");
        this.commitId = Objects.requireNonNull(commitId, "commitId");
        this.cache = new ElementCache(this::fetchElement);
    }

    public static Session open(SysMLApiClient client, String projectId, String commitId) {
        Logger.info("Opening session: project=%s commit=%s", projectId, commitId);
        return new Session(client, projectId, commitId);
    }

    /**
     * Opens a session on the most recent commit of {@code projectId}.
     *
     * @throws IllegalStateException if the project has no commits
     */
    public static Session openLatest(SysMLApiClient client, String projectId) {
        List<Element> commits = client.getCommits(projectId);
        Element latest = SysMLApiClient.latestCommit(commits);
        if (latest == null || latest.id() == null) {
            throw new IllegalStateException("No commits found in project " + projectId);
        }
        Logger.info("Using latest commit: %s (%s)", latest.displayName(), latest.id());
        return open(client, projectId, latest.id());
    }

    /** A fresh session on another commit of the same project; this session is unchanged. */
    public Session withCommit(String otherCommitId) {
        return open(client, projectId, otherCommitId);
    }

    public SysMLApiClient client() {
        return client;
    }

    public String projectId() {
        return projectId;
    }

    public String commitId() {
        return commitId;
    }

    public ElementCache cache() {
        return cache;
    }

    public Element getOrFetch(String elementId) {
        return cache.getOrFetch(elementId);
    }

    /** One GET for the element at this session's commit; bypasses the cache. */
    public Element fetchElement(String elementId) {
        return client.getElement(projectId, commitId, elementId);
    }

    // -------------------------------------------------------------------------
    // Bulk loading
    // -------------------------------------------------------------------------

    /** Fetches the commit's root elements and caches them. */
    public List<Element> loadRoots() {
        List<Element> roots = client.getRoots(projectId, commitId);
        cache.putAll(roots);
        Logger.info("Found %d root element(s)", roots.size());
        return roots;
    }

    /** Pages through every element of the commit into the cache. */
    public int loadAllElements(int pageSize, Cancellation cancellation) {
        List<Element> all = client.getAllElements(projectId, commitId, pageSize, cancellation);
        cache.putAll(all);
        return all.size();
    }

    /**
     * Caches the root elements of every project this project uses, without
     * overwriting anything already cached. Failing dependencies are logged and
     * skipped.
     *
     * @return the ids of the dependency projects that were loaded
     */
    public List<String> loadDependencies(Cancellation cancellation) {
        List<String> loaded = new ArrayList<>();
        Element project = client.getProject(projectId);
        List<Dependency> usages = dependencies(project);
        if (usages.isEmpty()) {
            Logger.info("No dependencies found for project %s", projectId);
            return loaded;
        }

        Logger.info("Found %d dependencies to load", usages.size());
        for (int i = 0; i < usages.size(); i++) {
            if (cancellation.isCancelled()) break;
            Dependency dep = usages.get(i);
            if (dep.projectId() == null || dep.commitId() == null) {
                Logger.info("  Skipping dependency with missing project or commit ID");
                continue;
            }
            try {
                Logger.info("Loading dependency %d/%d: %s", i + 1, usages.size(), dep.projectId());
                List<Element> roots = client.getRoots(dep.projectId(), dep.commitId());
                cache.putAllAbsent(roots);
                loaded.add(dep.projectId());
            } catch (ApiException e) {
                Logger.warn("Failed to load dependency %s: %s", dep.projectId(), e.getMessage());
            }
        }
        Logger.info("Dependency loading complete. Cache now contains %d elements", cache.size());
        return loaded;
    }

    record Dependency(String projectId, String commitId) {}

    static List<Dependency> dependencies(Element project) {
        Object raw = project.get("projectUsages");
        List<Dependency> result = new ArrayList<>();
        if (raw instanceof JSONArray array) {
            for (Object usage : array) addDependency(usage, result);
        } else {
            addDependency(raw, result);
        }
        return result;
    }

    private static void addDependency(Object usage, List<Dependency> into) {
        if (!(usage instanceof JSONObject obj)) return;
        Element wrapped = Element.of(obj);
        List<String> projects = wrapped.references("usedProject");
        List<String> commits = wrapped.references("usedCommit");
        into.add(new Dependency(projects.isEmpty() ? null : projects.get(0),
            commits.isEmpty() ? null : commits.get(0)));
    }

    @Override
    public String toString() {
        return "Session[project=" + projectId + ", commit=" + commitId + ", cached=" + cache.size() + "]";
    }
}
