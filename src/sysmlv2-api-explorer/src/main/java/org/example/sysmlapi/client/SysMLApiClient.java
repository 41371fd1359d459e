package org.example.sysmlapi.client;

import org.example.sysmlapi.Logger;
import org.example.sysmlapi.config.ExplorerSettings;
import org.example.sysmlapi.model.Element;
import org.example.sysmlapi.session.Cancellation;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only client for the SysML v2 REST API.
 *
 * <p>Every call is one synchronous, Basic-authenticated GET with a JSON body.
 * Nothing is retried: status codes of 400 and above raise
 * {@link RemoteException}, and connection or timeout problems raise
 * {@link TransportException}. Callers decide whether a failure is fatal.
 *
 * <p>Endpoints used:
 * <pre>
 *   GET /projects
 *   GET /projects/{projectId}
 *   GET /projects/{projectId}/commits
 *   GET /projects/{projectId}/branches
 *   GET /projects/{projectId}/commits/{commitId}/roots
 *   GET /projects/{projectId}/commits/{commitId}/elements?page[size]=..&amp;page[after]=..
 *   GET /projects/{projectId}/commits/{commitId}/elements/{elementId}
 * </pre>
 */
public class SysMLApiClient {

    static final int LOG_BODY_LIMIT = 500;
    public static final int DEFAULT_PAGE_SIZE = 500;

    private final ExplorerSettings settings;
    private final HttpClient httpClient;
    private final String authorization;

    public SysMLApiClient(ExplorerSettings settings, String username, String password) {
        this.settings = settings;
        this.authorization = "Basic " + Base64.getEncoder()
            .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));

        HttpClient.Builder builder = HttpClient.newBuilder()
            .connectTimeout(settings.connectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL);
        if (settings.insecure()) {
            builder.sslContext(trustAllContext());
        }
        this.httpClient = builder.build();

        Logger.info("SysML v2 API client initialized: %s (connect=%ss, read=%ss%s)",
            settings.baseUrl(), settings.connectTimeout().toSeconds(), settings.readTimeout().toSeconds(),
            settings.insecure() ? ", insecure TLS" : "");
    }

    public ExplorerSettings getSettings() {
        return settings;
    }

    // -------------------------------------------------------------------------
    // Generic access
    // -------------------------------------------------------------------------

    /** GETs {@code path} (relative to the base URL) and returns the parsed object. */
    public Element fetchObject(String path) {
        Object json = getJson(path, Map.of());
        if (json instanceof JSONObject obj) return Element.of(obj);
        throw new RemoteException(path, 200, "Expected a JSON object but got " + describe(json));
    }

    /** GETs {@code path} and returns the array body as elements. Non-object entries are skipped. */
    public List<Element> fetchList(String path) {
        return fetchList(path, Map.of());
    }

    public List<Element> fetchList(String path, Map<String, ?> params) {
        Object json = getJson(path, params);
        if (!(json instanceof JSONArray array)) {
            throw new RemoteException(path, 200, "Expected a JSON array but got " + describe(json));
        }
        List<Element> result = new ArrayList<>(array.length());
        for (Object item : array) {
            if (item instanceof JSONObject obj) result.add(Element.of(obj));
        }
        return result;
    }

    /**
     * Performs one GET and parses the body as JSON (object or array).
     *
     * @throws RemoteException    on status &gt;= 400 or a body that is not JSON
     * @throws TransportException on I/O failure, timeout, interruption or a malformed URL
     */
    public Object getJson(String path, Map<String, ?> params) {
        String endpoint = path + query(params);
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(settings.baseUrl() + endpoint))
                .timeout(settings.readTimeout())
                .header("Accept", "application/json")
                .header("Authorization", authorization)
                .GET()
                .build();
        } catch (IllegalArgumentException e) {
            throw new TransportException(endpoint, e);
        }

        Logger.debug("GET %s", endpoint);
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            Logger.warn("GET %s failed: %s", endpoint, e.toString());
            throw new TransportException(endpoint, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(endpoint, e);
        }

        int status = response.statusCode();
        String body = response.body() != null ? response.body() : "";
        Logger.debug("Response %s: status=%d, length=%d", endpoint, status, body.length());

        if (status >= 400) {
            Logger.warn("API error %d for %s: %s", status, endpoint, RemoteException.truncate(body, LOG_BODY_LIMIT));
            throw new RemoteException(endpoint, status, body);
        }
        try {
            return new JSONTokener(body).nextValue();
        } catch (JSONException e) {
            throw new RemoteException(endpoint, status, body, e);
        }
    }

    // -------------------------------------------------------------------------
    // Endpoints
    // -------------------------------------------------------------------------

    public List<Element> getProjects() {
        List<Element> projects = fetchList("/projects");
        Logger.info("Found %d projects", projects.size());
        return projects;
    }

    public Element getProject(String projectId) {
        return fetchObject("/projects/" + projectId);
    }

    public List<Element> getCommits(String projectId) {
        return fetchList("/projects/" + projectId + "/commits");
    }

    public List<Element> getBranches(String projectId) {
        return fetchList("/projects/" + projectId + "/branches");
    }

    public List<Element> getRoots(String projectId, String commitId) {
        return fetchList("/projects/" + projectId + "/commits/" + commitId + "/roots");
    }

    public Element getElement(String projectId, String commitId, String elementId) {
        return fetchObject("/projects/" + projectId + "/commits/" + commitId + "/elements/" + elementId);
    }

    public List<Element> getElementsPage(String projectId, String commitId, int pageSize, int after) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("page[size]", pageSize);
        if (after > 0) params.put("page[after]", after);
        return fetchList("/projects/" + projectId + "/commits/" + commitId + "/elements", params);
    }

    /**
     * Pages through every element of a commit. Stops at the first empty or
     * short page, or between pages once {@code cancellation} is set.
     */
    public List<Element> getAllElements(String projectId, String commitId, int pageSize, Cancellation cancellation) {
        List<Element> all = new ArrayList<>();
        int offset = 0;
        while (!cancellation.isCancelled()) {
            List<Element> page = getElementsPage(projectId, commitId, pageSize, offset);
            all.addAll(page);
            Logger.info("Fetched %d elements so far...", all.size());
            if (page.size() < pageSize) break;
            offset += page.size();
        }
        Logger.info("Total elements fetched: %d", all.size());
        return all;
    }

    /** A project is accessible when its commit list answers 200; any failure means no. */
    public boolean isProjectAccessible(String projectId) {
        try {
            getJson("/projects/" + projectId + "/commits", Map.of());
            return true;
        } catch (RuntimeException e) {
            Logger.debug("Project %s not accessible: %s", projectId, e.getMessage());
            return false;
        }
    }

    /**
     * Returns the commit with the greatest {@code created} timestamp; later
     * list positions win ties, so an undated list yields its last commit.
     */
    public static Element latestCommit(List<Element> commits) {
        Element latest = null;
        for (Element commit : commits) {
            if (latest == null) {
                latest = commit;
                continue;
            }
            String a = latest.string("created");
            String b = commit.string("created");
            if (a == null || b == null || b.compareTo(a) >= 0) latest = commit;
        }
        return latest;
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    static String query(Map<String, ?> params) {
        if (params == null || params.isEmpty()) return "";
        return params.entrySet().stream()
            .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                + URLEncoder.encode(String.valueOf(e.getValue()), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&", "?", ""));
    }

    private static String describe(Object json) {
        if (json == null || JSONObject.NULL.equals(json)) return "null";
        String text = json.toString();
        return json.getClass().getSimpleName() + " " + RemoteException.truncate(text, 80);
    }

    private static SSLContext trustAllContext() {
        TrustManager[] trustAll = { new X509TrustManager() {
            @Override public void checkClientTrusted(X509Certificate[] chain, String authType) {}
            @Override public void checkServerTrusted(X509Certificate[] chain, String authType) {}
            @Override public X509Certificate[] getAcceptedIssuers() { return new X509Certificate[0]; }
        } };
        // The JDK client reads this once, when its first instance is created.
        System.setProperty("jdk.internal.httpclient.disableHostnameVerification", "true");
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustAll, new SecureRandom());
            return context;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot create trust-all TLS context", e);
        }
    }
}
