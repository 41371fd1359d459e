package org.example.sysmlapi.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;

/**
 * Connection and worker-pool settings shared by all commands.
 *
 * @param baseUrl            API root, e.g. {@code https://host:8443/sysmlv2-api/api}
 * @param connectTimeout     fixed connect timeout for every request
 * @param readTimeout        fixed per-request response timeout
 * @param insecure           trust any TLS certificate and host name
 * @param expansionThreads   worker pool size for tree expansion
 * @param probeThreads       worker pool size for project accessibility checks
 */
public record ExplorerSettings(
    String baseUrl,
    Duration connectTimeout,
    Duration readTimeout,
    boolean insecure,
    int expansionThreads,
    int probeThreads
) {
    public static final String DEFAULT_BASE_URL = "http://localhost:9000";
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_EXPANSION_THREADS = 8;
    public static final int DEFAULT_PROBE_THREADS = 10;

    public ExplorerSettings {
        if (baseUrl == null || baseUrl.isBlank()) baseUrl = DEFAULT_BASE_URL;
        while (baseUrl.endsWith("/")) baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        if (connectTimeout == null) connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        if (readTimeout == null) readTimeout = DEFAULT_READ_TIMEOUT;
        if (expansionThreads < 1) throw new IllegalArgumentException("expansionThreads must be >= 1");
        if (probeThreads < 1) throw new IllegalArgumentException("probeThreads must be >= 1");
    }

    /** True for an absolute http or https URL with a host. */
    public static boolean isValidBaseUrl(String url) {
        if (url == null || url.isBlank()) return false;
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            return ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme)) && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    public static ExplorerSettings defaults(String baseUrl) {
        return new ExplorerSettings(baseUrl, DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT, false,
            DEFAULT_EXPANSION_THREADS, DEFAULT_PROBE_THREADS);
    }
}
