package org.example.sysmlapi.client;

/**
 * Base class for failures talking to the SysML v2 API server.
 */
public class ApiException extends RuntimeException {

    private final String endpoint;

    public ApiException(String endpoint, String message, Throwable cause) {
        super(message, cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
