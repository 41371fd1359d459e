package org.example.sysmlapi.client;

/**
 * The server answered with an error status (or with a body that is not JSON).
 */
public class RemoteException extends ApiException {

    static final int MESSAGE_BODY_LIMIT = 200;

    private final int status;
    private final String body;

    public RemoteException(String endpoint, int status, String body) {
        this(endpoint, status, body, null);
    }

    public RemoteException(String endpoint, int status, String body, Throwable cause) {
        super(endpoint, "API returned status " + status + " for " + endpoint + ": "
            + truncate(body, MESSAGE_BODY_LIMIT), cause);
        this.status = status;
        this.body = body != null ? body : "";
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }

    public static String truncate(String text, int limit) {
        if (text == null) return "";
        return text.length() <= limit ? text : text.substring(0, limit) + "...";
    }
}
