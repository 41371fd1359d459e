package org.example.sysmlapi.client;

/**
 * The request never produced an HTTP response: DNS, connect, TLS or timeout,
 * or the URL could not be built at all.
 */
public class TransportException extends ApiException {

    public TransportException(String endpoint, Throwable cause) {
        super(endpoint, "Request to " + endpoint + " failed: " + describe(cause), cause);
    }

    private static String describe(Throwable cause) {
        String msg = cause.getMessage();
        return msg != null ? cause.getClass().getSimpleName() + ": " + msg : cause.getClass().getSimpleName();
    }
}
