package org.example.sysmlapi.cache;

/**
 * Navigation to an element id that is not cached and could not be fetched.
 */
public class NotFoundInCacheException extends RuntimeException {

    private final String elementId;

    public NotFoundInCacheException(String elementId, Throwable cause) {
        super("Element " + elementId + " is not cached and could not be fetched"
            + (cause != null ? ": " + cause.getMessage() : ""), cause);
        this.elementId = elementId;
    }

    public String getElementId() {
        return elementId;
    }
}
