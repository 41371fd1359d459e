package org.example.sysmlapi.config;

/**
 * Resolved login for the API server. {@link #toString()} never prints the password.
 */
public record Credentials(String username, String password, String baseUrl, String source) {

    /**
     * Masks all but the first and last character; short passwords become {@code ***}.
     */
    public static String maskPassword(String password) {
        if (password == null || password.length() <= 2) return "***";
        return password.charAt(0) + "*".repeat(password.length() - 2) + password.charAt(password.length() - 1);
    }

    @Override
    public String toString() {
        return "Credentials[username=" + username + ", password=" + maskPassword(password)
            + ", baseUrl=" + baseUrl + ", source=" + source + "]";
    }
}
