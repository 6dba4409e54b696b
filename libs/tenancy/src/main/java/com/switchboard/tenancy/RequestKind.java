package com.switchboard.tenancy;

/**
 * Whether a request only reads tenant data or may change it. Mutations get a fresher view of the
 * registry before they are allowed through.
 */
public enum RequestKind {
    READ,
    MUTATION;

    /**
     * Classifies an HTTP method: GET, HEAD, OPTIONS and TRACE read, everything else mutates.
     */
    public static RequestKind fromHttpMethod(String method) {
        if (method == null) {
            return MUTATION;
        }
        return switch (method.toUpperCase(java.util.Locale.ROOT)) {
            case "GET", "HEAD", "OPTIONS", "TRACE" -> READ;
            default -> MUTATION;
        };
    }
}
