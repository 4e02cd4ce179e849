package org.example.storyteller.config;

import jakarta.servlet.http.HttpServletRequest;

import java.util.regex.Pattern;

/**
 * Request id handling shared by the correlation filter and the controllers that report it.
 */
public final class RequestCorrelation {

    public static final String HEADER_NAME = "X-Request-Id";
    public static final String ATTRIBUTE_NAME = "requestId";
    public static final String UNKNOWN = "unknown";
    static final int MAX_REQUEST_ID_LENGTH = 80;
    // Caller-supplied ids end up in log lines; keep them to a log-safe alphabet.
    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^A-Za-z0-9._:\\-]");

    private RequestCorrelation() {
    }

    public static String resolveRequestId(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN;
        }
        if (request.getAttribute(ATTRIBUTE_NAME) instanceof String value && !value.isBlank()) {
            return value;
        }
        return UNKNOWN;
    }

    static String normalize(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return null;
        }
        String cleaned = UNSAFE_CHARS.matcher(headerValue.trim()).replaceAll("");
        if (cleaned.isEmpty()) {
            return null;
        }
        return cleaned.length() > MAX_REQUEST_ID_LENGTH ? cleaned.substring(0, MAX_REQUEST_ID_LENGTH) : cleaned;
    }
}
