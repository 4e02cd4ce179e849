package org.example.storyteller.service.llm;

/**
 * Thrown when an LLM provider call fails. Carries the HTTP status when the server answered.
 */
public class LlmProviderException extends RuntimeException {

    private final Integer statusCode;

    public LlmProviderException(String message) {
        this(message, null, null);
    }

    public LlmProviderException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public LlmProviderException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the provider, or null for transport failures and timeouts.
     */
    public Integer getStatusCode() {
        return statusCode;
    }

    public boolean isRateLimited() {
        return statusCode != null && (statusCode == 429 || statusCode == 402);
    }
}
