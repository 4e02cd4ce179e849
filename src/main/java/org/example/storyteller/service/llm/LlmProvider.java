package org.example.storyteller.service.llm;

/**
 * HTTP client for a text-generation model (xAI, Ollama).
 * Implementations are stateless after construction and may be shared across runs.
 */
public interface LlmProvider {

    /**
     * Generate a completion for the prompt.
     *
     * @throws LlmProviderException on transport errors, non-2xx responses, timeouts or unreadable bodies
     */
    String generate(String prompt, LlmOptions options);

    /**
     * Whether the provider is configured and reachable enough to accept requests.
     */
    boolean isAvailable();

    /**
     * Short provider name for logs (e.g. "ollama", "xai").
     */
    String getProviderName();
}
