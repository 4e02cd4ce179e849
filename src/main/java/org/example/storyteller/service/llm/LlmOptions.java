package org.example.storyteller.service.llm;

/**
 * Sampling options for one generation request.
 */
public record LlmOptions(
    double temperature,
    Double topP,        // nullable
    Integer maxTokens   // nullable
) {
    /**
     * Options for narrating one segment: creative sampling capped at the given output length.
     */
    public static LlmOptions forNarration(int maxTokens) {
        return new LlmOptions(0.8, 0.9, maxTokens);
    }
}
