package org.example.storyteller.service.backend;

import org.example.storyteller.service.llm.LlmProvider;

/**
 * Locally hosted model backend. No external network dependency; a smaller budget suits smaller models.
 */
public class LocalNarrationBackend extends LlmNarrationBackend {

    public static final String NAME = "local";
    public static final int DEFAULT_MAX_TOKENS_PER_SEGMENT = 2500;

    public LocalNarrationBackend(LlmProvider provider, int maxTokensPerSegment) {
        super(NAME, provider, maxTokensPerSegment);
    }
}
