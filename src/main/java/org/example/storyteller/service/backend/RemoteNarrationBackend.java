package org.example.storyteller.service.backend;

import org.example.storyteller.service.llm.LlmProvider;

/**
 * Hosted-model backend. Highest quality, network dependent and metered.
 */
public class RemoteNarrationBackend extends LlmNarrationBackend {

    public static final String NAME = "remote";
    public static final int DEFAULT_MAX_TOKENS_PER_SEGMENT = 3000;

    public RemoteNarrationBackend(LlmProvider provider, int maxTokensPerSegment) {
        super(NAME, provider, maxTokensPerSegment);
    }

    @Override
    public String narrate(String segmentText, String contextDigest, StyleHint styleHint) {
        if (!getProvider().isAvailable()) {
            throw new BackendUnavailableException(NAME,
                    getProvider().getProviderName() + " is not configured (missing API key)");
        }
        return super.narrate(segmentText, contextDigest, styleHint);
    }

    @Override
    public boolean isMetered() {
        return true;
    }
}
