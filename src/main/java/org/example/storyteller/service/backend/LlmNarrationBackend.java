package org.example.storyteller.service.backend;

import org.example.storyteller.service.llm.LlmOptions;
import org.example.storyteller.service.llm.LlmProvider;
import org.example.storyteller.service.llm.LlmProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Narration through a hosted or local language model. Provider errors are translated into the
 * backend failure types the narrator fails over on.
 */
public abstract class LlmNarrationBackend implements NarrationBackend {

    private static final Logger log = LoggerFactory.getLogger(LlmNarrationBackend.class);

    private final String name;
    private final LlmProvider provider;
    private final int maxTokensPerSegment;

    protected LlmNarrationBackend(String name, LlmProvider provider, int maxTokensPerSegment) {
        if (maxTokensPerSegment <= 0) {
            throw new IllegalArgumentException("maxTokensPerSegment must be positive for backend " + name);
        }
        this.name = name;
        this.provider = provider;
        this.maxTokensPerSegment = maxTokensPerSegment;
    }

    @Override
    public String narrate(String segmentText, String contextDigest, StyleHint styleHint) {
        String prompt = buildPrompt(segmentText, contextDigest, styleHint);
        String generated;
        try {
            generated = provider.generate(prompt, LlmOptions.forNarration(maxTokensPerSegment));
        } catch (LlmProviderException e) {
            if (e.isRateLimited()) {
                throw new BackendQuotaExceededException(name,
                        provider.getProviderName() + " rejected the request: " + e.getMessage(), e);
            }
            throw new BackendUnavailableException(name,
                    provider.getProviderName() + " call failed: " + e.getMessage(), e);
        }

        if (generated == null || generated.isBlank()) {
            throw new BackendUnavailableException(name, provider.getProviderName() + " returned an empty narration");
        }
        log.debug("Backend {} narrated {} chars into {} chars", name, segmentText.length(), generated.length());
        return generated.strip();
    }

    protected String buildPrompt(String segmentText, String contextDigest, StyleHint styleHint) {
        return String.format("""
            Narrate this part of a tabletop role-playing session as story prose.

            POSITION IN THE STORY: %s
            %s

            WHAT HAS HAPPENED SO FAR:
            %s

            SESSION TRANSCRIPT (this part only):
            ---
            %s
            ---

            RULES:
            - Write in past tense, third person.
            - Keep every named character, place and event from this part; invent nothing that contradicts it.
            - Turn table talk and dice rolls into in-world action.
            - Do not retell earlier parts; continue from them.
            - Return only the story prose, no headings or notes.
            """,
                styleHint.name().toLowerCase(Locale.ROOT),
                styleHint.instruction(),
                contextDigest == null || contextDigest.isBlank() ? "(nothing yet)" : contextDigest,
                segmentText
        );
    }

    protected LlmProvider getProvider() {
        return provider;
    }

    @Override
    public int maxTokensPerSegment() {
        return maxTokensPerSegment;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isAvailable() {
        return provider.isAvailable();
    }
}
