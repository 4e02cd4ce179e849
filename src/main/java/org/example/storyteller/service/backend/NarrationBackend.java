package org.example.storyteller.service.backend;

/**
 * A generation backend that turns one transcript segment plus accumulated context into story prose.
 * Implementations hold no per-run state and may be shared by concurrent runs.
 */
public interface NarrationBackend {

    /**
     * Narrate one segment.
     *
     * @param segmentText the raw transcript slice
     * @param contextDigest bounded digest of the session memory so far
     * @param styleHint where the segment sits in the story
     * @return generated narration, never blank
     * @throws BackendUnavailableException on network, auth, timeout or malformed-response failures
     * @throws BackendQuotaExceededException when the backend rejects the call for rate or cost reasons
     */
    String narrate(String segmentText, String contextDigest, StyleHint styleHint);

    /**
     * Largest segment, in estimated tokens, this backend accepts in one call.
     */
    int maxTokensPerSegment();

    String name();

    /**
     * Metered backends are authorized against the quota authority before every call.
     */
    default boolean isMetered() {
        return false;
    }

    default boolean isAvailable() {
        return true;
    }
}
