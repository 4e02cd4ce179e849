package org.example.storyteller.model;

/**
 * Recorded when a run abandons {@code fromBackend} for {@code toBackend} at a given segment.
 */
public record FailoverEvent(
        int segmentIndex,
        String fromBackend,
        String toBackend,
        FailoverReason reason,
        String message
) {
}
