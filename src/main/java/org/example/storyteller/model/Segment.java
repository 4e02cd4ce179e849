package org.example.storyteller.model;

/**
 * A contiguous slice {@code [start, end)} of the transcript sized for one backend call.
 */
public record Segment(
        int index,
        int start,
        int end,
        String content,
        int estimatedTokens
) {
    public int length() {
        return end - start;
    }
}
