package org.example.storyteller.service.segment;

/**
 * Thrown when a transcript cannot be segmented at all (null, empty or blank text).
 */
public class SegmentationException extends RuntimeException {

    public SegmentationException(String message) {
        super(message);
    }
}
