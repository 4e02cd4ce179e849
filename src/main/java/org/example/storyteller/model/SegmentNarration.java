package org.example.storyteller.model;

import java.time.Duration;

public record SegmentNarration(
        int segmentIndex,
        String text,
        String backendName,
        boolean success,
        Duration elapsed
) {
    public static SegmentNarration failed(int segmentIndex, String backendName, Duration elapsed) {
        return new SegmentNarration(segmentIndex, "", backendName, false, elapsed);
    }
}
