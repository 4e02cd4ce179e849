package org.example.storyteller.model;

import java.util.List;

/**
 * Final output of one synthesis run. Lists are copied on construction.
 */
public record SynthesisResult(
        String storyText,
        int segmentsProcessed,
        List<String> characters,
        List<String> locations,
        List<PlotPoint> plotPoints,
        double completenessScore,
        List<FailoverEvent> failoverEvents,
        double processingTimeSeconds,
        boolean success,
        FailureReason failureReason,
        String failureMessage,
        List<SegmentNarration> narrations
) {
    public SynthesisResult {
        storyText = storyText == null ? "" : storyText;
        characters = characters == null ? List.of() : List.copyOf(characters);
        locations = locations == null ? List.of() : List.copyOf(locations);
        plotPoints = plotPoints == null ? List.of() : List.copyOf(plotPoints);
        failoverEvents = failoverEvents == null ? List.of() : List.copyOf(failoverEvents);
        narrations = narrations == null ? List.of() : List.copyOf(narrations);
    }

    public static SynthesisResult segmentationFailure(String message, double processingTimeSeconds) {
        return new SynthesisResult(
                "",
                0,
                List.of(),
                List.of(),
                List.of(),
                0.0,
                List.of(),
                processingTimeSeconds,
                false,
                FailureReason.SEGMENTATION_ERROR,
                message,
                List.of()
        );
    }
}
