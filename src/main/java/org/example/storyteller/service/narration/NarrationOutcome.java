package org.example.storyteller.service.narration;

import org.example.storyteller.model.FailoverEvent;
import org.example.storyteller.model.SegmentNarration;

import java.util.List;

/**
 * Narrations produced by one narrator pass, in index order, with the failovers that happened on the way.
 * {@code cancelled} marks a pass stopped between segments before every segment was narrated.
 */
public record NarrationOutcome(
        List<SegmentNarration> narrations,
        List<FailoverEvent> failoverEvents,
        boolean cancelled
) {
    public NarrationOutcome {
        narrations = List.copyOf(narrations);
        failoverEvents = List.copyOf(failoverEvents);
    }
}
