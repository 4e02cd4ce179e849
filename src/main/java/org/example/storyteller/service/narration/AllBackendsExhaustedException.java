package org.example.storyteller.service.narration;

import org.example.storyteller.model.FailoverEvent;
import org.example.storyteller.model.SegmentNarration;

import java.util.List;

/**
 * Every configured backend failed on the same segment. Carries what was produced before the failure.
 */
public class AllBackendsExhaustedException extends RuntimeException {

    private final int segmentIndex;
    private final List<SegmentNarration> partialNarrations;
    private final List<FailoverEvent> failoverEvents;

    public AllBackendsExhaustedException(
            int segmentIndex,
            List<SegmentNarration> partialNarrations,
            List<FailoverEvent> failoverEvents,
            Throwable lastFailure) {
        super("All narration backends failed on segment " + segmentIndex, lastFailure);
        this.segmentIndex = segmentIndex;
        this.partialNarrations = List.copyOf(partialNarrations);
        this.failoverEvents = List.copyOf(failoverEvents);
    }

    public int getSegmentIndex() {
        return segmentIndex;
    }

    public List<SegmentNarration> getPartialNarrations() {
        return partialNarrations;
    }

    public List<FailoverEvent> getFailoverEvents() {
        return failoverEvents;
    }
}
