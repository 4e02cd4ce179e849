package org.example.storyteller.service;

import org.example.storyteller.model.FailoverReason;
import org.example.storyteller.model.FailureReason;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

@Service
public class SynthesisMetricsService {

    private final LongAdder runsStarted = new LongAdder();
    private final LongAdder runsCompleted = new LongAdder();
    private final LongAdder runsFailed = new LongAdder();
    private final LongAdder runsCancelled = new LongAdder();
    private final LongAdder segmentationFailures = new LongAdder();
    private final LongAdder segmentsNarrated = new LongAdder();
    private final LongAdder failovers = new LongAdder();
    private final LongAdder quotaRejections = new LongAdder();
    private final AtomicLong runLatencyTotalMs = new AtomicLong(0);
    private final ConcurrentHashMap<String, LongAdder> segmentsByBackend = new ConcurrentHashMap<>();

    public void recordRunStarted() {
        runsStarted.increment();
    }

    public void recordRunCompleted(long durationMs) {
        runsCompleted.increment();
        addLatency(durationMs);
    }

    public void recordRunFailed(FailureReason reason, long durationMs) {
        switch (reason) {
            case CANCELLED -> runsCancelled.increment();
            case SEGMENTATION_ERROR -> {
                segmentationFailures.increment();
                runsFailed.increment();
            }
            default -> runsFailed.increment();
        }
        addLatency(durationMs);
    }

    public void recordSegmentNarrated(String backendName) {
        segmentsNarrated.increment();
        segmentsByBackend.computeIfAbsent(backendName, ignored -> new LongAdder()).increment();
    }

    public void recordFailover(FailoverReason reason) {
        failovers.increment();
        if (reason == FailoverReason.QUOTA_EXCEEDED) {
            quotaRejections.increment();
        }
    }

    public Map<String, Object> snapshot() {
        long completed = runsCompleted.sum();
        long failed = runsFailed.sum();
        long cancelled = runsCancelled.sum();
        long measured = completed + failed + cancelled;
        long avgLatencyMs = measured == 0 ? 0 : runLatencyTotalMs.get() / measured;

        Map<String, Long> byBackend = new LinkedHashMap<>();
        segmentsByBackend.forEach((name, count) -> byBackend.put(name, count.sum()));

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("runsStarted", runsStarted.sum());
        metrics.put("runsCompleted", completed);
        metrics.put("runsFailed", failed);
        metrics.put("runsCancelled", cancelled);
        metrics.put("segmentationFailures", segmentationFailures.sum());
        metrics.put("segmentsNarrated", segmentsNarrated.sum());
        metrics.put("segmentsByBackend", byBackend);
        metrics.put("failovers", failovers.sum());
        metrics.put("quotaRejections", quotaRejections.sum());
        metrics.put("runAverageLatencyMs", avgLatencyMs);
        return metrics;
    }

    private void addLatency(long durationMs) {
        if (durationMs > 0) {
            runLatencyTotalMs.addAndGet(durationMs);
        }
    }
}
