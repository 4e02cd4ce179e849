package org.example.storyteller.service.narration;

import org.example.storyteller.model.ExtractedElements;
import org.example.storyteller.model.FailoverEvent;
import org.example.storyteller.model.FailoverReason;
import org.example.storyteller.model.Segment;
import org.example.storyteller.model.SegmentNarration;
import org.example.storyteller.service.SynthesisMetricsService;
import org.example.storyteller.service.backend.BackendQuotaExceededException;
import org.example.storyteller.service.backend.BackendUnavailableException;
import org.example.storyteller.service.backend.NarrationBackend;
import org.example.storyteller.service.backend.StyleHint;
import org.example.storyteller.service.extract.ElementExtractor;
import org.example.storyteller.service.memory.SessionMemory;
import org.example.storyteller.service.quota.QuotaAuthority;
import org.example.storyteller.service.segment.TokenEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Drives segments through extraction, memory and the active backend strictly in index order.
 * <p>
 * Segment {@code n} is narrated against memory holding exactly segments {@code 0..n}'s elements and
 * the narrations of {@code 0..n-1}. On a backend failure the run switches to the next backend in the
 * preference list for the rest of the run and the same segment is narrated again from scratch, so a
 * segment's output always comes from a single backend. All per-run state lives in local variables;
 * the narrator itself is shared.
 */
@Service
public class SegmentNarrator {

    private static final Logger log = LoggerFactory.getLogger(SegmentNarrator.class);

    private final ElementExtractor elementExtractor;
    private final QuotaAuthority quotaAuthority;
    private final TokenEstimator tokenEstimator;
    private final SynthesisMetricsService metricsService;
    private final double contextRatio;

    public SegmentNarrator(
            ElementExtractor elementExtractor,
            QuotaAuthority quotaAuthority,
            TokenEstimator tokenEstimator,
            SynthesisMetricsService metricsService,
            @Value("${storyteller.narration.context-ratio:0.15}") double contextRatio) {
        if (contextRatio <= 0 || contextRatio >= 1) {
            throw new IllegalArgumentException("context-ratio must be between 0 and 1: " + contextRatio);
        }
        this.elementExtractor = elementExtractor;
        this.quotaAuthority = quotaAuthority;
        this.tokenEstimator = tokenEstimator;
        this.metricsService = metricsService;
        this.contextRatio = contextRatio;
    }

    /**
     * Narrates every segment, or stops early when {@code cancelled} reports true between segments.
     *
     * @throws AllBackendsExhaustedException when every backend fails on the same segment
     */
    public NarrationOutcome narrate(
            List<Segment> segments,
            List<NarrationBackend> backends,
            SessionMemory memory,
            BooleanSupplier cancelled) {
        if (backends == null || backends.isEmpty()) {
            throw new IllegalArgumentException("At least one narration backend is required");
        }

        // Extraction is pure, so every segment can be processed up front; memory stays in index order.
        List<ExtractedElements> extracted = segments.stream()
                .map(segment -> elementExtractor.extract(segment.index(), segment.content()))
                .toList();

        List<SegmentNarration> narrations = new ArrayList<>();
        List<FailoverEvent> failoverEvents = new ArrayList<>();
        int active = 0;

        for (Segment segment : segments) {
            if (cancelled != null && cancelled.getAsBoolean()) {
                log.info("Run cancelled before segment {}/{}", segment.index() + 1, segments.size());
                return new NarrationOutcome(narrations, failoverEvents, true);
            }

            memory.register(extracted.get(segment.index()));
            StyleHint styleHint = StyleHint.forPosition(segment.index(), segments.size());
            log.info("Narrating segment {}/{} ({} tokens, {}) with backend {}",
                    segment.index() + 1, segments.size(), segment.estimatedTokens(), styleHint,
                    backends.get(active).name());

            while (true) {
                NarrationBackend backend = backends.get(active);
                long startedAt = System.nanoTime();
                try {
                    String digest = memory.snapshotContext(contextCharsFor(backend));
                    reserveQuota(backend, segment, digest);
                    String text = backend.narrate(segment.content(), digest, styleHint);
                    Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
                    narrations.add(new SegmentNarration(segment.index(), text, backend.name(), true, elapsed));
                    memory.appendNarrationSummary(segment.index(), text);
                    metricsService.recordSegmentNarrated(backend.name());
                    break;
                } catch (RuntimeException e) {
                    Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
                    FailoverReason reason = e instanceof BackendQuotaExceededException
                            ? FailoverReason.QUOTA_EXCEEDED
                            : FailoverReason.UNAVAILABLE;

                    if (active + 1 >= backends.size()) {
                        log.error("Backend {} failed on segment {} and no backend is left: {}",
                                backend.name(), segment.index(), e.getMessage());
                        narrations.add(SegmentNarration.failed(segment.index(), backend.name(), elapsed));
                        throw new AllBackendsExhaustedException(segment.index(), narrations, failoverEvents, e);
                    }

                    NarrationBackend next = backends.get(active + 1);
                    failoverEvents.add(new FailoverEvent(
                            segment.index(), backend.name(), next.name(), reason, e.getMessage()));
                    metricsService.recordFailover(reason);
                    log.warn("Backend {} failed on segment {} ({}): {}; failing over to {} for the rest of the run",
                            backend.name(), segment.index(), reason, e.getMessage(), next.name());
                    active++;
                }
            }
        }

        return new NarrationOutcome(narrations, failoverEvents, false);
    }

    private void reserveQuota(NarrationBackend backend, Segment segment, String digest) {
        if (!backend.isMetered()) {
            return;
        }
        // Nothing is reserved for a call that cannot be made.
        if (!backend.isAvailable()) {
            throw new BackendUnavailableException(backend.name(), "Backend reports itself unavailable");
        }
        // Input plus an output of roughly the same size as the segment.
        int estimatedTokens = segment.estimatedTokens() * 2 + tokenEstimator.estimate(digest);
        if (!quotaAuthority.estimateAndReserve(backend.name(), estimatedTokens)) {
            throw new BackendQuotaExceededException(backend.name(),
                    "Quota authority refused " + estimatedTokens + " tokens");
        }
    }

    int contextCharsFor(NarrationBackend backend) {
        return tokenEstimator.maxCharsFor((int) Math.floor(backend.maxTokensPerSegment() * contextRatio));
    }
}
