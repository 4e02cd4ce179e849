package org.example.storyteller.service;

import org.example.storyteller.model.FailoverEvent;
import org.example.storyteller.model.FailureReason;
import org.example.storyteller.model.Segment;
import org.example.storyteller.model.SegmentNarration;
import org.example.storyteller.model.SessionContext;
import org.example.storyteller.model.SynthesisResult;
import org.example.storyteller.service.backend.NarrationBackend;
import org.example.storyteller.service.backend.NarrationBackendRegistry;
import org.example.storyteller.service.memory.SessionMemory;
import org.example.storyteller.service.narration.AllBackendsExhaustedException;
import org.example.storyteller.service.narration.NarrationOutcome;
import org.example.storyteller.service.narration.RunState;
import org.example.storyteller.service.narration.SegmentNarrator;
import org.example.storyteller.service.segment.SegmentationException;
import org.example.storyteller.service.segment.Segmenter;
import org.example.storyteller.service.synthesis.StorySynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Entry point for turning a transcript into a story: segment, narrate with failover, synthesize.
 * Callers always get a {@link SynthesisResult}; only caller mistakes surface as exceptions.
 */
@Service
public class StorySynthesisService {

    private static final Logger log = LoggerFactory.getLogger(StorySynthesisService.class);

    public static final String RUN_ID_KEY = "runId";

    private final Segmenter segmenter;
    private final SegmentNarrator segmentNarrator;
    private final StorySynthesizer storySynthesizer;
    private final NarrationBackendRegistry backendRegistry;
    private final SynthesisMetricsService metricsService;
    private final int summaryMaxChars;

    public StorySynthesisService(
            Segmenter segmenter,
            SegmentNarrator segmentNarrator,
            StorySynthesizer storySynthesizer,
            NarrationBackendRegistry backendRegistry,
            SynthesisMetricsService metricsService,
            @Value("${storyteller.memory.summary-max-chars:1500}") int summaryMaxChars) {
        this.segmenter = segmenter;
        this.segmentNarrator = segmentNarrator;
        this.storySynthesizer = storySynthesizer;
        this.backendRegistry = backendRegistry;
        this.metricsService = metricsService;
        this.summaryMaxChars = summaryMaxChars;
    }

    public SynthesisResult synthesize(String transcript, List<String> backendPreference, Integer segmentTokenBudget) {
        return synthesize(transcript, SessionContext.empty(), backendPreference, segmentTokenBudget, () -> false);
    }

    public SynthesisResult synthesize(
            String transcript,
            List<String> backendPreference,
            Integer segmentTokenBudget,
            BooleanSupplier cancelled) {
        return synthesize(transcript, SessionContext.empty(), backendPreference, segmentTokenBudget, cancelled);
    }

    public SynthesisResult synthesize(
            String transcript,
            SessionContext context,
            List<String> backendPreference,
            Integer segmentTokenBudget) {
        return synthesize(transcript, context, backendPreference, segmentTokenBudget, () -> false);
    }

    /**
     * @param context what the caller knows before the transcript starts; seeds the session memory,
     *                may be null
     * @param backendPreference backend names in failover order; null or empty uses the configured default
     * @param segmentTokenBudget overrides the budget, which otherwise is the smallest budget among the
     *                           preferred backends so any of them can take over mid-run
     * @param cancelled checked between segments
     * @throws IllegalArgumentException for unknown backend names or a non-positive budget override
     */
    public SynthesisResult synthesize(
            String transcript,
            SessionContext context,
            List<String> backendPreference,
            Integer segmentTokenBudget,
            BooleanSupplier cancelled) {
        List<NarrationBackend> backends = backendRegistry.resolve(backendPreference);
        int budget = resolveBudget(backends, segmentTokenBudget);

        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(RUN_ID_KEY, runId);
        long startedAt = System.currentTimeMillis();
        metricsService.recordRunStarted();
        try {
            log.info("Run {} started: backends={}, segmentTokenBudget={}", runId,
                    backends.stream().map(NarrationBackend::name).toList(), budget);
            return run(transcript, context == null ? SessionContext.empty() : context, backends, budget, cancelled,
                    startedAt);
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }

    private SynthesisResult run(
            String transcript,
            SessionContext context,
            List<NarrationBackend> backends,
            int budget,
            BooleanSupplier cancelled,
            long startedAt) {
        transition(RunState.IDLE, RunState.SEGMENTING);
        List<Segment> segments;
        try {
            segments = segmenter.segment(transcript, budget);
        } catch (SegmentationException e) {
            transition(RunState.SEGMENTING, RunState.FAILED);
            long elapsedMs = System.currentTimeMillis() - startedAt;
            metricsService.recordRunFailed(FailureReason.SEGMENTATION_ERROR, elapsedMs);
            log.warn("Segmentation failed: {}", e.getMessage());
            return SynthesisResult.segmentationFailure(e.getMessage(), elapsedMs / 1000.0);
        }

        transition(RunState.SEGMENTING, RunState.NARRATING);
        SessionMemory memory = new SessionMemory(summaryMaxChars);
        memory.seed(context);
        NarrationOutcome outcome;
        try {
            outcome = segmentNarrator.narrate(segments, backends, memory, cancelled);
        } catch (AllBackendsExhaustedException e) {
            transition(RunState.NARRATING, RunState.FAILED);
            log.error("All backends exhausted on segment {}", e.getSegmentIndex(), e);
            return partialResult(memory, segments.size(), e.getPartialNarrations(), e.getFailoverEvents(),
                    FailureReason.ALL_BACKENDS_EXHAUSTED, e.getMessage(), startedAt);
        }

        if (outcome.cancelled()) {
            transition(RunState.NARRATING, RunState.FAILED);
            return partialResult(memory, segments.size(), outcome.narrations(), outcome.failoverEvents(),
                    FailureReason.CANCELLED, "Run cancelled after " + outcome.narrations().size() + " of "
                            + segments.size() + " segments", startedAt);
        }

        transition(RunState.NARRATING, RunState.SYNTHESIZING);
        StorySynthesizer.ComposedStory story = storySynthesizer.compose(outcome.narrations(), memory);
        transition(RunState.SYNTHESIZING, RunState.COMPLETE);

        long elapsedMs = System.currentTimeMillis() - startedAt;
        metricsService.recordRunCompleted(elapsedMs);
        log.info("Run complete: {} segments, {} failovers, completeness {}, {} ms",
                segments.size(), outcome.failoverEvents().size(), story.completenessScore(), elapsedMs);
        return new SynthesisResult(
                story.text(),
                outcome.narrations().size(),
                memory.getCharacters(),
                memory.getLocations(),
                memory.getPlotPoints(),
                story.completenessScore(),
                outcome.failoverEvents(),
                elapsedMs / 1000.0,
                true,
                null,
                null,
                outcome.narrations()
        );
    }

    private SynthesisResult partialResult(
            SessionMemory memory,
            int segmentCount,
            List<SegmentNarration> narrations,
            List<FailoverEvent> failoverEvents,
            FailureReason reason,
            String message,
            long startedAt) {
        StorySynthesizer.ComposedStory story = storySynthesizer.compose(narrations, memory);
        long successful = narrations.stream().filter(SegmentNarration::success).count();
        long elapsedMs = System.currentTimeMillis() - startedAt;
        metricsService.recordRunFailed(reason, elapsedMs);
        log.warn("Run ended with {} after {} of {} segments", reason, successful, segmentCount);
        return new SynthesisResult(
                story.text(),
                (int) successful,
                memory.getCharacters(),
                memory.getLocations(),
                memory.getPlotPoints(),
                story.completenessScore(),
                failoverEvents,
                elapsedMs / 1000.0,
                false,
                reason,
                message,
                narrations
        );
    }

    int resolveBudget(List<NarrationBackend> backends, Integer override) {
        if (override != null) {
            if (override <= 0) {
                throw new IllegalArgumentException("Segment token budget must be positive: " + override);
            }
            return override;
        }
        return backends.stream()
                .mapToInt(NarrationBackend::maxTokensPerSegment)
                .min()
                .orElseThrow(() -> new IllegalArgumentException("No narration backends configured"));
    }

    private void transition(RunState from, RunState to) {
        log.debug("Run state {} -> {}", from, to);
    }
}
