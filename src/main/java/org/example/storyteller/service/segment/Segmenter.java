package org.example.storyteller.service.segment;

import org.example.storyteller.model.Boundary;
import org.example.storyteller.model.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

/**
 * Turns a transcript and its boundaries into an ordered, gap-free, non-overlapping list of segments,
 * each within the token budget. Concatenating the segment contents reproduces the transcript exactly.
 */
@Component
public class Segmenter {

    private static final Logger log = LoggerFactory.getLogger(Segmenter.class);

    private final BoundaryDetector boundaryDetector;
    private final TokenEstimator tokenEstimator;

    public Segmenter(BoundaryDetector boundaryDetector, TokenEstimator tokenEstimator) {
        this.boundaryDetector = boundaryDetector;
        this.tokenEstimator = tokenEstimator;
    }

    /**
     * Detects boundaries (synthesizing them for unmarked text) and segments the transcript.
     *
     * @throws SegmentationException if the transcript is null, empty or blank
     */
    public List<Segment> segment(String transcript, int tokenBudget) {
        requireSegmentable(transcript);
        requirePositiveBudget(tokenBudget);

        List<Boundary> boundaries = boundaryDetector.detect(transcript);
        int totalTokens = tokenEstimator.estimate(transcript);
        if (boundaries.isEmpty() && totalTokens > tokenBudget) {
            int targetSegments = (totalTokens + tokenBudget - 1) / tokenBudget;
            log.info("No markers found; dividing {} estimated tokens into {} sentence-aligned segments",
                    totalTokens, targetSegments);
            boundaries = boundaryDetector.synthesize(transcript, targetSegments);
        }

        List<Segment> segments = split(transcript, boundaries, tokenBudget);
        log.info("Segmented transcript of {} chars ({} tokens) into {} segments with budget {}",
                transcript.length(), totalTokens, segments.size(), tokenBudget);
        return segments;
    }

    /**
     * Greedily packs boundary-delimited spans into segments. Hard boundaries always start a new
     * segment; a span larger than the budget on its own is force-split at sentence starts.
     */
    public List<Segment> split(String transcript, List<Boundary> boundaries, int tokenBudget) {
        requireSegmentable(transcript);
        requirePositiveBudget(tokenBudget);

        int length = transcript.length();
        TreeMap<Integer, Boundary> cuts = new TreeMap<>();
        if (boundaries != null) {
            for (Boundary boundary : boundaries) {
                if (boundary.offset() > 0 && boundary.offset() < length) {
                    cuts.merge(boundary.offset(), boundary,
                            (existing, incoming) -> incoming.priority() > existing.priority() ? incoming : existing);
                }
            }
        }

        List<int[]> ranges = new ArrayList<>();
        int spanStart = 0;
        int currentStart = 0;
        int currentEnd = 0;
        List<Integer> offsets = new ArrayList<>(cuts.keySet());
        offsets.add(length);

        for (int spanEnd : offsets) {
            boolean hardStart = spanStart > 0 && cuts.containsKey(spanStart) && cuts.get(spanStart).kind().isHard();
            int spanTokens = tokenEstimator.estimate(spanEnd - spanStart);

            if (spanTokens > tokenBudget) {
                if (currentEnd > currentStart) {
                    ranges.add(new int[]{currentStart, currentEnd});
                }
                ranges.addAll(forceSplit(transcript, spanStart, spanEnd, tokenBudget));
                currentStart = spanEnd;
                currentEnd = spanEnd;
            } else {
                boolean overBudget = tokenEstimator.estimate(spanEnd - currentStart) > tokenBudget;
                if (currentEnd > currentStart && (hardStart || overBudget)) {
                    ranges.add(new int[]{currentStart, currentEnd});
                    currentStart = spanStart;
                }
                currentEnd = spanEnd;
            }
            spanStart = spanEnd;
        }
        if (currentEnd > currentStart) {
            ranges.add(new int[]{currentStart, currentEnd});
        }

        List<Segment> segments = new ArrayList<>(ranges.size());
        for (int[] range : ranges) {
            String content = transcript.substring(range[0], range[1]);
            segments.add(new Segment(segments.size(), range[0], range[1], content, tokenEstimator.estimate(content)));
        }
        return List.copyOf(segments);
    }

    private List<int[]> forceSplit(String transcript, int start, int end, int tokenBudget) {
        int maxChars = tokenEstimator.maxCharsFor(tokenBudget);
        List<int[]> pieces = new ArrayList<>();
        int pieceStart = start;
        while (tokenEstimator.estimate(end - pieceStart) > tokenBudget) {
            int limit = pieceStart + maxChars;
            int cut = TextBoundaries.lastSentenceStart(transcript, pieceStart, limit);
            if (cut < 0) {
                cut = TextBoundaries.lastWordStart(transcript, pieceStart, limit);
            }
            if (cut < 0) {
                log.warn("No whitespace within {} chars after offset {}; cutting at the budget limit",
                        maxChars, pieceStart);
                cut = limit;
            }
            pieces.add(new int[]{pieceStart, cut});
            pieceStart = cut;
        }
        pieces.add(new int[]{pieceStart, end});
        return pieces;
    }

    private void requireSegmentable(String transcript) {
        if (transcript == null || transcript.isBlank()) {
            throw new SegmentationException("Transcript is empty; nothing to segment");
        }
    }

    private void requirePositiveBudget(int tokenBudget) {
        if (tokenBudget <= 0) {
            throw new IllegalArgumentException("Segment token budget must be positive: " + tokenBudget);
        }
    }
}
