package org.example.storyteller.service.segment;

import org.example.storyteller.model.Boundary;
import org.example.storyteller.model.BoundaryKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds split points in a session transcript.
 * Every marker boundary sits at the start of the line that carries the marker.
 */
@Component
public class BoundaryDetector {

    private static final Logger log = LoggerFactory.getLogger(BoundaryDetector.class);

    private static final int FLAGS = Pattern.MULTILINE | Pattern.CASE_INSENSITIVE;
    private static final String LINE_PREFIX = "^[ \\t]*(?:[*#=>\\[]+[ \\t]*)?";
    private static final String ORDINAL = "(?:\\d+|[ivxlc]+|one|two|three|four|five|six|seven|eight|nine|ten)\\b";

    private record MarkerRule(Pattern pattern, BoundaryKind kind) {}

    private static final List<MarkerRule> MARKER_RULES = List.of(
            new MarkerRule(Pattern.compile(LINE_PREFIX + "(?:session|part)[ \\t]+" + ORDINAL, FLAGS),
                    BoundaryKind.PART_MARKER),
            new MarkerRule(Pattern.compile(LINE_PREFIX + "(?:combat|initiative|encounter|round[ \\t]+\\d+)\\b", FLAGS),
                    BoundaryKind.ENCOUNTER_MARKER),
            new MarkerRule(Pattern.compile("^[^\\n]*\\broll(?:s|ing)?[ \\t]+(?:for[ \\t]+)?initiative\\b", FLAGS),
                    BoundaryKind.ENCOUNTER_MARKER),
            new MarkerRule(Pattern.compile("^[ \\t]*(?:-{3,}|\\*{3,}|_{3,})[ \\t]*$", FLAGS),
                    BoundaryKind.SCENE_MARKER),
            new MarkerRule(Pattern.compile(LINE_PREFIX + "(?:scene|act)[ \\t]+" + ORDINAL, FLAGS),
                    BoundaryKind.SCENE_MARKER),
            new MarkerRule(Pattern.compile("^[ \\t]*\\[(?:scene change|time skip|later)\\]", FLAGS),
                    BoundaryKind.SCENE_MARKER),
            new MarkerRule(Pattern.compile(LINE_PREFIX + "chapter[ \\t]+(?:\\d+|[ivxlc]+\\b|[a-z]+\\b)", FLAGS),
                    BoundaryKind.CHAPTER_MARKER)
    );

    private final int minBoundaryDistance;

    public BoundaryDetector(@Value("${storyteller.segmentation.min-boundary-distance:200}") int minBoundaryDistance) {
        this.minBoundaryDistance = Math.max(1, minBoundaryDistance);
    }

    /**
     * Detects marker boundaries, ordered by offset. Offset 0 is never returned.
     * Markers closer than the minimum distance collapse into the higher-priority one.
     */
    public List<Boundary> detect(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Boundary> candidates = new ArrayList<>();
        for (MarkerRule rule : MARKER_RULES) {
            Matcher matcher = rule.pattern().matcher(text);
            while (matcher.find()) {
                candidates.add(Boundary.of(matcher.start(), rule.kind()));
            }
        }
        candidates.sort(Comparator.comparingInt(Boundary::offset)
                .thenComparing(Comparator.comparingInt(Boundary::priority).reversed()));

        List<Boundary> kept = new ArrayList<>();
        // The transcript start acts as an unbeatable boundary so nothing is kept right after it.
        Boundary last = new Boundary(0, BoundaryKind.PART_MARKER, Integer.MAX_VALUE);
        for (Boundary candidate : candidates) {
            if (candidate.offset() - last.offset() >= minBoundaryDistance) {
                kept.add(candidate);
                last = candidate;
            } else if (candidate.priority() > last.priority()) {
                kept.remove(kept.size() - 1);
                kept.add(candidate);
                last = candidate;
            }
        }

        log.debug("Detected {} boundaries from {} marker matches", kept.size(), candidates.size());
        return List.copyOf(kept);
    }

    /**
     * Evenly spaced boundaries for unstructured text, each moved to the nearest sentence start
     * (or word start when no sentence ends nearby) so no word is ever split.
     */
    public List<Boundary> synthesize(String text, int segmentCount) {
        if (text == null || text.isEmpty() || segmentCount <= 1) {
            return List.of();
        }

        int length = text.length();
        int window = Math.max(1, length / (segmentCount * 4));
        List<Boundary> boundaries = new ArrayList<>();
        int previous = 0;
        for (int k = 1; k < segmentCount; k++) {
            int target = (int) ((long) length * k / segmentCount);
            int offset = TextBoundaries.nearestSentenceStart(text, target, window);
            if (offset < 0) {
                offset = TextBoundaries.nearestWordStart(text, target, window);
            }
            if (offset <= previous || offset >= length) {
                continue;
            }
            boundaries.add(Boundary.of(offset, BoundaryKind.SYNTHETIC));
            previous = offset;
        }

        log.debug("Synthesized {} boundaries for {} target segments", boundaries.size(), segmentCount);
        return List.copyOf(boundaries);
    }
}
