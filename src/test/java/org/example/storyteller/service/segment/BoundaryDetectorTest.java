package org.example.storyteller.service.segment;

import org.example.storyteller.model.Boundary;
import org.example.storyteller.model.BoundaryKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoundaryDetectorTest {

    private final BoundaryDetector detector = new BoundaryDetector(200);

    @Test
    void detect_partMarkers_returnsLineStartOffsetsAndSkipsTranscriptStart() {
        String filler = "The party talks about the road ahead and checks supplies. ".repeat(6);
        String text = "Part 1\n" + filler + "\nPart 2\n" + filler + "\n## Session 3\n" + filler;

        List<Boundary> boundaries = detector.detect(text);

        assertEquals(2, boundaries.size());
        assertEquals(text.indexOf("Part 2"), boundaries.get(0).offset());
        assertEquals(text.indexOf("## Session 3"), boundaries.get(1).offset());
        assertTrue(boundaries.stream().allMatch(b -> b.kind() == BoundaryKind.PART_MARKER));
    }

    @Test
    void detect_markersCloserThanMinimumDistance_keepsHigherPriority() {
        String filler = "Rain falls on the old stones while the group waits. ".repeat(6);
        String text = filler + "\nScene 2\nA short line.\nSession 2\n" + filler;

        List<Boundary> boundaries = detector.detect(text);

        assertEquals(1, boundaries.size());
        assertEquals(BoundaryKind.PART_MARKER, boundaries.get(0).kind());
        assertEquals(text.indexOf("Session 2"), boundaries.get(0).offset());
    }

    @Test
    void detect_recognizesEncounterSceneAndChapterMarkers() {
        String filler = "Everyone settles in while the dice are passed around the table. ".repeat(5);
        String text = filler + "\nRoll for initiative!\n" + filler + "\n---\n" + filler + "\nChapter Two\n" + filler;

        List<Boundary> boundaries = detector.detect(text);

        assertEquals(List.of(BoundaryKind.ENCOUNTER_MARKER, BoundaryKind.SCENE_MARKER, BoundaryKind.CHAPTER_MARKER),
                boundaries.stream().map(Boundary::kind).toList());
    }

    @Test
    void detect_plainProse_returnsNoBoundaries() {
        String text = "The heroes walked for a long time and nothing much happened. ".repeat(20);

        assertTrue(detector.detect(text).isEmpty());
        assertTrue(detector.detect("").isEmpty());
    }

    @Test
    void synthesize_unmarkedText_placesBoundariesAtSentenceStarts() {
        String text = "The lantern flickered as the wind picked up outside. ".repeat(60);

        List<Boundary> boundaries = detector.synthesize(text, 3);

        assertEquals(2, boundaries.size());
        for (Boundary boundary : boundaries) {
            assertEquals(BoundaryKind.SYNTHETIC, boundary.kind());
            assertTrue(TextBoundaries.isSentenceStart(text, boundary.offset()), "offset " + boundary.offset());
        }
        assertTrue(boundaries.get(0).offset() < boundaries.get(1).offset());
    }

    @Test
    void synthesize_withoutSentenceEnds_fallsBackToWordStarts() {
        String text = "word ".repeat(300);

        List<Boundary> boundaries = detector.synthesize(text, 4);

        assertEquals(3, boundaries.size());
        boundaries.forEach(b -> assertTrue(TextBoundaries.isWordStart(text, b.offset())));
    }
}
