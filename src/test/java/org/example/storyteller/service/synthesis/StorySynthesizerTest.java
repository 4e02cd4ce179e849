package org.example.storyteller.service.synthesis;

import org.example.storyteller.model.ExtractedElements;
import org.example.storyteller.model.SegmentNarration;
import org.example.storyteller.model.SessionContext;
import org.example.storyteller.service.memory.SessionMemory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StorySynthesizerTest {

    private final StorySynthesizer synthesizer = new StorySynthesizer();
    private SessionMemory memory;

    @BeforeEach
    void setUp() {
        memory = new SessionMemory(1500);
        memory.register(new ExtractedElements(0, Set.of("Aria"), Set.of("Ironhold"),
                List.of("Aria discovers the hidden door")));
        memory.register(new ExtractedElements(1, Set.of("Brom"), Set.of(), List.of()));
    }

    @Test
    void compose_joinsNarrationsAndAppendsDramatisPersonae() {
        StorySynthesizer.ComposedStory story = synthesizer.compose(List.of(
                narration(0, "Aria woke early in Ironhold. She discovers the hidden door."),
                narration(1, "Brom sharpened his blade. Nobody spoke.")
        ), memory);

        String[] paragraphs = story.text().split("\n\n");
        assertEquals(3, paragraphs.length);
        assertEquals("Aria woke early in Ironhold. She discovers the hidden door.", paragraphs[0]);
        assertTrue(paragraphs[2].startsWith("Dramatis Personae\nCharacters: Aria, Brom\nPlaces: Ironhold\nThreads:"));
        assertTrue(paragraphs[2].contains("- Aria discovers the hidden door"));
        assertEquals(1.0, story.completenessScore(), 1e-9);
    }

    @Test
    void compose_nearIdenticalOpening_isDropped() {
        StorySynthesizer.ComposedStory story = synthesizer.compose(List.of(
                narration(0, "The mist hung over the valley as dawn broke. Aria woke."),
                narration(1, "The mist hung over the valley as the day broke. Brom sharpened his blade.")
        ), memory);

        String second = story.text().split("\n\n")[1];
        assertEquals("Brom sharpened his blade.", second);
    }

    @Test
    void compose_openingRepeatingKnownLocationWithoutCharacter_isDropped() {
        StorySynthesizer.ComposedStory story = synthesizer.compose(List.of(
                narration(0, "Rain fell over Ironhold all night. Aria kept watch."),
                narration(1, "Ironhold lay silent under grey clouds. Brom sharpened his blade.")
        ), memory);

        assertFalse(story.text().contains("Ironhold lay silent"));
        assertTrue(story.text().contains("Brom sharpened his blade."));
    }

    @Test
    void compose_openingThatIntroducesCharacter_isKept() {
        StorySynthesizer.ComposedStory story = synthesizer.compose(List.of(
                narration(0, "Rain fell over Ironhold all night. Aria kept watch."),
                narration(1, "Brom reached Ironhold at noon. He was tired.")
        ), memory);

        assertTrue(story.text().contains("Brom reached Ironhold at noon."));
    }

    @Test
    void compose_singleSentenceNarration_isNeverEmptied() {
        StorySynthesizer.ComposedStory story = synthesizer.compose(List.of(
                narration(0, "The mist hung over the valley."),
                narration(1, "The mist hung over the valley.")
        ), memory);

        assertTrue(story.text().startsWith("The mist hung over the valley.\n\nThe mist hung over the valley.\n\n"));
    }

    @Test
    void compose_skipsFailedNarrationsAndRejectsGaps() {
        SegmentNarration failed = SegmentNarration.failed(1, "local", Duration.ZERO);

        StorySynthesizer.ComposedStory story = synthesizer.compose(List.of(narration(0, "Aria woke."), failed), memory);

        assertTrue(story.text().startsWith("Aria woke."));
        assertThrows(IllegalArgumentException.class,
                () -> synthesizer.compose(List.of(narration(0, "One."), narration(2, "Three.")), memory));
    }

    @Test
    void score_countsNamesAndNearVerbatimPlotPoints() {
        double partial = synthesizer.score("Aria walked through Ironhold.", memory);
        double full = synthesizer.score("Aria and Brom reached Ironhold, where Aria then discovers a hidden door.", memory);

        assertEquals(0.5, partial, 1e-9);
        assertEquals(1.0, full, 1e-9);
    }

    @Test
    void compose_narrationsThatDropEntities_scoreLowEvenThoughRosterIsListed() {
        StorySynthesizer.ComposedStory bland = synthesizer.compose(List.of(
                narration(0, "Nothing of note happened."),
                narration(1, "Nothing of note happened.")
        ), memory);
        StorySynthesizer.ComposedStory partial = synthesizer.compose(List.of(
                narration(0, "Aria woke early in Ironhold."),
                narration(1, "The night passed quietly.")
        ), memory);

        assertTrue(bland.text().contains("Characters: Aria, Brom"));
        assertEquals(0.0, bland.completenessScore(), 1e-9);
        assertEquals(0.5, partial.completenessScore(), 1e-9);
    }

    @Test
    void score_ignoresRosterNamesTheTranscriptNeverMentioned() {
        SessionMemory seeded = new SessionMemory(1500);
        seeded.seed(new SessionContext("Night 3", null, List.of("Aria", "Vex"), List.of(), null));
        seeded.register(new ExtractedElements(0, Set.of("Aria"), Set.of(), List.of()));

        StorySynthesizer.ComposedStory story = synthesizer.compose(List.of(narration(0, "Aria kept watch.")), seeded);

        assertEquals(1.0, story.completenessScore(), 1e-9);
        assertTrue(story.text().contains("Characters: Aria, Vex"));
    }

    @Test
    void score_nothingRegistered_isOne() {
        assertEquals(1.0, synthesizer.score("", new SessionMemory(100)), 1e-9);
        assertEquals("", synthesizer.closingParagraph(new SessionMemory(100)));
    }

    @Test
    void jaccard_ofWordSets() {
        assertEquals(0.5, StorySynthesizer.jaccard(Set.of("a", "b"), Set.of("b", "c", "a", "d")), 1e-9);
        assertEquals(0.0, StorySynthesizer.jaccard(Set.of(), Set.of()), 1e-9);
    }

    private static SegmentNarration narration(int index, String text) {
        return new SegmentNarration(index, text, "offline", true, Duration.ofMillis(5));
    }
}
