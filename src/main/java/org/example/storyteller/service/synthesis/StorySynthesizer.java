package org.example.storyteller.service.synthesis;

import org.example.storyteller.model.PlotPoint;
import org.example.storyteller.model.SegmentNarration;
import org.example.storyteller.service.memory.SessionMemory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Joins per-segment narrations into one story and appends a closing cast paragraph. The completeness
 * score measures how much of the session memory the narrations themselves carried.
 */
@Component
public class StorySynthesizer {

    private static final Logger log = LoggerFactory.getLogger(StorySynthesizer.class);

    static final double OPENING_SIMILARITY_THRESHOLD = 0.6;
    static final double PLOT_POINT_WORD_MATCH = 0.6;
    static final int MAX_PLOT_THREADS = 8;
    static final String DRAMATIS_PERSONAE = "Dramatis Personae";

    private static final Pattern FIRST_SENTENCE_END = Pattern.compile("(?<=[.!?])[\"'”’)]*\\s+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{Nd}']+");
    private static final Set<String> INSIGNIFICANT_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "of", "to", "in", "on", "at", "for", "with", "by", "from",
            "is", "was", "are", "were", "be", "it", "its", "as", "that", "this", "his", "her", "their", "they",
            "he", "she", "we", "you", "i"
    );

    public record ComposedStory(String text, double completenessScore) {
    }

    /**
     * Composes successful narrations, which must be in index order without gaps starting at 0.
     */
    public ComposedStory compose(List<SegmentNarration> narrations, SessionMemory memory) {
        List<SegmentNarration> ordered = narrations.stream()
                .filter(SegmentNarration::success)
                .toList();
        for (int i = 0; i < ordered.size(); i++) {
            if (ordered.get(i).segmentIndex() != i) {
                throw new IllegalArgumentException("Narrations must be contiguous from segment 0; found segment "
                        + ordered.get(i).segmentIndex() + " at position " + i);
            }
        }

        List<String> paragraphs = new ArrayList<>();
        String previousOpening = null;
        int dropped = 0;
        for (SegmentNarration narration : ordered) {
            String text = narration.text().strip();
            if (text.isEmpty()) {
                continue;
            }
            String[] split = splitFirstSentence(text);
            String opening = split[0];
            if (previousOpening != null && !split[1].isEmpty() && restatesOpening(previousOpening, opening, memory)) {
                log.debug("Dropping repeated opening of segment {}: {}", narration.segmentIndex(), opening);
                text = split[1];
                dropped++;
            }
            previousOpening = opening;
            paragraphs.add(text);
        }

        // Scored before the cast paragraph is added, since that paragraph names every registered entity.
        double score = score(String.join("\n\n", paragraphs), memory);
        String closing = closingParagraph(memory);
        if (!closing.isEmpty()) {
            paragraphs.add(closing);
        }
        String story = String.join("\n\n", paragraphs);
        log.info("Composed story from {} narrations ({} repeated openings dropped), completeness {}",
                ordered.size(), dropped, String.format(Locale.ROOT, "%.2f", score));
        return new ComposedStory(story, score);
    }

    /**
     * Fraction of registered characters, locations and plot points present in {@code text}.
     * Characters known only from the caller's session context are not counted.
     * With nothing registered the score is 1.0.
     */
    public double score(String text, SessionMemory memory) {
        List<String> characters = memory.getTranscriptCharacters();
        List<String> locations = memory.getLocations();
        List<PlotPoint> plotPoints = memory.getPlotPoints();
        int total = characters.size() + locations.size() + plotPoints.size();
        if (total == 0) {
            return 1.0;
        }

        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        Set<String> textWords = words(lower);
        int found = 0;
        for (String name : characters) {
            if (lower.contains(name.toLowerCase(Locale.ROOT))) {
                found++;
            }
        }
        for (String name : locations) {
            if (lower.contains(name.toLowerCase(Locale.ROOT))) {
                found++;
            }
        }
        for (PlotPoint point : plotPoints) {
            if (plotPointPresent(point.text(), lower, textWords)) {
                found++;
            }
        }
        return (double) found / total;
    }

    String closingParagraph(SessionMemory memory) {
        List<String> characters = memory.getCharacters();
        List<String> locations = memory.getLocations();
        List<PlotPoint> plotPoints = memory.getPlotPoints();
        if (characters.isEmpty() && locations.isEmpty() && plotPoints.isEmpty()) {
            return "";
        }

        StringBuilder closing = new StringBuilder(DRAMATIS_PERSONAE).append('\n');
        if (!characters.isEmpty()) {
            closing.append("Characters: ").append(String.join(", ", characters)).append('\n');
        }
        if (!locations.isEmpty()) {
            closing.append("Places: ").append(String.join(", ", locations)).append('\n');
        }
        if (!plotPoints.isEmpty()) {
            closing.append("Threads:\n");
            plotPoints.stream()
                    .limit(MAX_PLOT_THREADS)
                    .forEach(point -> closing.append("- ").append(point.text()).append('\n'));
        }
        return closing.toString().stripTrailing();
    }

    boolean restatesOpening(String previousOpening, String opening, SessionMemory memory) {
        if (jaccard(words(previousOpening.toLowerCase(Locale.ROOT)), words(opening.toLowerCase(Locale.ROOT)))
                >= OPENING_SIMILARITY_THRESHOLD) {
            return true;
        }
        // Same scene-setting: both openings name a known place and the new one introduces nobody.
        String previousLower = previousOpening.toLowerCase(Locale.ROOT);
        String lower = opening.toLowerCase(Locale.ROOT);
        boolean sharedLocation = memory.getLocations().stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .anyMatch(name -> previousLower.contains(name) && lower.contains(name));
        boolean namesCharacter = memory.getCharacters().stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .anyMatch(lower::contains);
        return sharedLocation && !namesCharacter;
    }

    static String[] splitFirstSentence(String text) {
        var matcher = FIRST_SENTENCE_END.matcher(text);
        if (!matcher.find()) {
            return new String[]{text, ""};
        }
        return new String[]{text.substring(0, matcher.start()).strip(), text.substring(matcher.end()).strip()};
    }

    static double jaccard(Set<String> left, Set<String> right) {
        if (left.isEmpty() && right.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        return (double) intersection.size() / union.size();
    }

    private boolean plotPointPresent(String plotPoint, String lowerText, Set<String> textWords) {
        String lowerPoint = plotPoint.toLowerCase(Locale.ROOT);
        if (lowerPoint.endsWith("...")) {
            lowerPoint = lowerPoint.substring(0, lowerPoint.length() - 3);
        }
        if (lowerText.contains(lowerPoint.strip())) {
            return true;
        }
        Set<String> significant = words(lowerPoint).stream()
                .filter(word -> !INSIGNIFICANT_WORDS.contains(word))
                .collect(Collectors.toSet());
        if (significant.isEmpty()) {
            return false;
        }
        long matched = significant.stream().filter(textWords::contains).count();
        return (double) matched / significant.size() >= PLOT_POINT_WORD_MATCH;
    }

    private static Set<String> words(String lowerText) {
        return Arrays.stream(NON_WORD.split(lowerText))
                .filter(word -> !word.isBlank())
                .collect(Collectors.toSet());
    }
}
