package org.example.storyteller.service.backend;

import org.example.storyteller.model.ExtractedElements;
import org.example.storyteller.service.extract.ElementExtractor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Offline backend: template narration assembled from the segment's own lines and extracted elements,
 * tied back to earlier segments through the characters and setting named in the context digest.
 * No model call, fully deterministic, always available.
 */
public class TemplateNarrationBackend implements NarrationBackend {

    public static final String NAME = "offline";
    public static final int DEFAULT_MAX_TOKENS_PER_SEGMENT = 2000;

    private static final Pattern SPEAKER_LINE = Pattern.compile("^([A-Z][A-Za-z' -]{0,40}?)\\s*:\\s*(.+)$");
    private static final Pattern MARKER_LINE = Pattern.compile(
            "^(?:(?:session|part|chapter|scene|act|round)\\s+\\S+|combat|initiative|encounter|-{3,}|\\*{3,}|_{3,}"
                    + "|\\[(?:scene change|time skip|later)\\])$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern DECORATION = Pattern.compile("[*#_>]+");

    private static final List<String> OPENINGS = List.of(
            "The tale begins%s.",
            "Our story opens%s.",
            "It was here, %s, that the adventure began."
    );
    private static final List<String> CONTINUATIONS = List.of(
            "The story continues%s.",
            "The adventure pressed on%s.",
            "Events moved on%s."
    );
    private static final List<String> CLOSINGS = List.of(
            "As the session drew toward its end%s, the last threads came together.",
            "The final stretch of the night unfolded%s."
    );
    private static final String FINALE = "And so this chapter of the adventure came to a close.";
    private static final String NO_NAMES = "(none yet)";

    private final ElementExtractor elementExtractor;
    private final int maxTokensPerSegment;

    public TemplateNarrationBackend(ElementExtractor elementExtractor, int maxTokensPerSegment) {
        if (maxTokensPerSegment <= 0) {
            throw new IllegalArgumentException("maxTokensPerSegment must be positive for backend " + NAME);
        }
        this.elementExtractor = elementExtractor;
        this.maxTokensPerSegment = maxTokensPerSegment;
    }

    @Override
    public String narrate(String segmentText, String contextDigest, StyleHint styleHint) {
        String text = segmentText == null ? "" : segmentText;
        ExtractedElements elements = elementExtractor.extract(0, text);
        int variant = Math.floorMod(text.hashCode(), 1 << 16);

        String setting = digestLine(contextDigest, "Setting");
        StringBuilder story = new StringBuilder(openingLine(styleHint, elements, setting, variant));
        if (styleHint == StyleHint.OPENING && !elements.characters().isEmpty()) {
            story.append(" Gathered there were ").append(joinNames(new ArrayList<>(elements.characters()))).append('.');
        }

        List<String> paragraphs = retell(text);
        for (String paragraph : paragraphs) {
            story.append("\n\n").append(paragraph);
        }
        if (styleHint == StyleHint.CLOSING) {
            List<String> company = digestNames(contextDigest);
            if (!company.isEmpty()) {
                story.append("\n\n").append("Through it all the company held together: ")
                        .append(joinNames(company)).append('.');
            }
            story.append("\n\n").append(FINALE);
        }
        return story.toString();
    }

    private String openingLine(StyleHint styleHint, ExtractedElements elements, String setting, int variant) {
        List<String> templates = switch (styleHint) {
            case OPENING -> OPENINGS;
            case MIDDLE -> CONTINUATIONS;
            case CLOSING -> CLOSINGS;
        };
        String template = templates.get(variant % templates.size());
        String place = elements.locations().stream().findFirst()
                .orElse(styleHint == StyleHint.OPENING ? setting : null);
        if (template.contains(", %s,")) {
            return String.format(template, place == null ? "among friends" : "in " + place);
        }
        return String.format(template, place == null ? "" : " in " + place);
    }

    /**
     * Value of a {@code Label: value} line in the digest, or null.
     */
    static String digestLine(String digest, String label) {
        if (digest == null || digest.isBlank()) {
            return null;
        }
        String prefix = label + ": ";
        return digest.lines()
                .filter(line -> line.startsWith(prefix))
                .map(line -> line.substring(prefix.length()).strip())
                .filter(value -> !value.isEmpty() && !value.equals(NO_NAMES))
                .findFirst()
                .orElse(null);
    }

    private static List<String> digestNames(String digest) {
        String names = digestLine(digest, "Characters");
        if (names == null) {
            return List.of();
        }
        return Arrays.stream(names.split(","))
                .map(String::strip)
                .filter(name -> !name.isEmpty() && !name.endsWith("..."))
                .toList();
    }

    private List<String> retell(String text) {
        List<String> paragraphs = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String rawLine : text.split("\\R")) {
            String line = DECORATION.matcher(rawLine).replaceAll("").strip();
            if (line.isEmpty()) {
                flush(paragraphs, current);
                continue;
            }
            if (MARKER_LINE.matcher(line).matches()) {
                flush(paragraphs, current);
                continue;
            }
            if (current.length() > 0) {
                current.append(' ');
            }
            current.append(retellLine(line));
        }
        flush(paragraphs, current);
        return paragraphs;
    }

    private String retellLine(String line) {
        Matcher speaker = SPEAKER_LINE.matcher(line);
        if (!speaker.matches()) {
            return terminate(line);
        }
        String who = speaker.group(1).strip();
        String words = speaker.group(2).strip().replace("\"", "");
        if (who.equalsIgnoreCase("DM") || who.equalsIgnoreCase("GM") || who.equalsIgnoreCase("Location")) {
            return terminate(words);
        }
        return who + " said, \"" + terminate(words) + "\"";
    }

    private static String terminate(String sentence) {
        if (sentence.isEmpty()) {
            return sentence;
        }
        char last = sentence.charAt(sentence.length() - 1);
        return last == '.' || last == '!' || last == '?' ? sentence : sentence + ".";
    }

    private static void flush(List<String> paragraphs, StringBuilder current) {
        if (current.length() > 0) {
            paragraphs.add(current.toString());
            current.setLength(0);
        }
    }

    private static String joinNames(List<String> names) {
        if (names.size() == 1) {
            return names.get(0);
        }
        return String.join(", ", names.subList(0, names.size() - 1)) + " and " + names.get(names.size() - 1);
    }

    @Override
    public int maxTokensPerSegment() {
        return maxTokensPerSegment;
    }

    @Override
    public String name() {
        return NAME;
    }
}
