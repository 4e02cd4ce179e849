package org.example.storyteller.service.extract;

import org.example.storyteller.model.ExtractedElements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic extraction of characters, locations and notable events from one segment.
 * <p>
 * Rules are evaluated per sentence in priority order; for characters and locations the first rule
 * that yields an accepted candidate wins for that sentence. The output depends only on the input text,
 * so it is identical whichever narration backend is active. Extraction never throws: a failure is
 * logged as an extraction warning and yields empty elements.
 */
@Component
public class ElementExtractor {

    private static final Logger log = LoggerFactory.getLogger(ElementExtractor.class);

    private static final Pattern SENTENCE_SPLIT = Pattern.compile("(?<=[.!?])\\s+|\\n+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MAX_EVENT_LENGTH = 160;
    private static final int MAX_NAME_LENGTH = 40;
    private static final int MAX_NAME_WORDS = 4;

    private static final String NAME = "[A-Z][A-Za-z'-]+";
    private static final String ACTION_VERBS = "rolls|attacks|casts|moves|investigates|discovers|finds|says|asks"
            + "|draws|swings|shouts|whispers|defeats|grabs|opens|runs|heals|sneaks|climbs|strikes|fires|charges"
            + "|searches|examines|enters|leaves|reveals|steals|flees|escapes|slays|rescues|arrives|replies|nods";
    private static final String PLACE_NOUNS = "Forest|Woods|Cave|Caves|Cavern|Caverns|Tower|Temple|City|Village|Town"
            + "|Dungeon|Keep|Castle|Tavern|Inn|Mountain|Mountains|Pass|Bridge|Crypt|Ruins|Harbor|Harbour|Market"
            + "|Library|Hall|Fortress|Swamp|Marsh|Lake|River|Vale|Valley|Citadel|Sanctum|Mine|Mines|Shrine|Gate"
            + "|Port|Catacombs|Abbey|Manor|Palace|Docks|Sewers|Camp|Outpost";
    private static final String EVENT_VERBS = "rolls?|rolled|attacks?|attacked|casts?|moves?|moved|investigates?"
            + "|investigated|discovers?|discovered|finds?|found|defeats?|defeated|slays?|slew|escapes?|escaped"
            + "|steals?|stole|reveals?|revealed|betrays?|betrayed|rescues?|rescued|uncovers?|uncovered|opens?"
            + "|opened|enters?|entered|flees?|fled|dies|died|captures?|captured|kills?|killed";

    public static final List<ExtractionRule> DEFAULT_RULES = List.of(
            ExtractionRule.of("speaker-tag",
                    "^\\s*\\*{0,2}(" + NAME + "(?:\\s+" + NAME + "){0,2})\\*{0,2}\\s*:",
                    ExtractionCategory.CHARACTER, 10, 1),
            ExtractionRule.of("player-alias",
                    "Player\\s+\\d+\\s*\\(([^)]{2,40})\\)",
                    ExtractionCategory.CHARACTER, 20, 1),
            ExtractionRule.of("actor-verb",
                    "\\b([A-Z][a-z]+(?:\\s+[A-Z][a-z]+)?)\\s+(?:" + ACTION_VERBS + ")\\b",
                    ExtractionCategory.CHARACTER, 30, 1),
            ExtractionRule.of("location-tag",
                    "(?i:location)\\s*:\\s*([A-Z][^.\\n,;:]{1,48})",
                    ExtractionCategory.LOCATION, 10, 1),
            ExtractionRule.of("place-noun",
                    "\\b((?:[A-Z][a-z]+\\s+){0,2}(?:" + PLACE_NOUNS + "))\\b",
                    ExtractionCategory.LOCATION, 20, 1),
            ExtractionRule.of("locative-cue",
                    "\\b(?:in|at|near|through|entering|leaving|into|inside|toward|towards|reach|reaches|reached)"
                            + "\\s+(?:[Tt]he\\s+)?([A-Z][a-z]+(?:\\s+[A-Z][a-z]+){0,2})\\b(?!['’])",
                    ExtractionCategory.LOCATION, 30, 1),
            ExtractionRule.ofIgnoreCase("action-verb",
                    "\\b(?:" + EVENT_VERBS + ")\\b",
                    ExtractionCategory.EVENT, 10, 0)
    );

    static final Set<String> STOPWORDS = Set.of(
            "i", "you", "he", "she", "they", "we", "it", "me", "him", "her", "them", "us",
            "the", "a", "an", "this", "that", "these", "those", "then", "now", "and", "but", "so", "or",
            "his", "hers", "their", "our", "my", "your", "its", "what", "why", "how", "who", "where", "when",
            "while", "there", "here", "finally", "later", "also", "meanwhile", "suddenly", "after", "before",
            "dm", "gm", "dungeon master", "master", "player", "players", "everyone", "someone", "nobody", "party",
            "session", "part", "round", "combat", "scene", "chapter", "act", "encounter", "initiative",
            "location", "roll", "rolls", "nat", "natural", "damage", "hit", "miss", "turn", "check", "save",
            "monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday",
            "yes", "no", "okay", "ok", "well", "oh", "hey", "let", "lets", "let's", "if", "as", "with", "on"
    );

    private final List<ExtractionRule> rules;
    private final int maxEventsPerSegment;

    @Autowired
    public ElementExtractor(@Value("${storyteller.extraction.max-events-per-segment:5}") int maxEventsPerSegment) {
        this(DEFAULT_RULES, maxEventsPerSegment);
    }

    public ElementExtractor(List<ExtractionRule> rules, int maxEventsPerSegment) {
        this.rules = rules.stream()
                .sorted(Comparator.comparingInt(ExtractionRule::priority))
                .toList();
        this.maxEventsPerSegment = Math.max(0, maxEventsPerSegment);
    }

    public List<ExtractionRule> getRules() {
        return rules;
    }

    public ExtractedElements extract(int segmentIndex, String text) {
        if (text == null || text.isBlank()) {
            return ExtractedElements.empty(segmentIndex);
        }
        try {
            return doExtract(segmentIndex, text);
        } catch (RuntimeException e) {
            log.warn("Extraction warning for segment {}: {}; continuing with empty elements",
                    segmentIndex, e.toString());
            return ExtractedElements.empty(segmentIndex);
        }
    }

    private ExtractedElements doExtract(int segmentIndex, String text) {
        Map<ExtractionCategory, List<ExtractionRule>> byCategory = new EnumMap<>(ExtractionCategory.class);
        for (ExtractionRule rule : rules) {
            byCategory.computeIfAbsent(rule.category(), ignored -> new ArrayList<>()).add(rule);
        }

        Map<String, String> characters = new LinkedHashMap<>();
        Map<String, String> locations = new LinkedHashMap<>();
        Set<String> events = new LinkedHashSet<>();

        for (String sentence : SENTENCE_SPLIT.split(text)) {
            if (sentence.isBlank()) {
                continue;
            }
            firstMatchingNames(sentence, byCategory.get(ExtractionCategory.CHARACTER))
                    .forEach(name -> characters.putIfAbsent(key(name), name));
            firstMatchingNames(sentence, byCategory.get(ExtractionCategory.LOCATION))
                    .forEach(name -> locations.putIfAbsent(key(name), name));
            if (events.size() < maxEventsPerSegment && matchesAny(sentence, byCategory.get(ExtractionCategory.EVENT))) {
                String event = toEvent(sentence);
                if (!event.isEmpty()) {
                    events.add(event);
                }
            }
        }

        // Speaker tags and actor verbs are stronger evidence than locative cues.
        locations.keySet().removeAll(characters.keySet());

        return new ExtractedElements(
                segmentIndex,
                new LinkedHashSet<>(characters.values()),
                new LinkedHashSet<>(locations.values()),
                new ArrayList<>(events)
        );
    }

    private List<String> firstMatchingNames(String sentence, List<ExtractionRule> categoryRules) {
        if (categoryRules == null) {
            return List.of();
        }
        for (ExtractionRule rule : categoryRules) {
            List<String> accepted = new ArrayList<>();
            Matcher matcher = rule.pattern().matcher(sentence);
            while (matcher.find()) {
                String candidate = normalizeName(matcher.group(rule.group()));
                if (candidate != null) {
                    accepted.add(candidate);
                }
            }
            if (!accepted.isEmpty()) {
                return accepted;
            }
        }
        return List.of();
    }

    private boolean matchesAny(String sentence, List<ExtractionRule> categoryRules) {
        if (categoryRules == null) {
            return false;
        }
        return categoryRules.stream().anyMatch(rule -> rule.pattern().matcher(sentence).find());
    }

    String normalizeName(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = WHITESPACE.matcher(raw.replace("*", " ")).replaceAll(" ").trim();
        cleaned = cleaned.replaceAll("^[^A-Za-z]+|[^A-Za-z]+$", "");
        if (cleaned.isEmpty()) {
            return null;
        }

        List<String> tokens = new ArrayList<>(Arrays.asList(cleaned.split(" ")));
        while (!tokens.isEmpty() && STOPWORDS.contains(tokens.get(0).toLowerCase(Locale.ROOT))) {
            tokens.remove(0);
        }
        if (tokens.isEmpty() || tokens.size() > MAX_NAME_WORDS) {
            return null;
        }
        if (tokens.stream().anyMatch(token -> STOPWORDS.contains(token.toLowerCase(Locale.ROOT)))) {
            return null;
        }
        String name = String.join(" ", tokens);
        if (STOPWORDS.contains(name.toLowerCase(Locale.ROOT))
                || name.length() < 2
                || name.length() > MAX_NAME_LENGTH
                || !Character.isUpperCase(name.charAt(0))) {
            return null;
        }
        return name;
    }

    private String toEvent(String sentence) {
        String cleaned = WHITESPACE.matcher(sentence.replace("*", "")).replaceAll(" ").trim();
        if (cleaned.split(" ").length < 3) {
            return "";
        }
        if (cleaned.length() <= MAX_EVENT_LENGTH) {
            return cleaned;
        }
        return cleaned.substring(0, MAX_EVENT_LENGTH).trim() + "...";
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
