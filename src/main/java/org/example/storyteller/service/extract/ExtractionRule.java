package org.example.storyteller.service.extract;

import java.util.regex.Pattern;

/**
 * One row of the extraction rule table. Lower priority values are evaluated first;
 * {@code group} selects the capture group holding the candidate (0 for the whole match).
 */
public record ExtractionRule(
        String name,
        Pattern pattern,
        ExtractionCategory category,
        int priority,
        int group
) {
    public static ExtractionRule of(String name, String regex, ExtractionCategory category, int priority, int group) {
        return new ExtractionRule(name, Pattern.compile(regex), category, priority, group);
    }

    public static ExtractionRule ofIgnoreCase(String name, String regex, ExtractionCategory category, int priority, int group) {
        return new ExtractionRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), category, priority, group);
    }
}
