package org.example.storyteller.model;

import java.util.List;

/**
 * What the caller already knows about the session before the transcript is read: its name, the
 * campaign setting, the party roster and what happened in earlier sessions.
 */
public record SessionContext(
        String sessionName,
        String setting,
        List<String> characters,
        List<String> previousEvents,
        String campaignNotes
) {
    public SessionContext {
        sessionName = blankToNull(sessionName);
        setting = blankToNull(setting);
        characters = clean(characters);
        previousEvents = clean(previousEvents);
        campaignNotes = blankToNull(campaignNotes);
    }

    public static SessionContext empty() {
        return new SessionContext(null, null, List.of(), List.of(), null);
    }

    public boolean isEmpty() {
        return sessionName == null && setting == null && characters.isEmpty() && previousEvents.isEmpty()
                && campaignNotes == null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }

    private static List<String> clean(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(value -> value != null && !value.isBlank())
                .map(String::strip)
                .toList();
    }
}
