package org.example.storyteller.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Characters, locations and notable events pulled from one segment.
 */
public record ExtractedElements(
        int segmentIndex,
        Set<String> characters,
        Set<String> locations,
        List<String> events
) {
    public ExtractedElements {
        characters = characters == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(characters));
        locations = locations == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(locations));
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static ExtractedElements empty(int segmentIndex) {
        return new ExtractedElements(segmentIndex, Set.of(), Set.of(), List.of());
    }

    public boolean isEmpty() {
        return characters.isEmpty() && locations.isEmpty() && events.isEmpty();
    }
}
