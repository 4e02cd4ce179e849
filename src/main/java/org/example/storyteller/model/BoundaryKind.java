package org.example.storyteller.model;

/**
 * Kinds of split points, highest priority first.
 * Part/session markers are hard: segments never span them.
 */
public enum BoundaryKind {
    PART_MARKER(40, true),
    ENCOUNTER_MARKER(30, false),
    SCENE_MARKER(20, false),
    CHAPTER_MARKER(10, false),
    SYNTHETIC(0, false);

    private final int priority;
    private final boolean hard;

    BoundaryKind(int priority, boolean hard) {
        this.priority = priority;
        this.hard = hard;
    }

    public int priority() {
        return priority;
    }

    public boolean isHard() {
        return hard;
    }
}
