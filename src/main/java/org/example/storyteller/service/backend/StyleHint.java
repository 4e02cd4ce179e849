package org.example.storyteller.service.backend;

/**
 * Position of a segment in the story, used to steer the narration's register.
 */
public enum StyleHint {
    OPENING("Open the story: establish the setting and introduce the characters as they appear."),
    MIDDLE("Continue the story from where it left off; do not re-introduce the setting or the cast."),
    CLOSING("Bring the story to a close: resolve this part's events and end on a concluding note.");

    private final String instruction;

    StyleHint(String instruction) {
        this.instruction = instruction;
    }

    public String instruction() {
        return instruction;
    }

    public static StyleHint forPosition(int index, int segmentCount) {
        if (index <= 0) {
            return OPENING;
        }
        if (index >= segmentCount - 1) {
            return CLOSING;
        }
        return MIDDLE;
    }
}
