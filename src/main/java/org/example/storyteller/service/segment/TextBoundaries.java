package org.example.storyteller.service.segment;

/**
 * Offsets where a cut keeps sentences, or at least words, intact.
 * A returned offset is always the first character of the following piece.
 */
final class TextBoundaries {

    private TextBoundaries() {
    }

    static boolean isSentenceStart(CharSequence text, int position) {
        if (!isWordStart(text, position)) {
            return false;
        }
        int cursor = position - 1;
        while (cursor >= 0 && Character.isWhitespace(text.charAt(cursor))) {
            if (text.charAt(cursor) == '\n') {
                return true;
            }
            cursor--;
        }
        if (cursor < 0) {
            return false;
        }
        char last = text.charAt(cursor);
        if ((last == '"' || last == '\'' || last == ')' || last == '*') && cursor > 0) {
            last = text.charAt(cursor - 1);
        }
        return last == '.' || last == '!' || last == '?';
    }

    static boolean isWordStart(CharSequence text, int position) {
        return position > 0
                && position < text.length()
                && !Character.isWhitespace(text.charAt(position))
                && Character.isWhitespace(text.charAt(position - 1));
    }

    /**
     * Nearest sentence start within {@code window} of {@code target}, preferring the earlier one on ties.
     */
    static int nearestSentenceStart(CharSequence text, int target, int window) {
        for (int distance = 0; distance <= window; distance++) {
            if (isSentenceStart(text, target - distance)) {
                return target - distance;
            }
            if (isSentenceStart(text, target + distance)) {
                return target + distance;
            }
        }
        return -1;
    }

    static int nearestWordStart(CharSequence text, int target, int window) {
        for (int distance = 0; distance <= window; distance++) {
            if (isWordStart(text, target - distance)) {
                return target - distance;
            }
            if (isWordStart(text, target + distance)) {
                return target + distance;
            }
        }
        return -1;
    }

    /**
     * Last sentence start in {@code (from, limit]}, or -1.
     */
    static int lastSentenceStart(CharSequence text, int from, int limit) {
        for (int position = Math.min(limit, text.length() - 1); position > from; position--) {
            if (isSentenceStart(text, position)) {
                return position;
            }
        }
        return -1;
    }

    static int lastWordStart(CharSequence text, int from, int limit) {
        for (int position = Math.min(limit, text.length() - 1); position > from; position--) {
            if (isWordStart(text, position)) {
                return position;
            }
        }
        return -1;
    }
}
