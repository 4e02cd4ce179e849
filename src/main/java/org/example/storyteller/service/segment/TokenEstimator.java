package org.example.storyteller.service.segment;

import org.springframework.stereotype.Component;

/**
 * Character-count token estimate: one token per three characters, rounded up.
 * Deliberately conservative so budgets hold for every supported backend.
 */
@Component
public class TokenEstimator {

    static final int CHARS_PER_TOKEN = 3;

    public int estimate(CharSequence text) {
        return text == null ? 0 : estimate(text.length());
    }

    public int estimate(int charCount) {
        if (charCount <= 0) {
            return 0;
        }
        return (charCount + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    /**
     * Largest character count whose estimate still fits in {@code tokens}.
     */
    public int maxCharsFor(int tokens) {
        if (tokens <= 0) {
            return 0;
        }
        return (int) Math.min(Integer.MAX_VALUE, (long) tokens * CHARS_PER_TOKEN);
    }
}
