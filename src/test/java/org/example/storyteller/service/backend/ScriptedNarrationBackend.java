package org.example.storyteller.service.backend;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Test backend whose behaviour per call is scripted; call numbers start at 1.
 */
public class ScriptedNarrationBackend implements NarrationBackend {

    public record Call(String segmentText, String contextDigest, StyleHint styleHint) {}

    private final String name;
    private final int maxTokensPerSegment;
    private final boolean metered;
    private final IntFunction<String> script;
    private final List<Call> calls = new ArrayList<>();
    private boolean available = true;

    public ScriptedNarrationBackend(String name, int maxTokensPerSegment, boolean metered, IntFunction<String> script) {
        this.name = name;
        this.maxTokensPerSegment = maxTokensPerSegment;
        this.metered = metered;
        this.script = script;
    }

    /**
     * Returns the segment text unchanged.
     */
    public static ScriptedNarrationBackend echo(String name, int maxTokensPerSegment) {
        return new ScriptedNarrationBackend(name, maxTokensPerSegment, false, null);
    }

    public static ScriptedNarrationBackend failing(String name, int maxTokensPerSegment) {
        return new ScriptedNarrationBackend(name, maxTokensPerSegment, false, call -> {
            throw new BackendUnavailableException(name, "connection refused");
        });
    }

    @Override
    public String narrate(String segmentText, String contextDigest, StyleHint styleHint) {
        calls.add(new Call(segmentText, contextDigest, styleHint));
        if (script == null) {
            return segmentText;
        }
        return script.apply(calls.size());
    }

    @Override
    public int maxTokensPerSegment() {
        return maxTokensPerSegment;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isMetered() {
        return metered;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public List<Call> getCalls() {
        return calls;
    }
}
