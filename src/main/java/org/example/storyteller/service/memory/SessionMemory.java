package org.example.storyteller.service.memory;

import org.example.storyteller.model.ExtractedElements;
import org.example.storyteller.model.PlotPoint;
import org.example.storyteller.model.SessionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Run-scoped state accumulated while a transcript is narrated segment by segment.
 * <p>
 * Character and location sets only ever grow (case-insensitive, first spelling wins). The free-text
 * running summary is the only part that shrinks, through {@link #compact()}. One instance belongs to
 * exactly one run and is not thread-safe.
 */
public class SessionMemory {

    private static final Logger log = LoggerFactory.getLogger(SessionMemory.class);

    static final int RECENT_PLOT_POINTS = 5;
    static final int ALWAYS_KEPT_RECENT_LINES = 2;
    static final int NARRATION_EXCERPT_CHARS = 200;
    static final int CAMPAIGN_NOTES_CHARS = 300;

    private final int summaryMaxChars;
    private final Map<String, String> characters = new LinkedHashMap<>();
    private final Map<String, String> locations = new LinkedHashMap<>();
    private final List<PlotPoint> plotPoints = new ArrayList<>();
    private final List<String> summaryLines = new ArrayList<>();
    // Roster names the transcript has not mentioned yet.
    private final Set<String> seededOnlyCharacters = new HashSet<>();
    private String sessionName;
    private String setting;
    private String campaignNotes;
    private int lastSegmentIndex = -1;

    public SessionMemory(int summaryMaxChars) {
        if (summaryMaxChars <= 0) {
            throw new IllegalArgumentException("summaryMaxChars must be positive: " + summaryMaxChars);
        }
        this.summaryMaxChars = summaryMaxChars;
    }

    /**
     * Primes the memory with caller-supplied context before segment 0: the roster joins the character
     * set, earlier events open the running summary, and the session name, setting and notes head every
     * digest.
     */
    public void seed(SessionContext context) {
        if (context == null || context.isEmpty()) {
            return;
        }
        if (lastSegmentIndex >= 0) {
            throw new IllegalStateException("Session context must be seeded before segment 0 is registered");
        }
        sessionName = context.sessionName();
        setting = context.setting();
        campaignNotes = context.campaignNotes() == null ? null : excerpt(context.campaignNotes(), CAMPAIGN_NOTES_CHARS);

        for (String name : context.characters()) {
            if (characters.putIfAbsent(key(name), name) == null) {
                seededOnlyCharacters.add(key(name));
            }
        }
        context.previousEvents().forEach(event -> appendSummaryLine("Previously: " + event));
        log.debug("Seeded session memory: {} characters, {} earlier events",
                context.characters().size(), context.previousEvents().size());
    }

    /**
     * Merges one segment's elements. Segments must arrive in non-decreasing index order.
     */
    public void register(ExtractedElements elements) {
        if (elements == null) {
            return;
        }
        if (elements.segmentIndex() < lastSegmentIndex) {
            throw new IllegalStateException("Segment " + elements.segmentIndex()
                    + " registered after segment " + lastSegmentIndex);
        }
        lastSegmentIndex = elements.segmentIndex();

        elements.characters().forEach(name -> {
            characters.putIfAbsent(key(name), name);
            seededOnlyCharacters.remove(key(name));
        });
        elements.locations().forEach(name -> locations.putIfAbsent(key(name), name));
        elements.events().forEach(event -> plotPoints.add(new PlotPoint(elements.segmentIndex(), event)));

        if (!elements.isEmpty()) {
            appendSummaryLine(describe(elements));
        }
    }

    /**
     * Folds a short excerpt of a finished narration into the running summary.
     */
    public void appendNarrationSummary(int segmentIndex, String narration) {
        if (narration == null || narration.isBlank()) {
            return;
        }
        appendSummaryLine("Segment " + (segmentIndex + 1) + " narrated: " + excerpt(narration, NARRATION_EXCERPT_CHARS));
    }

    /**
     * Bounded digest of what is known so far: entity lists, the most recent plot points and the
     * compacted summary, cut to {@code maxChars}.
     */
    public String snapshotContext(int maxChars) {
        if (maxChars <= 0) {
            return "";
        }
        StringBuilder digest = new StringBuilder();
        if (sessionName != null) {
            digest.append("Session: ").append(sessionName).append('\n');
        }
        if (setting != null) {
            digest.append("Setting: ").append(setting).append('\n');
        }
        if (campaignNotes != null) {
            digest.append("Campaign notes: ").append(campaignNotes).append('\n');
        }
        digest.append("Characters: ").append(listOrNone(getCharacters())).append('\n');
        digest.append("Locations: ").append(listOrNone(getLocations())).append('\n');

        List<PlotPoint> recent = plotPoints.subList(Math.max(0, plotPoints.size() - RECENT_PLOT_POINTS), plotPoints.size());
        if (!recent.isEmpty()) {
            digest.append("Recent events:\n");
            recent.forEach(point -> digest.append("- ").append(point.text()).append('\n'));
        }
        if (!summaryLines.isEmpty()) {
            digest.append("Story so far:\n").append(getSummary()).append('\n');
        }

        String result = digest.toString().stripTrailing();
        if (result.length() <= maxChars) {
            return result;
        }
        if (maxChars <= 3) {
            return result.substring(0, maxChars);
        }
        return result.substring(0, maxChars - 3).trim() + "...";
    }

    /**
     * Shrinks the running summary to half its limit, keeping the newest lines and the older lines
     * that mention the most known characters and locations, in their original order.
     */
    public void compact() {
        int target = summaryMaxChars / 2;
        int before = summaryLength();
        if (before <= target) {
            return;
        }

        int size = summaryLines.size();
        boolean[] keep = new boolean[size];
        int used = 0;
        for (int i = size - 1; i >= Math.max(0, size - ALWAYS_KEPT_RECENT_LINES); i--) {
            keep[i] = true;
            used += summaryLines.get(i).length() + 1;
        }

        List<Integer> olderBySalience = IntStream.range(0, Math.max(0, size - ALWAYS_KEPT_RECENT_LINES))
                .boxed()
                .sorted(Comparator.comparingInt((Integer i) -> salience(summaryLines.get(i))).reversed()
                        .thenComparing(Comparator.reverseOrder()))
                .toList();
        for (int i : olderBySalience) {
            int cost = summaryLines.get(i).length() + 1;
            if (used + cost <= target) {
                keep[i] = true;
                used += cost;
            }
        }

        List<String> retained = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            if (keep[i]) {
                retained.add(summaryLines.get(i));
            }
        }
        summaryLines.clear();
        summaryLines.addAll(retained);

        // The newest lines alone may still exceed the target; trim the oldest of them.
        while (summaryLength() > target && summaryLines.size() > 1) {
            summaryLines.remove(0);
        }
        if (summaryLength() > target) {
            String only = summaryLines.get(0);
            summaryLines.set(0, only.substring(only.length() - target));
        }
        log.debug("Compacted session summary from {} to {} chars", before, summaryLength());
    }

    public List<String> getCharacters() {
        return List.copyOf(characters.values());
    }

    /**
     * Characters the transcript itself has mentioned, leaving out roster names it never brought up.
     */
    public List<String> getTranscriptCharacters() {
        return characters.entrySet().stream()
                .filter(entry -> !seededOnlyCharacters.contains(entry.getKey()))
                .map(Map.Entry::getValue)
                .toList();
    }

    public List<String> getLocations() {
        return List.copyOf(locations.values());
    }

    public List<PlotPoint> getPlotPoints() {
        return List.copyOf(plotPoints);
    }

    public String getSummary() {
        return String.join("\n", summaryLines);
    }

    public int summaryLength() {
        return getSummary().length();
    }

    public int getLastSegmentIndex() {
        return lastSegmentIndex;
    }

    private void appendSummaryLine(String line) {
        summaryLines.add(line);
        if (summaryLength() > summaryMaxChars) {
            compact();
        }
    }

    private int salience(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        int score = 0;
        for (String name : characters.keySet()) {
            if (lower.contains(name)) {
                score++;
            }
        }
        for (String name : locations.keySet()) {
            if (lower.contains(name)) {
                score++;
            }
        }
        return score;
    }

    private String describe(ExtractedElements elements) {
        StringBuilder line = new StringBuilder("Segment ").append(elements.segmentIndex() + 1).append(':');
        if (!elements.characters().isEmpty()) {
            line.append(" with ").append(String.join(", ", elements.characters())).append(';');
        }
        if (!elements.locations().isEmpty()) {
            line.append(" at ").append(String.join(", ", elements.locations())).append(';');
        }
        if (!elements.events().isEmpty()) {
            line.append(' ').append(elements.events().get(0));
        }
        return line.toString();
    }

    private static String excerpt(String text, int maxChars) {
        String flattened = text.strip().replaceAll("\\s+", " ");
        return flattened.length() > maxChars ? flattened.substring(0, maxChars).trim() + "..." : flattened;
    }

    private static String listOrNone(List<String> values) {
        return values.isEmpty() ? "(none yet)" : String.join(", ", values);
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
