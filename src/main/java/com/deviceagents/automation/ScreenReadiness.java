package com.deviceagents.automation;

import com.deviceagents.screen.ScreenNode;
import com.deviceagents.screen.ScreenSnapshot;
import com.deviceagents.screen.ScreenStateGuards;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Waits used around a search: the opened app settling, and results appearing after submit.
 */
public class ScreenReadiness {
    private static final Logger logger = LogManager.getLogger(ScreenReadiness.class);

    public static final long DEFAULT_POLL_MS = 280L;
    static final int MIN_READY_NODES = 6;
    static final int REQUIRED_STABLE_COUNT = 3;
    static final double STABLE_SIMILARITY = 0.9;
    static final int RESULTS_SNAPSHOT_NODES = 140;
    static final int MIN_RESULT_NODES = 10;
    static final int REQUIRED_RESULT_CONFIRMATIONS = 2;

    private static final List<String> RESULT_INDICATORS = Arrays.asList(
            "results", "about", "all", "images", "videos", "news", "shopping", "maps",
            "top stories", "found", "search results", "showing", "of", "items", "entries",
            "view", "see", "filter", "sort", "refine");
    private static final List<String> RESULT_HINTS = Arrays.asList(
            "results", "about", "all", "images", "videos", "news", "shopping", "maps", "top stories");

    private final ScreenStateGuards guards;

    public ScreenReadiness(ScreenStateGuards guards) {
        this.guards = guards;
    }

    /**
     * Waits for at least {@value #MIN_READY_NODES} text nodes in {@code expectedPackage} that stay
     * stable over {@value #REQUIRED_STABLE_COUNT} consecutive comparisons. On timeout the last
     * populated snapshot is returned, or null.
     */
    public ScreenSnapshot waitForScreenReady(String expectedPackage, long timeoutMs, long pollMs) {
        long endAt = guards.session().now() + timeoutMs;
        ScreenSnapshot last = null;
        int stableCount = 0;
        while (guards.session().now() < endAt) {
            ScreenSnapshot snapshot = guards.capture();
            if (snapshot != null && expectedPackage.equals(snapshot.getPackageName())
                    && snapshot.getNodes().size() >= MIN_READY_NODES
                    && !ScreenStateGuards.highlights(snapshot, 16).isEmpty()) {
                if (last != null) {
                    if (isStable(last, snapshot)) {
                        stableCount++;
                        if (stableCount >= REQUIRED_STABLE_COUNT) {
                            return snapshot;
                        }
                    } else {
                        stableCount = 0;
                    }
                }
                last = snapshot;
            }
            if (!guards.pause(pollMs)) {
                break;
            }
        }
        logger.debug("Screen of {} did not settle within {} ms", expectedPackage, timeoutMs);
        return last;
    }

    /**
     * Waits for two consecutive snapshots that look like a results page for {@code query}.
     */
    public ScreenSnapshot waitForSearchResults(String expectedPackage, String query, long timeoutMs, long pollMs) {
        long endAt = guards.session().now() + timeoutMs;
        ScreenSnapshot last = null;
        int confirmations = 0;
        while (guards.session().now() < endAt) {
            ScreenSnapshot snapshot = guards.capture(RESULTS_SNAPSHOT_NODES);
            if (snapshot != null && expectedPackage.equals(snapshot.getPackageName())) {
                boolean confirmed = ScreenStateGuards.containsText(snapshot, query)
                        && (hasResultIndicators(snapshot) || snapshot.getNodes().size() >= MIN_RESULT_NODES)
                        && isLikelyResultsScreen(snapshot, query);
                if (confirmed) {
                    confirmations++;
                    if (confirmations >= REQUIRED_RESULT_CONFIRMATIONS) {
                        return snapshot;
                    }
                } else {
                    confirmations = 0;
                }
                last = snapshot;
            }
            if (!guards.pause(pollMs)) {
                break;
            }
        }
        if (last != null && ScreenStateGuards.containsText(last, query) && isLikelyResultsScreen(last, query)) {
            return last;
        }
        return null;
    }

    static boolean isStable(ScreenSnapshot previous, ScreenSnapshot current) {
        if (previous.getNodes().size() != current.getNodes().size()) {
            return false;
        }
        if (ScreenStateGuards.highlights(previous).size() != ScreenStateGuards.highlights(current).size()) {
            return false;
        }
        return similarity(joinedText(previous), joinedText(current)) >= STABLE_SIMILARITY;
    }

    static boolean hasResultIndicators(ScreenSnapshot snapshot) {
        for (ScreenNode node : snapshot.getNodes()) {
            String merged = merged(node);
            for (String indicator : RESULT_INDICATORS) {
                if (merged.contains(indicator)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * The query shows up outside any text field, or the page carries result-tab hints and
     * enough content.
     */
    static boolean isLikelyResultsScreen(ScreenSnapshot snapshot, String query) {
        String normalized = query.trim().toLowerCase(Locale.ROOT);
        String[] tokens = normalized.split("\\s+");
        boolean hasResultHints = false;
        for (ScreenNode node : snapshot.getNodes()) {
            String merged = merged(node);
            if (merged.isEmpty()) continue;
            if (!hasResultHints) {
                for (String hint : RESULT_HINTS) {
                    if (merged.contains(hint)) {
                        hasResultHints = true;
                        break;
                    }
                }
            }
            if (node.getClassName().toLowerCase(Locale.ROOT).contains("edittext")) continue;
            if (merged.contains(normalized)) {
                return true;
            }
            int matched = 0;
            for (String token : tokens) {
                if (token.length() >= 3 && merged.contains(token)) {
                    matched++;
                }
            }
            if (matched >= 2) {
                return true;
            }
        }
        return hasResultHints && snapshot.getNodes().size() >= MIN_RESULT_NODES;
    }

    /** 1 - (edit distance / length of the longer string). */
    static double similarity(String a, String b) {
        if (a.equals(b)) return 1.0;
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        String longer = a.length() >= b.length() ? a : b;
        String shorter = longer == a ? b : a;
        int distance = levenshtein(longer, shorter);
        return (longer.length() - distance) / (double) longer.length();
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(previous[j] + 1, current[j - 1] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    private static String joinedText(ScreenSnapshot snapshot) {
        StringBuilder sb = new StringBuilder();
        for (ScreenNode node : snapshot.getNodes()) {
            if (sb.length() > 0) sb.append('|');
            sb.append(node.getText()).append(node.getContentDescription());
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    private static String merged(ScreenNode node) {
        return (node.getText() + " " + node.getContentDescription()).trim().toLowerCase(Locale.ROOT);
    }
}
