package com.deviceagents.screen;

import com.deviceagents.config.AppConfig;
import com.deviceagents.device.DeviceSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 前台等待与检查点记录。
 * <p>
 * {@link #waitForForegroundPackage} 是自动化核心唯一的阻塞点：按固定间隔轮询快照，
 * 直到前台包名落在期望集合内或超时。文本判断均基于快照的 highlights（去重后的可见文本），
 * 与节点身份无关。
 * </p>
 */
public class ScreenStateGuards {
    private static final Logger logger = LogManager.getLogger(ScreenStateGuards.class);

    public static final int DEFAULT_HIGHLIGHT_LIMIT = 10;
    public static final long DEFAULT_POLL_MS = 280L;
    static final int TEXT_MATCH_HIGHLIGHT_LIMIT = 60;
    static final int PHONE_SUFFIX_DIGITS = 6;

    private final DeviceSession session;

    public ScreenStateGuards(DeviceSession session) {
        this.session = session;
    }

    /** Snapshot with the configured node limit ({@code snapshot.max.nodes}). */
    public ScreenSnapshot capture() {
        return capture(AppConfig.getInstance().getSnapshotMaxNodes());
    }

    /**
     * @return null when the screen cannot be read
     */
    public ScreenSnapshot capture(int maxNodes) {
        if (session.screen() == null) {
            return null;
        }
        try {
            return session.screen().capture(maxNodes);
        } catch (RuntimeException e) {
            logger.warn("Screen capture failed: {}", e.getMessage());
            return null;
        }
    }

    public ScreenSnapshot waitForForegroundPackage(Set<String> expectedPackages) {
        AppConfig config = AppConfig.getInstance();
        return waitForForegroundPackage(expectedPackages, config.getForegroundTimeoutMs(), config.getForegroundPollMs());
    }

    /**
     * Polls until the foreground package is one of {@code expectedPackages}.
     *
     * @return the matching snapshot, or null on timeout or interruption
     */
    public ScreenSnapshot waitForForegroundPackage(Set<String> expectedPackages, long timeoutMs, long pollMs) {
        long endAt = session.now() + Math.max(0L, timeoutMs);
        long interval = Math.max(1L, pollMs);
        while (true) {
            ScreenSnapshot snapshot = capture();
            if (snapshot != null && expectedPackages.contains(snapshot.getPackageName())) {
                return snapshot;
            }
            if (session.now() >= endAt) {
                return null;
            }
            if (!pause(interval)) {
                return null;
            }
        }
    }

    /**
     * Sleeps through the session's sleeper.
     *
     * @return false when interrupted; the interrupt flag is restored
     */
    public boolean pause(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            session.sleeper().sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Wait interrupted");
            return false;
        }
    }

    public ScreenCheckpoint captureCheckpoint(String step, String expectedPackage) {
        return checkpointOf(step, expectedPackage, capture());
    }

    public static ScreenCheckpoint checkpointOf(String step, String expectedPackage, ScreenSnapshot snapshot) {
        String actualPackage = snapshot == null ? "" : snapshot.getPackageName();
        return new ScreenCheckpoint(step, expectedPackage, actualPackage, highlights(snapshot, DEFAULT_HIGHLIGHT_LIMIT));
    }

    public static List<String> highlights(ScreenSnapshot snapshot) {
        return highlights(snapshot, DEFAULT_HIGHLIGHT_LIMIT);
    }

    /**
     * Distinct trimmed text of each node (description when text is blank), in snapshot order.
     */
    public static List<String> highlights(ScreenSnapshot snapshot, int limit) {
        return highlights(snapshot, limit, true);
    }

    /** Highlights without text fields, so typed input is not mistaken for screen content. */
    public static List<String> readOnlyHighlights(ScreenSnapshot snapshot) {
        return highlights(snapshot, DEFAULT_HIGHLIGHT_LIMIT, false);
    }

    private static List<String> highlights(ScreenSnapshot snapshot, int limit, boolean includeEditable) {
        if (snapshot == null || limit <= 0) {
            return Collections.emptyList();
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (ScreenNode node : snapshot.getNodes()) {
            if (!includeEditable && node.isEditable()) {
                continue;
            }
            String text = node.getText().trim();
            String description = node.getContentDescription().trim();
            if (!text.isEmpty()) {
                distinct.add(text);
            } else if (!description.isEmpty()) {
                distinct.add(description);
            }
            if (distinct.size() >= limit) {
                break;
            }
        }
        return new ArrayList<>(distinct);
    }

    /**
     * Case-insensitive check against the joined highlights. When the whole value is not
     * present, tokens of at least 3 characters are counted: 2 must match when there are 3 or
     * more tokens, otherwise 1. The token rule can pass on partial overlaps such as a
     * shared first name.
     */
    public static boolean containsText(ScreenSnapshot snapshot, String value) {
        if (snapshot == null || value == null) {
            return false;
        }
        String query = value.trim().toLowerCase(Locale.ROOT);
        if (query.isEmpty()) {
            return false;
        }
        String haystack = String.join(" ", highlights(snapshot, TEXT_MATCH_HIGHLIGHT_LIMIT)).toLowerCase(Locale.ROOT);
        if (haystack.contains(query)) {
            return true;
        }
        List<String> tokens = new ArrayList<>();
        for (String token : query.split("\\s+")) {
            if (token.length() >= 3) {
                tokens.add(token);
            }
        }
        if (tokens.isEmpty()) {
            return false;
        }
        int matched = 0;
        for (String token : tokens) {
            if (haystack.contains(token)) {
                matched++;
            }
        }
        int required = tokens.size() >= 3 ? 2 : 1;
        return matched >= required;
    }

    /**
     * True when the last six digits of {@code phoneNumber} appear in the digits of some node's
     * text plus description. Numbers with fewer than six digits never match.
     */
    public static boolean containsPhone(ScreenSnapshot snapshot, String phoneNumber) {
        if (snapshot == null || phoneNumber == null) {
            return false;
        }
        String digits = digitsOf(phoneNumber);
        if (digits.length() < PHONE_SUFFIX_DIGITS) {
            return false;
        }
        String suffix = digits.substring(digits.length() - PHONE_SUFFIX_DIGITS);
        for (ScreenNode node : snapshot.getNodes()) {
            if (digitsOf(node.getText() + node.getContentDescription()).contains(suffix)) {
                return true;
            }
        }
        return false;
    }

    public static String digitsOf(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isDigit(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public DeviceSession session() {
        return session;
    }
}
