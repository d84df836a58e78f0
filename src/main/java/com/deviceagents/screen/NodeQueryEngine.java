package com.deviceagents.screen;

import com.deviceagents.device.Bounds;
import com.deviceagents.device.DeviceActions;
import com.deviceagents.device.SwipeDirection;
import com.deviceagents.device.UiTreeNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * 活动窗口树上的节点查询与节点动作。
 * <p>
 * 查询在活节点上进行（快照是只读投影，动作需要活节点）。所有查询都是迭代式深度优先（先序），
 * 最多访问 {@link #MAX_VISITED_NODES} 个节点；找不到时返回 null / false，不抛异常。
 * </p>
 */
public class NodeQueryEngine {
    private static final Logger logger = LogManager.getLogger(NodeQueryEngine.class);

    static final int MAX_VISITED_NODES = 2_000;
    public static final long DEFAULT_TAP_DURATION_MS = 80L;
    public static final long MIN_TAP_DURATION_MS = 40L;
    public static final long MAX_TAP_DURATION_MS = 600L;
    public static final float MIN_SWIPE_RATIO = 0.15f;
    public static final float MAX_SWIPE_RATIO = 0.9f;
    public static final long MIN_SWIPE_DURATION_MS = 120L;
    public static final long MAX_SWIPE_DURATION_MS = 1_500L;

    private final DeviceActions actions;
    private final long gestureTimeoutMs;

    public NodeQueryEngine(DeviceActions actions, long gestureTimeoutMs) {
        this.actions = actions;
        this.gestureTimeoutMs = gestureTimeoutMs;
    }

    /**
     * Matches text or content description; {@code exact} means case-insensitive equality,
     * otherwise case-insensitive substring. {@code occurrence} is 1-based.
     */
    public UiTreeNode findByText(UiTreeNode root, String query, boolean exact, int occurrence) {
        return findByText(root, query, exact, occurrence, false);
    }

    private UiTreeNode findByText(UiTreeNode root, String query, boolean exact, int occurrence,
                                  boolean skipEditable) {
        if (query == null || query.trim().isEmpty()) {
            return null;
        }
        String wanted = lower(query);
        int wantedIndex = Math.max(1, occurrence);
        int[] matchCount = {0};
        return findByPredicate(root, node -> {
            if (skipEditable && isEditable(node)) {
                return false;
            }
            String text = lower(node.getText());
            String desc = lower(node.getContentDescription());
            boolean match = exact
                    ? text.equals(wanted) || desc.equals(wanted)
                    : text.contains(wanted) || desc.contains(wanted);
            return match && ++matchCount[0] == wantedIndex;
        });
    }

    public UiTreeNode findByText(UiTreeNode root, String query, boolean exact) {
        return findByText(root, query, exact, 1);
    }

    /**
     * Hints are tried in order; the first hint that is a case-insensitive substring of some
     * node's view id wins.
     */
    public UiTreeNode findByIdHints(UiTreeNode root, List<String> hints) {
        if (hints == null) {
            return null;
        }
        for (String hint : hints) {
            if (hint == null || hint.trim().isEmpty()) continue;
            String h = lower(hint);
            UiTreeNode found = findByPredicate(root, node -> lower(node.getViewId()).contains(h));
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    public UiTreeNode findByContentDescription(UiTreeNode root, String text) {
        if (text == null || text.trim().isEmpty()) return null;
        String wanted = lower(text);
        return findByPredicate(root, node -> lower(node.getContentDescription()).contains(wanted));
    }

    public UiTreeNode findByClassName(UiTreeNode root, String className) {
        if (className == null || className.trim().isEmpty()) return null;
        String wanted = lower(className);
        return findByPredicate(root, node -> lower(node.getClassName()).contains(wanted));
    }

    public UiTreeNode findByPredicate(UiTreeNode root, Predicate<UiTreeNode> predicate) {
        if (root == null) {
            return null;
        }
        ArrayDeque<UiTreeNode> stack = new ArrayDeque<>();
        stack.push(root);
        int visited = 0;
        while (!stack.isEmpty() && visited < MAX_VISITED_NODES) {
            UiTreeNode node = stack.pop();
            visited++;
            try {
                if (predicate.test(node)) {
                    return node;
                }
                // push in reverse so children are visited in order
                for (int i = node.getChildCount() - 1; i >= 0; i--) {
                    UiTreeNode child = node.getChild(i);
                    if (child != null) {
                        stack.push(child);
                    }
                }
            } catch (RuntimeException e) {
                logger.debug("Skipping stale node during search: {}", e.getMessage());
            }
        }
        return null;
    }

    /**
     * Clicks the node when clickable, otherwise the nearest clickable ancestor.
     *
     * @return false when no node in the parent chain is clickable or every click failed
     */
    public boolean clickNodeOrAncestor(UiTreeNode node) {
        UiTreeNode current = node;
        int depth = 0;
        while (current != null && depth < MAX_VISITED_NODES) {
            if (current.isClickable() && actions.click(current)) {
                return true;
            }
            current = current.getParent();
            depth++;
        }
        return false;
    }

    /** No verification here; callers re-read the screen. */
    public boolean setText(UiTreeNode node, String text) {
        if (node == null) {
            return false;
        }
        return actions.setText(node, text);
    }

    /**
     * Finds a node by text, clicks it (or an ancestor) and falls back to tapping the centre of
     * its bounds.
     */
    public TapResult tapVisibleNodeByText(UiTreeNode root, String query, boolean exact, int occurrence) {
        return tapVisibleNodeByText(root, query, exact, occurrence, false);
    }

    /**
     * @param skipEditable ignore text fields, whose content is user input rather than a label
     */
    public TapResult tapVisibleNodeByText(UiTreeNode root, String query, boolean exact, int occurrence,
                                          boolean skipEditable) {
        if (root == null) {
            return TapResult.failed("No active window found. Unlock your phone and open an app.");
        }
        UiTreeNode target = findByText(root, query, exact, occurrence, skipEditable);
        if (target == null) {
            return TapResult.failed("No matching node found for '" + query + "'.");
        }
        String packageName = root.getPackageName();
        if (clickNodeOrAncestor(target)) {
            return TapResult.tapped(packageName, target.getText(), target.getContentDescription());
        }
        Bounds bounds = target.getBounds();
        if (bounds != null && !bounds.isEmpty()
                && tap(bounds.centerX(), bounds.centerY(), DEFAULT_TAP_DURATION_MS)) {
            return TapResult.tapped(packageName, target.getText(), target.getContentDescription());
        }
        return TapResult.failed("Found a matching node, but click action failed.");
    }

    public boolean tap(int x, int y, long durationMs) {
        long duration = Math.max(MIN_TAP_DURATION_MS, Math.min(MAX_TAP_DURATION_MS, durationMs));
        return Gestures.await(actions.tap(x, y, duration), gestureTimeoutMs + duration);
    }

    /** Ratio is clamped to 0.15..0.9 of the screen, duration to 120..1500 ms. */
    public boolean swipe(SwipeDirection direction, float distanceRatio, long durationMs) {
        if (direction == null) {
            return false;
        }
        float ratio = clampRatio(distanceRatio);
        long duration = clampSwipeDuration(durationMs);
        return Gestures.await(actions.swipe(direction, ratio, duration), gestureTimeoutMs + duration);
    }

    public static float clampRatio(float ratio) {
        return Math.max(MIN_SWIPE_RATIO, Math.min(MAX_SWIPE_RATIO, ratio));
    }

    public static long clampSwipeDuration(long durationMs) {
        return Math.max(MIN_SWIPE_DURATION_MS, Math.min(MAX_SWIPE_DURATION_MS, durationMs));
    }

    public DeviceActions actions() {
        return actions;
    }

    public long gestureTimeoutMs() {
        return gestureTimeoutMs;
    }

    public static boolean isEditable(UiTreeNode node) {
        return lower(node.getClassName()).contains("edittext");
    }

    static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
