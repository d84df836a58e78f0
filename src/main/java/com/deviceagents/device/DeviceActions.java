package com.deviceagents.device;

import java.util.concurrent.CompletableFuture;

/**
 * Action side of the accessibility connection. Node actions report the platform's own
 * success flag, which callers must confirm by re-reading the screen.
 */
public interface DeviceActions {

    boolean click(UiTreeNode node);

    /** Focuses the node, then replaces its text. */
    boolean setText(UiTreeNode node, String text);

    boolean performAction(UiTreeNode node, NodeAction action);

    /**
     * Dispatches a tap gesture. The future completes with true once the gesture finished,
     * false when it was cancelled or could not be dispatched.
     */
    CompletableFuture<Boolean> tap(int x, int y, long durationMs);

    CompletableFuture<Boolean> swipe(SwipeDirection direction, float distanceRatio, long durationMs);

    boolean runGlobalAction(GlobalAction action);

    /** Display width in pixels, 0 when unknown. */
    int displayWidth();

    /**
     * Opens {@code uri} with a VIEW intent restricted to {@code packageName}.
     *
     * @return whether the intent was delivered; the resulting screen still has to be checked
     */
    boolean openDeepLink(String uri, String packageName);
}
