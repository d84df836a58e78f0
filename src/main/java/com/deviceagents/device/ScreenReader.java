package com.deviceagents.device;

import com.deviceagents.screen.ScreenSnapshot;

/**
 * Read side of the accessibility connection.
 */
public interface ScreenReader {

    /**
     * Captures a bounded, text-centric snapshot of the foreground window.
     *
     * @return null when no connection or no active window exists; never throws for that case
     */
    ScreenSnapshot capture(int maxNodes);

    /**
     * Live root of the active window, needed for node actions.
     *
     * @return null when no connection or no active window exists
     */
    UiTreeNode activeRoot();

    boolean isConnected();
}
