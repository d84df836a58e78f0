package com.deviceagents.automation.messaging;

import com.deviceagents.screen.ScreenCheckpoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of opening a pre-filled conversation. Nothing is sent; the user still taps send.
 */
public final class DraftOutcome {

    private final boolean success;
    private final String error;
    private final boolean screenStateVerified;
    private final List<ScreenCheckpoint> checkpoints;

    private DraftOutcome(boolean success, String error, boolean screenStateVerified, List<ScreenCheckpoint> checkpoints) {
        this.success = success;
        this.error = error;
        this.screenStateVerified = screenStateVerified;
        this.checkpoints = Collections.unmodifiableList(new ArrayList<>(checkpoints));
    }

    public static DraftOutcome opened(boolean screenStateVerified, List<ScreenCheckpoint> checkpoints) {
        return new DraftOutcome(true, null, screenStateVerified, checkpoints);
    }

    public static DraftOutcome aborted(String error, List<ScreenCheckpoint> checkpoints) {
        return new DraftOutcome(false, error, false, checkpoints);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getError() {
        return error;
    }

    public boolean isScreenStateVerified() {
        return screenStateVerified;
    }

    /** Empty when strict screen checks were off. */
    public List<ScreenCheckpoint> getCheckpoints() {
        return checkpoints;
    }
}
