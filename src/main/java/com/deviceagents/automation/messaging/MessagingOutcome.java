package com.deviceagents.automation.messaging;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of one send request. Aborted outcomes still carry every checkpoint recorded up to
 * the abort.
 */
public final class MessagingOutcome {

    private final boolean success;
    private final FailureReason failureReason;
    private final String error;
    private final WhatsAppVariant variant;
    private final List<ChatCheckpoint> checkpoints;

    private MessagingOutcome(boolean success, FailureReason failureReason, String error, WhatsAppVariant variant,
                             List<ChatCheckpoint> checkpoints) {
        this.success = success;
        this.failureReason = failureReason;
        this.error = error;
        this.variant = variant;
        this.checkpoints = Collections.unmodifiableList(new ArrayList<>(checkpoints));
    }

    public static MessagingOutcome sent(WhatsAppVariant variant, List<ChatCheckpoint> checkpoints) {
        return new MessagingOutcome(true, null, null, variant, checkpoints);
    }

    public static MessagingOutcome aborted(FailureReason reason, String error, WhatsAppVariant variant,
                                           List<ChatCheckpoint> checkpoints) {
        return new MessagingOutcome(false, reason, error, variant, checkpoints);
    }

    public boolean isSuccess() {
        return success;
    }

    /** Null on success. */
    public FailureReason getFailureReason() {
        return failureReason;
    }

    public String getError() {
        return error;
    }

    /** Null when the flow stopped before a variant was chosen. */
    public WhatsAppVariant getVariant() {
        return variant;
    }

    public List<ChatCheckpoint> getCheckpoints() {
        return checkpoints;
    }

    public ChatCheckpoint checkpoint(String step) {
        for (ChatCheckpoint checkpoint : checkpoints) {
            if (checkpoint.getStep().equals(step)) {
                return checkpoint;
            }
        }
        return null;
    }

    public JSONArray checkpointsJson() {
        JSONArray array = new JSONArray();
        for (ChatCheckpoint checkpoint : checkpoints) {
            array.add(checkpoint.toJson());
        }
        return array;
    }
}
