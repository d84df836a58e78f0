package com.deviceagents.automation.workflow;

import java.util.Locale;

public enum WorkflowAction {
    LAUNCH_APP,
    SEARCH,
    TAP,
    WAIT,
    SWIPE,
    TYPE;

    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Null for unknown actions. */
    public static WorkflowAction from(String value) {
        if (value == null) {
            return null;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (WorkflowAction action : values()) {
            if (action.getWireName().equals(v)) {
                return action;
            }
        }
        return null;
    }
}
