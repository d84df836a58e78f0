package com.deviceagents.device;

import java.util.Locale;

public enum SwipeDirection {
    UP, DOWN, LEFT, RIGHT;

    /** Case-insensitive lookup; returns null for unknown names. */
    public static SwipeDirection from(String value) {
        if (value == null) return null;
        String v = value.trim().toUpperCase(Locale.ROOT);
        for (SwipeDirection d : values()) {
            if (d.name().equals(v)) return d;
        }
        return null;
    }
}
