package com.deviceagents.device;

import java.util.Locale;

public enum GlobalAction {
    HOME("home"),
    BACK("back"),
    RECENTS("recents"),
    NOTIFICATIONS("notifications"),
    QUICK_SETTINGS("quick_settings"),
    POWER_DIALOG("power_dialog"),
    LOCK_SCREEN("lock_screen");

    private final String wireName;

    GlobalAction(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static GlobalAction from(String value) {
        if (value == null) return null;
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (GlobalAction action : values()) {
            if (action.wireName.equals(v)) return action;
        }
        return null;
    }
}
