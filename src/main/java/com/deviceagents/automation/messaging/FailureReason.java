package com.deviceagents.automation.messaging;

import java.util.Locale;

/**
 * Why a send was aborted. Contact failures are split by phase: before typing
 * ({@link #CONTACT_NOT_FOUND}, {@link #CONTACT_NOT_VERIFIED}) and after typing
 * ({@link #CONTACT_LOST_BEFORE_SEND}).
 */
public enum FailureReason {
    ACCESSIBILITY_DISABLED,
    INVALID_ARGUMENT,
    APP_NOT_INSTALLED,
    LAUNCH_FAILED,
    FOREGROUND_TIMEOUT,
    CONTACT_NOT_FOUND,
    CONTACT_NOT_VERIFIED,
    CONTACT_LOST_BEFORE_SEND,
    MESSAGE_NOT_VERIFIED,
    SEND_BUTTON_NOT_FOUND;

    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
