package com.deviceagents.automation;

import com.alibaba.fastjson2.JSONObject;

/**
 * Outcome of a {@link UiSearchAutomation} run. {@code error} is null on success.
 */
public final class UiSearchExecution {

    private final boolean success;
    private final boolean typed;
    private final boolean queryVisible;
    private final boolean inputFound;
    private final boolean triggerTapped;
    private final boolean popupDismissed;
    private final boolean submitted;
    private final String expectedPackage;
    private final String actualPackage;
    private final String error;

    public UiSearchExecution(boolean success, boolean typed, boolean queryVisible, boolean inputFound,
                             boolean triggerTapped, boolean popupDismissed, boolean submitted,
                             String expectedPackage, String actualPackage, String error) {
        this.success = success;
        this.typed = typed;
        this.queryVisible = queryVisible;
        this.inputFound = inputFound;
        this.triggerTapped = triggerTapped;
        this.popupDismissed = popupDismissed;
        this.submitted = submitted;
        this.expectedPackage = expectedPackage == null ? "" : expectedPackage;
        this.actualPackage = actualPackage == null ? "" : actualPackage;
        this.error = error;
    }

    public static UiSearchExecution unavailable(String expectedPackage, String error) {
        return new UiSearchExecution(false, false, false, false, false, false, false,
                expectedPackage, "", error);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isTyped() {
        return typed;
    }

    public boolean isQueryVisible() {
        return queryVisible;
    }

    public boolean isInputFound() {
        return inputFound;
    }

    public boolean isTriggerTapped() {
        return triggerTapped;
    }

    public boolean isPopupDismissed() {
        return popupDismissed;
    }

    public boolean isSubmitted() {
        return submitted;
    }

    public String getExpectedPackage() {
        return expectedPackage;
    }

    public String getActualPackage() {
        return actualPackage;
    }

    public String getError() {
        return error;
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("success", success);
        json.put("typed", typed);
        json.put("query_visible", queryVisible);
        json.put("input_found", inputFound);
        json.put("trigger_tapped", triggerTapped);
        json.put("popup_dismissed", popupDismissed);
        json.put("submitted", submitted);
        json.put("expected_package", expectedPackage);
        json.put("actual_package", actualPackage);
        if (error != null) {
            json.put("error", error);
        }
        return json;
    }
}
