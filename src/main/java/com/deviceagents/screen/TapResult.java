package com.deviceagents.screen;

public final class TapResult {

    private final boolean success;
    private final String packageName;
    private final String matchedText;
    private final String matchedDescription;
    private final String error;

    private TapResult(boolean success, String packageName, String matchedText, String matchedDescription, String error) {
        this.success = success;
        this.packageName = packageName;
        this.matchedText = matchedText;
        this.matchedDescription = matchedDescription;
        this.error = error;
    }

    public static TapResult tapped(String packageName, String matchedText, String matchedDescription) {
        return new TapResult(true, packageName, matchedText, matchedDescription, null);
    }

    public static TapResult failed(String error) {
        return new TapResult(false, null, null, null, error);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getPackageName() {
        return packageName;
    }

    public String getMatchedText() {
        return matchedText;
    }

    public String getMatchedDescription() {
        return matchedDescription;
    }

    public String getError() {
        return error;
    }
}
