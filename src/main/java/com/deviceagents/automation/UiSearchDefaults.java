package com.deviceagents.automation;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class UiSearchDefaults {

    public static final List<String> TRIGGER_HINTS =
            Collections.unmodifiableList(Arrays.asList("Search", "Find", "Lookup"));
    public static final List<String> INPUT_ID_HINTS = Collections.unmodifiableList(Arrays.asList(
            "search", "query", "search_src_text", "search_input", "search_edit_text"));
    public static final List<String> DISMISS_HINTS = Collections.unmodifiableList(Arrays.asList(
            "Close", "Dismiss", "Cancel", "Not now", "No thanks", "Skip", "Later", "Got it"));
    public static final List<String> SUBMIT_HINTS =
            Collections.unmodifiableList(Arrays.asList("Search", "Go", "Enter", "Done", "OK"));

    public static final long SETTLE_DELAY_MS = 1_400L;
    public static final long POLL_DELAY_MS = 420L;
    public static final long MIN_POLL_DELAY_MS = 120L;
    public static final int MAX_ATTEMPTS = 8;
    public static final int MAX_ATTEMPTS_LIMIT = 20;

    static final long POPUP_DISMISS_DELAY_MS = 320L;
    static final long TRIGGER_DELAY_MS = 450L;
    static final long POST_TYPE_DELAY_MS = 320L;

    private UiSearchDefaults() {
    }
}
