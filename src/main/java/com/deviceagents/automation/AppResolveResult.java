package com.deviceagents.automation;

import com.deviceagents.device.LaunchableApp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class AppResolveResult {

    private final LaunchableApp match;
    private final List<LaunchableApp> suggestions;

    public AppResolveResult(LaunchableApp match, List<LaunchableApp> suggestions) {
        this.match = match;
        this.suggestions = Collections.unmodifiableList(new ArrayList<>(suggestions));
    }

    public static AppResolveResult none() {
        return new AppResolveResult(null, Collections.<LaunchableApp>emptyList());
    }

    /** Null when nothing matched. */
    public LaunchableApp getMatch() {
        return match;
    }

    public List<LaunchableApp> getSuggestions() {
        return suggestions;
    }
}
