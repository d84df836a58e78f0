package com.deviceagents.tools.android;

import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.automation.UiSearchAutomation;
import com.deviceagents.automation.UiSearchExecution;
import com.deviceagents.automation.UiSearchRequest;
import com.deviceagents.device.DeviceSession;
import com.deviceagents.screen.ScreenCheckpoint;
import com.deviceagents.screen.ScreenStateGuards;
import com.deviceagents.tools.ToolContext;
import com.deviceagents.tools.ToolResults;
import com.deviceagents.tools.ToolSchema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 社交应用内搜索（Instagram / YouTube / X）。
 * <p>
 * 打开应用后复用通用搜索流程，只输入查询不提交；strict_screen_state 为 true（默认）时
 * 每一步都要求前台包名与查询文本可见，否则中止。
 * </p>
 */
public class SocialMediaTool extends AndroidBaseTool {

    static final long FOREGROUND_TIMEOUT_MS = 10_000L;

    enum Platform {
        INSTAGRAM("instagram", "Instagram", "com.instagram.android",
                Arrays.asList("Search", "Search and explore"), Arrays.asList("search", "search_src_text")),
        YOUTUBE("youtube", "YouTube", "com.google.android.youtube",
                Collections.singletonList("Search"), Arrays.asList("search", "search_edit_text")),
        X("x", "X/Twitter", "com.twitter.android",
                Arrays.asList("Search", "Search and Explore", "Explore"), Arrays.asList("search", "query"));

        final String wireName;
        final String displayName;
        final String packageName;
        final List<String> triggerHints;
        final List<String> inputIdHints;

        Platform(String wireName, String displayName, String packageName,
                 List<String> triggerHints, List<String> inputIdHints) {
            this.wireName = wireName;
            this.displayName = displayName;
            this.packageName = packageName;
            this.triggerHints = triggerHints;
            this.inputIdHints = inputIdHints;
        }

        static Platform from(String value) {
            switch (value) {
                case "instagram":
                    return INSTAGRAM;
                case "youtube":
                    return YOUTUBE;
                case "x":
                case "twitter":
                    return X;
                default:
                    return null;
            }
        }
    }

    private final UiSearchAutomation search;

    public SocialMediaTool(DeviceSession session) {
        super(session);
        this.search = new UiSearchAutomation(session, queries, guards);
    }

    @Override
    public String getName() {
        return "social_media";
    }

    @Override
    public String getDescription() {
        return "Search inside Instagram, YouTube or X with screen-state verification. Parameters: action (search), platform (instagram/youtube/x/twitter), query, strict_screen_state (default true).";
    }

    @Override
    public JSONObject getInputSchema() {
        return ToolSchema.object()
                .enumeration("action", "Action to perform.", "search")
                .enumeration("platform", "Target app.", "instagram", "youtube", "x", "twitter")
                .string("query", "Search text.")
                .bool("strict_screen_state", "Abort unless every step is verified on screen (default: true).")
                .required("action", "platform")
                .build();
    }

    @Override
    protected String run(JSONObject params, ToolContext context) {
        if (params.getString("action") == null) {
            return ToolResults.error("Action is required");
        }
        if (params.getString("platform") == null) {
            return ToolResults.error("Platform is required");
        }
        String action = trimmed(params, "action").toLowerCase(Locale.ROOT);
        String platformName = trimmed(params, "platform").toLowerCase(Locale.ROOT);
        String query = trimmed(params, "query");
        boolean strict = boolArg(params, "strict_screen_state", true);

        if (strict) {
            String disabled = requireAccessibility(
                    "strict_screen_state=true requires accessibility screen-state checks. Start the UiAutomator2 session for the device.");
            if (disabled != null) {
                return disabled;
            }
        }

        Platform platform = Platform.from(platformName);
        if (platform == null) {
            return ToolResults.error("Unsupported platform. Use: instagram, youtube, x, twitter");
        }
        if (!"search".equals(action)) {
            return ToolResults.error("Unsupported " + platform.displayName + " action '" + action + "'. Use: search");
        }
        if (query.isEmpty()) {
            return ToolResults.error("Query is required for search");
        }
        return search(platform, query, strict, context);
    }

    private String search(Platform platform, String query, boolean strict, ToolContext context) {
        String pkg = platform.packageName;
        if (!session.apps().isInstalled(pkg)) {
            return ToolResults.error(platform.displayName + " is not installed");
        }

        List<ScreenCheckpoint> checkpoints = new ArrayList<>();
        boolean alreadyForeground = false;
        if (strict) {
            ScreenCheckpoint before = guards.captureCheckpoint("before_open", pkg);
            checkpoints.add(before);
            alreadyForeground = before.isMatchedExpectedPackage();
        }
        if (!alreadyForeground && !session.apps().launch(pkg)) {
            return abort("Failed to open " + platform.displayName, checkpoints);
        }
        if (strict) {
            if (guards.waitForForegroundPackage(Collections.singleton(pkg), FOREGROUND_TIMEOUT_MS,
                    ScreenStateGuards.DEFAULT_POLL_MS) == null) {
                return abort("Safety check failed: " + platform.displayName + " did not reach foreground.", checkpoints);
            }
            checkpoints.add(guards.captureCheckpoint("after_open", pkg));
        }
        progress(context, "Searching " + platform.displayName + " for '" + query + "'");

        UiSearchExecution execution;
        if (session.isAccessibilityEnabled()) {
            execution = search.run(UiSearchRequest.builder(query, pkg)
                    .searchTriggerHints(platform.triggerHints)
                    .searchInputIdHints(platform.inputIdHints)
                    .build());
        } else {
            execution = UiSearchExecution.unavailable(pkg, "Accessibility service is not connected.");
        }

        boolean typed = execution.isTyped();
        boolean queryVisible = true;
        if (strict) {
            checkpoints.add(guards.captureCheckpoint("query_verification", pkg));
            if (!execution.isSuccess()) {
                String error = execution.getError() != null ? execution.getError()
                        : platform.displayName + " search query could not be typed.";
                return abort("Safety check failed: " + error, checkpoints);
            }
            queryVisible = execution.isQueryVisible();
            if (!typed || !queryVisible) {
                return abort("Safety check failed: " + platform.displayName
                        + " search query could not be verified on screen. Aborted.", checkpoints);
            }
        }

        JSONObject payload = new JSONObject();
        payload.put("platform", platform.wireName);
        payload.put("action", "search");
        payload.put("query", query);
        payload.put("auto_typed", typed);
        payload.put("strict_screen_state", strict);
        payload.put("screen_state_verified", queryVisible);
        payload.put("message", typed
                ? "Opened " + platform.displayName + " and typed search query"
                : "Opened " + platform.displayName + ". Search input was not auto-typed; app UI may differ.");
        if (strict) {
            payload.put("screen_checkpoints", ScreenCheckpoint.toJsonArray(checkpoints));
        }
        return ToolResults.success(payload);
    }
}
