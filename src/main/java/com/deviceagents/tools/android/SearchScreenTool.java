package com.deviceagents.tools.android;

import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.automation.AppResolveResult;
import com.deviceagents.automation.AppResolver;
import com.deviceagents.automation.ScreenReadiness;
import com.deviceagents.automation.UiSearchAutomation;
import com.deviceagents.automation.UiSearchExecution;
import com.deviceagents.automation.UiSearchRequest;
import com.deviceagents.device.DeviceSession;
import com.deviceagents.device.LaunchableApp;
import com.deviceagents.screen.ScreenCheckpoint;
import com.deviceagents.screen.ScreenSnapshot;
import com.deviceagents.screen.ScreenStateGuards;
import com.deviceagents.tools.ToolContext;
import com.deviceagents.tools.ToolResults;
import com.deviceagents.tools.ToolSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 通用界面搜索
 * <p>
 * 指定应用时先解析并启动，等待其到达前台且界面稳定；否则在当前前台应用内搜索。
 * 输入并（可选）提交查询后，还要确认结果页出现才算完成。每一步都记录检查点。
 * </p>
 */
public class SearchScreenTool extends AndroidBaseTool {

    static final int DEFAULT_MAX_ATTEMPTS = 8;
    static final int MAX_ATTEMPTS = 16;
    static final long DEFAULT_TIMEOUT_MS = 12_000L;
    static final long MIN_TIMEOUT_MS = 2_000L;
    static final long MAX_TIMEOUT_MS = 30_000L;

    private final UiSearchAutomation search;
    private final ScreenReadiness readiness;

    public SearchScreenTool(DeviceSession session) {
        super(session);
        this.search = new UiSearchAutomation(session, queries, guards);
        this.readiness = new ScreenReadiness(guards);
    }

    @Override
    public String getName() {
        return "search_screen";
    }

    @Override
    public String getDescription() {
        return "Search inside an app through its own search UI with screen-state verification. Parameters: query (required), app_name or package_name (optional; defaults to the foreground app), submit (default true), close_popups (default true), max_attempts (1-16), wait_timeout_ms, results_timeout_ms, search_trigger_hints, search_input_id_hints, dismiss_hints, submit_hints.";
    }

    @Override
    public JSONObject getInputSchema() {
        return ToolSchema.object()
                .enumeration("action", "Only 'search' is supported; may be omitted.", "search")
                .string("query", "Text to search for.")
                .string("app_name", "App to open before searching (fuzzy matched).")
                .string("package_name", "Package to open before searching.")
                .bool("submit", "Submit the query and wait for results (default: true).")
                .bool("close_popups", "Dismiss blocking popups before typing (default: true).")
                .integer("max_attempts", "Search attempts, 1-16 (default: 8).")
                .integer("wait_timeout_ms", "Foreground/ready wait, 2000-30000 ms (default: 12000).")
                .integer("results_timeout_ms", "Results wait, 2000-30000 ms (default: 12000).")
                .stringArray("search_trigger_hints", "Optional search trigger text/description hints.")
                .stringArray("search_input_id_hints", "Optional search input view-id hints.")
                .stringArray("dismiss_hints", "Optional popup dismiss button hints.")
                .stringArray("submit_hints", "Optional submit button/action hints.")
                .required("query")
                .build();
    }

    @Override
    protected String run(JSONObject params, ToolContext context) {
        String disabled = requireAccessibility(
                "search_screen requires accessibility screen-state checks. Start the UiAutomator2 session for the device.");
        if (disabled != null) {
            return disabled;
        }

        String action = trimmed(params, "action").toLowerCase(Locale.ROOT);
        if (!action.isEmpty() && !"search".equals(action)) {
            return ToolResults.error("Unsupported action '" + action + "'. Use action='search' or omit it.");
        }
        if (!params.containsKey("query") || params.getString("query") == null) {
            return ToolResults.error("Query is required");
        }
        String query = trimmed(params, "query");
        if (query.isEmpty()) {
            return ToolResults.error("Query cannot be empty");
        }

        int maxAttempts = intArg(params, "max_attempts", DEFAULT_MAX_ATTEMPTS, 1, MAX_ATTEMPTS);
        long waitTimeoutMs = longArg(params, "wait_timeout_ms", DEFAULT_TIMEOUT_MS, MIN_TIMEOUT_MS, MAX_TIMEOUT_MS);
        long resultsTimeoutMs = longArg(params, "results_timeout_ms", DEFAULT_TIMEOUT_MS, MIN_TIMEOUT_MS, MAX_TIMEOUT_MS);
        boolean closePopups = boolArg(params, "close_popups", true);
        boolean submit = boolArg(params, "submit", true);
        String packageArg = trimmed(params, "package_name");
        String appNameArg = trimmed(params, "app_name");

        List<ScreenCheckpoint> checkpoints = new ArrayList<>();
        String expectedPackage;
        String resolvedAppName = null;

        if (!packageArg.isEmpty() || !appNameArg.isEmpty()) {
            AppResolveResult resolved = AppResolver.resolve(session.apps().listLaunchableApps(), packageArg, appNameArg);
            LaunchableApp match = resolved.getMatch();
            if (match == null) {
                String q = packageArg.isEmpty() ? appNameArg : packageArg;
                return ToolResults.error(AppResolver.noMatchMessage(q, resolved.getSuggestions()));
            }
            checkpoints.add(guards.captureCheckpoint("before_open", match.getPackageName()));
            if (!session.apps().launch(match.getPackageName())) {
                return abort("Failed to open app '" + match.getAppName() + "' (" + match.getPackageName() + ").",
                        checkpoints);
            }
            expectedPackage = match.getPackageName();
            resolvedAppName = match.getAppName();
            progress(context, "Opened " + match + ", waiting for it to settle");

            if (guards.waitForForegroundPackage(Collections.singleton(expectedPackage), waitTimeoutMs,
                    ScreenStateGuards.DEFAULT_POLL_MS) == null) {
                checkpoints.add(guards.captureCheckpoint("foreground_timeout", expectedPackage));
                return abort("Safety check failed: app '" + expectedPackage + "' did not reach foreground.", checkpoints);
            }
            checkpoints.add(guards.captureCheckpoint("after_open_foreground", expectedPackage));

            ScreenSnapshot ready = readiness.waitForScreenReady(expectedPackage, waitTimeoutMs, ScreenReadiness.DEFAULT_POLL_MS);
            if (ready == null) {
                return abort("Safety check failed: app '" + expectedPackage
                        + "' opened but screen did not become ready.", checkpoints);
            }
            checkpoints.add(ScreenStateGuards.checkpointOf("after_open_ready", expectedPackage, ready));
        } else {
            ScreenSnapshot before = guards.capture();
            if (before == null) {
                return ToolResults.error(
                        "search_screen requires an active screen state. Unlock your phone and open the target app first.");
            }
            expectedPackage = before.getPackageName();
            if (expectedPackage == null || expectedPackage.trim().isEmpty()) {
                return ToolResults.error("Unable to resolve foreground package from screen state.");
            }
            checkpoints.add(guards.captureCheckpoint("before_search", expectedPackage));
        }

        if (!hasStep(checkpoints, "before_search")) {
            checkpoints.add(guards.captureCheckpoint("before_search", expectedPackage));
        }

        UiSearchRequest request = UiSearchRequest.builder(query, expectedPackage)
                .searchTriggerHints(stringList(params, "search_trigger_hints"))
                .searchInputIdHints(stringList(params, "search_input_id_hints"))
                .dismissHints(stringList(params, "dismiss_hints"))
                .submitHints(stringList(params, "submit_hints"))
                .closePopups(closePopups)
                .submitSearch(submit)
                .maxAttempts(maxAttempts)
                .build();
        UiSearchExecution result = search.run(request);

        checkpoints.add(guards.captureCheckpoint("after_query_entry", expectedPackage));

        if (!result.isSuccess()) {
            String error = result.getError() == null ? "screen-state verification failed" : result.getError();
            return abort("Search aborted: " + error, checkpoints);
        }

        ScreenSnapshot resultsSnapshot = null;
        if (submit) {
            resultsSnapshot = readiness.waitForSearchResults(expectedPackage, query, resultsTimeoutMs,
                    ScreenReadiness.DEFAULT_POLL_MS);
            if (resultsSnapshot == null) {
                checkpoints.add(guards.captureCheckpoint("results_timeout", expectedPackage));
                return abort("Search was submitted but results were not confirmed yet. Keep the app visible and retry.",
                        checkpoints);
            }
            checkpoints.add(ScreenStateGuards.checkpointOf("after_results_ready", expectedPackage, resultsSnapshot));
        } else {
            checkpoints.add(guards.captureCheckpoint("after_search", expectedPackage));
        }

        boolean resultsReady = resultsSnapshot != null || !submit;
        JSONObject payload = new JSONObject();
        payload.put("action", "search");
        payload.put("task_completed", true);
        payload.put("query", query);
        payload.put("expected_package", expectedPackage);
        payload.put("actual_package", result.getActualPackage());
        payload.put("typed", result.isTyped());
        payload.put("input_found", result.isInputFound());
        payload.put("trigger_tapped", result.isTriggerTapped());
        payload.put("popup_dismissed", result.isPopupDismissed());
        payload.put("submitted", result.isSubmitted());
        payload.put("close_popups", closePopups);
        payload.put("submit", submit);
        payload.put("results_ready", resultsReady);
        payload.put("screen_state_verified", result.isQueryVisible()
                && expectedPackage.equals(result.getActualPackage()) && resultsReady);
        if (resolvedAppName != null && !resolvedAppName.trim().isEmpty()) {
            payload.put("app_name", resolvedAppName);
        }
        payload.put("screen_checkpoints", ScreenCheckpoint.toJsonArray(checkpoints));
        return ToolResults.success(payload);
    }

    private static boolean hasStep(List<ScreenCheckpoint> checkpoints, String step) {
        for (ScreenCheckpoint checkpoint : checkpoints) {
            if (step.equals(checkpoint.getStep())) {
                return true;
            }
        }
        return false;
    }
}
