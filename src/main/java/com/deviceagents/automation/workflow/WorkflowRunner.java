package com.deviceagents.automation.workflow;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.automation.AppResolveResult;
import com.deviceagents.automation.AppResolver;
import com.deviceagents.automation.UiSearchAutomation;
import com.deviceagents.automation.UiSearchExecution;
import com.deviceagents.automation.UiSearchRequest;
import com.deviceagents.device.DeviceSession;
import com.deviceagents.device.LaunchableApp;
import com.deviceagents.device.SwipeDirection;
import com.deviceagents.device.UiTreeNode;
import com.deviceagents.screen.NodeQueryEngine;
import com.deviceagents.screen.ScreenSnapshot;
import com.deviceagents.screen.ScreenStateGuards;
import com.deviceagents.screen.TapResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 多步骤工作流执行器。
 * <p>
 * 按顺序执行 launch_app / search / tap / wait / swipe / type 步骤，整体受 {@code timeoutMs} 限制。
 * 每一步都产出一个带 {@code step_index}、{@code success} 的 JSON 结果；
 * {@code continueOnError} 为 false 时遇到失败步骤即停止。本类只负责编排，校验逻辑都复用已有组件。
 * </p>
 */
public class WorkflowRunner {
    private static final Logger logger = LogManager.getLogger(WorkflowRunner.class);

    public static final long DEFAULT_TIMEOUT_MS = 30_000L;
    static final long STEP_PAUSE_MS = 500L;
    static final long LAUNCH_VERIFY_TIMEOUT_MS = 8_000L;
    static final long POST_LAUNCH_SETTLE_MS = 2_000L;
    static final long DEFAULT_WAIT_MS = 1_000L;
    static final long DEFAULT_TEXT_WAIT_TIMEOUT_MS = 5_000L;
    static final long TEXT_WAIT_POLL_MS = 200L;
    static final int TEXT_WAIT_SNAPSHOT_NODES = 100;
    static final float DEFAULT_SWIPE_RATIO = 0.5f;
    static final long DEFAULT_SWIPE_DURATION_MS = 500L;
    static final long TYPE_VERIFY_DELAY_MS = 320L;
    static final int SEARCH_MAX_ATTEMPTS = 5;

    private static final List<String> SEARCH_TRIGGER_HINTS = Arrays.asList("search", "find", "look");
    private static final List<String> SEARCH_INPUT_HINTS = Arrays.asList("search", "query", "input");
    private static final List<String> SEARCH_DISMISS_HINTS = Arrays.asList("close", "dismiss", "cancel");
    private static final List<String> SEARCH_SUBMIT_HINTS = Arrays.asList("search", "go", "submit");

    private final DeviceSession session;
    private final NodeQueryEngine queries;
    private final ScreenStateGuards guards;
    private final UiSearchAutomation search;

    public WorkflowRunner(DeviceSession session, NodeQueryEngine queries, ScreenStateGuards guards,
                          UiSearchAutomation search) {
        this.session = session;
        this.queries = queries;
        this.guards = guards;
        this.search = search;
    }

    public WorkflowReport run(String workflowName, JSONArray steps, boolean continueOnError, long timeoutMs) {
        long start = session.now();
        List<JSONObject> results = new ArrayList<>();
        boolean success = true;
        logger.info("Running workflow '{}' with {} steps", workflowName, steps.size());

        for (int index = 0; index < steps.size(); index++) {
            if (session.now() - start > timeoutMs || Thread.currentThread().isInterrupted()) {
                success = false;
                results.add(stepError(index, "Workflow timeout exceeded"));
                break;
            }
            Object element = steps.get(index);
            JSONObject result = element instanceof JSONObject
                    ? executeStep((JSONObject) element, index)
                    : stepError(index, "Invalid step format");
            results.add(result);

            if (!result.getBooleanValue("success")) {
                success = false;
                logger.warn("Workflow '{}' step {} failed: {}", workflowName, index, result.getString("error"));
                if (!continueOnError) {
                    break;
                }
            }
            if (index < steps.size() - 1) {
                guards.pause(STEP_PAUSE_MS);
            }
        }
        return new WorkflowReport(workflowName, success, steps.size(), results, session.now() - start, continueOnError);
    }

    JSONObject executeStep(JSONObject step, int index) {
        String rawAction = step.getString("action");
        if (rawAction == null || rawAction.trim().isEmpty()) {
            return stepError(index, "action is required");
        }
        WorkflowAction action = WorkflowAction.from(rawAction);
        if (action == null) {
            return stepError(index, "Unknown action: " + rawAction.trim());
        }
        JSONObject params = step.getJSONObject("parameters");
        if (params == null) params = new JSONObject();
        JSONObject verification = step.getJSONObject("verification");
        if (verification == null) verification = new JSONObject();

        try {
            switch (action) {
                case LAUNCH_APP:
                    return launchStep(params, verification, index);
                case SEARCH:
                    return searchStep(params, verification, index);
                case TAP:
                    return tapStep(params, index);
                case WAIT:
                    return waitStep(params, index);
                case SWIPE:
                    return swipeStep(params, index);
                case TYPE:
                    return typeStep(params, index);
                default:
                    return stepError(index, "Unknown action: " + rawAction);
            }
        } catch (RuntimeException e) {
            logger.error("Workflow step {} ({}) failed", index, action.getWireName(), e);
            return stepError(index, "Step execution failed: " + e.getMessage());
        }
    }

    private JSONObject launchStep(JSONObject params, JSONObject verification, int index) {
        String appName = trimmed(params.getString("app_name"));
        String packageName = trimmed(params.getString("package_name"));
        if (appName.isEmpty() && packageName.isEmpty()) {
            return stepError(index, "app_name or package_name required");
        }
        boolean verify = verification.containsKey("verify") ? verification.getBooleanValue("verify") : true;
        long timeoutMs = verification.containsKey("timeout_ms")
                ? verification.getLongValue("timeout_ms") : LAUNCH_VERIFY_TIMEOUT_MS;

        AppResolveResult resolved = AppResolver.resolve(session.apps().listLaunchableApps(), packageName, appName);
        LaunchableApp match = resolved.getMatch();
        if (match == null) {
            return stepError(index, "App not found: " + (appName.isEmpty() ? packageName : appName));
        }
        if (!session.apps().launch(match.getPackageName())) {
            return stepError(index, "Cannot launch app: " + match.getPackageName());
        }
        boolean launchVerified = false;
        if (verify && session.isAccessibilityEnabled()) {
            launchVerified = guards.waitForForegroundPackage(Collections.singleton(match.getPackageName()),
                    timeoutMs, ScreenStateGuards.DEFAULT_POLL_MS) != null;
        }
        JSONObject result = stepResult(index, WorkflowAction.LAUNCH_APP, true);
        result.put("app_name", match.getAppName());
        result.put("package_name", match.getPackageName());
        result.put("launch_verified", launchVerified);
        return result;
    }

    private JSONObject searchStep(JSONObject params, JSONObject verification, int index) {
        String query = trimmed(params.getString("query"));
        if (query.isEmpty()) {
            return stepError(index, "query required");
        }
        String appName = trimmed(params.getString("app_name"));
        String packageName = trimmed(params.getString("package_name"));

        String expectedPackage;
        if (!appName.isEmpty() || !packageName.isEmpty()) {
            JSONObject launchParams = new JSONObject();
            launchParams.put("app_name", appName);
            launchParams.put("package_name", packageName);
            JSONObject launch = launchStep(launchParams, verification, index);
            if (!launch.getBooleanValue("success")) {
                return launch;
            }
            expectedPackage = launch.getString("package_name");
            guards.pause(POST_LAUNCH_SETTLE_MS);
        } else {
            ScreenSnapshot current = guards.capture();
            if (current == null || current.getPackageName().isEmpty()) {
                return stepError(index, "Unable to resolve foreground package for search.");
            }
            expectedPackage = current.getPackageName();
        }

        UiSearchExecution execution = search.run(UiSearchRequest.builder(query, expectedPackage)
                .searchTriggerHints(SEARCH_TRIGGER_HINTS)
                .searchInputIdHints(SEARCH_INPUT_HINTS)
                .dismissHints(SEARCH_DISMISS_HINTS)
                .submitHints(SEARCH_SUBMIT_HINTS)
                .closePopups(true)
                .submitSearch(true)
                .maxAttempts(SEARCH_MAX_ATTEMPTS)
                .build());
        JSONObject result = stepResult(index, WorkflowAction.SEARCH, execution.isSuccess());
        result.put("query", query);
        result.put("expected_package", expectedPackage);
        result.put("typed", execution.isTyped());
        result.put("input_found", execution.isInputFound());
        result.put("submitted", execution.isSubmitted());
        if (!execution.isSuccess()) {
            result.put("error", execution.getError());
        }
        return result;
    }

    private JSONObject tapStep(JSONObject params, int index) {
        String text = trimmed(params.getString("text"));
        String description = trimmed(params.getString("content_description"));
        Integer x = params.getInteger("x");
        Integer y = params.getInteger("y");

        boolean tapped;
        String target;
        String error = null;
        if (!text.isEmpty() || !description.isEmpty()) {
            target = text.isEmpty() ? description : text;
            TapResult tap = queries.tapVisibleNodeByText(session.screen().activeRoot(), target, false, 1);
            tapped = tap.isSuccess();
            error = tap.getError();
        } else if (x != null && y != null) {
            target = x + "," + y;
            tapped = queries.tap(x, y, NodeQueryEngine.DEFAULT_TAP_DURATION_MS);
            if (!tapped) error = "Tap gesture failed.";
        } else {
            return stepError(index, "text, content_description, or coordinates required");
        }
        JSONObject result = stepResult(index, WorkflowAction.TAP, tapped);
        result.put("target", target);
        if (error != null) {
            result.put("error", error);
        }
        return result;
    }

    private JSONObject waitStep(JSONObject params, int index) {
        String waitForText = trimmed(params.getString("wait_for_text"));
        if (waitForText.isEmpty()) {
            long duration = Math.max(0L, params.containsKey("duration_ms")
                    ? params.getLongValue("duration_ms") : DEFAULT_WAIT_MS);
            guards.pause(duration);
            JSONObject result = stepResult(index, WorkflowAction.WAIT, true);
            result.put("wait_type", "duration");
            result.put("duration_ms", duration);
            return result;
        }

        long timeoutMs = params.containsKey("timeout_ms")
                ? params.getLongValue("timeout_ms") : DEFAULT_TEXT_WAIT_TIMEOUT_MS;
        long start = session.now();
        boolean found = false;
        while (true) {
            ScreenSnapshot snapshot = guards.capture(TEXT_WAIT_SNAPSHOT_NODES);
            if (ScreenStateGuards.containsText(snapshot, waitForText)) {
                found = true;
                break;
            }
            if (session.now() - start >= timeoutMs || !guards.pause(TEXT_WAIT_POLL_MS)) {
                break;
            }
        }
        JSONObject result = stepResult(index, WorkflowAction.WAIT, found);
        result.put("wait_type", "text_appeared");
        result.put("target_text", waitForText);
        result.put("duration_ms", session.now() - start);
        if (!found) {
            result.put("error", "Text '" + waitForText + "' did not appear within " + timeoutMs + " ms.");
        }
        return result;
    }

    private JSONObject swipeStep(JSONObject params, int index) {
        String rawDirection = trimmed(params.getString("direction"));
        if (rawDirection.isEmpty()) {
            return stepError(index, "direction required");
        }
        SwipeDirection direction = SwipeDirection.from(rawDirection);
        if (direction == null) {
            return stepError(index, "Invalid direction: " + rawDirection);
        }
        float ratio = NodeQueryEngine.clampRatio(params.containsKey("distance_ratio")
                ? params.getFloatValue("distance_ratio") : DEFAULT_SWIPE_RATIO);
        long duration = NodeQueryEngine.clampSwipeDuration(params.containsKey("duration_ms")
                ? params.getLongValue("duration_ms") : DEFAULT_SWIPE_DURATION_MS);
        boolean swiped = queries.swipe(direction, ratio, duration);
        JSONObject result = stepResult(index, WorkflowAction.SWIPE, swiped);
        result.put("direction", direction.name().toLowerCase(Locale.ROOT));
        result.put("distance_ratio", ratio);
        result.put("duration_ms", duration);
        if (!swiped) {
            result.put("error", "Swipe gesture failed.");
        }
        return result;
    }

    /**
     * Types into the focused text field of the foreground app, or its first text field, and
     * confirms the text on screen.
     */
    private JSONObject typeStep(JSONObject params, int index) {
        String text = params.getString("text");
        if (text == null || text.trim().isEmpty()) {
            return stepError(index, "text required");
        }
        UiTreeNode root = session.screen().activeRoot();
        if (root == null) {
            return stepError(index, "No active window found. Unlock your phone and open an app.");
        }
        String pkg = root.getPackageName();
        UiTreeNode field = queries.findByPredicate(root, node -> NodeQueryEngine.isEditable(node) && node.isFocused());
        if (field == null) {
            field = queries.findByPredicate(root, NodeQueryEngine::isEditable);
        }
        if (field == null) {
            return stepError(index, "No text input found on the current screen.");
        }
        boolean set = queries.setText(field, text);
        boolean verified = false;
        if (set) {
            guards.pause(TYPE_VERIFY_DELAY_MS);
            ScreenSnapshot snapshot = guards.capture();
            verified = snapshot != null && snapshot.getPackageName().equals(pkg)
                    && ScreenStateGuards.containsText(snapshot, text);
        }
        JSONObject result = stepResult(index, WorkflowAction.TYPE, set && verified);
        result.put("text", text);
        result.put("package_name", pkg);
        if (!set) {
            result.put("error", "Setting text on the input failed.");
        } else if (!verified) {
            result.put("error", "Typed text could not be verified on screen.");
        }
        return result;
    }

    private static JSONObject stepResult(int index, WorkflowAction action, boolean success) {
        JSONObject result = new JSONObject();
        result.put("step_index", index);
        result.put("action", action.getWireName());
        result.put("success", success);
        return result;
    }

    static JSONObject stepError(int index, String error) {
        JSONObject result = new JSONObject();
        result.put("step_index", index);
        result.put("success", false);
        result.put("error", error);
        return result;
    }

    private static String trimmed(String value) {
        return value == null ? "" : value.trim();
    }
}
