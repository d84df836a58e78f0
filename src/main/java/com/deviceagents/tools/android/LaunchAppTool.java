package com.deviceagents.tools.android;

import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.automation.AppResolveResult;
import com.deviceagents.automation.AppResolver;
import com.deviceagents.device.DeviceSession;
import com.deviceagents.device.LaunchableApp;
import com.deviceagents.screen.ScreenCheckpoint;
import com.deviceagents.screen.ScreenStateGuards;
import com.deviceagents.tools.ToolContext;
import com.deviceagents.tools.ToolResults;
import com.deviceagents.tools.ToolSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 打开或关闭应用
 * <p>
 * 打开时先记录 before_open 检查点；若目标应用已在前台则直接返回。
 * 否则启动后等待前台包名匹配，超时即视为安全检查失败。
 * 无障碍不可用时仍会启动，但结果中标明未做屏幕校验。
 * </p>
 */
public class LaunchAppTool extends AndroidBaseTool {

    static final long FOREGROUND_TIMEOUT_MS = 8_000L;
    static final long CLOSE_LAUNCH_DELAY_MS = 420L;

    public LaunchAppTool(DeviceSession session) {
        super(session);
    }

    @Override
    public String getName() {
        return "launch_app";
    }

    @Override
    public String getDescription() {
        return "Open (with foreground verification) or best-effort close an app by package name or fuzzy app name. Parameters: action (open/close, default open), package_name, app_name.";
    }

    @Override
    public JSONObject getInputSchema() {
        return ToolSchema.object()
                .enumeration("action", "open (default) or close.", "open", "close")
                .string("package_name", "Exact package name, e.g. com.whatsapp.")
                .string("app_name", "App label; fuzzy matched against launchable apps.")
                .build();
    }

    @Override
    protected String run(JSONObject params, ToolContext context) {
        String action = trimmed(params, "action").toLowerCase(Locale.ROOT);
        if (action.isEmpty()) {
            action = "open";
        }
        if (!"open".equals(action) && !"close".equals(action)) {
            return ToolResults.error("Invalid action '" + action + "'. Use open or close.");
        }

        String packageArg = trimmed(params, "package_name");
        String appNameArg = trimmed(params, "app_name");
        if (packageArg.isEmpty() && appNameArg.isEmpty()) {
            return ToolResults.error("Provide package_name or app_name.");
        }

        AppResolveResult resolved = AppResolver.resolve(session.apps().listLaunchableApps(), packageArg, appNameArg);
        LaunchableApp matched = resolved.getMatch();
        if (matched == null) {
            String query = packageArg.isEmpty() ? appNameArg : packageArg;
            return ToolResults.error(AppResolver.noMatchMessage(query, resolved.getSuggestions()));
        }

        return "open".equals(action) ? open(matched) : close(matched);
    }

    private String open(LaunchableApp app) {
        String pkg = app.getPackageName();
        boolean canVerify = session.isAccessibilityEnabled();
        List<ScreenCheckpoint> checkpoints = new ArrayList<>();

        if (canVerify) {
            ScreenCheckpoint before = guards.captureCheckpoint("before_open", pkg);
            checkpoints.add(before);
            if (before.isMatchedExpectedPackage()) {
                JSONObject payload = basePayload("open", app);
                payload.put("already_open", true);
                payload.put("screen_state_verified", true);
                payload.put("screen_checkpoints", ScreenCheckpoint.toJsonArray(checkpoints));
                return ToolResults.success(payload);
            }
        }

        if (!session.apps().launch(pkg)) {
            return abort("App '" + pkg + "' cannot be launched.", checkpoints);
        }

        if (canVerify) {
            if (guards.waitForForegroundPackage(Collections.singleton(pkg), FOREGROUND_TIMEOUT_MS,
                    ScreenStateGuards.DEFAULT_POLL_MS) == null) {
                checkpoints.add(guards.captureCheckpoint("foreground_timeout", pkg));
                return abort("Safety check failed: app launch started but foreground package did not match "
                        + pkg + ".", checkpoints);
            }
            checkpoints.add(guards.captureCheckpoint("after_open", pkg));
        }

        JSONObject payload = basePayload("open", app);
        payload.put("screen_state_verified", canVerify);
        if (canVerify) {
            payload.put("screen_checkpoints", ScreenCheckpoint.toJsonArray(checkpoints));
        } else {
            payload.put("note", "Accessibility is disabled; launch succeeded but screen_state verification was skipped.");
        }
        return ToolResults.success(payload);
    }

    private String close(LaunchableApp app) {
        String disabled = requireAccessibility(ACCESSIBILITY_DISABLED);
        if (disabled != null) {
            return disabled;
        }
        // bring the target to the front first so the top recents card is the right one
        if (!session.apps().launch(app.getPackageName())) {
            return ToolResults.error("App '" + app.getPackageName() + "' cannot be launched.");
        }
        guards.pause(CLOSE_LAUNCH_DELAY_MS);
        boolean closed = closeForegroundAppBestEffort();

        JSONObject payload = basePayload("close", app);
        payload.put("success", closed);
        payload.put("note", CLOSE_NOTE);
        return payload.toJSONString();
    }

    private static JSONObject basePayload(String action, LaunchableApp app) {
        JSONObject payload = new JSONObject();
        payload.put("action", action);
        payload.put("package_name", app.getPackageName());
        payload.put("app_name", app.getAppName());
        return payload;
    }
}
