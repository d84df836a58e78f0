package com.deviceagents.tools.android;

import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.device.DeviceSession;
import com.deviceagents.device.GlobalAction;
import com.deviceagents.tools.ToolContext;
import com.deviceagents.tools.ToolResults;
import com.deviceagents.tools.ToolSchema;

import java.util.Locale;

public class GlobalActionTool extends AndroidBaseTool {

    static final String CLOSE_CURRENT_APP = "close_current_app";

    public GlobalActionTool(DeviceSession session) {
        super(session);
    }

    @Override
    public String getName() {
        return "global_action";
    }

    @Override
    public String getDescription() {
        return "Run a system navigation action. Parameters: action (required: home, back, recents, notifications, quick_settings, power_dialog, lock_screen, close_current_app).";
    }

    @Override
    public JSONObject getInputSchema() {
        return ToolSchema.object()
                .enumeration("action", "System action to run.",
                        "home", "back", "recents", "notifications", "quick_settings",
                        "power_dialog", "lock_screen", CLOSE_CURRENT_APP)
                .required("action")
                .build();
    }

    @Override
    protected String run(JSONObject params, ToolContext context) {
        String action = trimmed(params, "action").toLowerCase(Locale.ROOT);
        if (action.isEmpty()) {
            return ToolResults.error("Missing required argument: action");
        }
        String disabled = requireAccessibility(ACCESSIBILITY_DISABLED);
        if (disabled != null) {
            return disabled;
        }

        if (CLOSE_CURRENT_APP.equals(action)) {
            boolean swiped = closeForegroundAppBestEffort();
            JSONObject payload = new JSONObject();
            payload.put("action", CLOSE_CURRENT_APP);
            payload.put("success", swiped);
            payload.put("note", CLOSE_NOTE);
            return payload.toJSONString();
        }

        GlobalAction globalAction = GlobalAction.from(action);
        if (globalAction == null) {
            return ToolResults.error("Invalid action '" + action
                    + "'. Use home, back, recents, notifications, quick_settings, power_dialog, lock_screen, or close_current_app.");
        }
        if (!session.actions().runGlobalAction(globalAction)) {
            return ToolResults.error("Global action '" + action + "' failed.");
        }
        JSONObject payload = new JSONObject();
        payload.put("action", action);
        return ToolResults.success(payload);
    }
}
