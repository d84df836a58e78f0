package com.deviceagents.tools.android;

import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.device.DeviceSession;
import com.deviceagents.screen.ScreenSnapshot;
import com.deviceagents.tools.ToolContext;
import com.deviceagents.tools.ToolResults;
import com.deviceagents.tools.ToolSchema;

public class ScreenStateTool extends AndroidBaseTool {

    static final int DEFAULT_MAX_NODES = 80;
    static final int MIN_NODES = 5;
    static final int MAX_NODES = 200;

    public ScreenStateTool(DeviceSession session) {
        super(session);
    }

    @Override
    public String getName() {
        return "screen_state";
    }

    @Override
    public String getDescription() {
        return "Read the visible UI of the foreground app: package, root class and the text-bearing nodes with bounds. Parameters: max_nodes (optional, 5-200, default 80).";
    }

    @Override
    public JSONObject getInputSchema() {
        return ToolSchema.object()
                .integer("max_nodes", "Maximum number of text nodes to return, 5-200 (default: 80).")
                .build();
    }

    @Override
    protected String run(JSONObject params, ToolContext context) {
        String disabled = requireAccessibility(ACCESSIBILITY_DISABLED);
        if (disabled != null) {
            return disabled;
        }
        int maxNodes = intArg(params, "max_nodes", DEFAULT_MAX_NODES, MIN_NODES, MAX_NODES);
        ScreenSnapshot snapshot = guards.capture(maxNodes);
        if (snapshot == null) {
            return ToolResults.error("No active window is available from accessibility. Unlock your phone and open an app first.");
        }
        return ToolResults.success(snapshot.toJson());
    }
}
