package com.deviceagents.tools.android;

import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.device.DeviceSession;
import com.deviceagents.device.SwipeDirection;
import com.deviceagents.screen.NodeQueryEngine;
import com.deviceagents.tools.ToolContext;
import com.deviceagents.tools.ToolResults;
import com.deviceagents.tools.ToolSchema;

import java.util.Locale;

public class ScrollScreenTool extends AndroidBaseTool {

    static final float DEFAULT_DISTANCE_RATIO = 0.55f;
    static final long DEFAULT_DURATION_MS = 320L;

    public ScrollScreenTool(DeviceSession session) {
        super(session);
    }

    @Override
    public String getName() {
        return "scroll_screen";
    }

    @Override
    public String getDescription() {
        return "Swipe the screen to scroll content. Parameters: direction (up/down/left/right, required), distance_ratio (0.15-0.9, default 0.55), duration_ms (120-1500, default 320).";
    }

    @Override
    public JSONObject getInputSchema() {
        return ToolSchema.object()
                .enumeration("direction", "Direction the content should move.", "up", "down", "left", "right")
                .number("distance_ratio", "Swipe length as a fraction of the screen, 0.15-0.9 (default: 0.55).")
                .integer("duration_ms", "Swipe duration between 120 and 1500 ms (default: 320).")
                .required("direction")
                .build();
    }

    @Override
    protected String run(JSONObject params, ToolContext context) {
        String disabled = requireAccessibility(ACCESSIBILITY_DISABLED);
        if (disabled != null) {
            return disabled;
        }

        SwipeDirection direction = SwipeDirection.from(params.getString("direction"));
        if (direction == null) {
            return ToolResults.error("Invalid direction. Use up, down, left, or right.");
        }
        float ratio = floatArg(params, "distance_ratio", DEFAULT_DISTANCE_RATIO,
                NodeQueryEngine.MIN_SWIPE_RATIO, NodeQueryEngine.MAX_SWIPE_RATIO);
        long durationMs = longArg(params, "duration_ms", DEFAULT_DURATION_MS,
                NodeQueryEngine.MIN_SWIPE_DURATION_MS, NodeQueryEngine.MAX_SWIPE_DURATION_MS);

        if (!queries.swipe(direction, ratio, durationMs)) {
            return ToolResults.error("Scroll gesture failed.");
        }

        JSONObject payload = new JSONObject();
        payload.put("direction", direction.name().toLowerCase(Locale.ROOT));
        payload.put("distance_ratio", ratio);
        payload.put("duration_ms", durationMs);
        return ToolResults.success(payload);
    }
}
