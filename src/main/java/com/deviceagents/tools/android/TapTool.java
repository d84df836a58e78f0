package com.deviceagents.tools.android;

import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.device.DeviceSession;
import com.deviceagents.screen.NodeQueryEngine;
import com.deviceagents.screen.TapResult;
import com.deviceagents.tools.ToolContext;
import com.deviceagents.tools.ToolResults;
import com.deviceagents.tools.ToolSchema;

/**
 * 点击工具：按可见文本（或描述）点击，或按屏幕坐标点击，二者不可同时使用。
 */
public class TapTool extends AndroidBaseTool {

    public TapTool(DeviceSession session) {
        super(session);
    }

    @Override
    public String getName() {
        return "tap";
    }

    @Override
    public String getDescription() {
        return "Tap a visible element by text/content description, or tap raw screen coordinates. Parameters: text, exact (default false), occurrence (1-based, default 1), x, y, duration_ms (40-600, default 80).";
    }

    @Override
    public JSONObject getInputSchema() {
        return ToolSchema.object()
                .string("text", "Visible text or content description to tap (case-insensitive by default).")
                .bool("exact", "When true, text/description match must be exact.")
                .integer("occurrence", "1-based match index when multiple nodes match text (default: 1).")
                .integer("x", "X coordinate in screen pixels. Use with y for coordinate-based tap.")
                .integer("y", "Y coordinate in screen pixels. Use with x for coordinate-based tap.")
                .integer("duration_ms", "Tap duration between 40 and 600 ms (default: 80).")
                .build();
    }

    @Override
    protected String run(JSONObject params, ToolContext context) {
        String disabled = requireAccessibility(ACCESSIBILITY_DISABLED);
        if (disabled != null) {
            return disabled;
        }

        String text = trimmed(params, "text");
        Integer x = params.getInteger("x");
        Integer y = params.getInteger("y");
        long durationMs = longArg(params, "duration_ms", NodeQueryEngine.DEFAULT_TAP_DURATION_MS,
                NodeQueryEngine.MIN_TAP_DURATION_MS, NodeQueryEngine.MAX_TAP_DURATION_MS);

        boolean hasCoordinates = x != null || y != null;
        boolean hasText = !text.isEmpty();
        if (hasCoordinates && hasText) {
            return ToolResults.error("Use either text-based tap or coordinate-based tap, not both in the same call.");
        }
        if (!hasCoordinates && !hasText) {
            return ToolResults.error("Missing target. Provide text, or provide both x and y coordinates.");
        }

        if (hasCoordinates) {
            if (x == null || y == null) {
                return ToolResults.error("Coordinate tap requires both x and y.");
            }
            if (!queries.tap(x, y, durationMs)) {
                return ToolResults.error("Tap gesture failed at coordinates (" + x + ", " + y + ").");
            }
            JSONObject payload = new JSONObject();
            payload.put("mode", "coordinates");
            payload.put("x", x);
            payload.put("y", y);
            payload.put("duration_ms", durationMs);
            return ToolResults.success(payload);
        }

        boolean exact = boolArg(params, "exact", false);
        Integer rawOccurrence = params.getInteger("occurrence");
        int occurrence = Math.max(1, rawOccurrence == null ? 1 : rawOccurrence);
        TapResult result = queries.tapVisibleNodeByText(session.screen().activeRoot(), text, exact, occurrence);
        if (!result.isSuccess()) {
            String error = result.getError();
            return ToolResults.error(error != null ? error
                    : "Failed to tap '" + text + "'. Use screen_state to inspect visible text and try again.");
        }

        JSONObject payload = new JSONObject();
        payload.put("mode", "text");
        payload.put("query", text);
        payload.put("exact", exact);
        payload.put("occurrence", occurrence);
        payload.put("package_name", nullToEmpty(result.getPackageName()));
        payload.put("matched_text", nullToEmpty(result.getMatchedText()));
        payload.put("matched_description", nullToEmpty(result.getMatchedDescription()));
        return ToolResults.success(payload);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
