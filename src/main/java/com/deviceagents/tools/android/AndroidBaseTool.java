package com.deviceagents.tools.android;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.config.AppConfig;
import com.deviceagents.device.DeviceSession;
import com.deviceagents.device.GlobalAction;
import com.deviceagents.device.LaunchableApp;
import com.deviceagents.device.SwipeDirection;
import com.deviceagents.screen.NodeQueryEngine;
import com.deviceagents.screen.ScreenCheckpoint;
import com.deviceagents.screen.ScreenStateGuards;
import com.deviceagents.tools.Tool;
import com.deviceagents.tools.ToolContext;
import com.deviceagents.tools.ToolResults;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 设备工具基类
 * <p>
 * 持有当前 {@link DeviceSession}，负责参数读取与钳制、无障碍检查，
 * 并保证同一时刻只有一个工具在驱动设备。子类实现 {@link #run(JSONObject, ToolContext)}。
 * </p>
 */
public abstract class AndroidBaseTool implements Tool {
    private static final Logger logger = LogManager.getLogger(AndroidBaseTool.class);

    protected static final ReentrantLock TOOL_LOCK = new ReentrantLock();

    protected static final String ACCESSIBILITY_DISABLED =
            "Accessibility automation is disabled. Start the UiAutomator2 session for the device and retry.";

    protected static final String CLOSE_NOTE =
            "Best effort only. Android does not allow third-party apps to force-stop arbitrary packages.";

    private static final long RECENTS_SETTLE_MS = 300L;
    private static final float CLOSE_SWIPE_RATIO = 0.7f;
    private static final long CLOSE_SWIPE_DURATION_MS = 260L;
    private static final long CLOSE_HOME_DELAY_MS = 120L;

    protected final DeviceSession session;
    protected final NodeQueryEngine queries;
    protected final ScreenStateGuards guards;

    protected AndroidBaseTool(DeviceSession session) {
        this.session = session;
        this.queries = new NodeQueryEngine(session.actions(), AppConfig.getInstance().getGestureTimeoutMs());
        this.guards = new ScreenStateGuards(session);
    }

    @Override
    public final String execute(JSONObject params, ToolContext context) {
        JSONObject args = params == null ? new JSONObject() : params;
        TOOL_LOCK.lock();
        try {
            return run(args, context);
        } catch (RuntimeException e) {
            logger.error("Tool {} failed", getName(), e);
            return ToolResults.error(getName() + " failed: " + e.getMessage());
        } finally {
            TOOL_LOCK.unlock();
        }
    }

    protected abstract String run(JSONObject params, ToolContext context);

    /**
     * @return an error result when accessibility is off, otherwise null
     */
    protected String requireAccessibility(String message) {
        if (session.isAccessibilityEnabled()) {
            return null;
        }
        return ToolResults.error(message);
    }

    /**
     * Opens recents, swipes the top card away and returns home. Android offers no way to
     * force-stop another package, so this only closes the task when the launcher cooperates.
     *
     * @return whether the swipe gesture completed
     */
    protected boolean closeForegroundAppBestEffort() {
        if (!session.actions().runGlobalAction(GlobalAction.RECENTS)) {
            return false;
        }
        guards.pause(RECENTS_SETTLE_MS);
        boolean swiped = queries.swipe(SwipeDirection.UP, CLOSE_SWIPE_RATIO, CLOSE_SWIPE_DURATION_MS);
        guards.pause(CLOSE_HOME_DELAY_MS);
        session.actions().runGlobalAction(GlobalAction.HOME);
        return swiped;
    }

    /** Error result that keeps the checkpoints recorded before the abort. */
    protected static String abort(String message, List<ScreenCheckpoint> checkpoints) {
        if (checkpoints == null || checkpoints.isEmpty()) {
            return ToolResults.error(message);
        }
        JSONObject extra = new JSONObject();
        extra.put("screen_checkpoints", ScreenCheckpoint.toJsonArray(checkpoints));
        return ToolResults.error(message, extra);
    }

    protected static void progress(ToolContext context, String message) {
        if (context != null) {
            context.sendText(message);
        }
    }

    protected static String trimmed(JSONObject params, String key) {
        String value = params.getString(key);
        return value == null ? "" : value.trim();
    }

    protected static int intArg(JSONObject params, String key, int defaultValue, int min, int max) {
        Integer value = params.getInteger(key);
        int v = value == null ? defaultValue : value;
        return Math.max(min, Math.min(max, v));
    }

    protected static long longArg(JSONObject params, String key, long defaultValue, long min, long max) {
        Long value = params.getLong(key);
        long v = value == null ? defaultValue : value;
        return Math.max(min, Math.min(max, v));
    }

    protected static float floatArg(JSONObject params, String key, float defaultValue, float min, float max) {
        Float value = params.getFloat(key);
        float v = value == null ? defaultValue : value;
        return Math.max(min, Math.min(max, v));
    }

    protected static boolean boolArg(JSONObject params, String key, boolean defaultValue) {
        Boolean value = params.getBoolean(key);
        return value == null ? defaultValue : value;
    }

    /** Non-blank trimmed strings of a JSON array argument; empty when absent. */
    protected static List<String> stringList(JSONObject params, String key) {
        JSONArray array = params.getJSONArray(key);
        if (array == null || array.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> values = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            String value = array.getString(i);
            if (value != null && !value.trim().isEmpty()) {
                values.add(value.trim());
            }
        }
        return values;
    }
}
