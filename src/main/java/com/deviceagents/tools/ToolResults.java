package com.deviceagents.tools;

import com.alibaba.fastjson2.JSONObject;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * 工具结果的统一格式：{"success": true, ...} 或 {"success": false, "error": "..."}。
 */
public final class ToolResults {
    private static final Logger logger = LogManager.getLogger(ToolResults.class);

    private ToolResults() {
    }

    public static String success(JSONObject payload) {
        JSONObject result = new JSONObject();
        result.put("success", true);
        if (payload != null) {
            result.putAll(payload);
        }
        return result.toJSONString();
    }

    public static String error(String message) {
        return error(message, null);
    }

    /** Error result carrying extra diagnostic fields; {@code success} is always false. */
    public static String error(String message, JSONObject extra) {
        JSONObject result = new JSONObject();
        if (extra != null) {
            result.putAll(extra);
        }
        result.put("success", false);
        result.put("error", message);
        return result.toJSONString();
    }

    public static boolean isSuccess(String result) {
        if (result == null || result.isEmpty()) {
            return false;
        }
        try {
            return JSONObject.parseObject(result).getBooleanValue("success");
        } catch (RuntimeException e) {
            logger.debug("Tool result is not a JSON object: {}", e.getMessage());
            return false;
        }
    }
}
