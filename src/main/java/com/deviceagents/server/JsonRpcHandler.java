package com.deviceagents.server;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.tools.Tool;
import com.deviceagents.tools.ToolContext;
import com.deviceagents.tools.ToolManager;
import com.deviceagents.tools.ToolRegistry;
import com.deviceagents.tools.ToolResults;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * JSON-RPC 2.0 请求路由
 * <p>
 * 支持 initialize、notifications/initialized、tools/list、tools/call。
 * 没有 id 的请求是通知，不返回响应。工具自身的失败作为 isError 结果返回，
 * 只有工具抛出异常时才使用 INTERNAL_ERROR。
 * </p>
 */
public class JsonRpcHandler {
    private static final Logger logger = LogManager.getLogger(JsonRpcHandler.class);

    public static final String PROTOCOL_VERSION = "2024-11-05";
    public static final String SERVER_NAME = "deviceAgents";
    public static final String SERVER_VERSION = "1.0.0";

    private final ToolContext context;

    public JsonRpcHandler(ToolContext context) {
        this.context = context;
    }

    /**
     * @return the serialized response, or null for notifications
     */
    public String handle(String line) {
        Object parsed;
        try {
            parsed = JSON.parse(line);
        } catch (JSONException e) {
            logger.warn("Unparseable request: {}", e.getMessage());
            return error(null, JsonRpcErrorCodes.PARSE_ERROR, "Parse error: " + e.getMessage()).toJSONString();
        }
        if (!(parsed instanceof JSONObject)) {
            return error(null, JsonRpcErrorCodes.INVALID_REQUEST, "Invalid request").toJSONString();
        }
        JSONObject request = (JSONObject) parsed;
        Object id = request.get("id");
        String method = request.getString("method");
        if (method == null || method.trim().isEmpty()) {
            return error(id, JsonRpcErrorCodes.INVALID_REQUEST, "Invalid request: method is required").toJSONString();
        }

        if (id == null) {
            logger.debug("Notification {}", method);
            return null;
        }
        return dispatch(id, method, request.get("params")).toJSONString();
    }

    JSONObject dispatch(Object id, String method, Object params) {
        switch (method) {
            case "initialize":
                return result(id, initializeResult());
            case "notifications/initialized":
                return result(id, new JSONObject());
            case "tools/list":
                return result(id, toolsListResult());
            case "tools/call":
                return callTool(id, params);
            default:
                return error(id, JsonRpcErrorCodes.METHOD_NOT_FOUND, "Method not found: " + method);
        }
    }

    private JSONObject callTool(Object id, Object rawParams) {
        if (!(rawParams instanceof JSONObject)) {
            return error(id, JsonRpcErrorCodes.INVALID_PARAMS, "Missing params");
        }
        JSONObject params = (JSONObject) rawParams;
        String toolName = params.getString("name");
        if (toolName == null) {
            return error(id, JsonRpcErrorCodes.INVALID_PARAMS, "Missing tool name");
        }
        if (!ToolRegistry.contains(toolName)) {
            return error(id, JsonRpcErrorCodes.TOOL_NOT_FOUND, "Tool not found: " + toolName);
        }
        Object rawArgs = params.get("arguments");
        if (rawArgs != null && !(rawArgs instanceof JSONObject)) {
            return error(id, JsonRpcErrorCodes.INVALID_PARAMS, "arguments must be an object");
        }

        try {
            String text = ToolManager.executeTool(toolName, (JSONObject) rawArgs, context);
            JSONObject content = new JSONObject();
            content.put("type", "text");
            content.put("text", text);
            JSONArray contents = new JSONArray();
            contents.add(content);
            JSONObject result = new JSONObject();
            result.put("content", contents);
            result.put("isError", !ToolResults.isSuccess(text));
            return result(id, result);
        } catch (RuntimeException e) {
            logger.error("Tool execution error: {}", toolName, e);
            return error(id, JsonRpcErrorCodes.INTERNAL_ERROR, e.getMessage() == null ? "Tool error" : e.getMessage());
        }
    }

    private static JSONObject initializeResult() {
        JSONObject serverInfo = new JSONObject();
        serverInfo.put("name", SERVER_NAME);
        serverInfo.put("version", SERVER_VERSION);
        JSONObject tools = new JSONObject();
        tools.put("listChanged", false);
        JSONObject capabilities = new JSONObject();
        capabilities.put("tools", tools);

        JSONObject result = new JSONObject();
        result.put("protocolVersion", PROTOCOL_VERSION);
        result.put("serverInfo", serverInfo);
        result.put("capabilities", capabilities);
        return result;
    }

    private static JSONObject toolsListResult() {
        JSONArray tools = new JSONArray();
        for (Tool tool : ToolRegistry.getAll()) {
            JSONObject info = new JSONObject();
            info.put("name", tool.getName());
            info.put("description", tool.getDescription());
            info.put("inputSchema", tool.getInputSchema());
            tools.add(info);
        }
        JSONObject result = new JSONObject();
        result.put("tools", tools);
        return result;
    }

    private static JSONObject result(Object id, JSONObject result) {
        JSONObject response = new JSONObject();
        response.put("jsonrpc", "2.0");
        response.put("result", result);
        response.put("id", id);
        return response;
    }

    private static JSONObject error(Object id, int code, String message) {
        JSONObject error = new JSONObject();
        error.put("code", code);
        error.put("message", message);
        JSONObject response = new JSONObject();
        response.put("jsonrpc", "2.0");
        response.put("error", error);
        if (id != null) {
            response.put("id", id);
        }
        return response;
    }
}
