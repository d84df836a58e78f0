package com.deviceagents.tools;

import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.device.DeviceSession;
import com.deviceagents.tools.android.GlobalActionTool;
import com.deviceagents.tools.android.LaunchAppTool;
import com.deviceagents.tools.android.ListAppsTool;
import com.deviceagents.tools.android.ScreenStateTool;
import com.deviceagents.tools.android.ScrollScreenTool;
import com.deviceagents.tools.android.SearchScreenTool;
import com.deviceagents.tools.android.SocialMediaTool;
import com.deviceagents.tools.android.TapTool;
import com.deviceagents.tools.android.WorkflowAutomationTool;
import com.deviceagents.tools.messaging.SendMessageTool;
import com.deviceagents.tools.messaging.SendWhatsAppBusinessMessageTool;
import com.deviceagents.tools.messaging.SendWhatsAppMessageTool;
import com.deviceagents.tools.messaging.WhatsAppAutomationTool;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 工具管理类
 * <p>
 * 负责工具的注册以及直接命令（{@code tool_name key="value"}）的解析执行。
 * JSON-RPC 调用同样经由 {@link #executeTool(String, JSONObject, ToolContext)} 进入工具。
 * </p>
 */
public class ToolManager {
    private static final Logger logger = LogManager.getLogger(ToolManager.class);

    private static final Pattern PARAM_PATTERN = Pattern.compile("(\\w+)=(?:\"([^\"]*)\"|([^\\s]+))");

    /**
     * 注册所有设备工具，已注册时直接返回。
     */
    public static void registerTools(DeviceSession session) {
        // 避免重复注册
        if (!ToolRegistry.getAll().isEmpty()) {
            return;
        }

        ToolRegistry.register(new ScreenStateTool(session));
        ToolRegistry.register(new TapTool(session));
        ToolRegistry.register(new ScrollScreenTool(session));
        ToolRegistry.register(new GlobalActionTool(session));
        ToolRegistry.register(new ListAppsTool(session));
        ToolRegistry.register(new LaunchAppTool(session));
        ToolRegistry.register(new SearchScreenTool(session));
        ToolRegistry.register(new SocialMediaTool(session));
        ToolRegistry.register(new SendWhatsAppMessageTool(session));
        ToolRegistry.register(new SendWhatsAppBusinessMessageTool(session));
        ToolRegistry.register(new WhatsAppAutomationTool(session));
        ToolRegistry.register(new SendMessageTool(session));
        ToolRegistry.register(new WorkflowAutomationTool(session));
        logger.info("Registered {} tools", ToolRegistry.getAll().size());
    }

    /**
     * Runs a registered tool. Unexpected exceptions propagate to the caller.
     *
     * @throws IllegalArgumentException when no tool has that name
     */
    public static String executeTool(String toolName, JSONObject params, ToolContext context) {
        Tool tool = ToolRegistry.get(toolName);
        if (tool == null) {
            throw new IllegalArgumentException("Tool not found: " + toolName);
        }
        logger.info("Executing tool: {}", toolName);
        long start = System.currentTimeMillis();
        String result = tool.execute(params == null ? new JSONObject() : params, context);
        logger.info("Tool {} finished in {} ms", toolName, System.currentTimeMillis() - start);
        return result;
    }

    /**
     * 尝试解析直接命令
     * 格式: tool_name key="value" key2="value2"
     * 如果匹配成功并执行，返回 true；工具不存在、或有参数文本却解析不出 key=value 时返回 false。
     */
    public static boolean tryExecuteDirectCommand(String text, ToolContext context) {
        if (text == null || text.trim().isEmpty()) return false;

        String[] parts = text.trim().split("\\s+", 2);
        String toolName = parts[0];

        if (!ToolRegistry.contains(toolName)) {
            return false;
        }

        String args = (parts.length > 1) ? parts[1].trim() : "";
        JSONObject params = new JSONObject();

        if (!args.isEmpty()) {
            boolean hasExplicitParams = false;
            Matcher m = PARAM_PATTERN.matcher(args);
            while (m.find()) {
                hasExplicitParams = true;
                String key = m.group(1);
                String value = m.group(2) != null ? m.group(2) : m.group(3);
                params.put(key, value);
            }
            if (!hasExplicitParams) {
                return false;
            }
        }

        try {
            String result = executeTool(toolName, params, context);
            if (context != null) {
                context.sendText(result);
            }
        } catch (RuntimeException e) {
            logger.error("Direct execution of {} failed", toolName, e);
            if (context != null) {
                context.sendText(ToolResults.error("Tool execution failed: " + e.getMessage()));
            }
        }
        return true;
    }
}
