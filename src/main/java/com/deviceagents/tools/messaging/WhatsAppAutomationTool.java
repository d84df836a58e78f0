package com.deviceagents.tools.messaging;

import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.automation.messaging.MessageRequest;
import com.deviceagents.automation.messaging.WhatsAppVariant;
import com.deviceagents.device.DeviceSession;
import com.deviceagents.tools.ToolContext;
import com.deviceagents.tools.ToolResults;
import com.deviceagents.tools.ToolSchema;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * WhatsApp 自动化入口。只允许完整校验的 send_message；逐步操作（选联系人、输入、点发送）
 * 因无法保证目标会话而被拒绝。
 */
public class WhatsAppAutomationTool extends WhatsAppBaseTool {

    static final List<String> REFUSED_ACTIONS =
            Arrays.asList("select_contact", "type_message", "press_send", "press_cancel");

    public WhatsAppAutomationTool(DeviceSession session) {
        super(session);
    }

    @Override
    public String getName() {
        return "whatsapp_automation";
    }

    @Override
    public String getDescription() {
        return "WhatsApp automation. Only action=send_message is executed (full screen-state verified flow); step-by-step actions are refused. Parameters: action, contact_name, message, whatsapp_type, phone_number, strict_contact_match.";
    }

    @Override
    public JSONObject getInputSchema() {
        return ToolSchema.object()
                .enumeration("action", "Automation action.",
                        "send_message", "select_contact", "type_message", "press_send", "press_cancel")
                .string("contact_name", "Contact name (action=send_message).")
                .string("message", "Message content (action=send_message).")
                .enumeration("whatsapp_type", "WhatsApp app type: 'personal' or 'business'.", "personal", "business")
                .string("phone_number", "Optional phone number used as fallback for contact match.")
                .bool("strict_contact_match", "Abort send if contact cannot be confirmed on screen (default: true).")
                .required("action")
                .build();
    }

    @Override
    protected String run(JSONObject params, ToolContext context) {
        String rawAction = params.getString("action");
        if (rawAction == null) {
            return ToolResults.error("Action is required");
        }
        String action = rawAction.trim().toLowerCase(Locale.ROOT);
        if (REFUSED_ACTIONS.contains(action)) {
            return ToolResults.error("Action '" + action + "' is disabled because unverified step-by-step mode is unsafe. "
                    + "Use send_whatsapp_message (or whatsapp_automation with action=send_message) for full screen-state verified execution.");
        }
        if (!"send_message".equals(action)) {
            return ToolResults.error("Unsupported action. Use: send_message, select_contact, type_message, press_send, press_cancel");
        }

        String contactName = params.getString("contact_name");
        if (contactName == null) {
            return ToolResults.error("contact_name is required for action=send_message");
        }
        String message = params.getString("message");
        if (message == null) {
            return ToolResults.error("message is required for action=send_message");
        }
        String rawType = params.getString("whatsapp_type");
        String typeError = checkWhatsAppType(rawType);
        if (typeError != null) {
            return typeError;
        }
        MessageRequest request = new MessageRequest(contactName, message, params.getString("phone_number"),
                WhatsAppVariant.fromType(rawType), boolArg(params, "strict_contact_match", true));
        return sendVerified(request, context);
    }
}
