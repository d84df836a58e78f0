package com.deviceagents.tools.messaging;

import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.automation.messaging.MessageRequest;
import com.deviceagents.automation.messaging.WhatsAppVariant;
import com.deviceagents.device.DeviceSession;
import com.deviceagents.tools.ToolContext;
import com.deviceagents.tools.ToolResults;
import com.deviceagents.tools.ToolSchema;

/**
 * WhatsApp 发送消息
 * <p>
 * 打开 WhatsApp、搜索并打开联系人会话、确认会话对象、输入并确认消息后才点击发送。
 * 任何一步无法在屏幕上确认都会中止，结果中带有 failure_reason 与全部检查点。
 * </p>
 */
public class SendWhatsAppMessageTool extends WhatsAppBaseTool {

    public SendWhatsAppMessageTool(DeviceSession session) {
        super(session);
    }

    @Override
    public String getName() {
        return "send_whatsapp_message";
    }

    @Override
    public String getDescription() {
        return "Send a WhatsApp message to a named contact with screen-state verification at every step. Parameters: contact_name (required), message (required), whatsapp_type (personal/business, optional), phone_number (optional fallback match), strict_contact_match (default true).";
    }

    @Override
    public JSONObject getInputSchema() {
        return ToolSchema.object()
                .string("contact_name", "Contact name to search and send message to.")
                .string("message", "Message content to send.")
                .enumeration("whatsapp_type", "WhatsApp app type: 'personal' or 'business'.", "personal", "business")
                .string("phone_number", "Optional phone number used as fallback for contact match.")
                .bool("strict_contact_match", "Abort send if contact cannot be confirmed on screen (default: true).")
                .required("contact_name", "message")
                .build();
    }

    @Override
    protected String run(JSONObject params, ToolContext context) {
        String contactName = params.getString("contact_name");
        if (contactName == null) {
            return ToolResults.error("Contact name is required");
        }
        String message = params.getString("message");
        if (message == null) {
            return ToolResults.error("Message is required");
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
