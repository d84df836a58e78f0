package com.deviceagents.tools.messaging;

import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.automation.messaging.MessageRequest;
import com.deviceagents.automation.messaging.SendCommandParser;
import com.deviceagents.automation.messaging.WhatsAppVariant;
import com.deviceagents.device.DeviceSession;
import com.deviceagents.tools.ToolContext;
import com.deviceagents.tools.ToolResults;
import com.deviceagents.tools.ToolSchema;

/**
 * WhatsApp Business 发送消息
 * <p>
 * 接受 recipient/text 等别名，也接受一整句命令（raw_command），解析出联系人与消息后交给联系人校验流程。
 * </p>
 */
public class SendWhatsAppBusinessMessageTool extends WhatsAppBaseTool {

    static final String CONTACT_REQUIRED =
            "contact_name is required (or provide raw_command like: send message to Fahad Shakoor on whatsapp bussiness hello)";
    static final String MESSAGE_REQUIRED = "message is required (or provide raw_command containing the message text)";

    public SendWhatsAppBusinessMessageTool(DeviceSession session) {
        super(session);
    }

    @Override
    public String getName() {
        return "send_whatsapp_business_message";
    }

    @Override
    public String getDescription() {
        return "Send a message through WhatsApp Business with contact verification. Parameters: contact_name (or recipient), message (or text), raw_command (e.g. 'send message to Fahad on whatsapp business hello'), phone_number, strict_contact_match.";
    }

    @Override
    public JSONObject getInputSchema() {
        return ToolSchema.object()
                .string("contact_name", "Contact name to send to.")
                .string("recipient", "Alias of contact_name.")
                .string("message", "Message content to send.")
                .string("text", "Alias of message.")
                .string("raw_command", "Whole command, e.g. 'send message to Fahad Shakoor on whatsapp business hello'.")
                .string("phone_number", "Optional phone number used as fallback for contact match.")
                .bool("strict_contact_match", "Abort send if contact cannot be confirmed on screen (default: true).")
                .build();
    }

    @Override
    protected String run(JSONObject params, ToolContext context) {
        String contactName = firstNonBlank(params, "contact_name", "recipient");
        String message = firstNonBlank(params, "message", "text");
        String rawCommand = firstNonBlank(params, "raw_command", "command", "request");
        if (rawCommand == null && contactName == null && SendCommandParser.parse(message) != null) {
            rawCommand = message;
            message = null;
        }

        String[] parsed = SendCommandParser.parse(rawCommand);
        if (parsed != null) {
            if (contactName == null) {
                contactName = parsed[0];
            }
            if (message == null) {
                message = parsed[1];
            }
        }
        if (contactName == null) {
            return ToolResults.error(CONTACT_REQUIRED);
        }
        if (message == null) {
            return ToolResults.error(MESSAGE_REQUIRED);
        }

        MessageRequest request = new MessageRequest(contactName, message, params.getString("phone_number"),
                WhatsAppVariant.BUSINESS, boolArg(params, "strict_contact_match", true));
        return sendVerified(request, context);
    }

    private static String firstNonBlank(JSONObject params, String... keys) {
        for (String key : keys) {
            String value = trimmed(params, key);
            if (!value.isEmpty()) {
                return value;
            }
        }
        return null;
    }
}
