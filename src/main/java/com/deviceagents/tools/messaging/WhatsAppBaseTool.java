package com.deviceagents.tools.messaging;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.automation.messaging.MessageRequest;
import com.deviceagents.automation.messaging.MessagingOutcome;
import com.deviceagents.automation.messaging.WhatsAppMessageFlow;
import com.deviceagents.automation.messaging.WhatsAppVariant;
import com.deviceagents.device.DeviceSession;
import com.deviceagents.tools.ToolContext;
import com.deviceagents.tools.ToolResults;
import com.deviceagents.tools.android.AndroidBaseTool;

/**
 * WhatsApp 发送类工具的公共部分：把请求交给联系人校验的发送流程，并把结果转换成工具输出。
 */
public abstract class WhatsAppBaseTool extends AndroidBaseTool {

    static final String COMPLETED_STATUS = "Message flow completed with screen-state verification.";
    static final String[] STEPS_COMPLETED = {
            "opened_whatsapp", "selected_contact", "verified_contact",
            "typed_message", "verified_pre_send_state", "pressed_send"
    };

    protected final WhatsAppMessageFlow flow;

    protected WhatsAppBaseTool(DeviceSession session) {
        super(session);
        this.flow = new WhatsAppMessageFlow(session, queries, guards);
    }

    /**
     * @return an error result for an unrecognised non-blank type; null otherwise
     */
    protected static String checkWhatsAppType(String rawType) {
        if (rawType == null || rawType.trim().isEmpty() || WhatsAppVariant.fromType(rawType) != null) {
            return null;
        }
        return ToolResults.error("Unsupported whatsapp_type '" + rawType.trim() + "'. Use personal or business.");
    }

    protected String sendVerified(MessageRequest request, ToolContext context) {
        progress(context, "Sending WhatsApp message to '" + request.getContactName() + "' with screen-state checks");
        MessagingOutcome outcome = flow.send(request);
        WhatsAppVariant variant = outcome.getVariant();

        if (!outcome.isSuccess()) {
            JSONObject extra = new JSONObject();
            extra.put("failure_reason", outcome.getFailureReason() == null ? null : outcome.getFailureReason().getWireName());
            if (variant != null) {
                extra.put("whatsapp_type", variant.getType());
                extra.put("package_name", variant.getPackageName());
            }
            extra.put("contact_name", request.getContactName());
            extra.put("screen_checkpoints", outcome.checkpointsJson());
            return ToolResults.error(outcome.getError(), extra);
        }

        JSONObject payload = new JSONObject();
        payload.put("action", "send_whatsapp_message");
        payload.put("whatsapp_type", variant.getType());
        payload.put("package_name", variant.getPackageName());
        payload.put("contact_name", request.getContactName());
        payload.put("phone_number", request.getPhoneNumber() == null ? "" : request.getPhoneNumber());
        payload.put("message", request.getMessage());
        payload.put("strict_contact_match", request.isStrictContactMatch());
        payload.put("status", COMPLETED_STATUS);
        JSONArray steps = new JSONArray();
        for (String step : STEPS_COMPLETED) {
            steps.add(step);
        }
        payload.put("steps_completed", steps);
        payload.put("screen_checkpoints", outcome.checkpointsJson());
        return ToolResults.success(payload);
    }
}
