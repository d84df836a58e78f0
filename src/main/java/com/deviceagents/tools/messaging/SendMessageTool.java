package com.deviceagents.tools.messaging;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.automation.messaging.ConversationLink;
import com.deviceagents.automation.messaging.DeepLinkDraftFlow;
import com.deviceagents.automation.messaging.DraftOutcome;
import com.deviceagents.automation.messaging.MessageRequest;
import com.deviceagents.automation.messaging.MessagingApps;
import com.deviceagents.automation.messaging.WhatsAppVariant;
import com.deviceagents.device.DeviceSession;
import com.deviceagents.screen.ScreenCheckpoint;
import com.deviceagents.tools.ToolContext;
import com.deviceagents.tools.ToolResults;
import com.deviceagents.tools.ToolSchema;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * 通用发消息入口
 * <p>
 * 规范化 app 别名后路由：带 contact_name 的 WhatsApp 请求走联系人校验的发送流程；
 * 只有号码的 WhatsApp、Instagram、Messenger 与 Google Messages 通过深链接打开预填好的草稿，
 * 由用户在应用里点击发送。strict_screen_state 打开时，目标号码或用户名必须出现在屏幕上。
 * </p>
 */
public class SendMessageTool extends WhatsAppBaseTool {
    private static final Logger logger = LogManager.getLogger(SendMessageTool.class);

    static final String STRICT_NEEDS_ACCESSIBILITY = "strict_screen_state=true requires accessibility screen-state checks. "
            + "Start the UiAutomator2 session or pass strict_screen_state=false.";
    static final String MANUAL_SEND_NOTE = "Message needs to be sent manually in the app";

    private final DeepLinkDraftFlow drafts;

    public SendMessageTool(DeviceSession session) {
        super(session);
        this.drafts = new DeepLinkDraftFlow(session, guards);
    }

    @Override
    public String getName() {
        return "send_message";
    }

    @Override
    public String getDescription() {
        return "Send a message through a messaging app. WhatsApp sends to a named contact use the contact-safe verified flow; "
                + "a WhatsApp phone number, Instagram, Messenger and Google Messages open a pre-filled draft for the user to send. "
                + "Parameters: app (whatsapp, whatsapp_business, whatsapp_personal, instagram, messenger, google_messages), message, "
                + "contact_name, phone_number, username, whatsapp_type, strict_contact_match, strict_screen_state.";
    }

    @Override
    public JSONObject getInputSchema() {
        return ToolSchema.object()
                .string("app", "Messaging app name or alias.")
                .string("message", "Message content to send.")
                .string("contact_name", "Contact name (WhatsApp).")
                .string("phone_number", "Phone number (WhatsApp draft, Google Messages, or fallback for contact match).")
                .string("username", "Username (Instagram, Messenger).")
                .enumeration("whatsapp_type", "WhatsApp app type when app=whatsapp.", "personal", "business")
                .bool("strict_contact_match", "Abort send if contact cannot be confirmed on screen (default: true).")
                .bool("strict_screen_state", "Verify foreground app and target on screen after opening a draft (default: true).")
                .required("app", "message")
                .build();
    }

    @Override
    protected String run(JSONObject params, ToolContext context) {
        String rawApp = params.getString("app");
        if (rawApp == null) {
            return ToolResults.error("App is required");
        }
        String app = MessagingApps.normalize(rawApp);
        if (app == null) {
            return ToolResults.error("Unsupported app '" + rawApp.trim()
                    + "'. Use: whatsapp, whatsapp_business, whatsapp_personal, instagram, messenger, google_messages");
        }
        String message = params.getString("message");
        if (message == null) {
            return ToolResults.error("Message is required");
        }
        if (message.trim().isEmpty()) {
            return ToolResults.error("Message cannot be empty");
        }
        boolean strict = boolArg(params, "strict_screen_state", true);
        String phoneNumber = trimmed(params, "phone_number");
        String username = trimmed(params, "username");

        if (MessagingApps.isWhatsApp(app)) {
            return sendWhatsApp(app, params, message, phoneNumber, strict, context);
        }
        if (MessagingApps.GOOGLE_MESSAGES.equals(app) && phoneNumber.isEmpty()) {
            return ToolResults.error("Phone number is required for Google Messages");
        }
        if (strict && !session.isAccessibilityEnabled()) {
            return ToolResults.error(STRICT_NEEDS_ACCESSIBILITY);
        }

        ConversationLink link;
        String action;
        String status;
        if (MessagingApps.INSTAGRAM.equals(app)) {
            link = ConversationLink.instagram(username);
            action = "opened_instagram_profile";
            status = username.isEmpty() ? "Opened Instagram" : "Opened Instagram profile for " + username;
        } else if (MessagingApps.MESSENGER.equals(app)) {
            link = ConversationLink.messenger(username);
            action = "opened_messenger_chat";
            status = username.isEmpty() ? "Opened Messenger" : "Opened Messenger chat with " + username;
        } else {
            link = ConversationLink.googleMessages(phoneNumber, message);
            action = "opened_messages_with_compose";
            status = "Opened Google Messages with pre-filled message to " + phoneNumber;
        }
        if (!installed(link.getPackageName())) {
            return ToolResults.error((MessagingApps.MESSENGER.equals(app) ? "Facebook Messenger" : link.getAppName())
                    + " is not installed");
        }

        progress(context, "Opening " + link.getAppName() + " draft");
        DraftOutcome outcome = drafts.open(link, strict);
        if (!outcome.isSuccess()) {
            return abort(outcome.getError(), outcome.getCheckpoints());
        }
        JSONObject payload = draftPayload(link, action, message, strict, outcome);
        if (!username.isEmpty()) {
            payload.put("username", username);
        }
        if (!phoneNumber.isEmpty()) {
            payload.put("phone_number", phoneNumber);
        }
        payload.put("status", status);
        payload.put("note", MANUAL_SEND_NOTE);
        return ToolResults.success(payload);
    }

    private String sendWhatsApp(String app, JSONObject params, String message, String phoneNumber,
                                boolean strict, ToolContext context) {
        String rawType = params.getString("whatsapp_type");
        String typeError = checkWhatsAppType(rawType);
        if (typeError != null) {
            return typeError;
        }
        WhatsAppVariant requested;
        if (MessagingApps.WHATSAPP_BUSINESS.equals(app)) {
            requested = WhatsAppVariant.BUSINESS;
        } else if (MessagingApps.WHATSAPP_PERSONAL.equals(app)) {
            requested = WhatsAppVariant.PERSONAL;
        } else {
            requested = WhatsAppVariant.fromType(rawType);
        }

        String contactName = trimmed(params, "contact_name");
        if (!contactName.isEmpty()) {
            MessageRequest request = new MessageRequest(contactName, message, params.getString("phone_number"),
                    requested, boolArg(params, "strict_contact_match", true));
            return sendVerified(request, context);
        }

        if (phoneNumber.isEmpty()) {
            return ToolResults.error("Phone number is required for WhatsApp (or provide contact_name)");
        }
        if (strict && !session.isAccessibilityEnabled()) {
            return ToolResults.error(STRICT_NEEDS_ACCESSIBILITY);
        }
        WhatsAppVariant variant = flow.resolveVariant(requested);
        if (variant == null) {
            return ToolResults.error((requested == null ? "WhatsApp" : requested.getDisplayName()) + " is not installed");
        }

        ConversationLink link = ConversationLink.whatsApp(variant, phoneNumber, contactName, message);
        progress(context, "Opening " + variant.getDisplayName() + " chat with " + phoneNumber);
        DraftOutcome outcome = drafts.open(link, strict);
        if (!outcome.isSuccess()) {
            return abort(outcome.getError(), outcome.getCheckpoints());
        }
        JSONObject payload = draftPayload(link, "opened_whatsapp_draft", message, strict, outcome);
        payload.put("phone_number", phoneNumber);
        payload.put("contact_name", contactName);
        payload.put("used_app", variant.getDisplayName());
        payload.put("whatsapp_type", variant.getType());
        payload.put("status", "Opened " + variant.getDisplayName() + " with pre-filled message to " + phoneNumber);
        payload.put("note", "Message will be sent after you tap the send button in WhatsApp");
        JSONArray nextActions = new JSONArray();
        nextActions.add("SEND");
        nextActions.add("CANCEL");
        payload.put("next_actions", nextActions);
        return ToolResults.success(payload);
    }

    private static JSONObject draftPayload(ConversationLink link, String action, String message, boolean strict,
                                           DraftOutcome outcome) {
        JSONObject payload = new JSONObject();
        payload.put("action", action);
        payload.put("app", link.getApp());
        payload.put("package_name", link.getPackageName());
        payload.put("message", message);
        payload.put("strict_screen_state", strict);
        payload.put("screen_state_verified", outcome.isScreenStateVerified());
        if (strict) {
            payload.put("screen_checkpoints", ScreenCheckpoint.toJsonArray(outcome.getCheckpoints()));
        }
        return payload;
    }

    private boolean installed(String pkg) {
        try {
            return session.apps().isInstalled(pkg);
        } catch (RuntimeException e) {
            logger.warn("Could not check whether {} is installed: {}", pkg, e.getMessage());
            return false;
        }
    }
}
