package com.deviceagents.automation.messaging;

import com.deviceagents.screen.ScreenSnapshot;
import com.deviceagents.screen.ScreenStateGuards;

import java.io.UnsupportedEncodingException;
import java.net.URLEncoder;

/**
 * 打开某个会话的深链接，以及打开后用来确认目标的屏幕线索（号码或用户名）。
 */
public final class ConversationLink {

    public static final String INSTAGRAM_PACKAGE = "com.instagram.android";
    public static final String MESSENGER_PACKAGE = "com.facebook.orca";
    public static final String GOOGLE_MESSAGES_PACKAGE = "com.google.android.apps.messaging";

    private final String app;
    private final String packageName;
    private final String appName;
    private final String uri;
    private final String phoneNumber;
    private final String targetText;

    private ConversationLink(String app, String packageName, String appName, String uri,
                             String phoneNumber, String targetText) {
        this.app = app;
        this.packageName = packageName;
        this.appName = appName;
        this.uri = uri;
        this.phoneNumber = phoneNumber;
        this.targetText = targetText;
    }

    /** wa.me chat with the message pre-filled; the contact name is an alternative on-screen match. */
    public static ConversationLink whatsApp(WhatsAppVariant variant, String phoneNumber, String contactName, String message) {
        String uri = "https://wa.me/" + ScreenStateGuards.digitsOf(phoneNumber) + "?text=" + encode(message);
        return new ConversationLink(MessagingApps.WHATSAPP, variant.getPackageName(), variant.getDisplayName(), uri,
                phoneNumber, blankToNull(contactName));
    }

    /** Profile page; a blank username opens the app on its own start page. */
    public static ConversationLink instagram(String username) {
        String user = blankToNull(username);
        String uri = "https://www.instagram.com/" + (user == null ? "_" : encode(user));
        return new ConversationLink(MessagingApps.INSTAGRAM, INSTAGRAM_PACKAGE, "Instagram", uri, null, user);
    }

    public static ConversationLink messenger(String username) {
        String user = blankToNull(username);
        String uri = "https://m.me/" + (user == null ? "" : encode(user));
        return new ConversationLink(MessagingApps.MESSENGER, MESSENGER_PACKAGE, "Messenger", uri, null, user);
    }

    public static ConversationLink googleMessages(String phoneNumber, String message) {
        String uri = "sms:" + ScreenStateGuards.digitsOf(phoneNumber) + "?body=" + encode(message);
        return new ConversationLink(MessagingApps.GOOGLE_MESSAGES, GOOGLE_MESSAGES_PACKAGE, "Google Messages", uri,
                phoneNumber, null);
    }

    /**
     * True when the snapshot shows the phone number (last digits) or the target text outside
     * text fields. A link without any target matches any screen of the app.
     */
    public boolean matchesTarget(ScreenSnapshot snapshot) {
        if (snapshot == null) {
            return false;
        }
        ScreenSnapshot shown = snapshot.withoutEditable();
        boolean hasPhone = phoneNumber != null && !ScreenStateGuards.digitsOf(phoneNumber).isEmpty();
        if (!hasPhone && targetText == null) {
            return true;
        }
        return (hasPhone && ScreenStateGuards.containsPhone(shown, phoneNumber))
                || (targetText != null && ScreenStateGuards.containsText(shown, targetText));
    }

    /** Form encoding with spaces as %20, which wa.me and sms: both read. */
    static String encode(String value) {
        try {
            return URLEncoder.encode(value == null ? "" : value, "UTF-8").replace("+", "%20");
        } catch (UnsupportedEncodingException e) {
            throw new IllegalStateException("UTF-8 not supported", e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }

    public String getApp() {
        return app;
    }

    public String getPackageName() {
        return packageName;
    }

    public String getAppName() {
        return appName;
    }

    public String getUri() {
        return uri;
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }

    public String getTargetText() {
        return targetText;
    }
}
