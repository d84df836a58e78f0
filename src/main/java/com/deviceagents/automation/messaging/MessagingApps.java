package com.deviceagents.automation.messaging;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Canonical names for the {@code app} argument of {@code send_message}.
 */
public final class MessagingApps {

    public static final String WHATSAPP = "whatsapp";
    public static final String WHATSAPP_BUSINESS = "whatsapp_business";
    public static final String WHATSAPP_PERSONAL = "whatsapp_personal";
    public static final String INSTAGRAM = "instagram";
    public static final String MESSENGER = "messenger";
    public static final String GOOGLE_MESSAGES = "google_messages";

    public static final List<String> CANONICAL = Arrays.asList(
            WHATSAPP, WHATSAPP_BUSINESS, WHATSAPP_PERSONAL, INSTAGRAM, MESSENGER, GOOGLE_MESSAGES);

    private static final List<String> BUSINESS_HINTS = Arrays.asList("business", "bussiness", "buisness", "biz", "w4b");
    private static final List<String> PERSONAL_HINTS = Arrays.asList("personal", "normal", "regular", "main");

    private MessagingApps() {
    }

    /**
     * Maps aliases and common misspellings ("WhatsApp Business", "what'sapp", "insta", "sms")
     * to a canonical name.
     *
     * @return null when the value names no supported app
     */
    public static String normalize(String rawApp) {
        if (rawApp == null) {
            return null;
        }
        String compact = rawApp.trim().toLowerCase(Locale.ROOT).replace("'", "").replaceAll("[^a-z0-9]+", "");
        if (compact.isEmpty()) {
            return null;
        }
        if (compact.contains("whatsapp") || compact.contains("whatsap") || compact.contains("watsapp")) {
            if (containsAny(compact, BUSINESS_HINTS)) {
                return WHATSAPP_BUSINESS;
            }
            if (containsAny(compact, PERSONAL_HINTS)) {
                return WHATSAPP_PERSONAL;
            }
            return WHATSAPP;
        }
        switch (compact) {
            case "instagram":
            case "insta":
                return INSTAGRAM;
            case "messenger":
            case "fbmessenger":
            case "facebookmessenger":
            case "facebookchat":
            case "fbchat":
                return MESSENGER;
            case "googlemessages":
            case "googlemessage":
            case "messages":
            case "androidmessages":
            case "sms":
            case "text":
                return GOOGLE_MESSAGES;
            default:
                return null;
        }
    }

    public static boolean isWhatsApp(String canonical) {
        return WHATSAPP.equals(canonical) || WHATSAPP_BUSINESS.equals(canonical) || WHATSAPP_PERSONAL.equals(canonical);
    }

    private static boolean containsAny(String value, List<String> hints) {
        for (String hint : hints) {
            if (value.contains(hint)) {
                return true;
            }
        }
        return false;
    }
}
