package com.deviceagents.automation.messaging;

import java.util.Locale;

public enum WhatsAppVariant {
    PERSONAL("com.whatsapp", "personal", "WhatsApp"),
    BUSINESS("com.whatsapp.w4b", "business", "WhatsApp Business");

    private final String packageName;
    private final String type;
    private final String displayName;

    WhatsAppVariant(String packageName, String type, String displayName) {
        this.packageName = packageName;
        this.type = type;
        this.displayName = displayName;
    }

    public String getPackageName() {
        return packageName;
    }

    /** Wire value of {@code whatsapp_type}. */
    public String getType() {
        return type;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static WhatsAppVariant fromPackage(String packageName) {
        for (WhatsAppVariant variant : values()) {
            if (variant.packageName.equals(packageName)) {
                return variant;
            }
        }
        return null;
    }

    /**
     * Accepts loose spellings such as "Business", "bussiness", "biz", "w4b", "normal".
     *
     * @return null when blank or unrecognised
     */
    public static WhatsAppVariant fromType(String rawType) {
        if (rawType == null) {
            return null;
        }
        String normalized = rawType.trim().toLowerCase(Locale.ROOT)
                .replace("'", "")
                .replaceAll("[^a-z0-9]+", "");
        if (normalized.isEmpty()) {
            return null;
        }
        if (normalized.startsWith("personal") || normalized.equals("normal") || normalized.equals("regular")) {
            return PERSONAL;
        }
        if (normalized.startsWith("business") || normalized.startsWith("bussiness")
                || normalized.startsWith("buisness") || normalized.equals("biz") || normalized.equals("w4b")) {
            return BUSINESS;
        }
        return null;
    }
}
