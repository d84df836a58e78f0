package com.deviceagents.automation.messaging;

public final class MessageRequest {

    private final String contactName;
    private final String message;
    private final String phoneNumber;
    private final WhatsAppVariant variant;
    private final boolean strictContactMatch;

    /**
     * @param phoneNumber optional, used as a fallback contact match
     * @param variant     null to pick from the foreground app or installed variants
     */
    public MessageRequest(String contactName, String message, String phoneNumber, WhatsAppVariant variant,
                          boolean strictContactMatch) {
        this.contactName = contactName == null ? "" : contactName.trim();
        this.message = message == null ? "" : message.trim();
        this.phoneNumber = phoneNumber == null || phoneNumber.trim().isEmpty() ? null : phoneNumber.trim();
        this.variant = variant;
        this.strictContactMatch = strictContactMatch;
    }

    public String getContactName() {
        return contactName;
    }

    public String getMessage() {
        return message;
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }

    public WhatsAppVariant getVariant() {
        return variant;
    }

    public boolean isStrictContactMatch() {
        return strictContactMatch;
    }
}
