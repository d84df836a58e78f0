package com.deviceagents.automation.messaging;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits free-form commands such as "send message to Fahad Shakoor on whatsapp business hello"
 * into a contact and a message.
 */
public final class SendCommandParser {

    private static final String WHATSAPP = "what'?s?app(?:\\s+business|\\s+bussiness|\\s+buisness|\\s+w4b)?";
    private static final Pattern SEND_TO = Pattern.compile(
            "send\\s+(?:a\\s+)?message\\s+to\\s+(.+?)\\s+on\\s+" + WHATSAPP + "\\s+(.+)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern TO = Pattern.compile(
            "to\\s+(.+?)\\s+(?:on\\s+)?" + WHATSAPP + "\\s+(.+)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private SendCommandParser() {
    }

    /**
     * @return {contact, message}, or null when the command does not name both
     */
    public static String[] parse(String command) {
        if (command == null || command.trim().isEmpty()) {
            return null;
        }
        String text = command.trim();
        Matcher matcher = SEND_TO.matcher(text);
        if (!matcher.find()) {
            matcher = TO.matcher(text);
            if (!matcher.find()) {
                return null;
            }
        }
        String contact = matcher.group(1).trim().replaceAll("^[,.:;]+|[,.:;]+$", "").trim();
        String message = matcher.group(2).trim();
        if (contact.isEmpty() || message.isEmpty()) {
            return null;
        }
        return new String[]{contact, message};
    }
}
