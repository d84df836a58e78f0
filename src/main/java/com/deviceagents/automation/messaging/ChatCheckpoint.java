package com.deviceagents.automation.messaging;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.screen.ScreenNode;
import com.deviceagents.screen.ScreenSnapshot;
import com.deviceagents.screen.ScreenStateGuards;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 消息发送流程中某一步的屏幕观察结果。
 * <p>
 * 除前台包名外，还记录联系人、消息正文、发送按钮是否“看起来可见”。这些判断都是启发式的：
 * 联系人姓名中任意一个不少于 3 个字符的词出现在可见文本里即视为可见，存在误判的可能。
 * 输入框中的文本不计入联系人判断，否则搜索框里刚输入的姓名会被当成联系人已出现。
 * </p>
 */
public final class ChatCheckpoint {

    static final int MIN_NAME_TOKEN_LENGTH = 3;
    static final int MESSAGE_PREFIX_LENGTH = 18;
    static final int PHONE_SUFFIX_DIGITS = 6;

    private final String step;
    private final String expectedPackage;
    private final String foregroundPackage;
    private final int nodeCount;
    private final List<String> highlights;
    private final boolean contactLikelyVisible;
    private final boolean messageLikelyVisible;
    private final boolean sendButtonLikelyVisible;

    ChatCheckpoint(String step, String expectedPackage, String foregroundPackage, int nodeCount,
                   List<String> highlights, boolean contactLikelyVisible, boolean messageLikelyVisible,
                   boolean sendButtonLikelyVisible) {
        this.step = step;
        this.expectedPackage = expectedPackage == null ? "" : expectedPackage;
        this.foregroundPackage = foregroundPackage == null ? "" : foregroundPackage;
        this.nodeCount = nodeCount;
        this.highlights = Collections.unmodifiableList(new ArrayList<>(highlights));
        this.contactLikelyVisible = contactLikelyVisible;
        this.messageLikelyVisible = messageLikelyVisible;
        this.sendButtonLikelyVisible = sendButtonLikelyVisible;
    }

    /**
     * @param snapshot    may be null, giving an empty checkpoint with every flag false
     * @param contactName blank to skip the contact check
     * @param message     null or blank to skip the message check
     */
    public static ChatCheckpoint of(String step, String expectedPackage, ScreenSnapshot snapshot,
                                    String contactName, String phoneNumber, String message) {
        if (snapshot == null) {
            return new ChatCheckpoint(step, expectedPackage, "", 0, Collections.<String>emptyList(),
                    false, false, false);
        }
        List<String> highlights = ScreenStateGuards.highlights(snapshot);
        return new ChatCheckpoint(step, expectedPackage, snapshot.getPackageName(), snapshot.getNodes().size(),
                highlights,
                contactLikelyVisible(ScreenStateGuards.readOnlyHighlights(snapshot), contactName, phoneNumber),
                messageLikelyVisible(highlights, message),
                sendButtonLikelyVisible(snapshot));
    }

    static boolean contactLikelyVisible(List<String> highlights, String contactName, String phoneNumber) {
        List<String> tokens = new ArrayList<>();
        if (contactName != null) {
            for (String token : contactName.toLowerCase(Locale.ROOT).trim().split("\\s+")) {
                if (token.length() >= MIN_NAME_TOKEN_LENGTH) {
                    tokens.add(token);
                }
            }
        }
        String digits = ScreenStateGuards.digitsOf(phoneNumber);
        String suffix = digits.length() >= PHONE_SUFFIX_DIGITS
                ? digits.substring(digits.length() - PHONE_SUFFIX_DIGITS) : "";
        for (String item : highlights) {
            String lower = item.toLowerCase(Locale.ROOT);
            for (String token : tokens) {
                if (lower.contains(token)) {
                    return true;
                }
            }
            if (!suffix.isEmpty() && ScreenStateGuards.digitsOf(item).contains(suffix)) {
                return true;
            }
        }
        return false;
    }

    static boolean messageLikelyVisible(List<String> highlights, String message) {
        if (message == null || message.trim().isEmpty()) {
            return false;
        }
        String full = message.trim().toLowerCase(Locale.ROOT);
        String prefix = full.substring(0, Math.min(MESSAGE_PREFIX_LENGTH, full.length()));
        for (String item : highlights) {
            String lower = item.toLowerCase(Locale.ROOT);
            if (lower.contains(full) || lower.contains(prefix)) {
                return true;
            }
        }
        return false;
    }

    static boolean sendButtonLikelyVisible(ScreenSnapshot snapshot) {
        for (ScreenNode node : snapshot.getNodes()) {
            String label = (node.getText() + " " + node.getContentDescription()).toLowerCase(Locale.ROOT);
            if (node.isClickable() && label.contains("send")) {
                return true;
            }
        }
        return false;
    }

    public String getStep() {
        return step;
    }

    public String getExpectedPackage() {
        return expectedPackage;
    }

    public String getForegroundPackage() {
        return foregroundPackage;
    }

    public boolean isMatchedExpectedPackage() {
        return !foregroundPackage.isEmpty() && foregroundPackage.equals(expectedPackage);
    }

    public int getNodeCount() {
        return nodeCount;
    }

    public List<String> getHighlights() {
        return highlights;
    }

    public boolean isContactLikelyVisible() {
        return contactLikelyVisible;
    }

    public boolean isMessageLikelyVisible() {
        return messageLikelyVisible;
    }

    public boolean isSendButtonLikelyVisible() {
        return sendButtonLikelyVisible;
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("step", step);
        json.put("expected_package", expectedPackage);
        json.put("foreground_package", foregroundPackage);
        json.put("matched_expected_package", isMatchedExpectedPackage());
        json.put("node_count", nodeCount);
        json.put("contact_likely_visible", contactLikelyVisible);
        json.put("message_likely_visible", messageLikelyVisible);
        json.put("send_button_likely_visible", sendButtonLikelyVisible);
        json.put("highlights", new JSONArray(highlights));
        return json;
    }
}
