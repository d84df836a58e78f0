package com.deviceagents.tools.messaging;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.testing.FakeDevice;
import com.deviceagents.testing.FakeNode;
import com.deviceagents.tools.ToolContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static com.deviceagents.testing.FakeNode.editText;
import static com.deviceagents.testing.FakeNode.text;
import static com.deviceagents.testing.FakeNode.window;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SendMessageToolTest {

    @Mock
    private ToolContext context;

    private FakeDevice device;
    private SendMessageTool tool;

    @BeforeEach
    public void setUp() {
        MockitoAnnotations.openMocks(this);
        device = new FakeDevice();
        device.show(window("com.android.launcher3", text("Home")));
        tool = new SendMessageTool(device.session());
    }

    private JSONObject call(String json) {
        return JSONObject.parseObject(tool.execute(JSONObject.parseObject(json), context));
    }

    @Test
    public void testArgumentErrors() {
        assertEquals("App is required", call("{\"message\":\"hi\"}").getString("error"));
        assertTrue(call("{\"app\":\"telegram\",\"message\":\"hi\"}").getString("error")
                .startsWith("Unsupported app 'telegram'. Use: whatsapp"));
        assertEquals("Message is required", call("{\"app\":\"whatsapp\"}").getString("error"));
        assertEquals("Message cannot be empty", call("{\"app\":\"whatsapp\",\"message\":\"  \"}").getString("error"));
        assertEquals("Phone number is required for WhatsApp (or provide contact_name)",
                call("{\"app\":\"whatsapp\",\"message\":\"hi\"}").getString("error"));
        assertEquals("Phone number is required for Google Messages",
                call("{\"app\":\"sms\",\"message\":\"hi\",\"username\":\"alice\"}").getString("error"));
        assertEquals("Unsupported whatsapp_type 'work'. Use personal or business.",
                call("{\"app\":\"whatsapp\",\"message\":\"hi\",\"contact_name\":\"Alice\",\"whatsapp_type\":\"work\"}")
                        .getString("error"));
        assertTrue(device.launched().isEmpty());
    }

    @Test
    public void testInstagramOpensProfileDraft() {
        device.install("com.instagram.android", "Instagram");
        device.onLaunch("com.instagram.android", window("com.instagram.android", text("alice.codes"), text("Message")));

        JSONObject result = call("{\"app\":\"insta\",\"message\":\"hi there\",\"username\":\"alice.codes\"}");

        assertTrue(result.getBooleanValue("success"), result.toJSONString());
        assertEquals("opened_instagram_profile", result.getString("action"));
        assertEquals("alice.codes", result.getString("username"));
        assertEquals("Message needs to be sent manually in the app", result.getString("note"));
        assertTrue(result.getBooleanValue("screen_state_verified"));
        JSONArray checkpoints = result.getJSONArray("screen_checkpoints");
        assertEquals(3, checkpoints.size());
        assertEquals("before_open", checkpoints.getJSONObject(0).getString("step"));
        assertEquals("after_open", checkpoints.getJSONObject(1).getString("step"));
        assertEquals("target_verification", checkpoints.getJSONObject(2).getString("step"));
        assertEquals("com.instagram.android https://www.instagram.com/alice.codes", device.deepLinks().get(0));
        assertTrue(device.interactions().isEmpty());
    }

    @Test
    public void testMessengerNotInstalled() {
        JSONObject result = call("{\"app\":\"fb messenger\",\"message\":\"hi\",\"username\":\"alice\"}");

        assertEquals("Facebook Messenger is not installed", result.getString("error"));
        assertTrue(device.deepLinks().isEmpty());
    }

    @Test
    public void testWhatsAppByPhoneOpensDraftWithNextActions() {
        device.install("com.whatsapp", "WhatsApp");
        FakeNode compose = editText("com.whatsapp:id/entry");
        compose.setText("See you at 5");
        device.onLaunch("com.whatsapp", window("com.whatsapp", text("+1 555-123-4567"), compose));

        JSONObject result = call("{\"app\":\"whatsapp\",\"message\":\"See you at 5\",\"phone_number\":\"+1 555-123-4567\"}");

        assertTrue(result.getBooleanValue("success"), result.toJSONString());
        assertEquals("opened_whatsapp_draft", result.getString("action"));
        assertEquals("WhatsApp", result.getString("used_app"));
        assertEquals("personal", result.getString("whatsapp_type"));
        assertEquals("Opened WhatsApp with pre-filled message to +1 555-123-4567", result.getString("status"));
        JSONArray nextActions = result.getJSONArray("next_actions");
        assertEquals("SEND", nextActions.getString(0));
        assertEquals("CANCEL", nextActions.getString(1));
        assertEquals("com.whatsapp https://wa.me/15551234567?text=See%20you%20at%205", device.deepLinks().get(0));
        assertTrue(device.launched().isEmpty());
    }

    @Test
    public void testDraftAbortsWhenRecipientNotShown() {
        device.install("com.google.android.apps.messaging", "Messages");
        FakeNode compose = editText("compose_message_text");
        compose.setText("call 555-123-4567 later");
        device.onLaunch("com.google.android.apps.messaging",
                window("com.google.android.apps.messaging", text("New conversation"), compose));

        JSONObject result = call("{\"app\":\"google messages\",\"message\":\"call 555-123-4567 later\","
                + "\"phone_number\":\"555-123-4567\"}");

        assertFalse(result.getBooleanValue("success"));
        assertTrue(result.getString("error").startsWith("Safety check failed: could not verify the requested Google Messages target"));
        JSONArray checkpoints = result.getJSONArray("screen_checkpoints");
        assertEquals(3, checkpoints.size());
        assertEquals("target_verification", checkpoints.getJSONObject(2).getString("step"));
        assertTrue(checkpoints.getJSONObject(2).getBooleanValue("matched_expected_package"));
    }

    @Test
    public void testDraftAbortsWhenAppStaysInBackground() {
        device.install("com.instagram.android", "Instagram");

        JSONObject result = call("{\"app\":\"instagram\",\"message\":\"hi\",\"username\":\"alice\"}");

        assertEquals("Safety check failed: expected Instagram in foreground, but another app stayed active.",
                result.getString("error"));
        JSONArray checkpoints = result.getJSONArray("screen_checkpoints");
        assertEquals(2, checkpoints.size());
        assertEquals("com.android.launcher3", checkpoints.getJSONObject(1).getString("actual_package"));
    }

    @Test
    public void testStrictDraftNeedsAccessibility() {
        device.install("com.instagram.android", "Instagram");
        device.disconnect();

        JSONObject result = call("{\"app\":\"instagram\",\"message\":\"hi\",\"username\":\"alice\"}");

        assertTrue(result.getString("error").startsWith("strict_screen_state=true requires accessibility"));
        assertTrue(device.deepLinks().isEmpty());
    }

    @Test
    public void testNonStrictDraftSkipsScreenChecks() {
        device.install("com.facebook.orca", "Messenger");

        JSONObject result = call("{\"app\":\"messenger\",\"message\":\"hi\",\"username\":\"alice\","
                + "\"strict_screen_state\":false}");

        assertTrue(result.getBooleanValue("success"), result.toJSONString());
        assertEquals("opened_messenger_chat", result.getString("action"));
        assertFalse(result.getBooleanValue("screen_state_verified"));
        assertFalse(result.containsKey("screen_checkpoints"));
        assertEquals("com.facebook.orca https://m.me/alice", device.deepLinks().get(0));
    }

    @Test
    public void testWhatsAppNotInstalled() {
        JSONObject result = call("{\"app\":\"whatsapp\",\"message\":\"hi\",\"contact_name\":\"Alice\"}");

        assertFalse(result.getBooleanValue("success"));
        assertEquals("app_not_installed", result.getString("failure_reason"));
        assertEquals("Alice", result.getString("contact_name"));
        assertTrue(device.launched().isEmpty());
    }

    @Test
    public void testBusinessAliasTargetsBusinessPackage() {
        device.install("com.whatsapp.w4b", "WhatsApp Business");
        device.makeUnlaunchable("com.whatsapp.w4b");

        JSONObject result = call("{\"app\":\"whatsapp_business\",\"message\":\"hi\",\"contact_name\":\"Alice\"}");

        assertFalse(result.getBooleanValue("success"));
        assertEquals("launch_failed", result.getString("failure_reason"));
        assertEquals("business", result.getString("whatsapp_type"));
        assertEquals("com.whatsapp.w4b", result.getString("package_name"));
    }

    @Test
    public void testAccessibilityDisabled() {
        device.disconnect();

        JSONObject result = call("{\"app\":\"whatsapp\",\"message\":\"hi\",\"contact_name\":\"Alice\"}");

        assertEquals("accessibility_disabled", result.getString("failure_reason"));
    }
}
