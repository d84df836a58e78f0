package com.deviceagents.tools.android;

import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.device.GlobalAction;
import com.deviceagents.testing.FakeDevice;
import com.deviceagents.tools.ToolContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.Arrays;
import java.util.Collections;

import static com.deviceagents.testing.FakeNode.text;
import static com.deviceagents.testing.FakeNode.window;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GlobalActionToolTest {

    @Mock
    private ToolContext context;

    private FakeDevice device;
    private GlobalActionTool tool;

    @BeforeEach
    public void setUp() {
        MockitoAnnotations.openMocks(this);
        device = new FakeDevice();
        device.show(window("com.example.maps", text("Directions")));
        tool = new GlobalActionTool(device.session());
    }

    private JSONObject call(String action) {
        JSONObject params = new JSONObject();
        if (action != null) {
            params.put("action", action);
        }
        return JSONObject.parseObject(tool.execute(params, context));
    }

    @Test
    public void testMissingActionIsReportedBeforeAccessibility() {
        device.disconnect();

        JSONObject result = call(null);

        assertFalse(result.getBooleanValue("success"));
        assertEquals("Missing required argument: action", result.getString("error"));
    }

    @Test
    public void testHome() {
        JSONObject result = call("Home");

        assertTrue(result.getBooleanValue("success"));
        assertEquals("home", result.getString("action"));
        assertEquals(Collections.singletonList(GlobalAction.HOME), device.globalActions());
    }

    @Test
    public void testInvalidAction() {
        JSONObject result = call("fly");

        assertFalse(result.getBooleanValue("success"));
        assertTrue(result.getString("error").startsWith("Invalid action 'fly'."));
        assertTrue(device.globalActions().isEmpty());
    }

    @Test
    public void testCloseCurrentAppIsBestEffort() {
        JSONObject result = call("close_current_app");

        assertTrue(result.getBooleanValue("success"));
        assertEquals("close_current_app", result.getString("action"));
        assertTrue(result.getString("note").startsWith("Best effort only."));
        assertEquals(Arrays.asList(GlobalAction.RECENTS, GlobalAction.HOME), device.globalActions());
        assertEquals(Collections.singletonList("swipe UP 0.7 260"), device.gestures());
    }

    @Test
    public void testCloseCurrentAppReportsFailedSwipe() {
        device.failGestures();

        JSONObject result = call("close_current_app");

        assertFalse(result.getBooleanValue("success"));
        assertEquals(Arrays.asList(GlobalAction.RECENTS, GlobalAction.HOME), device.globalActions());
    }
}
