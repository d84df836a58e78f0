package com.deviceagents.tools.android;

import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.testing.FakeDevice;
import com.deviceagents.tools.ToolContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.Collections;

import static com.deviceagents.testing.FakeNode.text;
import static com.deviceagents.testing.FakeNode.window;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ScrollScreenToolTest {

    @Mock
    private ToolContext context;

    private FakeDevice device;
    private ScrollScreenTool tool;

    @BeforeEach
    public void setUp() {
        MockitoAnnotations.openMocks(this);
        device = new FakeDevice();
        device.show(window("com.example.feed", text("Post 1")));
        tool = new ScrollScreenTool(device.session());
    }

    @Test
    public void testScrollDownWithDefaults() {
        JSONObject result = JSONObject.parseObject(
                tool.execute(JSONObject.parseObject("{\"direction\":\"DOWN\"}"), context));

        assertTrue(result.getBooleanValue("success"));
        assertEquals("down", result.getString("direction"));
        assertEquals(320L, result.getLongValue("duration_ms"));
        assertEquals(Collections.singletonList("swipe DOWN 0.55 320"), device.gestures());
    }

    @Test
    public void testClampsRatioAndDuration() {
        JSONObject result = JSONObject.parseObject(tool.execute(
                JSONObject.parseObject("{\"direction\":\"left\",\"distance_ratio\":2.0,\"duration_ms\":10}"), context));

        assertTrue(result.getBooleanValue("success"));
        assertEquals(Collections.singletonList("swipe LEFT 0.9 120"), device.gestures());
    }

    @Test
    public void testInvalidDirection() {
        JSONObject result = JSONObject.parseObject(
                tool.execute(JSONObject.parseObject("{\"direction\":\"sideways\"}"), context));

        assertFalse(result.getBooleanValue("success"));
        assertEquals("Invalid direction. Use up, down, left, or right.", result.getString("error"));
        assertTrue(device.gestures().isEmpty());
    }

    @Test
    public void testGestureFailure() {
        device.failGestures();

        JSONObject result = JSONObject.parseObject(
                tool.execute(JSONObject.parseObject("{\"direction\":\"up\"}"), context));

        assertEquals("Scroll gesture failed.", result.getString("error"));
    }
}
