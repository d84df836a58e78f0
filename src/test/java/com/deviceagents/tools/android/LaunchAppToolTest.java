package com.deviceagents.tools.android;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.device.GlobalAction;
import com.deviceagents.testing.FakeDevice;
import com.deviceagents.testing.FakeNode;
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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LaunchAppToolTest {

    private static final String SPOTIFY = "com.spotify.music";

    @Mock
    private ToolContext context;

    private FakeDevice device;
    private LaunchAppTool tool;

    @BeforeEach
    public void setUp() {
        MockitoAnnotations.openMocks(this);
        device = new FakeDevice();
        device.show(window("com.android.launcher3", text("Home")));
        device.install(SPOTIFY, "Spotify");
        device.install("com.android.chrome", "Chrome");
        tool = new LaunchAppTool(device.session());
    }

    private JSONObject call(String json) {
        return JSONObject.parseObject(tool.execute(JSONObject.parseObject(json), context));
    }

    private FakeNode spotifyHome() {
        return window(SPOTIFY, text("Good evening"));
    }

    @Test
    public void testOpenVerifiesForeground() {
        device.onLaunch(SPOTIFY, spotifyHome());

        JSONObject result = call("{\"app_name\":\"spotify\"}");

        assertTrue(result.getBooleanValue("success"));
        assertEquals("open", result.getString("action"));
        assertEquals(SPOTIFY, result.getString("package_name"));
        assertEquals("Spotify", result.getString("app_name"));
        assertTrue(result.getBooleanValue("screen_state_verified"));
        JSONArray checkpoints = result.getJSONArray("screen_checkpoints");
        assertEquals(2, checkpoints.size());
        assertEquals("before_open", checkpoints.getJSONObject(0).getString("step"));
        assertFalse(checkpoints.getJSONObject(0).getBooleanValue("matched_expected_package"));
        assertEquals("after_open", checkpoints.getJSONObject(1).getString("step"));
        assertTrue(checkpoints.getJSONObject(1).getBooleanValue("matched_expected_package"));
    }

    @Test
    public void testAlreadyOpenSkipsLaunch() {
        device.show(spotifyHome());

        JSONObject result = call("{\"package_name\":\"com.spotify.music\"}");

        assertTrue(result.getBooleanValue("success"));
        assertTrue(result.getBooleanValue("already_open"));
        assertTrue(device.launched().isEmpty());
    }

    @Test
    public void testLaunchFailure() {
        device.makeUnlaunchable(SPOTIFY);

        JSONObject result = call("{\"app_name\":\"Spotify\"}");

        assertFalse(result.getBooleanValue("success"));
        assertEquals("App 'com.spotify.music' cannot be launched.", result.getString("error"));
    }

    @Test
    public void testForegroundNeverReached() {
        JSONObject result = call("{\"app_name\":\"Spotify\"}");

        assertFalse(result.getBooleanValue("success"));
        assertEquals("Safety check failed: app launch started but foreground package did not match com.spotify.music.",
                result.getString("error"));
        assertEquals(Collections.singletonList(SPOTIFY), device.launched());
        JSONArray checkpoints = result.getJSONArray("screen_checkpoints");
        assertEquals(2, checkpoints.size());
        assertEquals("before_open", checkpoints.getJSONObject(0).getString("step"));
        assertEquals("foreground_timeout", checkpoints.getJSONObject(1).getString("step"));
        assertEquals("com.android.launcher3", checkpoints.getJSONObject(1).getString("actual_package"));
    }

    @Test
    public void testOpenWithoutAccessibilitySkipsVerification() {
        device.disconnect();

        JSONObject result = call("{\"app_name\":\"Spotify\"}");

        assertTrue(result.getBooleanValue("success"));
        assertFalse(result.getBooleanValue("screen_state_verified"));
        assertNull(result.getJSONArray("screen_checkpoints"));
        assertTrue(result.getString("note").startsWith("Accessibility is disabled"));
    }

    @Test
    public void testUnknownAppReportsNoMatch() {
        JSONObject result = call("{\"package_name\":\"org.unknown.app\"}");

        assertFalse(result.getBooleanValue("success"));
        assertTrue(result.getString("error").startsWith("No launchable app matched 'org.unknown.app'."));
        assertTrue(device.launched().isEmpty());
    }

    @Test
    public void testArgumentErrors() {
        assertEquals("Invalid action 'restart'. Use open or close.",
                call("{\"action\":\"restart\",\"app_name\":\"Spotify\"}").getString("error"));
        assertEquals("Provide package_name or app_name.", call("{\"action\":\"open\"}").getString("error"));
    }

    @Test
    public void testCloseBringsAppForwardThenSwipesItAway() {
        device.onLaunch(SPOTIFY, spotifyHome());

        JSONObject result = call("{\"action\":\"close\",\"app_name\":\"Spotify\"}");

        assertTrue(result.getBooleanValue("success"));
        assertEquals("close", result.getString("action"));
        assertEquals(Collections.singletonList(SPOTIFY), device.launched());
        assertEquals(Arrays.asList(GlobalAction.RECENTS, GlobalAction.HOME), device.globalActions());
        assertEquals(Collections.singletonList("swipe UP 0.7 260"), device.gestures());
    }

    @Test
    public void testCloseRequiresAccessibility() {
        device.disconnect();

        JSONObject result = call("{\"action\":\"close\",\"app_name\":\"Spotify\"}");

        assertFalse(result.getBooleanValue("success"));
        assertTrue(device.launched().isEmpty());
    }
}
