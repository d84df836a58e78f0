package com.deviceagents.tools.android;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.testing.FakeDevice;
import com.deviceagents.tools.ToolContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static com.deviceagents.testing.FakeNode.button;
import static com.deviceagents.testing.FakeNode.text;
import static com.deviceagents.testing.FakeNode.window;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ScreenStateToolTest {

    @Mock
    private ToolContext context;

    private FakeDevice device;
    private ScreenStateTool tool;

    @BeforeEach
    public void setUp() {
        MockitoAnnotations.openMocks(this);
        device = new FakeDevice();
        tool = new ScreenStateTool(device.session());
    }

    @Test
    public void testReturnsForegroundPackageAndNodes() {
        device.show(window("com.example.notes", text("Groceries"), button("Save")));

        JSONObject result = JSONObject.parseObject(tool.execute(new JSONObject(), context));

        assertTrue(result.getBooleanValue("success"));
        assertEquals("com.example.notes", result.getString("foreground_package"));
        JSONArray nodes = result.getJSONArray("nodes");
        assertEquals(2, nodes.size());
        assertEquals("Groceries", nodes.getJSONObject(0).getString("text"));
    }

    @Test
    public void testMaxNodesLimitsOutput() {
        device.show(window("com.example.notes", text("a"), text("b"), text("c"), text("d"), text("e"),
                text("f"), text("g"), text("h"), text("i"), text("j"), text("k"), text("l")));

        JSONObject params = new JSONObject();
        params.put("max_nodes", 3);
        JSONObject result = JSONObject.parseObject(tool.execute(params, context));

        // max_nodes never goes below five
        assertEquals(5, result.getJSONArray("nodes").size());
    }

    @Test
    public void testNoActiveWindow() {
        JSONObject result = JSONObject.parseObject(tool.execute(new JSONObject(), context));

        assertFalse(result.getBooleanValue("success"));
        assertEquals("No active window is available from accessibility. Unlock your phone and open an app first.",
                result.getString("error"));
    }

    @Test
    public void testAccessibilityDisabled() {
        device.show(window("com.example.notes", text("Groceries")));
        device.disconnect();

        JSONObject result = JSONObject.parseObject(tool.execute(null, context));

        assertFalse(result.getBooleanValue("success"));
        assertTrue(result.getString("error").startsWith("Accessibility automation is disabled."));
    }
}
