package com.deviceagents.tools.android;

import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.testing.FakeDevice;
import com.deviceagents.tools.ToolContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static com.deviceagents.testing.FakeNode.button;
import static com.deviceagents.testing.FakeNode.window;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.verify;

public class WorkflowAutomationToolTest {

    @Mock
    private ToolContext context;

    private FakeDevice device;
    private WorkflowAutomationTool tool;

    @BeforeEach
    public void setUp() {
        MockitoAnnotations.openMocks(this);
        device = new FakeDevice();
        device.show(window("com.example.todo", button("Add task")));
        tool = new WorkflowAutomationTool(device.session());
    }

    @Test
    public void testRunsStepsAndReportsProgress() {
        JSONObject params = JSONObject.parseObject("{\"workflow_name\":\"add\",\"steps\":["
                + "{\"action\":\"tap\",\"parameters\":{\"text\":\"Add task\"}},"
                + "{\"action\":\"wait\",\"parameters\":{\"duration_ms\":200}}]}");

        JSONObject report = JSONObject.parseObject(tool.execute(params, context));

        assertTrue(report.getBooleanValue("success"));
        assertEquals("add", report.getString("workflow_name"));
        assertEquals(2, report.getIntValue("total_steps"));
        assertEquals(2, report.getIntValue("completed_steps"));
        verify(context).sendText(contains("Running workflow 'add' (2 steps)"));
    }

    @Test
    public void testFailedStepFailsWorkflow() {
        JSONObject params = JSONObject.parseObject("{\"workflow_name\":\"bad\",\"steps\":["
                + "{\"action\":\"dance\"}]}");

        JSONObject report = JSONObject.parseObject(tool.execute(params, context));

        assertFalse(report.getBooleanValue("success"));
        assertEquals("Unknown action: dance", report.getJSONArray("results").getJSONObject(0).getString("error"));
    }

    @Test
    public void testArgumentErrors() {
        assertEquals("workflow_name is required",
                JSONObject.parseObject(tool.execute(JSONObject.parseObject("{\"steps\":[]}"), context)).getString("error"));
        assertEquals("steps array is required",
                JSONObject.parseObject(tool.execute(JSONObject.parseObject("{\"workflow_name\":\"x\"}"), context))
                        .getString("error"));
    }

    @Test
    public void testAccessibilityDisabled() {
        device.disconnect();

        JSONObject result = JSONObject.parseObject(tool.execute(
                JSONObject.parseObject("{\"workflow_name\":\"x\",\"steps\":[]}"), context));

        assertFalse(result.getBooleanValue("success"));
        assertTrue(result.getString("error").startsWith("workflow_automation requires accessibility service."));
    }
}
