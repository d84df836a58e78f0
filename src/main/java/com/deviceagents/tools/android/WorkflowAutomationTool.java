package com.deviceagents.tools.android;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.automation.UiSearchAutomation;
import com.deviceagents.automation.workflow.WorkflowReport;
import com.deviceagents.automation.workflow.WorkflowRunner;
import com.deviceagents.device.DeviceSession;
import com.deviceagents.tools.ToolContext;
import com.deviceagents.tools.ToolResults;
import com.deviceagents.tools.ToolSchema;

public class WorkflowAutomationTool extends AndroidBaseTool {

    private final WorkflowRunner runner;

    public WorkflowAutomationTool(DeviceSession session) {
        super(session);
        this.runner = new WorkflowRunner(session, queries, guards, new UiSearchAutomation(session, queries, guards));
    }

    @Override
    public String getName() {
        return "workflow_automation";
    }

    @Override
    public String getDescription() {
        return "Run a multi-step UI workflow. Parameters: workflow_name (required), steps (required array of {action: launch_app|search|tap|wait|swipe|type, parameters, verification}), continue_on_error (default false), timeout_ms (default 30000).";
    }

    @Override
    public JSONObject getInputSchema() {
        return ToolSchema.object()
                .string("workflow_name", "Name of the workflow to execute.")
                .objectArray("steps", "Array of workflow steps: {action, parameters, verification}.")
                .bool("continue_on_error", "Continue workflow even if a step fails (default: false).")
                .integer("timeout_ms", "Overall workflow timeout in milliseconds (default: 30000).")
                .required("workflow_name", "steps")
                .build();
    }

    @Override
    protected String run(JSONObject params, ToolContext context) {
        String disabled = requireAccessibility(
                "workflow_automation requires accessibility service. Start the UiAutomator2 session for the device.");
        if (disabled != null) {
            return disabled;
        }
        String workflowName = params.getString("workflow_name");
        if (workflowName == null) {
            return ToolResults.error("workflow_name is required");
        }
        JSONArray steps = params.getJSONArray("steps");
        if (steps == null) {
            return ToolResults.error("steps array is required");
        }
        boolean continueOnError = boolArg(params, "continue_on_error", false);
        Long rawTimeout = params.getLong("timeout_ms");
        long timeoutMs = rawTimeout == null ? WorkflowRunner.DEFAULT_TIMEOUT_MS : rawTimeout;

        progress(context, "Running workflow '" + workflowName + "' (" + steps.size() + " steps)");
        WorkflowReport report = runner.run(workflowName, steps, continueOnError, timeoutMs);
        return report.toJson().toJSONString();
    }
}
