package com.deviceagents.automation.workflow;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class WorkflowReport {

    private final String workflowName;
    private final boolean success;
    private final int totalSteps;
    private final List<JSONObject> results;
    private final long durationMs;
    private final boolean continueOnError;

    public WorkflowReport(String workflowName, boolean success, int totalSteps, List<JSONObject> results,
                          long durationMs, boolean continueOnError) {
        this.workflowName = workflowName;
        this.success = success;
        this.totalSteps = totalSteps;
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
        this.durationMs = durationMs;
        this.continueOnError = continueOnError;
    }

    public boolean isSuccess() {
        return success;
    }

    public int getTotalSteps() {
        return totalSteps;
    }

    /** One entry per attempted step, in order. */
    public List<JSONObject> getResults() {
        return results;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("workflow_name", workflowName);
        json.put("success", success);
        json.put("total_steps", totalSteps);
        json.put("completed_steps", results.size());
        json.put("duration_ms", durationMs);
        json.put("continue_on_error", continueOnError);
        json.put("results", new JSONArray(results));
        return json;
    }
}
