package com.deviceagents.tools.android;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.automation.AppResolver;
import com.deviceagents.device.DeviceSession;
import com.deviceagents.device.LaunchableApp;
import com.deviceagents.tools.ToolContext;
import com.deviceagents.tools.ToolResults;
import com.deviceagents.tools.ToolSchema;

import java.util.List;

public class ListAppsTool extends AndroidBaseTool {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 300;

    public ListAppsTool(DeviceSession session) {
        super(session);
    }

    @Override
    public String getName() {
        return "list_apps";
    }

    @Override
    public String getDescription() {
        return "List launchable apps, optionally ranked by a fuzzy query against app name and package. Parameters: query (optional), limit (1-300, default 50).";
    }

    @Override
    public JSONObject getInputSchema() {
        return ToolSchema.object()
                .string("query", "Optional app name or package fragment to rank by.")
                .integer("limit", "Maximum number of apps to return, 1-300 (default: 50).")
                .build();
    }

    @Override
    protected String run(JSONObject params, ToolContext context) {
        String query = trimmed(params, "query");
        int limit = intArg(params, "limit", DEFAULT_LIMIT, 1, MAX_LIMIT);
        List<LaunchableApp> all = session.apps().listLaunchableApps();
        List<LaunchableApp> selected = AppResolver.search(all, query, limit);

        JSONArray apps = new JSONArray();
        for (LaunchableApp app : selected) {
            apps.add(app.toJson());
        }
        JSONObject payload = new JSONObject();
        payload.put("query", query);
        payload.put("count", selected.size());
        payload.put("total_launchable", all.size());
        payload.put("apps", apps);
        return ToolResults.success(payload);
    }
}
