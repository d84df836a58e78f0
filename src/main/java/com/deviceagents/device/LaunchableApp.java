package com.deviceagents.device;

import com.alibaba.fastjson2.JSONObject;

public final class LaunchableApp {

    private final String packageName;
    private final String appName;

    public LaunchableApp(String packageName, String appName) {
        this.packageName = packageName;
        this.appName = appName == null || appName.trim().isEmpty() ? packageName : appName.trim();
    }

    public String getPackageName() {
        return packageName;
    }

    public String getAppName() {
        return appName;
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("app_name", appName);
        json.put("package_name", packageName);
        return json;
    }

    @Override
    public String toString() {
        return appName + " (" + packageName + ")";
    }
}
