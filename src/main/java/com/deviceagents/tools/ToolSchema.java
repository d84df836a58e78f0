package com.deviceagents.tools;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

/**
 * Small builder for the JSON Schema objects tools advertise.
 */
public final class ToolSchema {
    private final JSONObject properties = new JSONObject();
    private final JSONArray required = new JSONArray();

    private ToolSchema() {
    }

    public static ToolSchema object() {
        return new ToolSchema();
    }

    public ToolSchema string(String name, String description) {
        return property(name, "string", description);
    }

    public ToolSchema integer(String name, String description) {
        return property(name, "integer", description);
    }

    public ToolSchema number(String name, String description) {
        return property(name, "number", description);
    }

    public ToolSchema bool(String name, String description) {
        return property(name, "boolean", description);
    }

    public ToolSchema stringArray(String name, String description) {
        JSONObject items = new JSONObject();
        items.put("type", "string");
        JSONObject prop = new JSONObject();
        prop.put("type", "array");
        prop.put("items", items);
        prop.put("description", description);
        properties.put(name, prop);
        return this;
    }

    public ToolSchema objectArray(String name, String description) {
        JSONObject items = new JSONObject();
        items.put("type", "object");
        JSONObject prop = new JSONObject();
        prop.put("type", "array");
        prop.put("items", items);
        prop.put("description", description);
        properties.put(name, prop);
        return this;
    }

    public ToolSchema enumeration(String name, String description, String... values) {
        JSONObject prop = new JSONObject();
        prop.put("type", "string");
        prop.put("description", description);
        JSONArray options = new JSONArray();
        for (String value : values) {
            options.add(value);
        }
        prop.put("enum", options);
        properties.put(name, prop);
        return this;
    }

    public ToolSchema required(String... names) {
        for (String name : names) {
            required.add(name);
        }
        return this;
    }

    public JSONObject build() {
        JSONObject schema = new JSONObject();
        schema.put("type", "object");
        schema.put("properties", properties);
        if (!required.isEmpty()) {
            schema.put("required", required);
        }
        return schema;
    }

    private ToolSchema property(String name, String type, String description) {
        JSONObject prop = new JSONObject();
        prop.put("type", type);
        prop.put("description", description);
        properties.put(name, prop);
        return this;
    }
}
