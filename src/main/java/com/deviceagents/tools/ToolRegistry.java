package com.deviceagents.tools;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

public class ToolRegistry {
    // insertion order is the order tools/list advertises
    private static final Map<String, Tool> tools = new LinkedHashMap<>();

    public static synchronized void register(Tool tool) {
        tools.put(tool.getName(), tool);
    }

    public static synchronized Tool get(String name) {
        return tools.get(name);
    }

    public static synchronized Collection<Tool> getAll() {
        return new ArrayList<>(tools.values());
    }

    public static synchronized boolean contains(String name) {
        return tools.containsKey(name);
    }

    /** Drops every registration; used when the device session is replaced. */
    public static synchronized void clear() {
        tools.clear();
    }
}
