package com.deviceagents.screen;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 某一时刻前台窗口的不可变快照。
 * <p>
 * 每次采集都新建，节点顺序即广度优先遍历顺序。快照之间没有节点身份，只按内容（文本、包名）比较。
 * </p>
 */
public final class ScreenSnapshot {

    private final String packageName;
    private final String rootClassName;
    private final List<ScreenNode> nodes;

    public ScreenSnapshot(String packageName, String rootClassName, List<ScreenNode> nodes) {
        this.packageName = packageName == null ? "" : packageName;
        this.rootClassName = rootClassName == null ? "" : rootClassName;
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
    }

    public String getPackageName() {
        return packageName;
    }

    public String getRootClassName() {
        return rootClassName;
    }

    public List<ScreenNode> getNodes() {
        return nodes;
    }

    /** Same screen without text fields, whose content is input rather than what the app shows. */
    public ScreenSnapshot withoutEditable() {
        List<ScreenNode> kept = new ArrayList<>();
        for (ScreenNode node : nodes) {
            if (!node.isEditable()) {
                kept.add(node);
            }
        }
        return new ScreenSnapshot(packageName, rootClassName, kept);
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("foreground_package", packageName);
        json.put("root_class", rootClassName);
        json.put("node_count", nodes.size());
        JSONArray array = new JSONArray();
        for (ScreenNode node : nodes) {
            array.add(node.toJson());
        }
        json.put("nodes", array);
        return json;
    }
}
