package com.deviceagents.screen;

import com.alibaba.fastjson2.JSONObject;
import com.deviceagents.device.Bounds;

import java.util.Locale;

public final class ScreenNode {

    private final String text;
    private final String contentDescription;
    private final String className;
    private final boolean clickable;
    private final Bounds bounds;

    public ScreenNode(String text, String contentDescription, String className, boolean clickable, Bounds bounds) {
        this.text = text == null ? "" : text;
        this.contentDescription = contentDescription == null ? "" : contentDescription;
        this.className = className == null ? "" : className;
        this.clickable = clickable;
        this.bounds = bounds == null ? Bounds.EMPTY : bounds;
    }

    public String getText() {
        return text;
    }

    public String getContentDescription() {
        return contentDescription;
    }

    public String getClassName() {
        return className;
    }

    public boolean isClickable() {
        return clickable;
    }

    /** Text fields echo whatever was typed into them. */
    public boolean isEditable() {
        return className.toLowerCase(Locale.ROOT).contains("edittext");
    }

    public Bounds getBounds() {
        return bounds;
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("text", text);
        json.put("content_description", contentDescription);
        json.put("class_name", className);
        json.put("clickable", clickable);
        JSONObject b = new JSONObject();
        b.put("left", bounds.getLeft());
        b.put("top", bounds.getTop());
        b.put("right", bounds.getRight());
        b.put("bottom", bounds.getBottom());
        json.put("bounds", b);
        return json;
    }
}
