package com.deviceagents.android;

import com.deviceagents.device.Bounds;
import com.deviceagents.device.NodeAction;
import com.deviceagents.device.UiTreeNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * One element of a UiAutomator2 page-source dump. Immutable once the parser has linked it.
 */
public final class XmlUiNode implements UiTreeNode {

    /** Editor action that submits a search field through the IME. */
    public static final int ACTION_IME_SEARCH = 0x01000000;
    static final NodeAction IME_SEARCH = new NodeAction(ACTION_IME_SEARCH, "Search");

    private final String text;
    private final String contentDescription;
    private final String className;
    private final String viewId;
    private final String hintText;
    private final String packageName;
    private final boolean clickable;
    private final boolean focusable;
    private final boolean focused;
    private final Bounds bounds;
    private final List<XmlUiNode> children = new ArrayList<>();
    private XmlUiNode parent;

    XmlUiNode(String text, String contentDescription, String className, String viewId, String hintText,
              String packageName, boolean clickable, boolean focusable, boolean focused, Bounds bounds) {
        this.text = orEmpty(text);
        this.contentDescription = orEmpty(contentDescription);
        this.className = orEmpty(className);
        this.viewId = orEmpty(viewId);
        this.hintText = orEmpty(hintText);
        this.packageName = orEmpty(packageName);
        this.clickable = clickable;
        this.focusable = focusable;
        this.focused = focused;
        this.bounds = bounds == null ? Bounds.EMPTY : bounds;
    }

    void addChild(XmlUiNode child) {
        child.parent = this;
        children.add(child);
    }

    @Override
    public String getText() {
        return text;
    }

    @Override
    public String getContentDescription() {
        return contentDescription;
    }

    @Override
    public String getClassName() {
        return className;
    }

    @Override
    public String getViewId() {
        return viewId;
    }

    @Override
    public String getHintText() {
        return hintText;
    }

    @Override
    public String getPackageName() {
        return packageName;
    }

    @Override
    public boolean isClickable() {
        return clickable;
    }

    @Override
    public boolean isFocusable() {
        return focusable;
    }

    @Override
    public boolean isFocused() {
        return focused;
    }

    @Override
    public Bounds getBounds() {
        return bounds;
    }

    @Override
    public int getChildCount() {
        return children.size();
    }

    @Override
    public UiTreeNode getChild(int index) {
        if (index < 0 || index >= children.size()) {
            return null;
        }
        return children.get(index);
    }

    @Override
    public UiTreeNode getParent() {
        return parent;
    }

    /**
     * The dump carries no imeOptions, so the IME search action is only offered on text fields
     * that identify as search inputs or hold input focus. Other nodes have none.
     */
    @Override
    public List<NodeAction> getActions() {
        if (lower(className).contains("edittext") && (focused || looksLikeSearchInput())) {
            return Collections.singletonList(IME_SEARCH);
        }
        return Collections.emptyList();
    }

    private boolean looksLikeSearchInput() {
        String id = lower(viewId);
        return id.contains("search") || id.contains("query") || lower(hintText).contains("search");
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
