package com.deviceagents.device;

import java.util.List;

/**
 * 前台窗口可访问性树中的一个节点。
 * <p>
 * 树是“活”的：在遍历过程中界面可能发生变化，因此 {@link #getChild(int)} 允许返回 null，
 * 调用方应将其视为被剪掉的分支而不是错误。字符串属性缺失时返回空串，不返回 null。
 * </p>
 */
public interface UiTreeNode {

    String getText();

    String getContentDescription();

    String getClassName();

    /** Resource id such as {@code com.whatsapp:id/entry}, or empty. */
    String getViewId();

    String getHintText();

    String getPackageName();

    boolean isClickable();

    boolean isFocusable();

    boolean isFocused();

    Bounds getBounds();

    int getChildCount();

    UiTreeNode getChild(int index);

    UiTreeNode getParent();

    List<NodeAction> getActions();
}
