package com.deviceagents.screen;

import com.deviceagents.device.Bounds;
import com.deviceagents.device.UiTreeNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * 从活动窗口根节点构建 {@link ScreenSnapshot}。
 * <p>
 * 广度优先遍历，只收集 text 或 contentDescription 非空的节点，最多 maxNodes 个，
 * 因此在上限内优先保留层级较高、更显著的节点。遍历期间界面可能变化，
 * 子节点为 null 或读取节点抛出运行时异常时，该分支被跳过，不向外抛出。
 * </p>
 */
public final class ScreenSnapshotProvider {
    private static final Logger logger = LogManager.getLogger(ScreenSnapshotProvider.class);

    /** Hard cap on visited nodes, independent of how many are collected. */
    static final int MAX_VISITED_NODES = 5_000;

    private ScreenSnapshotProvider() {
    }

    public static ScreenSnapshot capture(UiTreeNode root, int maxNodes) {
        if (root == null) {
            return null;
        }
        String packageName;
        String rootClass;
        try {
            packageName = root.getPackageName();
            rootClass = root.getClassName();
        } catch (RuntimeException e) {
            logger.debug("Root node detached before capture: {}", e.getMessage());
            return null;
        }

        List<ScreenNode> nodes = new ArrayList<>();
        ArrayDeque<UiTreeNode> queue = new ArrayDeque<>();
        queue.add(root);
        int visited = 0;

        while (!queue.isEmpty() && nodes.size() < maxNodes && visited < MAX_VISITED_NODES) {
            UiTreeNode node = queue.removeFirst();
            visited++;
            try {
                String text = node.getText();
                String description = node.getContentDescription();
                if (!isBlank(text) || !isBlank(description)) {
                    Bounds bounds = node.getBounds();
                    nodes.add(new ScreenNode(text, description, node.getClassName(), node.isClickable(), bounds));
                }

                int childCount = node.getChildCount();
                for (int i = 0; i < childCount; i++) {
                    UiTreeNode child = node.getChild(i);
                    if (child != null) {
                        queue.add(child);
                    }
                }
            } catch (RuntimeException e) {
                // stale node, prune the branch
                logger.debug("Skipping stale node during capture: {}", e.getMessage());
            }
        }

        return new ScreenSnapshot(packageName, rootClass, nodes);
    }

    static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
