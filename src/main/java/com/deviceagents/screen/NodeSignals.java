package com.deviceagents.screen;

import com.deviceagents.device.UiTreeNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Hint matching on node attributes: view id, hint text, content description and text.
 */
public final class NodeSignals {

    private NodeSignals() {
    }

    /** Trimmed, lower-cased, distinct, blanks removed. */
    public static List<String> normalize(Collection<String> rawHints) {
        Set<String> out = new LinkedHashSet<>();
        if (rawHints != null) {
            for (String hint : rawHints) {
                if (hint == null) continue;
                String h = hint.trim().toLowerCase(Locale.ROOT);
                if (!h.isEmpty()) {
                    out.add(h);
                }
            }
        }
        return new ArrayList<>(out);
    }

    /**
     * True when any normalized hint is a substring of the node's id, hint text, description
     * or text.
     */
    public static boolean hasAnySignal(UiTreeNode node, List<String> normalizedHints) {
        if (normalizedHints.isEmpty()) {
            return false;
        }
        String[] haystacks = {
                lower(node.getViewId()),
                lower(node.getHintText()),
                lower(node.getContentDescription()),
                lower(node.getText())
        };
        for (String hint : normalizedHints) {
            for (String value : haystacks) {
                if (value.contains(hint)) {
                    return true;
                }
            }
        }
        return false;
    }

    public static boolean isActionable(UiTreeNode node) {
        return node.isClickable() || node.isFocusable();
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
