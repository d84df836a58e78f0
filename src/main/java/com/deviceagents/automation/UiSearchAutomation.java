package com.deviceagents.automation;

import com.deviceagents.config.AppConfig;
import com.deviceagents.device.DeviceSession;
import com.deviceagents.device.NodeAction;
import com.deviceagents.device.UiTreeNode;
import com.deviceagents.screen.NodeQueryEngine;
import com.deviceagents.screen.NodeSignals;
import com.deviceagents.screen.ScreenSnapshot;
import com.deviceagents.screen.ScreenStateGuards;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 通用的应用内搜索流程。
 * <p>
 * 每一轮：确认前台包名 → （可选）关闭弹窗 → 找搜索输入框，找不到则点击搜索入口后再找 →
 * 输入关键词 → （可选）提交 → 重新读取屏幕验证关键词可见。
 * 动作的返回值只作参考，是否成功以重新读取的屏幕为准。轮数用尽后按
 * 包名漂移 → 未找到输入框 → 输入失败 → 提交失败 → 未验证 的优先级给出失败原因。
 * </p>
 */
public class UiSearchAutomation {
    private static final Logger logger = LogManager.getLogger(UiSearchAutomation.class);

    private final DeviceSession session;
    private final NodeQueryEngine queries;
    private final ScreenStateGuards guards;

    public UiSearchAutomation(DeviceSession session) {
        this(session, new NodeQueryEngine(session.actions(), AppConfig.getInstance().getGestureTimeoutMs()),
                new ScreenStateGuards(session));
    }

    public UiSearchAutomation(DeviceSession session, NodeQueryEngine queries, ScreenStateGuards guards) {
        this.session = session;
        this.queries = queries;
        this.guards = guards;
    }

    public UiSearchExecution run(UiSearchRequest request) {
        String expectedPackage = request.getExpectedPackage();
        if (!session.isAccessibilityEnabled()) {
            return UiSearchExecution.unavailable(expectedPackage, "Accessibility service is not connected.");
        }
        String query = request.getQuery().trim();
        if (query.isEmpty()) {
            return UiSearchExecution.unavailable(expectedPackage, "Search query cannot be empty.");
        }

        logger.info("Searching '{}' in {}", query, expectedPackage);
        guards.pause(Math.max(0L, request.getSettleDelayMs()));

        boolean inputFound = false;
        boolean triggerTapped = false;
        boolean typed = false;
        boolean popupDismissed = false;
        boolean submitted = false;
        String lastPackage = "";

        long pollDelay = Math.max(UiSearchDefaults.MIN_POLL_DELAY_MS, request.getPollDelayMs());
        int maxAttempts = Math.max(1, Math.min(UiSearchDefaults.MAX_ATTEMPTS_LIMIT, request.getMaxAttempts()));

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            ScreenSnapshot snapshot = guards.capture();
            if (snapshot == null) {
                guards.pause(pollDelay);
                continue;
            }
            lastPackage = snapshot.getPackageName();
            if (!lastPackage.equals(expectedPackage)) {
                logger.debug("Attempt {}: foreground is {}, expected {}", attempt, lastPackage, expectedPackage);
                guards.pause(pollDelay);
                continue;
            }

            UiTreeNode root = session.screen().activeRoot();
            if (root == null) {
                guards.pause(pollDelay);
                continue;
            }

            if (request.isClosePopups() && dismissBlockingPopup(root, request.getDismissHints())) {
                popupDismissed = true;
                guards.pause(UiSearchDefaults.POPUP_DISMISS_DELAY_MS);
                root = refreshedRoot(root);
            }

            UiTreeNode input = findSearchInput(root, request.getSearchInputIdHints());
            if (input != null) {
                inputFound = true;
            } else {
                UiTreeNode trigger = findSearchTrigger(root, request.getSearchInputIdHints(), request.getSearchTriggerHints());
                if (trigger != null && queries.clickNodeOrAncestor(trigger)) {
                    triggerTapped = true;
                    guards.pause(UiSearchDefaults.TRIGGER_DELAY_MS);
                    root = refreshedRoot(root);
                    input = findSearchInput(root, request.getSearchInputIdHints());
                    if (input != null) {
                        inputFound = true;
                    }
                }
            }

            if (input == null) {
                guards.pause(pollDelay);
                continue;
            }

            if (queries.setText(input, query)) {
                typed = true;
                if (request.isSubmitSearch()) {
                    submitted = submit(input, refreshedRoot(root), request.getSubmitHints());
                }
                guards.pause(UiSearchDefaults.POST_TYPE_DELAY_MS);
                ScreenSnapshot verify = guards.capture();
                boolean queryVisible = verify != null
                        && expectedPackage.equals(verify.getPackageName())
                        && ScreenStateGuards.containsText(verify, query);
                if (queryVisible && (!request.isSubmitSearch() || submitted)) {
                    logger.info("Search '{}' verified on attempt {}", query, attempt);
                    return new UiSearchExecution(true, true, true, inputFound, triggerTapped, popupDismissed,
                            submitted, expectedPackage, verify.getPackageName(), null);
                }
                if (verify != null) {
                    lastPackage = verify.getPackageName();
                }
            }
            guards.pause(pollDelay);
        }

        String error = diagnose(request, lastPackage, inputFound, typed, submitted);
        logger.warn("Search '{}' in {} failed: {}", query, expectedPackage, error);
        return new UiSearchExecution(false, typed, false, inputFound, triggerTapped, popupDismissed,
                submitted, expectedPackage, lastPackage, error);
    }

    static String diagnose(UiSearchRequest request, String lastPackage, boolean inputFound, boolean typed,
                           boolean submitted) {
        String expected = request.getExpectedPackage();
        if (!lastPackage.isEmpty() && !lastPackage.equals(expected)) {
            return "Foreground package changed to '" + lastPackage + "' while waiting for '" + expected + "'.";
        }
        if (!inputFound) {
            return "No search input was found on the current screen.";
        }
        if (!typed) {
            return "A search input was found, but typing the query failed.";
        }
        if (request.isSubmitSearch() && !submitted) {
            return "Query was typed but submit action could not be triggered.";
        }
        return "Query text could not be verified on screen after typing.";
    }

    private UiTreeNode refreshedRoot(UiTreeNode fallback) {
        UiTreeNode root = session.screen().activeRoot();
        return root == null ? fallback : root;
    }

    /**
     * Editable node carrying a search signal, else the focused editable node.
     */
    UiTreeNode findSearchInput(UiTreeNode root, List<String> idHints) {
        List<String> hints = withDefaults(idHints);
        UiTreeNode bySignal = queries.findByPredicate(root,
                node -> NodeQueryEngine.isEditable(node) && NodeSignals.hasAnySignal(node, hints));
        if (bySignal != null) {
            return bySignal;
        }
        return queries.findByPredicate(root, node -> NodeQueryEngine.isEditable(node) && node.isFocused());
    }

    UiTreeNode findSearchTrigger(UiTreeNode root, List<String> idHints, List<String> triggerHints) {
        List<String> combined = new ArrayList<>(idHints);
        combined.addAll(triggerHints);
        List<String> hints = withDefaults(combined);
        return queries.findByPredicate(root, node -> !NodeQueryEngine.isEditable(node)
                && NodeSignals.isActionable(node)
                && NodeSignals.hasAnySignal(node, hints));
    }

    private boolean dismissBlockingPopup(UiTreeNode root, List<String> dismissHints) {
        List<String> hints = NodeSignals.normalize(dismissHints);
        if (hints.isEmpty()) {
            return false;
        }
        UiTreeNode dismiss = queries.findByPredicate(root, node -> NodeSignals.isActionable(node)
                && !NodeQueryEngine.isEditable(node)
                && NodeSignals.hasAnySignal(node, hints));
        if (dismiss == null) {
            return false;
        }
        logger.debug("Dismissing popup via '{}'", dismiss.getText().isEmpty() ? dismiss.getContentDescription() : dismiss.getText());
        return queries.clickNodeOrAncestor(dismiss);
    }

    /**
     * Prefers an IME-style action on the input whose label contains a submit hint, then a
     * submit-labelled control elsewhere on screen.
     */
    private boolean submit(UiTreeNode input, UiTreeNode root, List<String> submitHints) {
        List<String> hints = NodeSignals.normalize(submitHints);
        for (NodeAction action : input.getActions()) {
            String label = action.getLabel() == null ? "" : action.getLabel().trim().toLowerCase(Locale.ROOT);
            if (label.isEmpty()) continue;
            for (String hint : hints) {
                if (label.contains(hint)) {
                    if (queries.actions().performAction(input, action)) {
                        return true;
                    }
                    break;
                }
            }
        }
        if (hints.isEmpty()) {
            return false;
        }
        UiTreeNode submitNode = queries.findByPredicate(root, node -> NodeSignals.isActionable(node)
                && !NodeQueryEngine.isEditable(node)
                && NodeSignals.hasAnySignal(node, hints));
        return submitNode != null && queries.clickNodeOrAncestor(submitNode);
    }

    private static List<String> withDefaults(List<String> hints) {
        List<String> combined = new ArrayList<>(hints);
        combined.addAll(UiSearchDefaults.TRIGGER_HINTS);
        combined.addAll(UiSearchDefaults.INPUT_ID_HINTS);
        return NodeSignals.normalize(combined);
    }
}
