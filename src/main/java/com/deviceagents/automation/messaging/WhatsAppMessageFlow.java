package com.deviceagents.automation.messaging;

import com.deviceagents.config.AppConfig;
import com.deviceagents.device.Bounds;
import com.deviceagents.device.DeviceSession;
import com.deviceagents.device.GlobalAction;
import com.deviceagents.device.UiTreeNode;
import com.deviceagents.screen.NodeQueryEngine;
import com.deviceagents.screen.ScreenSnapshot;
import com.deviceagents.screen.ScreenStateGuards;
import com.deviceagents.screen.TapResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * 带联系人校验的 WhatsApp 发送流程。
 * <p>
 * 阶段依次为：打开应用 → 选择联系人 → 校验联系人 → 输入消息 → 发送前复核 → 发送。
 * 每个阶段都会记录一个 {@link ChatCheckpoint}。严格模式下，联系人在输入前或发送前无法在屏幕上确认时，
 * 流程直接中止且不会重试发送，调用方需要调整参数后重新发起。
 * 所有点击与输入都只在前台包名等于目标包名时执行。
 * </p>
 */
public class WhatsAppMessageFlow {
    private static final Logger logger = LogManager.getLogger(WhatsAppMessageFlow.class);

    static final int CONTACT_ATTEMPTS = 12;
    static final int TYPE_ATTEMPTS = 10;
    static final int SEND_ATTEMPTS = 10;
    static final long RETRY_DELAY_MS = 450L;
    static final long TRIGGER_DELAY_MS = 500L;
    static final long SEARCH_RESULTS_DELAY_MS = 900L;
    static final long CHAT_OPEN_DELAY_MS = 1_200L;
    static final long MESSAGE_INPUT_TIMEOUT_MS = 6_000L;
    static final long MESSAGE_INPUT_POLL_MS = 300L;
    static final long TYPE_VERIFY_DELAY_MS = 450L;
    static final long AFTER_SEND_DELAY_MS = 700L;
    static final int VARIANT_CHECK_NODES = 80;
    static final int SEND_TAP_OFFSET_PX = 80;
    static final int SEND_TAP_EDGE_MARGIN_PX = 24;
    static final long SEND_TAP_DURATION_MS = 90L;

    private static final List<String> MESSAGE_INPUT_ID_HINTS = Arrays.asList("entry", "conversation_entry", "compose", "input");
    private static final List<String> COMPOSE_ID_MARKERS = Arrays.asList("entry", "message", "compose");
    private static final List<String> SEARCH_INPUT_ID_HINTS = Arrays.asList("search_src_text", "search_input");
    private static final List<String> SEARCH_TRIGGER_ID_HINTS = Arrays.asList("menuitem_search", "search");
    private static final List<String> SEND_ID_HINTS = Arrays.asList("send", "send_button", "send_container");

    private final DeviceSession session;
    private final NodeQueryEngine queries;
    private final ScreenStateGuards guards;
    private final long foregroundTimeoutMs;
    private final long foregroundPollMs;

    public WhatsAppMessageFlow(DeviceSession session) {
        this(session, new NodeQueryEngine(session.actions(), AppConfig.getInstance().getGestureTimeoutMs()),
                new ScreenStateGuards(session));
    }

    public WhatsAppMessageFlow(DeviceSession session, NodeQueryEngine queries, ScreenStateGuards guards) {
        this.session = session;
        this.queries = queries;
        this.guards = guards;
        this.foregroundTimeoutMs = AppConfig.getInstance().getForegroundTimeoutMs();
        this.foregroundPollMs = AppConfig.getInstance().getForegroundPollMs();
    }

    public MessagingOutcome send(MessageRequest request) {
        List<ChatCheckpoint> checkpoints = new ArrayList<>();
        if (!session.isAccessibilityEnabled()) {
            return abort(FailureReason.ACCESSIBILITY_DISABLED,
                    "Accessibility service is disabled. Connect the device accessibility session first.", null, checkpoints);
        }
        if (request.getContactName().isEmpty()) {
            return abort(FailureReason.INVALID_ARGUMENT, "Contact name is required", null, checkpoints);
        }
        if (request.getMessage().isEmpty()) {
            return abort(FailureReason.INVALID_ARGUMENT, "Message cannot be empty", null, checkpoints);
        }

        WhatsAppVariant variant = resolveVariant(request.getVariant());
        if (variant == null) {
            String name = request.getVariant() == null ? "WhatsApp" : request.getVariant().getDisplayName();
            return abort(FailureReason.APP_NOT_INSTALLED, name + " is not installed", null, checkpoints);
        }
        String pkg = variant.getPackageName();
        logger.info("Sending message to '{}' via {}", request.getContactName(), pkg);

        checkpoints.add(checkpoint("before_open", pkg, request, null));
        if (!launch(pkg)) {
            return abort(FailureReason.LAUNCH_FAILED,
                    "Failed to open " + variant.getDisplayName() + " (" + pkg + ").", variant, checkpoints);
        }
        ScreenSnapshot foreground = guards.waitForForegroundPackage(Collections.singleton(pkg),
                foregroundTimeoutMs, foregroundPollMs);
        if (foreground == null) {
            return abort(FailureReason.FOREGROUND_TIMEOUT,
                    "Failed to bring WhatsApp to foreground (" + pkg + ").", variant, checkpoints);
        }
        checkpoints.add(ChatCheckpoint.of("opened_whatsapp", pkg, foreground,
                request.getContactName(), request.getPhoneNumber(), null));

        boolean selected = openContactChat(request, pkg);
        checkpoints.add(checkpoint("contact_selection", pkg, request, null));
        String contact = request.getContactName();
        if (!selected) {
            checkpoints.add(checkpoint("contact_verified", pkg, request, null));
            return abort(FailureReason.CONTACT_NOT_FOUND,
                    "Could not open chat for '" + contact + "': selected chat could not be confidently verified as '"
                            + contact + "'. Check contact spelling and WhatsApp UI state.", variant, checkpoints);
        }

        ChatCheckpoint verified = checkpoint("contact_verified", pkg, request, null);
        checkpoints.add(verified);
        if (request.isStrictContactMatch() && !verified.isContactLikelyVisible()) {
            return abort(FailureReason.CONTACT_NOT_VERIFIED,
                    "Aborted: selected chat could not be confidently verified as '" + contact + "'.", variant, checkpoints);
        }

        boolean typed = typeMessage(request.getMessage(), pkg);
        ChatCheckpoint typedCheckpoint = checkpoint("message_typed", pkg, request, request.getMessage());
        checkpoints.add(typedCheckpoint);
        if (!typed || !typedCheckpoint.isMessageLikelyVisible()) {
            return abort(FailureReason.MESSAGE_NOT_VERIFIED,
                    "Message typing could not be verified on screen.", variant, checkpoints);
        }

        ChatCheckpoint preSend = checkpoint("pre_send", pkg, request, request.getMessage());
        checkpoints.add(preSend);
        if (request.isStrictContactMatch() && !preSend.isContactLikelyVisible()) {
            return abort(FailureReason.CONTACT_LOST_BEFORE_SEND,
                    "Aborted before send: contact verification failed in pre-send state.", variant, checkpoints);
        }

        if (!pressSend(pkg)) {
            return abort(FailureReason.SEND_BUTTON_NOT_FOUND,
                    "Could not press send button in WhatsApp. Use screen_state + tap to inspect current UI.",
                    variant, checkpoints);
        }

        guards.pause(AFTER_SEND_DELAY_MS);
        checkpoints.add(checkpoint("after_send", pkg, request, null));
        logger.info("Message to '{}' sent via {}", contact, pkg);
        return MessagingOutcome.sent(variant, checkpoints);
    }

    /**
     * Explicit variant if installed; otherwise the variant already in the foreground, then
     * installed business, then installed personal.
     */
    public WhatsAppVariant resolveVariant(WhatsAppVariant requested) {
        if (requested != null) {
            return isInstalled(requested.getPackageName()) ? requested : null;
        }
        ScreenSnapshot current = guards.capture(VARIANT_CHECK_NODES);
        WhatsAppVariant inForeground = current == null ? null : WhatsAppVariant.fromPackage(current.getPackageName());
        if (inForeground != null) {
            return inForeground;
        }
        if (isInstalled(WhatsAppVariant.BUSINESS.getPackageName())) {
            return WhatsAppVariant.BUSINESS;
        }
        if (isInstalled(WhatsAppVariant.PERSONAL.getPackageName())) {
            return WhatsAppVariant.PERSONAL;
        }
        return null;
    }

    private boolean openContactChat(MessageRequest request, String pkg) {
        String contact = request.getContactName();
        for (int attempt = 1; attempt <= CONTACT_ATTEMPTS; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                return false;
            }
            UiTreeNode root = rootFor(pkg);
            if (root == null) {
                guards.pause(RETRY_DELAY_MS);
                continue;
            }

            boolean inChat = findMessageInput(root) != null;
            if (inChat && contactVisible(request, pkg)) {
                logger.debug("Chat for '{}' already open", contact);
                return true;
            }

            UiTreeNode trigger = findSearchTrigger(root);
            if (trigger != null) {
                queries.clickNodeOrAncestor(trigger);
                guards.pause(TRIGGER_DELAY_MS);
            } else if (inChat) {
                // some other chat is open and offers no search; go back to the chat list
                session.actions().runGlobalAction(GlobalAction.BACK);
                guards.pause(RETRY_DELAY_MS);
                continue;
            }

            UiTreeNode searchRoot = rootFor(pkg);
            UiTreeNode input = searchRoot == null ? null : findSearchInput(searchRoot);
            if (input != null && queries.setText(input, contact)) {
                guards.pause(SEARCH_RESULTS_DELAY_MS);
                UiTreeNode resultRoot = rootFor(pkg);
                UiTreeNode candidate = resultRoot == null ? null
                        : findContactCandidate(resultRoot, contact, request.getPhoneNumber());
                if (candidate != null && queries.clickNodeOrAncestor(candidate)) {
                    guards.pause(CHAT_OPEN_DELAY_MS);
                    if (waitForMessageInput(pkg)) {
                        return true;
                    }
                }
            }
            logger.debug("Contact selection attempt {} for '{}' did not open a chat", attempt, contact);
            guards.pause(RETRY_DELAY_MS);
        }
        return false;
    }

    private boolean typeMessage(String message, String pkg) {
        for (int attempt = 1; attempt <= TYPE_ATTEMPTS; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                return false;
            }
            UiTreeNode root = rootFor(pkg);
            if (root != null) {
                UiTreeNode field = findMessageInput(root);
                if (field != null && queries.setText(field, message)) {
                    guards.pause(TYPE_VERIFY_DELAY_MS);
                    ScreenSnapshot snapshot = guards.capture();
                    if (snapshot != null && pkg.equals(snapshot.getPackageName())
                            && ChatCheckpoint.messageLikelyVisible(ScreenStateGuards.highlights(snapshot), message)) {
                        return true;
                    }
                }
            }
            guards.pause(RETRY_DELAY_MS);
        }
        return false;
    }

    /**
     * Labelled send control first, then any visible "Send" text, then a tap just right of the
     * compose field where unlabelled send buttons usually sit.
     */
    private boolean pressSend(String pkg) {
        for (int attempt = 1; attempt <= SEND_ATTEMPTS; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                return false;
            }
            UiTreeNode root = rootFor(pkg);
            if (root != null) {
                UiTreeNode button = findSendButton(root);
                if (button != null && queries.clickNodeOrAncestor(button)) {
                    return true;
                }
                TapResult tap = queries.tapVisibleNodeByText(root, "Send", false, 1, true);
                if (tap.isSuccess()) {
                    return true;
                }
                UiTreeNode field = findMessageInput(root);
                int width = session.actions().displayWidth();
                if (field != null && width > 0) {
                    Bounds bounds = field.getBounds();
                    if (bounds != null && !bounds.isEmpty()) {
                        int x = Math.min(bounds.getRight() + SEND_TAP_OFFSET_PX, width - SEND_TAP_EDGE_MARGIN_PX);
                        if (queries.tap(x, bounds.centerY(), SEND_TAP_DURATION_MS)) {
                            return true;
                        }
                    }
                }
            }
            guards.pause(RETRY_DELAY_MS);
        }
        return false;
    }

    private boolean waitForMessageInput(String pkg) {
        long endAt = session.now() + MESSAGE_INPUT_TIMEOUT_MS;
        while (true) {
            UiTreeNode root = rootFor(pkg);
            if (root != null && findMessageInput(root) != null) {
                return true;
            }
            if (session.now() >= endAt || !guards.pause(MESSAGE_INPUT_POLL_MS)) {
                return false;
            }
        }
    }

    private boolean contactVisible(MessageRequest request, String pkg) {
        ScreenSnapshot snapshot = guards.capture();
        return snapshot != null && pkg.equals(snapshot.getPackageName())
                && ChatCheckpoint.contactLikelyVisible(ScreenStateGuards.readOnlyHighlights(snapshot),
                request.getContactName(), request.getPhoneNumber());
    }

    /** Live root, only while {@code pkg} is in the foreground. */
    private UiTreeNode rootFor(String pkg) {
        try {
            UiTreeNode root = session.screen().activeRoot();
            return root != null && pkg.equals(root.getPackageName()) ? root : null;
        } catch (RuntimeException e) {
            logger.debug("Active window unavailable: {}", e.getMessage());
            return null;
        }
    }

    UiTreeNode findMessageInput(UiTreeNode root) {
        for (String hint : MESSAGE_INPUT_ID_HINTS) {
            UiTreeNode byId = queries.findByPredicate(root, node -> NodeQueryEngine.isEditable(node)
                    && !isSearchField(node) && lower(node.getViewId()).contains(hint));
            if (byId != null) {
                return byId;
            }
        }
        return queries.findByPredicate(root, node -> NodeQueryEngine.isEditable(node) && !isSearchField(node));
    }

    /** Never falls back to the chat compose field. */
    UiTreeNode findSearchInput(UiTreeNode root) {
        for (String hint : SEARCH_INPUT_ID_HINTS) {
            UiTreeNode byId = queries.findByPredicate(root,
                    node -> NodeQueryEngine.isEditable(node) && lower(node.getViewId()).contains(hint));
            if (byId != null) {
                return byId;
            }
        }
        UiTreeNode bySignal = queries.findByPredicate(root,
                node -> NodeQueryEngine.isEditable(node) && isSearchField(node));
        if (bySignal != null) {
            return bySignal;
        }
        return queries.findByPredicate(root,
                node -> NodeQueryEngine.isEditable(node) && !containsAny(lower(node.getViewId()), COMPOSE_ID_MARKERS));
    }

    private UiTreeNode findSearchTrigger(UiTreeNode root) {
        for (String hint : SEARCH_TRIGGER_ID_HINTS) {
            UiTreeNode byId = queries.findByPredicate(root,
                    node -> !NodeQueryEngine.isEditable(node) && lower(node.getViewId()).contains(hint));
            if (byId != null) {
                return byId;
            }
        }
        return queries.findByPredicate(root,
                node -> !NodeQueryEngine.isEditable(node) && lower(node.getContentDescription()).contains("search"));
    }

    /**
     * Exact name, then substring, then phone digit suffix. Text fields are skipped so the typed
     * search text never counts as a result.
     */
    UiTreeNode findContactCandidate(UiTreeNode root, String contactName, String phoneNumber) {
        String wanted = lower(contactName);
        UiTreeNode exact = findResult(root, node -> lower(node.getText()).equals(wanted)
                || lower(node.getContentDescription()).equals(wanted));
        if (exact != null) {
            return exact;
        }
        UiTreeNode contains = findResult(root, node -> lower(node.getText()).contains(wanted)
                || lower(node.getContentDescription()).contains(wanted));
        if (contains != null) {
            return contains;
        }
        String digits = ScreenStateGuards.digitsOf(phoneNumber);
        if (digits.length() < ChatCheckpoint.PHONE_SUFFIX_DIGITS) {
            return null;
        }
        String suffix = digits.substring(digits.length() - ChatCheckpoint.PHONE_SUFFIX_DIGITS);
        return findResult(root, node -> ScreenStateGuards.digitsOf(node.getText()).contains(suffix));
    }

    private UiTreeNode findResult(UiTreeNode root, Predicate<UiTreeNode> match) {
        return queries.findByPredicate(root, node -> !NodeQueryEngine.isEditable(node) && match.test(node));
    }

    UiTreeNode findSendButton(UiTreeNode root) {
        for (String hint : SEND_ID_HINTS) {
            UiTreeNode byId = findResult(root, node -> lower(node.getViewId()).contains(hint));
            if (byId != null) {
                return byId;
            }
        }
        UiTreeNode byDescription = findResult(root, node -> lower(node.getContentDescription()).contains("send"));
        if (byDescription != null) {
            return byDescription;
        }
        return findResult(root, node -> lower(node.getText()).equals("send"));
    }

    private boolean launch(String pkg) {
        try {
            return session.apps().launch(pkg);
        } catch (RuntimeException e) {
            logger.warn("Launching {} failed: {}", pkg, e.getMessage());
            return false;
        }
    }

    private boolean isInstalled(String pkg) {
        try {
            return session.apps().isInstalled(pkg);
        } catch (RuntimeException e) {
            logger.warn("Could not check whether {} is installed: {}", pkg, e.getMessage());
            return false;
        }
    }

    private ChatCheckpoint checkpoint(String step, String pkg, MessageRequest request, String message) {
        return ChatCheckpoint.of(step, pkg, guards.capture(), request.getContactName(), request.getPhoneNumber(), message);
    }

    private static MessagingOutcome abort(FailureReason reason, String error, WhatsAppVariant variant,
                                          List<ChatCheckpoint> checkpoints) {
        logger.warn("Message flow aborted ({}): {}", reason, error);
        return MessagingOutcome.aborted(reason, error, variant, checkpoints);
    }

    private static boolean isSearchField(UiTreeNode node) {
        return lower(node.getViewId()).contains("search") || lower(node.getHintText()).contains("search");
    }

    private static boolean containsAny(String value, List<String> markers) {
        for (String marker : markers) {
            if (value.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
