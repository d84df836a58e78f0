package com.deviceagents.automation.messaging;

import com.deviceagents.config.AppConfig;
import com.deviceagents.device.DeviceSession;
import com.deviceagents.screen.ScreenCheckpoint;
import com.deviceagents.screen.ScreenSnapshot;
import com.deviceagents.screen.ScreenStateGuards;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 通过深链接打开预填好的会话草稿。
 * <p>
 * 严格模式下依次记录 before_open、after_open、target_verification 三个检查点：
 * 目标应用没有进入前台，或屏幕上找不到目标号码/用户名时中止。流程本身从不点击发送。
 * </p>
 */
public class DeepLinkDraftFlow {
    private static final Logger logger = LogManager.getLogger(DeepLinkDraftFlow.class);

    static final long SETTLE_DELAY_MS = 900L;
    static final int VERIFY_NODES = 120;

    private final DeviceSession session;
    private final ScreenStateGuards guards;

    public DeepLinkDraftFlow(DeviceSession session, ScreenStateGuards guards) {
        this.session = session;
        this.guards = guards;
    }

    public DraftOutcome open(ConversationLink link, boolean strict) {
        List<ScreenCheckpoint> checkpoints = new ArrayList<>();
        String pkg = link.getPackageName();
        if (strict) {
            checkpoints.add(guards.captureCheckpoint("before_open", pkg));
        }
        logger.info("Opening {} draft via {}", link.getAppName(), link.getUri());
        if (!deliver(link)) {
            return DraftOutcome.aborted("Failed to open " + link.getAppName() + " (" + pkg + ").", checkpoints);
        }
        if (!strict) {
            return DraftOutcome.opened(false, checkpoints);
        }

        AppConfig config = AppConfig.getInstance();
        ScreenSnapshot foreground = guards.waitForForegroundPackage(Collections.singleton(pkg),
                config.getForegroundTimeoutMs(), config.getForegroundPollMs());
        checkpoints.add(ScreenStateGuards.checkpointOf("after_open", pkg, foreground == null ? guards.capture() : foreground));
        if (foreground == null) {
            return DraftOutcome.aborted("Safety check failed: expected " + link.getAppName()
                    + " in foreground, but another app stayed active.", checkpoints);
        }

        guards.pause(SETTLE_DELAY_MS);
        ScreenSnapshot target = guards.capture(VERIFY_NODES);
        checkpoints.add(ScreenStateGuards.checkpointOf("target_verification", pkg, target));
        if (target == null || !pkg.equals(target.getPackageName()) || !link.matchesTarget(target)) {
            logger.warn("{} target not visible after deep link", link.getAppName());
            return DraftOutcome.aborted("Safety check failed: could not verify the requested " + link.getAppName()
                    + " target on screen. Aborted to prevent a wrong-recipient action.", checkpoints);
        }
        return DraftOutcome.opened(true, checkpoints);
    }

    private boolean deliver(ConversationLink link) {
        try {
            return session.actions().openDeepLink(link.getUri(), link.getPackageName());
        } catch (RuntimeException e) {
            logger.warn("Deep link into {} failed: {}", link.getPackageName(), e.getMessage());
            return false;
        }
    }
}
