package com.deviceagents.device;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.function.LongSupplier;

/**
 * 一次设备连接的能力集合。
 * <p>
 * 在连接建立时创建、断开时 {@link #close()}；工具和自动化流程通过构造函数注入本对象，
 * 而不是查找全局单例，这样测试可以换成内存中的假设备。
 * 同一时刻只应有一个自动化流程驱动同一台设备，本类不做互斥。
 * </p>
 */
public class DeviceSession implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(DeviceSession.class);

    private final ScreenReader screen;
    private final DeviceActions actions;
    private final AppRegistry apps;
    private final Sleeper sleeper;
    private final LongSupplier clock;
    private volatile boolean closed;

    public DeviceSession(ScreenReader screen, DeviceActions actions, AppRegistry apps) {
        this(screen, actions, apps, Sleeper.SYSTEM, System::currentTimeMillis);
    }

    public DeviceSession(ScreenReader screen, DeviceActions actions, AppRegistry apps,
                         Sleeper sleeper, LongSupplier clock) {
        this.screen = screen;
        this.actions = actions;
        this.apps = apps;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public ScreenReader screen() {
        return screen;
    }

    public DeviceActions actions() {
        return actions;
    }

    public AppRegistry apps() {
        return apps;
    }

    public Sleeper sleeper() {
        return sleeper;
    }

    public long now() {
        return clock.getAsLong();
    }

    /** True while the accessibility (screen) connection is usable. */
    public boolean isAccessibilityEnabled() {
        return !closed && screen != null && screen.isConnected();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        closeQuietly(screen);
        if (actions != screen) closeQuietly(actions);
        if (apps != screen && apps != actions) closeQuietly(apps);
        logger.info("Device session closed");
    }

    private static void closeQuietly(Object component) {
        if (component instanceof AutoCloseable) {
            try {
                ((AutoCloseable) component).close();
            } catch (Exception e) {
                logger.warn("Failed to close {}: {}", component.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
