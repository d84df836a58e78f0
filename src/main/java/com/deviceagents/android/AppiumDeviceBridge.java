package com.deviceagents.android;

import com.deviceagents.config.AppConfig;
import com.deviceagents.device.AppRegistry;
import com.deviceagents.device.Bounds;
import com.deviceagents.device.DeviceActions;
import com.deviceagents.device.GlobalAction;
import com.deviceagents.device.LaunchableApp;
import com.deviceagents.device.NodeAction;
import com.deviceagents.device.ScreenReader;
import com.deviceagents.device.SwipeDirection;
import com.deviceagents.device.UiTreeNode;
import com.deviceagents.screen.ScreenSnapshot;
import com.deviceagents.screen.ScreenSnapshotProvider;
import io.appium.java_client.AppiumBy;
import io.appium.java_client.android.AndroidDriver;
import io.appium.java_client.android.nativekey.AndroidKey;
import io.appium.java_client.android.nativekey.KeyEvent;
import io.appium.java_client.android.options.UiAutomator2Options;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.openqa.selenium.Dimension;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.interactions.Pause;
import org.openqa.selenium.interactions.PointerInput;
import org.openqa.selenium.interactions.Sequence;

import java.io.IOException;
import java.net.URL;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 基于 Appium UiAutomator2 会话的设备桥接
 * <p>
 * 读屏：拉取 page source 并解析为 {@link XmlUiNode} 树；节点操作：按 bounds（和 resource-id）定位元素；
 * 手势：W3C pointer 序列，在单独线程上执行并以 future 返回；应用枚举与安装检查走 adb。
 * 深链接优先使用 {@code mobile: deepLink}，失败时退回 {@code am start}。
 * 所有 WebDriver 异常都转换为 false / null，由上层的屏幕校验决定是否中止。
 * </p>
 */
public class AppiumDeviceBridge implements ScreenReader, DeviceActions, AppRegistry, AutoCloseable {
    private static final Logger logger = LogManager.getLogger(AppiumDeviceBridge.class);

    private final AndroidDriver driver;
    private final AndroidDeviceManager adb;
    private final String serial;
    private final ExecutorService gestureExecutor;
    private volatile boolean closed;

    AppiumDeviceBridge(AndroidDriver driver, AndroidDeviceManager adb, String serial) {
        this.driver = driver;
        this.adb = adb;
        this.serial = serial;
        this.gestureExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "gesture-dispatch");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Opens a UiAutomator2 session on the configured device, or the first one adb reports.
     */
    public static AppiumDeviceBridge connect(AppConfig config) throws IOException {
        AndroidDeviceManager adb = new AndroidDeviceManager(config.getAdbPath());
        String serial = config.getDeviceSerial();
        if (serial == null) {
            List<String> devices = adb.getDevices();
            if (devices.isEmpty()) {
                throw new IOException("No Android devices connected.");
            }
            serial = devices.get(0);
        }

        UiAutomator2Options options = new UiAutomator2Options()
                .setUdid(serial)
                .setNoReset(true)
                .setNewCommandTimeout(Duration.ofMinutes(3))
                .setAdbExecTimeout(Duration.ofSeconds(120));

        logger.info("Connecting to {} through {}", serial, config.getAppiumServerUrl());
        AndroidDriver driver = new AndroidDriver(new URL(config.getAppiumServerUrl()), options);
        return new AppiumDeviceBridge(driver, adb, serial);
    }

    public String getSerial() {
        return serial;
    }

    // ---- ScreenReader ----

    @Override
    public ScreenSnapshot capture(int maxNodes) {
        return ScreenSnapshotProvider.capture(activeRoot(), maxNodes);
    }

    @Override
    public UiTreeNode activeRoot() {
        if (closed) {
            return null;
        }
        try {
            return UiHierarchyParser.parseActiveWindow(driver.getPageSource());
        } catch (WebDriverException e) {
            logger.warn("Failed to read page source: {}", e.getMessage());
            return null;
        } catch (IllegalArgumentException e) {
            logger.warn("Unparseable page source: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isConnected() {
        return !closed && driver.getSessionId() != null;
    }

    // ---- DeviceActions ----

    @Override
    public boolean click(UiTreeNode node) {
        WebElement element = locate(node);
        if (element == null) {
            return false;
        }
        try {
            element.click();
            return true;
        } catch (WebDriverException e) {
            logger.debug("Click failed at {}: {}", node.getBounds(), e.getMessage());
            return false;
        }
    }

    @Override
    public boolean setText(UiTreeNode node, String text) {
        WebElement element = locate(node);
        if (element == null) {
            return false;
        }
        try {
            element.click();
            element.clear();
            element.sendKeys(text);
            return true;
        } catch (WebDriverException e) {
            logger.debug("Set text failed at {}: {}", node.getBounds(), e.getMessage());
            return false;
        }
    }

    @Override
    public boolean performAction(UiTreeNode node, NodeAction action) {
        if (action == null || action.getId() != XmlUiNode.ACTION_IME_SEARCH) {
            return false;
        }
        try {
            driver.executeScript("mobile: performEditorAction", Collections.singletonMap("action", "search"));
            return true;
        } catch (WebDriverException e) {
            logger.debug("Editor action failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public CompletableFuture<Boolean> tap(int x, int y, long durationMs) {
        return CompletableFuture.supplyAsync(() -> {
            PointerInput finger = new PointerInput(PointerInput.Kind.TOUCH, "finger");
            Sequence tap = new Sequence(finger, 1);
            tap.addAction(finger.createPointerMove(Duration.ZERO, PointerInput.Origin.viewport(), x, y));
            tap.addAction(finger.createPointerDown(PointerInput.MouseButton.LEFT.asArg()));
            tap.addAction(new Pause(finger, Duration.ofMillis(durationMs)));
            tap.addAction(finger.createPointerUp(PointerInput.MouseButton.LEFT.asArg()));
            return dispatch(tap, "tap");
        }, gestureExecutor);
    }

    @Override
    public CompletableFuture<Boolean> swipe(SwipeDirection direction, float distanceRatio, long durationMs) {
        return CompletableFuture.supplyAsync(() -> {
            Dimension size;
            try {
                size = driver.manage().window().getSize();
            } catch (WebDriverException e) {
                logger.debug("Window size unavailable: {}", e.getMessage());
                return false;
            }
            int[] path = swipePath(direction, distanceRatio, size.getWidth(), size.getHeight());
            PointerInput finger = new PointerInput(PointerInput.Kind.TOUCH, "finger");
            Sequence swipe = new Sequence(finger, 1);
            swipe.addAction(finger.createPointerMove(Duration.ZERO, PointerInput.Origin.viewport(), path[0], path[1]));
            swipe.addAction(finger.createPointerDown(PointerInput.MouseButton.LEFT.asArg()));
            swipe.addAction(finger.createPointerMove(Duration.ofMillis(durationMs), PointerInput.Origin.viewport(),
                    path[2], path[3]));
            swipe.addAction(finger.createPointerUp(PointerInput.MouseButton.LEFT.asArg()));
            return dispatch(swipe, "swipe");
        }, gestureExecutor);
    }

    /**
     * Start and end points of a swipe centred on the screen, as {startX, startY, endX, endY}.
     * "up" moves the finger upwards, scrolling content further down the page.
     */
    static int[] swipePath(SwipeDirection direction, float ratio, int width, int height) {
        int cx = width / 2;
        int cy = height / 2;
        int dy = Math.round(height * ratio / 2f);
        int dx = Math.round(width * ratio / 2f);
        switch (direction) {
            case UP:
                return new int[]{cx, cy + dy, cx, cy - dy};
            case DOWN:
                return new int[]{cx, cy - dy, cx, cy + dy};
            case LEFT:
                return new int[]{cx + dx, cy, cx - dx, cy};
            case RIGHT:
            default:
                return new int[]{cx - dx, cy, cx + dx, cy};
        }
    }

    @Override
    public boolean runGlobalAction(GlobalAction action) {
        try {
            switch (action) {
                case HOME:
                    driver.pressKey(new KeyEvent(AndroidKey.HOME));
                    return true;
                case BACK:
                    driver.pressKey(new KeyEvent(AndroidKey.BACK));
                    return true;
                case RECENTS:
                    driver.pressKey(new KeyEvent(AndroidKey.APP_SWITCH));
                    return true;
                case NOTIFICATIONS:
                    driver.openNotifications();
                    return true;
                case QUICK_SETTINGS:
                    adb.executeShell(serial, "cmd statusbar expand-settings");
                    return true;
                case POWER_DIALOG:
                    driver.longPressKey(new KeyEvent(AndroidKey.POWER));
                    return true;
                case LOCK_SCREEN:
                    driver.lockDevice();
                    return true;
                default:
                    return false;
            }
        } catch (WebDriverException | IOException e) {
            logger.warn("Global action {} failed: {}", action.getWireName(), e.getMessage());
            return false;
        }
    }

    @Override
    public int displayWidth() {
        try {
            return driver.manage().window().getSize().getWidth();
        } catch (WebDriverException e) {
            logger.debug("Window size unavailable: {}", e.getMessage());
            return 0;
        }
    }

    @Override
    public boolean openDeepLink(String uri, String packageName) {
        Map<String, Object> args = new HashMap<>();
        args.put("url", uri);
        args.put("package", packageName);
        try {
            driver.executeScript("mobile: deepLink", args);
            return true;
        } catch (WebDriverException e) {
            logger.debug("mobile: deepLink failed for {}, trying am start: {}", packageName, e.getMessage());
        }
        try {
            return adb.openUri(serial, uri, packageName);
        } catch (IOException e) {
            logger.warn("Deep link into {} failed: {}", packageName, e.getMessage());
            return false;
        }
    }

    // ---- AppRegistry ----

    @Override
    public List<LaunchableApp> listLaunchableApps() {
        try {
            return adb.listLaunchableApps(serial);
        } catch (IOException e) {
            logger.warn("Failed to list launchable apps: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    @Override
    public boolean isInstalled(String packageName) {
        try {
            return driver.isAppInstalled(packageName);
        } catch (WebDriverException e) {
            logger.debug("isAppInstalled failed, asking adb: {}", e.getMessage());
        }
        try {
            return adb.isInstalled(serial, packageName);
        } catch (IOException e) {
            logger.warn("Install check for {} failed: {}", packageName, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean launch(String packageName) {
        try {
            driver.activateApp(packageName);
            return true;
        } catch (WebDriverException e) {
            logger.debug("activateApp failed for {}, trying monkey: {}", packageName, e.getMessage());
        }
        try {
            return adb.launch(serial, packageName);
        } catch (IOException e) {
            logger.warn("Launch of {} failed: {}", packageName, e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        gestureExecutor.shutdownNow();
        try {
            driver.quit();
        } catch (WebDriverException e) {
            logger.warn("Failed to quit driver: {}", e.getMessage());
        }
    }

    private boolean dispatch(Sequence sequence, String name) {
        try {
            driver.perform(Collections.singletonList(sequence));
            return true;
        } catch (WebDriverException e) {
            logger.debug("{} gesture failed: {}", name, e.getMessage());
            return false;
        }
    }

    private WebElement locate(UiTreeNode node) {
        if (node == null) {
            return null;
        }
        Bounds bounds = node.getBounds();
        StringBuilder xpath = new StringBuilder("//*[@bounds='").append(bounds).append("'");
        String viewId = node.getViewId();
        if (viewId != null && !viewId.isEmpty() && viewId.indexOf('\'') < 0) {
            xpath.append(" and @resource-id='").append(viewId).append("'");
        }
        xpath.append("]");
        try {
            List<WebElement> elements = driver.findElements(AppiumBy.xpath(xpath.toString()));
            return elements.isEmpty() ? null : elements.get(0);
        } catch (WebDriverException e) {
            logger.debug("Element lookup failed for {}: {}", xpath, e.getMessage());
            return null;
        }
    }
}
