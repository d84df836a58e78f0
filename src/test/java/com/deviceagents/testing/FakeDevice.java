package com.deviceagents.testing;

import com.deviceagents.device.AppRegistry;
import com.deviceagents.device.DeviceActions;
import com.deviceagents.device.DeviceSession;
import com.deviceagents.device.GlobalAction;
import com.deviceagents.device.LaunchableApp;
import com.deviceagents.device.NodeAction;
import com.deviceagents.device.ScreenReader;
import com.deviceagents.device.SwipeDirection;
import com.deviceagents.device.UiTreeNode;
import com.deviceagents.screen.ScreenSnapshot;
import com.deviceagents.screen.ScreenSnapshotProvider;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory device with a virtual clock. Sleeping advances the clock instantly, so polling
 * loops run without real delays.
 */
public class FakeDevice implements ScreenReader, DeviceActions, AppRegistry {

    /** One recorded setText or click, with the foreground package at that moment. */
    public static final class Interaction {
        public final String kind;
        public final UiTreeNode node;
        public final String text;
        public final String foregroundPackage;

        Interaction(String kind, UiTreeNode node, String text, String foregroundPackage) {
            this.kind = kind;
            this.node = node;
            this.text = text;
            this.foregroundPackage = foregroundPackage;
        }
    }

    private long now = 1_000_000L;
    private FakeNode root;
    private FakeNode pendingRoot;
    private long pendingAt;
    private boolean connected = true;
    private boolean gestureResult = true;
    private int captureCount;
    private final List<Interaction> interactions = new ArrayList<>();
    private final List<GlobalAction> globalActions = new ArrayList<>();
    private final List<String> gestures = new ArrayList<>();
    private final List<String> launched = new ArrayList<>();
    private final List<String> deepLinks = new ArrayList<>();
    private final List<LaunchableApp> apps = new ArrayList<>();
    private final Set<String> installed = new HashSet<>();
    private final Set<String> unlaunchable = new HashSet<>();
    private final Map<String, FakeNode> screensOnLaunch = new HashMap<>();
    private final Map<String, Runnable> textHandlers = new HashMap<>();

    public DeviceSession session() {
        return new DeviceSession(this, this, this, millis -> now += millis, () -> now);
    }

    public long now() {
        return now;
    }

    public void advance(long millis) {
        now += millis;
    }

    public void show(FakeNode root) {
        this.root = root;
    }

    /** Replaces the screen once the virtual clock has advanced by {@code delayMs}. */
    public void showAfter(long delayMs, FakeNode screen) {
        this.pendingRoot = screen;
        this.pendingAt = now + delayMs;
    }

    public void disconnect() {
        this.connected = false;
    }

    public void failGestures() {
        this.gestureResult = false;
    }

    public void install(String packageName, String appName) {
        apps.add(new LaunchableApp(packageName, appName));
        installed.add(packageName);
    }

    public void makeUnlaunchable(String packageName) {
        unlaunchable.add(packageName);
    }

    public void onLaunch(String packageName, FakeNode screen) {
        screensOnLaunch.put(packageName, screen);
    }

    /** Runs after setText succeeds on a node whose text equals {@code typed}. */
    public void onTextTyped(String typed, Runnable handler) {
        textHandlers.put(typed, handler);
    }

    public int captureCount() {
        return captureCount;
    }

    public List<Interaction> interactions() {
        return interactions;
    }

    public List<Interaction> textEntries() {
        List<Interaction> out = new ArrayList<>();
        for (Interaction i : interactions) {
            if ("setText".equals(i.kind)) out.add(i);
        }
        return out;
    }

    public List<GlobalAction> globalActions() {
        return globalActions;
    }

    public List<String> gestures() {
        return gestures;
    }

    public List<String> launched() {
        return launched;
    }

    /** Opened deep links as "package uri". */
    public List<String> deepLinks() {
        return deepLinks;
    }

    private String foregroundPackage() {
        activeRoot();
        return root == null ? "" : root.getPackageName();
    }

    // ---- ScreenReader ----

    @Override
    public ScreenSnapshot capture(int maxNodes) {
        captureCount++;
        return ScreenSnapshotProvider.capture(activeRoot(), maxNodes);
    }

    @Override
    public UiTreeNode activeRoot() {
        if (pendingRoot != null && now >= pendingAt) {
            root = pendingRoot;
            pendingRoot = null;
        }
        return connected ? root : null;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    // ---- DeviceActions ----

    @Override
    public boolean click(UiTreeNode node) {
        interactions.add(new Interaction("click", node, null, foregroundPackage()));
        if (!(node instanceof FakeNode)) {
            return false;
        }
        FakeNode fake = (FakeNode) node;
        if (!fake.clickSucceeds()) {
            return false;
        }
        if (fake.clickHandler() != null) {
            fake.clickHandler().run();
        }
        return true;
    }

    @Override
    public boolean setText(UiTreeNode node, String text) {
        interactions.add(new Interaction("setText", node, text, foregroundPackage()));
        if (!(node instanceof FakeNode) || !((FakeNode) node).acceptsText()) {
            return false;
        }
        ((FakeNode) node).setText(text);
        Runnable handler = textHandlers.get(text);
        if (handler != null) {
            handler.run();
        }
        return true;
    }

    @Override
    public boolean performAction(UiTreeNode node, NodeAction action) {
        interactions.add(new Interaction("action:" + action.getLabel(), node, null, foregroundPackage()));
        return true;
    }

    @Override
    public CompletableFuture<Boolean> tap(int x, int y, long durationMs) {
        gestures.add("tap " + x + "," + y + " " + durationMs);
        return CompletableFuture.completedFuture(gestureResult);
    }

    @Override
    public CompletableFuture<Boolean> swipe(SwipeDirection direction, float distanceRatio, long durationMs) {
        gestures.add("swipe " + direction + " " + distanceRatio + " " + durationMs);
        return CompletableFuture.completedFuture(gestureResult);
    }

    @Override
    public boolean runGlobalAction(GlobalAction action) {
        globalActions.add(action);
        return true;
    }

    @Override
    public int displayWidth() {
        return 1080;
    }

    /** Shows the {@link #onLaunch} screen of the package, like a launch would. */
    @Override
    public boolean openDeepLink(String uri, String packageName) {
        deepLinks.add(packageName + " " + uri);
        if (!connected || !installed.contains(packageName) || unlaunchable.contains(packageName)) {
            return false;
        }
        FakeNode screen = screensOnLaunch.get(packageName);
        if (screen != null) {
            root = screen;
        }
        return true;
    }

    // ---- AppRegistry ----

    @Override
    public List<LaunchableApp> listLaunchableApps() {
        return new ArrayList<>(apps);
    }

    @Override
    public boolean isInstalled(String packageName) {
        return installed.contains(packageName);
    }

    @Override
    public boolean launch(String packageName) {
        launched.add(packageName);
        if (!installed.contains(packageName) || unlaunchable.contains(packageName)) {
            return false;
        }
        FakeNode screen = screensOnLaunch.get(packageName);
        if (screen != null) {
            root = screen;
        }
        return true;
    }
}
