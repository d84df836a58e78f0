package com.deviceagents.screen;

import com.deviceagents.device.DeviceSession;
import com.deviceagents.testing.FakeDevice;
import com.deviceagents.testing.FakeNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import static com.deviceagents.testing.FakeNode.text;
import static com.deviceagents.testing.FakeNode.window;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ScreenStateGuardsTest {

    private FakeDevice device;
    private ScreenStateGuards guards;

    @BeforeEach
    public void setUp() {
        device = new FakeDevice();
        guards = new ScreenStateGuards(device.session());
    }

    @Test
    public void testForegroundWaitTimesOutAfterPolling() {
        device.show(window("com.other", text("Home")));
        long start = device.now();

        ScreenSnapshot result = guards.waitForForegroundPackage(Collections.singleton("com.example"), 1_000L, 250L);

        assertNull(result);
        assertEquals(5, device.captureCount());
        assertEquals(1_000L, device.now() - start);
    }

    @Test
    public void testForegroundWaitReturnsMatchingSnapshot() {
        device.show(window("com.other", text("Home")));
        device.showAfter(600L, window("com.example", text("Inbox")));

        ScreenSnapshot result = guards.waitForForegroundPackage(
                new HashSet<>(Arrays.asList("com.example", "com.example.lite")), 5_000L, 250L);

        assertNotNull(result);
        assertEquals("com.example", result.getPackageName());
        assertEquals(4, device.captureCount());
    }

    @Test
    public void testForegroundWaitWithoutScreenConnection() {
        device.disconnect();

        assertNull(guards.waitForForegroundPackage(Collections.singleton("com.example"), 500L, 250L));
    }

    @Test
    public void testInterruptedPauseStopsWaiting() {
        DeviceSession interrupting = new DeviceSession(device, device, device,
                millis -> {
                    throw new InterruptedException();
                }, device::now);
        ScreenStateGuards interruptedGuards = new ScreenStateGuards(interrupting);
        device.show(window("com.other"));

        assertNull(interruptedGuards.waitForForegroundPackage(Collections.singleton("com.example"), 5_000L, 250L));
        assertTrue(Thread.interrupted());
    }

    @Test
    public void testCheckpointRecordsPackageAndHighlights() {
        device.show(window("com.example", text("Chats"), text("Chats"), new FakeNode().desc("New chat")));

        ScreenCheckpoint checkpoint = guards.captureCheckpoint("after_open", "com.example");

        assertTrue(checkpoint.isMatchedExpectedPackage());
        assertEquals(Arrays.asList("Chats", "New chat"), checkpoint.getHighlights());
        assertEquals("after_open", checkpoint.toJson().getString("step"));
    }

    @Test
    public void testCheckpointWithoutSnapshot() {
        ScreenCheckpoint checkpoint = ScreenStateGuards.checkpointOf("before_open", "com.example", null);

        assertFalse(checkpoint.isMatchedExpectedPackage());
        assertEquals("", checkpoint.getActualPackage());
        assertTrue(checkpoint.getHighlights().isEmpty());
    }

    @Test
    public void testHighlightsLimit() {
        FakeNode root = window("com.example");
        for (int i = 0; i < 15; i++) {
            root.children(text("item " + i));
        }
        ScreenSnapshot snapshot = ScreenSnapshotProvider.capture(root, 50);

        List<String> highlights = ScreenStateGuards.highlights(snapshot);

        assertEquals(ScreenStateGuards.DEFAULT_HIGHLIGHT_LIMIT, highlights.size());
        assertEquals("item 0", highlights.get(0));
    }

    @Test
    public void testContainsTextLiteralAndTokens() {
        ScreenSnapshot snapshot = ScreenSnapshotProvider.capture(
                window("com.example", text("Best pizza near me"), text("Open now")), 50);

        assertTrue(ScreenStateGuards.containsText(snapshot, "PIZZA"));
        assertTrue(ScreenStateGuards.containsText(snapshot, "cheap pizza"));
        assertTrue(ScreenStateGuards.containsText(snapshot, "pizza open late"));
        assertFalse(ScreenStateGuards.containsText(snapshot, "pizza delivery tonight"));
        assertFalse(ScreenStateGuards.containsText(snapshot, "go to"));
        assertFalse(ScreenStateGuards.containsText(snapshot, "  "));
        assertFalse(ScreenStateGuards.containsText(null, "pizza"));
    }

    @Test
    public void testContainsPhoneUsesLastSixDigits() {
        ScreenSnapshot snapshot = ScreenSnapshotProvider.capture(
                window("com.whatsapp", text("+1 (555) 123-4567")), 50);

        assertTrue(ScreenStateGuards.containsPhone(snapshot, "5551234567"));
        assertTrue(ScreenStateGuards.containsPhone(snapshot, "00 234 567"));
        assertFalse(ScreenStateGuards.containsPhone(snapshot, "4567"));
        assertFalse(ScreenStateGuards.containsPhone(snapshot, "999999"));
    }
}
