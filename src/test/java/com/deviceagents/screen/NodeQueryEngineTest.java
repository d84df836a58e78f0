package com.deviceagents.screen;

import com.deviceagents.device.SwipeDirection;
import com.deviceagents.device.UiTreeNode;
import com.deviceagents.testing.FakeDevice;
import com.deviceagents.testing.FakeNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.concurrent.CompletableFuture;

import static com.deviceagents.testing.FakeNode.button;
import static com.deviceagents.testing.FakeNode.group;
import static com.deviceagents.testing.FakeNode.text;
import static com.deviceagents.testing.FakeNode.window;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class NodeQueryEngineTest {

    private FakeDevice device;
    private NodeQueryEngine queries;

    @BeforeEach
    public void setUp() {
        device = new FakeDevice();
        queries = new NodeQueryEngine(device, 500L);
    }

    @Test
    public void testFindByTextExactAndSubstring() {
        FakeNode settings = text("Settings");
        FakeNode advanced = text("Advanced settings");
        FakeNode root = window("com.example", settings, advanced);

        assertSame(settings, queries.findByText(root, "settings", true));
        assertSame(settings, queries.findByText(root, "SETT", false));
        assertSame(advanced, queries.findByText(root, "settings", false, 2));
        assertNull(queries.findByText(root, "settings", true, 2));
        assertNull(queries.findByText(root, "  ", false));
    }

    @Test
    public void testFindByTextMatchesDescription() {
        FakeNode icon = new FakeNode().desc("Open menu");
        FakeNode root = window("com.example", icon);

        assertSame(icon, queries.findByText(root, "menu", false));
        assertSame(icon, queries.findByContentDescription(root, "OPEN"));
    }

    @Test
    public void testIdHintsAreTriedInOrder() {
        FakeNode query = text("").id("com.example:id/query");
        FakeNode search = text("").id("com.example:id/search_box");
        FakeNode root = window("com.example", query, search);

        assertSame(search, queries.findByIdHints(root, Arrays.asList("search", "query")));
        assertSame(query, queries.findByIdHints(root, Arrays.asList("missing", "query")));
        assertNull(queries.findByIdHints(root, Arrays.asList("nothing")));
    }

    @Test
    public void testClickFallsBackToClickableAncestor() {
        FakeNode label = text("Alice");
        FakeNode row = group(label).clickable();
        window("com.example", row);

        assertTrue(queries.clickNodeOrAncestor(label));
        assertSame(row, device.interactions().get(0).node);
    }

    @Test
    public void testClickFailsWithoutClickableChain() {
        FakeNode label = text("Alice");
        window("com.example", group(label));

        assertFalse(queries.clickNodeOrAncestor(label));
        assertTrue(device.interactions().isEmpty());
    }

    @Test
    public void testTapVisibleNodeByTextClicks() {
        FakeNode root = window("com.example", button("Continue"));

        TapResult result = queries.tapVisibleNodeByText(root, "continue", true, 1);

        assertTrue(result.isSuccess());
        assertEquals("com.example", result.getPackageName());
        assertEquals("Continue", result.getMatchedText());
        assertTrue(device.gestures().isEmpty());
    }

    @Test
    public void testTapVisibleNodeByTextFallsBackToBoundsCentre() {
        FakeNode root = window("com.example", text("Static label").bounds(100, 200, 300, 260));

        TapResult result = queries.tapVisibleNodeByText(root, "label", false, 1);

        assertTrue(result.isSuccess());
        assertEquals(Arrays.asList("tap 200,230 80"), device.gestures());
    }

    @Test
    public void testTapVisibleNodeByTextErrors() {
        assertEquals("No active window found. Unlock your phone and open an app.",
                queries.tapVisibleNodeByText(null, "x", false, 1).getError());

        FakeNode root = window("com.example", text("Something"));
        assertEquals("No matching node found for 'Other'.",
                queries.tapVisibleNodeByText(root, "Other", false, 1).getError());

        FakeNode noBounds = window("com.example", text("Empty").bounds(0, 0, 0, 0));
        assertEquals("Found a matching node, but click action failed.",
                queries.tapVisibleNodeByText(noBounds, "Empty", true, 1).getError());
    }

    @Test
    public void testSkipEditableIgnoresTypedText() {
        FakeNode field = FakeNode.editText("com.example:id/entry");
        field.setText("Send");
        FakeNode root = window("com.example", field);

        assertFalse(queries.tapVisibleNodeByText(root, "Send", false, 1, true).isSuccess());
    }

    @Test
    public void testGestureParametersAreClamped() {
        assertTrue(queries.tap(10, 20, 5));
        assertTrue(queries.swipe(SwipeDirection.UP, 2.0f, 10_000L));

        assertEquals("tap 10,20 40", device.gestures().get(0));
        assertEquals("swipe UP 0.9 1500", device.gestures().get(1));
        assertFalse(queries.swipe(null, 0.5f, 300L));
    }

    @Test
    public void testFailedGestureReportsFalse() {
        device.failGestures();

        assertFalse(queries.tap(1, 1, 80));
    }

    @Test
    public void testSearchIgnoresMissingChildren() {
        FakeNode target = text("found");
        FakeNode holey = new FakeNode() {
            @Override
            public int getChildCount() {
                return 2;
            }

            @Override
            public UiTreeNode getChild(int index) {
                return index == 1 ? target : null;
            }
        };
        FakeNode root = window("com.example", holey);

        assertSame(target, queries.findByText(root, "found", true));
    }

    @Test
    public void testGestureAwaitTimesOut() {
        CompletableFuture<Boolean> neverCompletes = new CompletableFuture<>();

        assertFalse(Gestures.await(neverCompletes, 10L));
        assertTrue(neverCompletes.isCancelled());
        assertFalse(Gestures.await(null, 10L));
    }
}
