package com.deviceagents.automation;

import com.deviceagents.device.DeviceSession;
import com.deviceagents.screen.NodeQueryEngine;
import com.deviceagents.screen.ScreenStateGuards;
import com.deviceagents.testing.FakeDevice;
import com.deviceagents.testing.FakeNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static com.deviceagents.testing.FakeNode.button;
import static com.deviceagents.testing.FakeNode.editText;
import static com.deviceagents.testing.FakeNode.text;
import static com.deviceagents.testing.FakeNode.window;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class UiSearchAutomationTest {

    private static final String PKG = "com.food";
    private static final int IME_SEARCH = 0x01000000;

    private FakeDevice device;
    private UiSearchAutomation automation;

    @BeforeEach
    public void setUp() {
        device = new FakeDevice();
        DeviceSession session = device.session();
        automation = new UiSearchAutomation(session, new NodeQueryEngine(device, 500L), new ScreenStateGuards(session));
    }

    @Test
    public void testDismissesPopupThenTypesAndSubmits() {
        FakeNode loading = window(PKG, text("Loading"));
        FakeNode home = window(PKG,
                editText("com.food:id/search_input").action(IME_SEARCH, "Search"),
                text("Popular dishes"));
        FakeNode popup = window(PKG,
                text("Turn on notifications?"),
                button("Not now").onClick(() -> {
                    device.show(loading);
                    device.showAfter(500L, home);
                }));
        device.show(popup);
        device.onTextTyped("pizza", () -> device.show(window(PKG,
                editText("com.food:id/search_input").hint("Search"),
                text("pizza near me"),
                text("Pizza Palace"))));

        UiSearchExecution execution = automation.run(UiSearchRequest.builder("pizza", PKG)
                .closePopups(true)
                .submitSearch(true)
                .build());

        assertTrue(execution.isSuccess());
        assertTrue(execution.isTyped());
        assertTrue(execution.isQueryVisible());
        assertTrue(execution.isPopupDismissed());
        assertTrue(execution.isSubmitted());
        assertTrue(execution.isInputFound());
        assertFalse(execution.isTriggerTapped());
        assertEquals(PKG, execution.getActualPackage());
        assertEquals(1, device.textEntries().size());
    }

    @Test
    public void testTapsTriggerWhenNoInputIsVisible() {
        FakeNode searchPage = window(PKG, editText("com.food:id/field").focused());
        device.show(window(PKG,
                new FakeNode().desc("Search").clickable().onClick(() -> device.show(searchPage)),
                text("Today")));

        UiSearchExecution execution = automation.run(UiSearchRequest.builder("  sushi ", PKG).build());

        assertTrue(execution.isSuccess());
        assertTrue(execution.isTriggerTapped());
        assertEquals("sushi", device.textEntries().get(0).text);
    }

    @Test
    public void testAttemptsAreBoundedWhenAnotherAppIsInFront() {
        device.show(window("com.other", text("Home")));

        UiSearchExecution execution = automation.run(UiSearchRequest.builder("pizza", PKG).maxAttempts(3).build());

        assertFalse(execution.isSuccess());
        assertEquals(3, device.captureCount());
        assertEquals("com.other", execution.getActualPackage());
        assertEquals("Foreground package changed to 'com.other' while waiting for 'com.food'.", execution.getError());
        assertTrue(device.interactions().isEmpty());
    }

    @Test
    public void testMissingInputIsReported() {
        device.show(window(PKG, text("Nothing to search here")));

        UiSearchExecution execution = automation.run(UiSearchRequest.builder("pizza", PKG).maxAttempts(2).build());

        assertFalse(execution.isSuccess());
        assertFalse(execution.isInputFound());
        assertEquals("No search input was found on the current screen.", execution.getError());
    }

    @Test
    public void testRejectedTypingIsReported() {
        device.show(window(PKG, editText("com.food:id/search_input").rejectText()));

        UiSearchExecution execution = automation.run(UiSearchRequest.builder("pizza", PKG).maxAttempts(2).build());

        assertFalse(execution.isSuccess());
        assertTrue(execution.isInputFound());
        assertFalse(execution.isTyped());
        assertEquals("A search input was found, but typing the query failed.", execution.getError());
    }

    @Test
    public void testTypedButInvisibleQueryIsNotSuccess() {
        device.show(window(PKG, editText("com.food:id/search_input")));
        device.onTextTyped("pizza", () -> device.show(window(PKG,
                editText("com.food:id/search_input"), text("Recent searches"))));

        UiSearchExecution execution = automation.run(UiSearchRequest.builder("pizza", PKG).maxAttempts(2).build());

        assertFalse(execution.isSuccess());
        assertTrue(execution.isTyped());
        assertFalse(execution.isQueryVisible());
        assertEquals("Query text could not be verified on screen after typing.", execution.getError());
    }

    @Test
    public void testSubmitRequiredButUnavailable() {
        device.show(window(PKG, editText("com.food:id/search_input")));

        UiSearchExecution execution = automation.run(UiSearchRequest.builder("pizza", PKG)
                .submitSearch(true)
                .maxAttempts(1)
                .build());

        assertFalse(execution.isSuccess());
        assertFalse(execution.isSubmitted());
        assertEquals("Query was typed but submit action could not be triggered.", execution.getError());
    }

    @Test
    public void testUnavailableWithoutScreenConnection() {
        device.disconnect();

        UiSearchExecution execution = automation.run(UiSearchRequest.builder("pizza", PKG).build());

        assertFalse(execution.isSuccess());
        assertEquals("Accessibility service is not connected.", execution.getError());
        assertEquals(0, device.captureCount());
    }

    @Test
    public void testBlankQueryIsRejected() {
        device.show(window(PKG));

        assertEquals("Search query cannot be empty.",
                automation.run(UiSearchRequest.builder("   ", PKG).build()).getError());
    }

    @Test
    public void testEmptyHintListsKeepDefaults() {
        UiSearchRequest request = UiSearchRequest.builder("q", PKG)
                .searchTriggerHints(Collections.<String>emptyList())
                .dismissHints(null)
                .build();

        assertEquals(UiSearchDefaults.TRIGGER_HINTS, request.getSearchTriggerHints());
        assertEquals(UiSearchDefaults.DISMISS_HINTS, request.getDismissHints());
        assertFalse(request.isClosePopups());
        assertFalse(request.isSubmitSearch());
    }
}
