package com.deviceagents.automation;

import com.deviceagents.screen.ScreenSnapshot;
import com.deviceagents.screen.ScreenStateGuards;
import com.deviceagents.testing.FakeDevice;
import com.deviceagents.testing.FakeNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.deviceagents.testing.FakeNode.editText;
import static com.deviceagents.testing.FakeNode.text;
import static com.deviceagents.testing.FakeNode.window;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ScreenReadinessTest {

    private static final String PKG = "com.food";

    private FakeDevice device;
    private ScreenReadiness readiness;

    @BeforeEach
    public void setUp() {
        device = new FakeDevice();
        readiness = new ScreenReadiness(new ScreenStateGuards(device.session()));
    }

    private static FakeNode homeScreen() {
        return window(PKG, text("Home"), text("Offers"), text("Orders"), text("Account"),
                text("Burgers"), text("Salads"), text("Desserts"));
    }

    @Test
    public void testReadyAfterStableSnapshots() {
        device.show(homeScreen());

        ScreenSnapshot ready = readiness.waitForScreenReady(PKG, 5_000L, 200L);

        assertNotNull(ready);
        assertEquals(4, device.captureCount());
    }

    @Test
    public void testSparseScreenNeverReady() {
        device.show(window(PKG, text("Loading")));

        assertNull(readiness.waitForScreenReady(PKG, 1_000L, 200L));
    }

    @Test
    public void testResultsConfirmedTwice() {
        device.show(window(PKG,
                editText("com.food:id/search_input"),
                text("All"), text("Images"), text("pizza near me"), text("Pizza Palace")));

        ScreenSnapshot results = readiness.waitForSearchResults(PKG, "pizza", 5_000L, 200L);

        assertNotNull(results);
        assertEquals(2, device.captureCount());
    }

    @Test
    public void testResultsRequireExpectedPackage() {
        device.show(window("com.other", text("pizza near me"), text("All")));

        assertNull(readiness.waitForSearchResults(PKG, "pizza", 1_000L, 200L));
    }

    @Test
    public void testQueryOnlyInsideTextFieldIsNotResults() {
        FakeNode field = editText("com.food:id/search_input");
        field.setText("pizza");
        device.show(window(PKG, field));
        ScreenSnapshot snapshot = device.capture(50);

        assertFalse(ScreenReadiness.isLikelyResultsScreen(snapshot, "pizza"));
    }

    @Test
    public void testSimilarity() {
        assertEquals(1.0, ScreenReadiness.similarity("abc", "abc"));
        assertEquals(0.0, ScreenReadiness.similarity("", "abc"));
        assertEquals(3, ScreenReadiness.levenshtein("kitten", "sitting"));
        assertTrue(ScreenReadiness.similarity("home|offers|orders", "home|offers|order") >= 0.9);
    }
}
