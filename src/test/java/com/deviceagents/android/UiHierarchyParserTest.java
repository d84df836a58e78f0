package com.deviceagents.android;

import com.deviceagents.device.Bounds;
import com.deviceagents.device.UiTreeNode;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class UiHierarchyParserTest {

    static String pageSource() throws IOException {
        try (InputStream in = UiHierarchyParserTest.class.getResourceAsStream("/android/page-source.xml")) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    public void testParsesEveryWindow() throws IOException {
        List<XmlUiNode> windows = UiHierarchyParser.parseWindows(pageSource());

        assertEquals(3, windows.size());
        assertEquals("com.android.systemui", windows.get(0).getPackageName());
        assertEquals("com.google.android.inputmethod.latin", windows.get(2).getPackageName());
    }

    @Test
    public void testActiveWindowSkipsSystemUiAndKeyboard() throws IOException {
        XmlUiNode root = UiHierarchyParser.parseActiveWindow(pageSource());

        assertEquals("com.whatsapp", root.getPackageName());
        assertEquals(3, root.getChildCount());

        UiTreeNode row = root.getChild(0);
        assertTrue(row.isClickable());
        UiTreeNode name = row.getChild(0);
        assertEquals("Alice Smith", name.getText());
        assertEquals("com.whatsapp:id/conversations_row_contact_name", name.getViewId());
        assertSame(row, name.getParent());
        assertEquals(new Bounds(200, 220, 800, 280), name.getBounds());
        assertTrue(name.getActions().isEmpty());
    }

    @Test
    public void testEditTextAttributes() throws IOException {
        UiTreeNode search = UiHierarchyParser.parseActiveWindow(pageSource()).getChild(1);

        assertEquals("android.widget.EditText", search.getClassName());
        assertEquals("Search...", search.getHintText());
        assertTrue(search.isFocused());
        assertEquals(1, search.getActions().size());
        assertEquals(XmlUiNode.ACTION_IME_SEARCH, search.getActions().get(0).getId());
    }

    @Test
    public void testSearchActionOnlyOnSearchOrFocusedFields() {
        String xml = "<hierarchy>"
                + "<android.widget.FrameLayout package=\"com.notes\" class=\"android.widget.FrameLayout\">"
                + "<android.widget.EditText package=\"com.notes\" class=\"android.widget.EditText\""
                + " resource-id=\"com.notes:id/note_body\" hint=\"Write a note\" focused=\"false\" />"
                + "<android.widget.EditText package=\"com.notes\" class=\"android.widget.EditText\""
                + " resource-id=\"com.notes:id/title\" focused=\"true\" />"
                + "<android.widget.EditText package=\"com.notes\" class=\"android.widget.EditText\""
                + " resource-id=\"com.notes:id/query\" focused=\"false\" />"
                + "</android.widget.FrameLayout>"
                + "</hierarchy>";

        XmlUiNode root = UiHierarchyParser.parseActiveWindow(xml);

        assertTrue(root.getChild(0).getActions().isEmpty());
        assertEquals(1, root.getChild(1).getActions().size());
        assertEquals(XmlUiNode.ACTION_IME_SEARCH, root.getChild(2).getActions().get(0).getId());
    }

    @Test
    public void testMalformedBoundsAreEmpty() throws IOException {
        UiTreeNode newChat = UiHierarchyParser.parseActiveWindow(pageSource()).getChild(2);

        assertEquals("New chat", newChat.getContentDescription());
        assertTrue(newChat.getBounds().isEmpty());
    }

    @Test
    public void testParseBounds() {
        assertEquals(new Bounds(-5, 10, 1080, 2400), UiHierarchyParser.parseBounds("[-5,10][1080,2400]"));
        assertSame(Bounds.EMPTY, UiHierarchyParser.parseBounds("[1,2][3]"));
        assertSame(Bounds.EMPTY, UiHierarchyParser.parseBounds(null));
    }

    @Test
    public void testOnlySystemWindowsFallsBackToFirst() {
        String xml = "<hierarchy>"
                + "<node package=\"com.android.systemui\" class=\"android.widget.FrameLayout\"/>"
                + "<node package=\"com.samsung.android.honeyboard.inputmethod\"/>"
                + "</hierarchy>";

        assertEquals("com.android.systemui", UiHierarchyParser.parseActiveWindow(xml).getPackageName());
    }

    @Test
    public void testSingleRootWithoutHierarchy() {
        XmlUiNode root = UiHierarchyParser.parseActiveWindow(
                "<node package=\"com.example\" class=\"android.widget.FrameLayout\" text=\"Hi\"/>");

        assertEquals("com.example", root.getPackageName());
        assertEquals("Hi", root.getText());
        assertFalse(root.isClickable());
    }

    @Test
    public void testEmptyAndInvalidSources() {
        assertNull(UiHierarchyParser.parseActiveWindow(""));
        assertNull(UiHierarchyParser.parseActiveWindow("<hierarchy></hierarchy>"));
        assertThrows(IllegalArgumentException.class, () -> UiHierarchyParser.parseActiveWindow("<hierarchy><node>"));
    }
}
