package com.deviceagents.android;

import com.deviceagents.device.Bounds;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 解析 UiAutomator2 的 page source（XML）为 {@link XmlUiNode} 树。
 * <p>
 * 根元素为 {@code <hierarchy>}，其子元素是各个窗口。多窗口时（例如输入法弹出），
 * 取第一个不属于系统界面或输入法的窗口作为活动窗口。
 * </p>
 */
public final class UiHierarchyParser {

    private static final Pattern BOUNDS = Pattern.compile("\\[(-?\\d+),(-?\\d+)]\\[(-?\\d+),(-?\\d+)]");
    private static final String SYSTEM_UI_PACKAGE = "com.android.systemui";
    private static final String IME_HINT = "inputmethod";

    private UiHierarchyParser() {
    }

    /**
     * @return root of the active window, or null when the dump has no elements
     * @throws IllegalArgumentException when the XML is malformed
     */
    public static XmlUiNode parseActiveWindow(String pageSource) {
        List<XmlUiNode> windows = parseWindows(pageSource);
        if (windows.isEmpty()) {
            return null;
        }
        for (XmlUiNode window : windows) {
            String pkg = window.getPackageName();
            if (!pkg.isEmpty() && !SYSTEM_UI_PACKAGE.equals(pkg) && !pkg.contains(IME_HINT)) {
                return window;
            }
        }
        return windows.get(0);
    }

    public static List<XmlUiNode> parseWindows(String pageSource) {
        List<XmlUiNode> windows = new ArrayList<>();
        if (pageSource == null || pageSource.trim().isEmpty()) {
            return windows;
        }
        Element root = parseDocument(pageSource).getDocumentElement();
        if (!"hierarchy".equals(root.getTagName())) {
            windows.add(toNode(root));
            return windows;
        }
        for (Element child : childElements(root)) {
            windows.add(toNode(child));
        }
        return windows;
    }

    /**
     * Parses {@code [left,top][right,bottom]}.
     *
     * @return {@link Bounds#EMPTY} when the value is missing or malformed
     */
    public static Bounds parseBounds(String value) {
        if (value == null) {
            return Bounds.EMPTY;
        }
        Matcher m = BOUNDS.matcher(value.trim());
        if (!m.matches()) {
            return Bounds.EMPTY;
        }
        return new Bounds(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                Integer.parseInt(m.group(3)), Integer.parseInt(m.group(4)));
    }

    private static Document parseDocument(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new IllegalArgumentException("Invalid page source: " + e.getMessage(), e);
        }
    }

    // iterative so deep layouts cannot overflow the stack
    private static XmlUiNode toNode(Element element) {
        XmlUiNode root = fromAttributes(element);
        List<Element> pendingElements = new ArrayList<>();
        List<XmlUiNode> pendingNodes = new ArrayList<>();
        pendingElements.add(element);
        pendingNodes.add(root);
        while (!pendingElements.isEmpty()) {
            Element current = pendingElements.remove(pendingElements.size() - 1);
            XmlUiNode currentNode = pendingNodes.remove(pendingNodes.size() - 1);
            for (Element child : childElements(current)) {
                XmlUiNode childNode = fromAttributes(child);
                currentNode.addChild(childNode);
                pendingElements.add(child);
                pendingNodes.add(childNode);
            }
        }
        return root;
    }

    private static XmlUiNode fromAttributes(Element e) {
        String className = e.getAttribute("class");
        if (className.isEmpty()) {
            className = e.getTagName();
        }
        return new XmlUiNode(
                e.getAttribute("text"),
                e.getAttribute("content-desc"),
                className,
                e.getAttribute("resource-id"),
                e.getAttribute("hint"),
                e.getAttribute("package"),
                Boolean.parseBoolean(e.getAttribute("clickable")),
                Boolean.parseBoolean(e.getAttribute("focusable")),
                Boolean.parseBoolean(e.getAttribute("focused")),
                parseBounds(e.getAttribute("bounds")));
    }

    private static List<Element> childElements(Element parent) {
        List<Element> elements = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) node);
            }
        }
        return elements;
    }
}
