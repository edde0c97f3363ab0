package com.qgistoolkit.util;

import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;

/**
 * Small DOM helpers over unqualified tag names.
 */
public final class XmlElements {

    private XmlElements() {
    }

    /**
     * Direct child elements of {@code parent}, optionally restricted to one tag name.
     *
     * @param parent parent element
     * @param tagName tag name, or {@code null} for every child element
     * @return child elements in document order
     */
    public static List<Element> children(Element parent, String tagName) {
        List<Element> result = new ArrayList<>();
        if (parent == null) {
            return result;
        }
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE
                    && (tagName == null || tagName.equals(node.getNodeName()))) {
                result.add((Element) node);
            }
        }
        return result;
    }

    public static Element firstChild(Element parent, String tagName) {
        List<Element> matches = children(parent, tagName);
        return matches.isEmpty() ? null : matches.get(0);
    }

    public static Element firstDescendant(Element parent, String tagName) {
        if (parent == null) {
            return null;
        }
        NodeList nodes = parent.getElementsByTagName(tagName);
        return nodes.getLength() > 0 ? (Element) nodes.item(0) : null;
    }

    public static List<Element> descendants(Element parent, String tagName) {
        List<Element> result = new ArrayList<>();
        if (parent == null) {
            return result;
        }
        NodeList nodes = parent.getElementsByTagName(tagName);
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    /**
     * Text of the first direct child with the given tag.
     *
     * @return text content, or {@code null} when there is no such child
     */
    public static String childText(Element parent, String tagName) {
        Element child = firstChild(parent, tagName);
        return child != null ? child.getTextContent() : null;
    }

    /**
     * Attribute value, distinguishing a missing attribute ({@code null}) from an empty one.
     */
    public static String attribute(Element element, String name) {
        if (element == null || !element.hasAttribute(name)) {
            return null;
        }
        return element.getAttribute(name);
    }

    /**
     * Copies every attribute of {@code source} onto {@code target}.
     */
    public static void copyAttributes(Element source, Element target) {
        if (source == null) {
            return;
        }
        NamedNodeMap attributes = source.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Node attribute = attributes.item(i);
            target.setAttribute(attribute.getNodeName(), attribute.getNodeValue());
        }
    }
}
