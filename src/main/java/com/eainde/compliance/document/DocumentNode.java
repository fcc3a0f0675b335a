package com.eainde.compliance.document;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable element of a parsed document tree.
 *
 * @param tag        lower-case element name
 * @param attributes attribute name to value, source order
 * @param children   child elements, document order
 * @param text       the element's own text, excluding descendants
 */
public record DocumentNode(String tag, Map<String, String> attributes, List<DocumentNode> children, String text) {

    public DocumentNode {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("tag must not be blank");
        }
        tag = tag.toLowerCase(Locale.ROOT);
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        children = children == null ? List.of() : List.copyOf(children);
        text = text == null ? "" : text;
    }

    public static DocumentNode element(String tag, Map<String, String> attributes, DocumentNode... children) {
        return new DocumentNode(tag, attributes, Arrays.asList(children), "");
    }

    public static DocumentNode element(String tag, DocumentNode... children) {
        return element(tag, Map.of(), children);
    }

    public static DocumentNode text(String tag, Map<String, String> attributes, String text) {
        return new DocumentNode(tag, attributes, List.of(), text);
    }

    public static DocumentNode text(String tag, String text) {
        return text(tag, Map.of(), text);
    }

    /** Attribute value, or null when absent. Attribute names are matched case-insensitively. */
    public String attr(String name) {
        String value = attributes.get(name);
        if (value != null) return value;
        for (Map.Entry<String, String> e : attributes.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) return e.getValue();
        }
        return null;
    }

    public boolean hasAttr(String name) {
        return attr(name) != null;
    }

    public boolean hasNonBlankAttr(String name) {
        String value = attr(name);
        return value != null && !value.isBlank();
    }

    public boolean is(String... tags) {
        for (String t : tags) {
            if (tag.equals(t)) return true;
        }
        return false;
    }

    public List<String> classes() {
        String value = attr("class");
        if (value == null || value.isBlank()) return List.of();
        return List.of(value.strip().split("\\s+"));
    }

    /** Own text plus all descendant text, space-joined and trimmed. */
    public String textContent() {
        StringBuilder sb = new StringBuilder();
        Deque<DocumentNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            DocumentNode node = stack.pop();
            if (!node.text.isEmpty()) sb.append(node.text).append(' ');
            for (int i = node.children.size() - 1; i >= 0; i--) {
                stack.push(node.children.get(i));
            }
        }
        return sb.toString().replaceAll("\\s+", " ").strip();
    }
}
