package com.williamcallahan.notepreview.domain.markdown;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable node of the markdown syntax tree.
 *
 * <p>Transforms never mutate a node; they build a new one through the {@code with*} helpers,
 * so a tree handed to one stage is never observed changing by another.</p>
 *
 * @param type node kind
 * @param value literal content for leaf kinds (text, code, raw markup, math), empty otherwise
 * @param attributes kind-specific attributes, see the {@code ATTR_*} keys
 * @param children ordered child nodes
 * @param position where the node starts in the source, or null for synthesized nodes
 */
public record SyntaxNode(
    SyntaxNodeType type,
    String value,
    Map<String, Object> attributes,
    List<SyntaxNode> children,
    SourcePosition position
) {

    public static final String ATTR_LEVEL = "level";
    public static final String ATTR_URL = "url";
    public static final String ATTR_TITLE = "title";
    public static final String ATTR_ALT = "alt";
    public static final String ATTR_LANGUAGE = "language";
    public static final String ATTR_START = "start";
    public static final String ATTR_TIGHT = "tight";
    public static final String ATTR_TASK = "task";
    public static final String ATTR_CHECKED = "checked";
    public static final String ATTR_HEADER = "header";
    public static final String ATTR_ALIGN = "align";
    public static final String ATTR_RAW = "raw";
    public static final String ATTR_SLUG = "id";
    public static final String ATTR_DATA_LINE = "data-line";
    public static final String ATTR_KIND = "kind";
    public static final String ATTR_ICON = "icon";
    public static final String ATTR_YAML = "yaml";

    public SyntaxNode {
        Objects.requireNonNull(type, "Syntax node type cannot be null");
        value = value == null ? "" : value;
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Creates a container node.
     */
    public static SyntaxNode of(SyntaxNodeType type, List<SyntaxNode> children, SourcePosition position) {
        return new SyntaxNode(type, "", Map.of(), children, position);
    }

    /**
     * Creates a leaf node carrying literal content.
     */
    public static SyntaxNode leaf(SyntaxNodeType type, String value, SourcePosition position) {
        return new SyntaxNode(type, value, Map.of(), List.of(), position);
    }

    /**
     * Creates a text node without a source position.
     */
    public static SyntaxNode text(String value) {
        return leaf(SyntaxNodeType.TEXT, value, null);
    }

    public SyntaxNode withChildren(List<SyntaxNode> newChildren) {
        return new SyntaxNode(type, value, attributes, newChildren, position);
    }

    public SyntaxNode withValue(String newValue) {
        return new SyntaxNode(type, newValue, attributes, children, position);
    }

    public SyntaxNode withType(SyntaxNodeType newType) {
        return new SyntaxNode(newType, value, attributes, children, position);
    }

    public SyntaxNode withAttribute(String key, Object attributeValue) {
        Map<String, Object> updated = new LinkedHashMap<>(attributes);
        if (attributeValue == null) {
            updated.remove(key);
        } else {
            updated.put(key, attributeValue);
        }
        return new SyntaxNode(type, value, updated, children, position);
    }

    public SyntaxNode withAttributes(Map<String, Object> newAttributes) {
        return new SyntaxNode(type, value, newAttributes, children, position);
    }

    public boolean is(SyntaxNodeType candidate) {
        return type == candidate;
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * Returns a string attribute, or the fallback when absent.
     */
    public String stringAttribute(String key, String fallback) {
        Object attributeValue = attributes.get(key);
        return attributeValue == null ? fallback : attributeValue.toString();
    }

    public boolean booleanAttribute(String key) {
        return Boolean.TRUE.equals(attributes.get(key));
    }

    public int intAttribute(String key, int fallback) {
        Object attributeValue = attributes.get(key);
        return attributeValue instanceof Number number ? number.intValue() : fallback;
    }

    /**
     * Concatenates the literal text of this subtree, rendering breaks as newlines.
     */
    public String plainText() {
        StringBuilder textBuilder = new StringBuilder();
        appendPlainText(this, textBuilder);
        return textBuilder.toString();
    }

    private static void appendPlainText(SyntaxNode node, StringBuilder textBuilder) {
        switch (node.type()) {
            case TEXT, CODE_SPAN, MATH_INLINE -> textBuilder.append(node.value());
            case EMOJI -> textBuilder.append(':').append(node.value()).append(':');
            case SOFT_BREAK, HARD_BREAK -> textBuilder.append('\n');
            default -> {
                for (SyntaxNode child : node.children()) {
                    appendPlainText(child, textBuilder);
                }
            }
        }
    }

    /**
     * Counts the nodes of this subtree, this node included.
     */
    public int size() {
        int total = 1;
        for (SyntaxNode child : children) {
            total += child.size();
        }
        return total;
    }

    /**
     * Collects all nodes of the given kind in document order.
     */
    public List<SyntaxNode> findAll(SyntaxNodeType wanted) {
        List<SyntaxNode> found = new ArrayList<>();
        collect(this, wanted, found);
        return found;
    }

    private static void collect(SyntaxNode node, SyntaxNodeType wanted, List<SyntaxNode> found) {
        if (node.type() == wanted) {
            found.add(node);
        }
        for (SyntaxNode child : node.children()) {
            collect(child, wanted, found);
        }
    }
}
