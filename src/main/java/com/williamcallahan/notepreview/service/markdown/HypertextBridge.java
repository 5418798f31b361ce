package com.williamcallahan.notepreview.service.markdown;

import com.williamcallahan.notepreview.domain.markdown.SyntaxNode;
import com.williamcallahan.notepreview.domain.markdown.SyntaxNodeType;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the transformed syntax tree into a jsoup hypertext tree.
 *
 * <p>Elements are built directly on a jsoup {@link Document}; jsoup owns all escaping. Raw markup
 * is parsed by jsoup in the context of its parent element and merged only when
 * {@code allowRawMarkup} is set, so the result must then go through the sanitizer.</p>
 */
public class HypertextBridge {
    private static final Logger logger = LoggerFactory.getLogger(HypertextBridge.class);

    static final String ADMONITION_CLASS = "admonition";
    static final String MATH_INLINE_CLASS = "math math-inline";
    static final String MATH_DISPLAY_CLASS = "math math-display";
    static final String TASK_ITEM_CLASS = "task-list-item";
    static final String TASK_LIST_CLASS = "contains-task-list";

    private static final Pattern CLOSING_TAG = Pattern.compile("^</\\s*([A-Za-z][A-Za-z0-9-]*)\\s*>$");

    public Document toHypertext(SyntaxNode root, boolean allowRawMarkup) {
        Document document = Document.createShell("");
        if (root == null) {
            return document;
        }
        try {
            new DomBuilder(allowRawMarkup).appendChildren(document.body(), root, false);
            return document;
        } catch (RuntimeException | StackOverflowError bridgeFailure) {
            logger.error("Failed to convert syntax tree to hypertext, falling back to plain text", bridgeFailure);
            return plainTextDocument(root);
        }
    }

    private static Document plainTextDocument(SyntaxNode root) {
        Document fallback = Document.createShell("");
        Element paragraph = fallback.body().appendElement("p");
        String[] lines = root.plainText().split("\n", -1);
        for (int index = 0; index < lines.length; index++) {
            if (index > 0) {
                paragraph.appendElement("br");
            }
            paragraph.appendText(lines[index]);
        }
        return fallback;
    }

    private static final class DomBuilder {
        private final boolean allowRawMarkup;

        DomBuilder(boolean allowRawMarkup) {
            this.allowRawMarkup = allowRawMarkup;
        }

        /**
         * Appends the children of {@code node} to {@code parent}. A raw tag that opens an element
         * without closing it captures the following siblings until its closing tag.
         */
        void appendChildren(Element parent, SyntaxNode node, boolean tight) {
            Deque<Element> openElements = new ArrayDeque<>();
            for (SyntaxNode child : node.children()) {
                Element target = openElements.isEmpty() ? parent : openElements.peek();
                if (allowRawMarkup && (child.is(SyntaxNodeType.RAW_HTML_INLINE) || child.is(SyntaxNodeType.RAW_HTML_BLOCK))) {
                    appendRawMarkup(target, child.value(), openElements);
                } else {
                    append(target, child, tight);
                }
            }
        }

        void append(Element parent, SyntaxNode node, boolean tight) {
            switch (node.type()) {
                case DOCUMENT -> appendChildren(parent, node, false);
                case PARAGRAPH -> {
                    if (tight) {
                        appendChildren(parent, node, false);
                    } else {
                        appendChildren(element(parent, "p", node), node, false);
                    }
                }
                case HEADING -> {
                    int level = Math.max(1, Math.min(6, node.intAttribute(SyntaxNode.ATTR_LEVEL, 1)));
                    Element heading = element(parent, "h" + level, node);
                    String slug = node.stringAttribute(SyntaxNode.ATTR_SLUG, null);
                    if (slug != null) {
                        heading.id(slug);
                    }
                    appendChildren(heading, node, false);
                }
                case TEXT -> parent.appendText(node.value());
                case EMOJI -> parent.appendText(":" + node.value() + ":");
                case EMPHASIS -> appendChildren(element(parent, "em", node), node, false);
                case STRONG -> appendChildren(element(parent, "strong", node), node, false);
                case STRIKETHROUGH -> appendChildren(element(parent, "del", node), node, false);
                case CODE_SPAN -> element(parent, "code", node).text(node.value());
                case CODE_BLOCK -> appendCodeBlock(parent, node);
                case BLOCK_QUOTE -> appendChildren(element(parent, "blockquote", node), node, false);
                case BULLET_LIST, ORDERED_LIST -> appendList(parent, node);
                case LIST_ITEM -> appendListItem(parent, node, tight);
                case LINK -> {
                    Element link = element(parent, "a", node).attr("href", node.stringAttribute(SyntaxNode.ATTR_URL, ""));
                    optionalAttribute(link, "title", node.stringAttribute(SyntaxNode.ATTR_TITLE, null));
                    appendChildren(link, node, false);
                }
                case IMAGE -> {
                    Element image = element(parent, "img", node)
                        .attr("src", node.stringAttribute(SyntaxNode.ATTR_URL, ""))
                        .attr("alt", node.stringAttribute(SyntaxNode.ATTR_ALT, ""));
                    optionalAttribute(image, "title", node.stringAttribute(SyntaxNode.ATTR_TITLE, null));
                }
                // merged by appendChildren when raw markup is allowed
                case RAW_HTML_BLOCK -> element(parent, "p", node).appendText(node.value());
                case RAW_HTML_INLINE -> parent.appendText(node.value());
                case SOFT_BREAK -> parent.appendText("\n");
                case HARD_BREAK -> parent.appendElement("br");
                case THEMATIC_BREAK -> element(parent, "hr", node);
                case TABLE -> appendChildren(element(parent, "table", node), node, false);
                case TABLE_HEAD -> appendChildren(element(parent, "thead", node), node, false);
                case TABLE_BODY -> appendChildren(element(parent, "tbody", node), node, false);
                case TABLE_ROW -> appendChildren(element(parent, "tr", node), node, false);
                case TABLE_CELL -> {
                    Element cell = element(parent, node.booleanAttribute(SyntaxNode.ATTR_HEADER) ? "th" : "td", node);
                    String align = node.stringAttribute(SyntaxNode.ATTR_ALIGN, "none");
                    if (!"none".equals(align)) {
                        cell.attr("align", align);
                    }
                    appendChildren(cell, node, false);
                }
                case ADMONITION -> appendAdmonition(parent, node);
                case MATH_INLINE -> element(parent, "span", node).attr("class", MATH_INLINE_CLASS).text(node.value());
                case MATH_BLOCK -> element(parent, "div", node).attr("class", MATH_DISPLAY_CLASS).text(node.value());
                case FLOWCHART, MERMAID -> element(parent, node.type().name().toLowerCase(Locale.ROOT), node)
                    .appendText(node.value());
                case CHART -> element(parent, "chart", node)
                    .attr("data-yaml", String.valueOf(node.booleanAttribute(SyntaxNode.ATTR_YAML)))
                    .appendText(node.value());
            }
        }

        private void appendCodeBlock(Element parent, SyntaxNode node) {
            Element pre = element(parent, "pre", node).attr("data-raw", node.value());
            Element code = pre.appendElement("code");
            String language = node.stringAttribute(SyntaxNode.ATTR_LANGUAGE, "");
            if (!language.isEmpty()) {
                code.addClass("language-" + language);
            }
            code.appendText(node.value());
        }

        private void appendList(Element parent, SyntaxNode node) {
            boolean ordered = node.is(SyntaxNodeType.ORDERED_LIST);
            Element list = element(parent, ordered ? "ol" : "ul", node);
            if (ordered) {
                int start = node.intAttribute(SyntaxNode.ATTR_START, 1);
                if (start != 1) {
                    list.attr("start", String.valueOf(start));
                }
            }
            if (node.children().stream().anyMatch(item -> item.booleanAttribute(SyntaxNode.ATTR_TASK))) {
                list.addClass(TASK_LIST_CLASS);
            }
            appendChildren(list, node, node.booleanAttribute(SyntaxNode.ATTR_TIGHT));
        }

        private void appendListItem(Element parent, SyntaxNode node, boolean tight) {
            Element item = element(parent, "li", node);
            if (node.booleanAttribute(SyntaxNode.ATTR_TASK)) {
                item.addClass(TASK_ITEM_CLASS);
                item.appendElement("input")
                    .attr("type", "checkbox")
                    .attr("disabled", true)
                    .attr("checked", node.booleanAttribute(SyntaxNode.ATTR_CHECKED));
                item.appendText(" ");
            }
            appendChildren(item, node, tight);
        }

        private void appendAdmonition(Element parent, SyntaxNode node) {
            String kind = node.stringAttribute(SyntaxNode.ATTR_KIND, "note");
            Element admonition = element(parent, "div", node)
                .addClass(ADMONITION_CLASS)
                .addClass(ADMONITION_CLASS + "-" + kind);
            Element title = admonition.appendElement("div").addClass("admonition-heading").appendElement("h5");
            String icon = node.stringAttribute(SyntaxNode.ATTR_ICON, "");
            if (!icon.isEmpty()) {
                title.appendElement("span").addClass("admonition-icon").text(icon);
            }
            title.appendText(node.stringAttribute(SyntaxNode.ATTR_TITLE, kind));
            appendChildren(admonition.appendElement("div").addClass("admonition-content"), node, false);
        }

        /**
         * Merges one piece of raw markup. A lone closing tag ends the matching open element; markup
         * whose last element is left unclosed becomes the target for the siblings that follow it.
         */
        private void appendRawMarkup(Element target, String markup, Deque<Element> openElements) {
            String trimmed = markup.trim();
            Matcher closing = CLOSING_TAG.matcher(trimmed);
            if (closing.matches()) {
                String tagName = closing.group(1).toLowerCase(Locale.ROOT);
                if (openElements.stream().anyMatch(open -> open.normalName().equals(tagName))) {
                    Element closed;
                    do {
                        closed = openElements.pop();
                    } while (!closed.normalName().equals(tagName));
                }
                return;
            }
            List<Node> parsed = Parser.parseFragment(markup, target, "");
            target.appendChildren(parsed);
            if (!parsed.isEmpty()
                && parsed.get(parsed.size() - 1) instanceof Element last
                && !last.tag().isSelfClosing()
                && !trimmed.endsWith("/>")
                && !trimmed.toLowerCase(Locale.ROOT).contains("</" + last.normalName())) {
                openElements.push(last);
            }
        }

        private static Element element(Element parent, String tagName, SyntaxNode node) {
            Element element = parent.appendElement(tagName);
            Object line = node.attributes().get(SyntaxNode.ATTR_DATA_LINE);
            if (line != null) {
                element.attr(SyntaxNode.ATTR_DATA_LINE, line.toString());
            }
            return element;
        }

        private static void optionalAttribute(Element element, String name, String attributeValue) {
            if (attributeValue != null) {
                element.attr(name, attributeValue);
            }
        }
    }
}
