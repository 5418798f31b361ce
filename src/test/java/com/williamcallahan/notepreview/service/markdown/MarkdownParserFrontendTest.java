package com.williamcallahan.notepreview.service.markdown;

import com.williamcallahan.notepreview.domain.markdown.SyntaxNode;
import com.williamcallahan.notepreview.domain.markdown.SyntaxNodeType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownParserFrontendTest {

    private MarkdownParserFrontend parser;

    @BeforeEach
    void setUp() {
        parser = new MarkdownParserFrontend();
    }

    @Test
    @DisplayName("Should produce a document with positioned blocks")
    void parsesHeadingAndParagraphWithPositions() {
        SyntaxNode document = parser.parse("# Title\n\nSome *text* here.");

        assertEquals(SyntaxNodeType.DOCUMENT, document.type());
        assertEquals(2, document.children().size());

        SyntaxNode heading = document.children().get(0);
        assertEquals(SyntaxNodeType.HEADING, heading.type());
        assertEquals(1, heading.intAttribute(SyntaxNode.ATTR_LEVEL, 0));
        assertEquals("Title", heading.plainText());
        assertEquals(1, heading.position().line());

        SyntaxNode paragraph = document.children().get(1);
        assertEquals(SyntaxNodeType.PARAGRAPH, paragraph.type());
        assertEquals(3, paragraph.position().line());
        assertEquals(1, paragraph.findAll(SyntaxNodeType.EMPHASIS).size());
    }

    @Test
    @DisplayName("Should never fail on empty or null input")
    void handlesEmptyInput() {
        assertEquals(SyntaxNodeType.DOCUMENT, parser.parse("").type());
        assertEquals(SyntaxNodeType.DOCUMENT, parser.parse(null).type());
        assertFalse(parser.parse(null).hasChildren());
    }

    @Test
    @DisplayName("Should keep fenced code language and content")
    void parsesFencedCode() {
        SyntaxNode document = parser.parse("```java\nint x = 1;\n```\n");

        SyntaxNode codeBlock = document.children().get(0);
        assertEquals(SyntaxNodeType.CODE_BLOCK, codeBlock.type());
        assertEquals("java", codeBlock.stringAttribute(SyntaxNode.ATTR_LANGUAGE, ""));
        assertEquals("int x = 1;\n", codeBlock.value());
    }

    @Test
    @DisplayName("Should mark task list items with their state")
    void parsesTaskItems() {
        SyntaxNode document = parser.parse("- [ ] open\n- [x] done\n");

        List<SyntaxNode> items = document.findAll(SyntaxNodeType.LIST_ITEM);
        assertEquals(2, items.size());
        assertTrue(items.get(0).booleanAttribute(SyntaxNode.ATTR_TASK));
        assertFalse(items.get(0).booleanAttribute(SyntaxNode.ATTR_CHECKED));
        assertTrue(items.get(1).booleanAttribute(SyntaxNode.ATTR_CHECKED));
    }

    @Test
    @DisplayName("Should resolve reference links and leave undefined references literal")
    void resolvesReferenceLinks() {
        SyntaxNode document = parser.parse("[defined][ref] and [missing][nope]\n\n[ref]: https://example.com\n");

        List<SyntaxNode> links = document.findAll(SyntaxNodeType.LINK);
        assertEquals(1, links.size());
        assertEquals("https://example.com", links.get(0).stringAttribute(SyntaxNode.ATTR_URL, ""));
        assertTrue(document.plainText().contains("missing"));
    }

    @Test
    @DisplayName("Should keep raw HTML as raw nodes")
    void keepsRawHtml() {
        SyntaxNode document = parser.parse("<div>block</div>\n\ntext <b>bold</b>\n");

        assertEquals(1, document.findAll(SyntaxNodeType.RAW_HTML_BLOCK).size());
        assertFalse(document.findAll(SyntaxNodeType.RAW_HTML_INLINE).isEmpty());
    }

    @Test
    void parsesTables() {
        SyntaxNode document = parser.parse("| a | b |\n|:--|--:|\n| 1 | 2 |\n");

        assertEquals(1, document.findAll(SyntaxNodeType.TABLE).size());
        List<SyntaxNode> cells = document.findAll(SyntaxNodeType.TABLE_CELL);
        assertEquals(4, cells.size());
        assertTrue(cells.get(0).booleanAttribute(SyntaxNode.ATTR_HEADER));
        assertEquals("left", cells.get(0).stringAttribute(SyntaxNode.ATTR_ALIGN, ""));
        assertEquals("right", cells.get(3).stringAttribute(SyntaxNode.ATTR_ALIGN, ""));
    }

    @Test
    @DisplayName("Should bound tree depth for deeply nested quotes")
    void boundsNestingDepth() {
        SyntaxNode shallow = parser.parse("> ".repeat(100) + "x");
        SyntaxNode deep = assertDoesNotThrow(() -> parser.parse("> ".repeat(20000) + "x"));

        assertTrue(depth(shallow) <= MarkdownParserFrontend.MAX_NESTING_DEPTH + 2);
        assertTrue(shallow.plainText().endsWith("x"));
        assertTrue(deep.plainText().endsWith("x"));
    }

    @Test
    void parsesEmojiShortcodesAndInlineMath() {
        SyntaxNode document = parser.parse("Done :rocket: with $x_1$");

        assertEquals("rocket", document.findAll(SyntaxNodeType.EMOJI).get(0).value());
        assertEquals("x_1", document.findAll(SyntaxNodeType.MATH_INLINE).get(0).value());
    }

    @Test
    void locatesTaskStatesFromTaskItems() {
        String source = "- [ ] one\n\n```\n- [ ] fenced\n```\n\n1. [x] two\n";

        List<Integer> offsets = parser.taskStateOffsets(source);

        assertEquals(2, offsets.size());
        assertEquals(' ', source.charAt(offsets.get(0)));
        assertEquals('x', source.charAt(offsets.get(1)));
        assertEquals(source.lastIndexOf("[x]") + 1, offsets.get(1));
    }

    private static int depth(SyntaxNode node) {
        int deepest = 0;
        for (SyntaxNode child : node.children()) {
            deepest = Math.max(deepest, depth(child));
        }
        return deepest + 1;
    }
}
