package com.williamcallahan.notepreview.service.markdown.transform;

import com.williamcallahan.notepreview.domain.markdown.SyntaxNode;
import com.williamcallahan.notepreview.domain.markdown.SyntaxNodeType;
import com.williamcallahan.notepreview.service.markdown.MarkdownParserFrontend;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AdmonitionTransformTest {

    private final MarkdownParserFrontend parser = new MarkdownParserFrontend();
    private final AdmonitionTransform transform = new AdmonitionTransform();

    @Test
    @DisplayName("Should wrap fenced content in an admonition with kind, title and icon")
    void recognizesAdmonition() {
        SyntaxNode document = transform.apply(parser.parse(":::warning Careful\nDo not **touch**.\n:::\n"));

        List<SyntaxNode> admonitions = document.findAll(SyntaxNodeType.ADMONITION);
        assertEquals(1, admonitions.size());
        SyntaxNode admonition = admonitions.get(0);
        assertEquals("warning", admonition.stringAttribute(SyntaxNode.ATTR_KIND, ""));
        assertEquals("Careful", admonition.stringAttribute(SyntaxNode.ATTR_TITLE, ""));
        assertEquals("⚠️", admonition.stringAttribute(SyntaxNode.ATTR_ICON, ""));
        assertEquals("Do not touch.", admonition.plainText());
        assertEquals(1, admonition.findAll(SyntaxNodeType.STRONG).size());
    }

    @Test
    @DisplayName("Should span several blocks between separate markers")
    void spansBlocks() {
        String markdown = ":::tip\n\nFirst paragraph.\n\n- item\n\n:::\n\nAfter.";
        SyntaxNode document = transform.apply(parser.parse(markdown));

        assertEquals(2, document.children().size());
        SyntaxNode admonition = document.children().get(0);
        assertEquals(SyntaxNodeType.ADMONITION, admonition.type());
        assertEquals("tip", admonition.stringAttribute(SyntaxNode.ATTR_TITLE, ""));
        assertEquals(1, admonition.findAll(SyntaxNodeType.BULLET_LIST).size());
        assertEquals("After.", document.children().get(1).plainText());
    }

    @Test
    @DisplayName("Should leave unclosed markers as literal text")
    void unclosedMarkerStaysLiteral() {
        SyntaxNode document = transform.apply(parser.parse(":::note\nnever closed"));

        assertTrue(document.findAll(SyntaxNodeType.ADMONITION).isEmpty());
        assertTrue(document.plainText().startsWith(":::note"));
    }

    @Test
    void unknownKindStaysLiteral() {
        SyntaxNode document = transform.apply(parser.parse(":::bogus\ntext\n:::\n"));

        assertTrue(document.findAll(SyntaxNodeType.ADMONITION).isEmpty());
    }

    @Test
    void nestsAdmonitions() {
        String markdown = ":::note Outer\n\n:::danger Inner\n\ninside\n\n:::\n\n:::\n";
        SyntaxNode document = transform.apply(parser.parse(markdown));

        List<SyntaxNode> admonitions = document.findAll(SyntaxNodeType.ADMONITION);
        assertEquals(2, admonitions.size());
        assertEquals("note", admonitions.get(0).stringAttribute(SyntaxNode.ATTR_KIND, ""));
        assertEquals("danger", admonitions.get(1).stringAttribute(SyntaxNode.ATTR_KIND, ""));
    }

    @Test
    @DisplayName("Should close on a marker absorbed into a trailing list item")
    void closesAfterTrailingList() {
        SyntaxNode document = transform.apply(parser.parse(":::note\n- a\n- b\n:::\n\nAfter\n"));

        List<SyntaxNode> admonitions = document.findAll(SyntaxNodeType.ADMONITION);
        assertEquals(1, admonitions.size());
        SyntaxNode list = admonitions.get(0).children().get(0);
        assertEquals(SyntaxNodeType.BULLET_LIST, list.type());
        assertEquals("b", list.children().get(1).plainText());
        assertEquals("After", document.children().get(1).plainText());
    }

    @Test
    void closesAfterTrailingBlockQuote() {
        SyntaxNode document = transform.apply(parser.parse(":::tip\n> quoted\n:::\n"));

        List<SyntaxNode> admonitions = document.findAll(SyntaxNodeType.ADMONITION);
        assertEquals(1, admonitions.size());
        assertEquals("quoted", admonitions.get(0).children().get(0).plainText());
    }
}
