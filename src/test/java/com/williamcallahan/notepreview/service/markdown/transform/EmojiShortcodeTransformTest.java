package com.williamcallahan.notepreview.service.markdown.transform;

import com.williamcallahan.notepreview.domain.markdown.SyntaxNode;
import com.williamcallahan.notepreview.domain.markdown.SyntaxNodeType;
import com.williamcallahan.notepreview.service.markdown.MarkdownParserFrontend;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EmojiShortcodeTransformTest {

    private final MarkdownParserFrontend parser = new MarkdownParserFrontend();
    private final EmojiShortcodeTransform transform = new EmojiShortcodeTransform();

    @Test
    @DisplayName("Should replace known shortcodes in text")
    void replacesShortcodes() {
        SyntaxNode document = transform.apply(parser.parse("Ship it :rocket: :smile:"));

        assertEquals("Ship it 🚀 😄", document.plainText());
        assertTrue(document.findAll(SyntaxNodeType.EMOJI).isEmpty());
    }

    @Test
    @DisplayName("Should resolve names from the full GitHub emoji set")
    void resolvesFullShortcodeSet() {
        assertEquals("🚀", EmojiShortcodeTransform.resolve("rocket"));
        assertEquals("👍", EmojiShortcodeTransform.resolve("+1"));
    }

    @Test
    @DisplayName("Should leave shortcodes in code untouched")
    void skipsCode() {
        SyntaxNode document = transform.apply(parser.parse("`:smile:`\n\n```\n:smile:\n```\n"));

        assertEquals(":smile:", document.findAll(SyntaxNodeType.CODE_SPAN).get(0).value());
        assertTrue(document.findAll(SyntaxNodeType.CODE_BLOCK).get(0).value().contains(":smile:"));
    }

    @Test
    @DisplayName("Should keep unknown shortcodes and emoticons literal")
    void keepsUnknownShortcodes() {
        SyntaxNode document = transform.apply(parser.parse("time 10:30:45 :not_an_emoji: :-)"));

        assertEquals("time 10:30:45 :not_an_emoji: :-)", document.plainText());
    }
}
