package com.williamcallahan.notepreview.service.markdown.transform;

import com.williamcallahan.notepreview.domain.markdown.SyntaxNode;
import com.williamcallahan.notepreview.domain.markdown.SyntaxNodeType;
import com.williamcallahan.notepreview.service.markdown.MarkdownParserFrontend;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HeadingSlugTransformTest {

    private final MarkdownParserFrontend parser = new MarkdownParserFrontend();
    private final HeadingSlugTransform transform = new HeadingSlugTransform();

    @Test
    @DisplayName("Should give repeated headings unique slugs")
    void disambiguatesRepeatedHeadings() {
        SyntaxNode document = transform.apply(parser.parse("# Overview\n\n## Overview\n\n### Overview\n"));

        List<String> slugs = document.findAll(SyntaxNodeType.HEADING).stream()
            .map(heading -> heading.stringAttribute(SyntaxNode.ATTR_SLUG, ""))
            .toList();
        assertEquals(List.of("overview", "overview-1", "overview-2"), slugs);
    }

    @Test
    void suffixNeverCollidesWithExistingSlug() {
        SyntaxNode document = transform.apply(parser.parse("# A\n\n# A-1\n\n# A\n"));

        List<String> slugs = document.findAll(SyntaxNodeType.HEADING).stream()
            .map(heading -> heading.stringAttribute(SyntaxNode.ATTR_SLUG, ""))
            .toList();
        assertEquals(List.of("a", "a-1", "a-2"), slugs);
    }

    @Test
    void slugifiesLikeGitHub() {
        assertEquals("hello-world", HeadingSlugTransform.slugify("Hello, World!"));
        assertEquals("whats-new-in-v2", HeadingSlugTransform.slugify("What's new in v2?"));
        assertEquals("snake_case-name", HeadingSlugTransform.slugify("snake_case name"));
    }
}
