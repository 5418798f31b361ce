package com.williamcallahan.notepreview.service.markdown;

import com.williamcallahan.notepreview.service.markdown.transform.TransformChain;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HypertextPipelineTest {

    private HypertextPipeline pipeline;

    @BeforeEach
    void setUp() {
        pipeline = HypertextPipeline.withDefaults();
    }

    @Test
    @DisplayName("Should produce sanitized hypertext for a typical note")
    void processesTypicalNote() {
        Document document = pipeline.process(
            "# Title\n\n- [ ] task\n\n<script>alert('x')</script>\n\n[docs](https://example.com)\n");

        Element heading = document.selectFirst("h1");
        assertNotNull(heading, "Heading should be rendered");
        assertEquals("user-content-title", heading.id());
        assertEquals(1, document.select("input[type=checkbox]").size());
        assertTrue(document.select("script").isEmpty(), "Scripts must never survive");
        assertEquals("https://example.com", document.selectFirst("a").attr("href"));
    }

    @Test
    @DisplayName("Should rewrite note links to bare note ids")
    void rewritesNoteLinks() {
        String id = "3f2504e0-4f89-11d3-9a0c-0305e82c3301";

        Document document = pipeline.process("[other](note:" + id + ")");

        assertEquals(id, document.selectFirst("a").attr("href"));
    }

    @Test
    @DisplayName("Should serve repeated sources from the cache as independent copies")
    void cachesAndClones() {
        Document first = pipeline.process("hello **world**");
        first.body().empty();
        Document second = pipeline.process("hello **world**");

        assertEquals("world", second.selectFirst("strong").text(), "Cached document must not be shared");
        assertEquals(1, pipeline.cacheStats().hitCount());
        assertEquals(1, pipeline.cacheStats().missCount());
        assertEquals(1, pipeline.cachedDocuments());

        pipeline.clearCache();
        assertEquals(0, pipeline.cachedDocuments());
    }

    @Test
    void truncatesOversizedInput() {
        HypertextPipeline small = new HypertextPipeline(
            new MarkdownParserFrontend(),
            TransformChain.standard(),
            new HypertextBridge(),
            new HypertextSanitizer(),
            SanitizationSchema.preview(),
            5,
            10,
            Duration.ofMinutes(1)
        );

        assertEquals("abcde", small.process("abcdefgh").body().text());
    }

    @Test
    void treatsNullAsEmpty() {
        assertEquals("", pipeline.process(null).body().text());
    }

    @Test
    @DisplayName("Should render deeply nested quotes without failing")
    void rendersDeepNesting() {
        Document document = assertDoesNotThrow(() -> pipeline.process("> ".repeat(20000) + "x"));

        assertTrue(document.body().text().endsWith("x"));
    }
}
