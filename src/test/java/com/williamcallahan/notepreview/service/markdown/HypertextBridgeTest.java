package com.williamcallahan.notepreview.service.markdown;

import com.williamcallahan.notepreview.domain.markdown.SyntaxNode;
import com.williamcallahan.notepreview.service.markdown.transform.TransformChain;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HypertextBridgeTest {

    private final MarkdownParserFrontend parser = new MarkdownParserFrontend();
    private final TransformChain chain = TransformChain.standard();
    private final HypertextBridge bridge = new HypertextBridge();

    private Document convert(String markdown, boolean allowRawMarkup) {
        SyntaxNode tree = chain.apply(parser.parse(markdown));
        return bridge.toHypertext(tree, allowRawMarkup);
    }

    @Test
    @DisplayName("Should render headings with slug ids and source lines")
    void rendersHeadings() {
        Document document = convert("# Getting Started\n", true);

        Element heading = document.selectFirst("h1");
        assertNotNull(heading);
        assertEquals("getting-started", heading.id());
        assertEquals("1", heading.attr("data-line"));
    }

    @Test
    @DisplayName("Should render task items as disabled checkboxes without paragraph wrappers")
    void rendersTaskItems() {
        Document document = convert("- [ ] open\n- [x] done\n", true);

        assertEquals(2, document.select("ul.contains-task-list > li.task-list-item").size());
        assertEquals(2, document.select("li > input[type=checkbox][disabled]").size());
        assertEquals(1, document.select("input[checked]").size());
        assertTrue(document.select("li > p").isEmpty());
    }

    @Test
    @DisplayName("Should merge raw markup only when allowed")
    void rawMarkupHandling() {
        Document merged = convert("<div class=\"box\">raw</div>\n\ntext <kbd>Ctrl</kbd>\n", true);
        Document escaped = convert("<div class=\"box\">raw</div>\n\ntext <kbd>Ctrl</kbd>\n", false);

        assertNotNull(merged.selectFirst("div.box"));
        assertNotNull(merged.selectFirst("kbd"));
        assertNull(escaped.selectFirst("div.box"));
        assertNull(escaped.selectFirst("kbd"));
        assertTrue(escaped.text().contains("<kbd>Ctrl</kbd>"));
    }

    @Test
    void rendersCustomBlocks() {
        String markdown = ":::info Heads up\nbody\n:::\n\n"
            + "Inline $a+b$ math.\n\n"
            + "```chart(yaml)\ntype: pie\n```\n\n"
            + "```mermaid\ngraph TD; A-->B\n```\n";

        Document document = convert(markdown, true);

        Element admonition = document.selectFirst("div.admonition.admonition-info");
        assertNotNull(admonition);
        assertTrue(admonition.selectFirst(".admonition-heading").text().contains("Heads up"));
        assertEquals("body", admonition.selectFirst(".admonition-content").text());
        assertEquals("a+b", document.selectFirst("span.math-inline").text());
        assertEquals("true", document.selectFirst("chart").attr("data-yaml"));
        assertEquals("graph TD; A-->B\n", document.selectFirst("mermaid").wholeText());
    }

    @Test
    void codeBlocksKeepLanguageAndRawText() {
        Document document = convert("```html\n<b>x</b>\n```\n", true);

        Element pre = document.selectFirst("pre");
        assertEquals("<b>x</b>\n", pre.attr("data-raw"));
        assertTrue(pre.selectFirst("code").hasClass("language-html"));
        assertNull(pre.selectFirst("b"));
    }

    @Test
    @DisplayName("Should keep markup characters in text as text")
    void textIsEscapedByTheDocumentModel() {
        Document document = convert("a < b & \"c\" `<i>`\n", false);

        Element paragraph = document.selectFirst("p");
        assertEquals("a < b & \"c\" <i>", paragraph.text());
        assertNull(paragraph.selectFirst("i"));
        assertTrue(document.body().html().contains("a &lt; b &amp;"));
    }

    @Test
    @DisplayName("Should wrap following blocks in a raw element left open")
    void rawOpeningTagCapturesFollowingBlocks() {
        Document document = convert("<details>\n<summary>More</summary>\n\nHidden body\n\n</details>\n\nAfter\n", true);

        Element details = document.selectFirst("details");
        assertNotNull(details);
        assertEquals("More", details.selectFirst("summary").text());
        assertEquals("Hidden body", details.selectFirst("p").text());
        Element after = document.body().children().last();
        assertEquals("After", after.text());
        assertEquals("body", after.parent().normalName());
    }

    @Test
    @DisplayName("Should nest inline raw tags around the text they enclose")
    void inlineRawTagsEncloseText() {
        Document document = convert("Press <kbd>Ctrl</kbd> and <span class=\"k\">*C*</span> now\n", true);

        assertEquals("Ctrl", document.selectFirst("p > kbd").text());
        assertNotNull(document.selectFirst("p > span.k > em"));
        assertTrue(document.selectFirst("p").ownText().endsWith("now"));
    }
}
