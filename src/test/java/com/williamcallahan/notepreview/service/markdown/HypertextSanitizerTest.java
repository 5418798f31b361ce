package com.williamcallahan.notepreview.service.markdown;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HypertextSanitizerTest {

    private final HypertextSanitizer sanitizer = new HypertextSanitizer();
    private final SanitizationSchema schema = SanitizationSchema.preview();

    private Document sanitize(String html) {
        return sanitizer.sanitize(Jsoup.parseBodyFragment(html), schema);
    }

    @Test
    @DisplayName("Should drop scripts with their content and event handler attributes")
    void removesScriptsAndHandlers() {
        Document clean = sanitize("<script>alert(1)</script><p onclick=\"steal()\">hi</p>");

        assertTrue(clean.select("script").isEmpty());
        assertFalse(clean.body().html().contains("alert"));
        assertEquals("hi", clean.selectFirst("p").text());
        assertFalse(clean.selectFirst("p").hasAttr("onclick"));
    }

    @Test
    @DisplayName("Should reject URLs with disallowed schemes")
    void rejectsUnsafeProtocols() {
        Document clean = sanitize(
            "<a id=\"js\" href=\"javascript:alert(1)\">a</a>"
                + "<a id=\"tab\" href=\"java&#9;script:alert(1)\">b</a>"
                + "<a id=\"rel\" href=\"/notes/1\">c</a>"
                + "<a id=\"mail\" href=\"mailto:me@example.com\">d</a>"
                + "<a id=\"upper\" href=\"HTTPS://example.com\">e</a>"
                + "<img src=\"data:image/png;base64,AAAA\">");

        assertFalse(clean.getElementById("user-content-js").hasAttr("href"));
        assertFalse(clean.getElementById("user-content-tab").hasAttr("href"));
        assertEquals("/notes/1", clean.getElementById("user-content-rel").attr("href"));
        assertEquals("mailto:me@example.com", clean.getElementById("user-content-mail").attr("href"));
        assertEquals("HTTPS://example.com", clean.getElementById("user-content-upper").attr("href"));
        assertFalse(clean.selectFirst("img").hasAttr("src"));
    }

    @Test
    @DisplayName("Should unwrap unknown elements and keep their children")
    void unwrapsUnknownElements() {
        Document clean = sanitize("<section><custom-box><b>kept</b> text</custom-box></section>");

        assertTrue(clean.select("section, custom-box").isEmpty());
        assertEquals("kept", clean.selectFirst("b").text());
        assertTrue(clean.body().text().contains("kept text"));
    }

    @Test
    void prefixesClobberableAttributes() {
        Document clean = sanitize("<h2 id=\"intro\">Intro</h2><a name=\"anchor\">x</a><h3 id=\"user-content-done\">y</h3>");

        assertEquals("user-content-intro", clean.selectFirst("h2").id());
        assertEquals("user-content-anchor", clean.selectFirst("a").attr("name"));
        assertEquals("user-content-done", clean.selectFirst("h3").id());
    }

    @Test
    void forcesCheckboxInputs() {
        Document clean = sanitize("<input type=\"text\" value=\"x\"><input type=\"checkbox\" checked>");

        assertEquals(2, clean.select("input[type=checkbox]").size());
        assertEquals(2, clean.select("input[disabled]").size());
        assertTrue(clean.select("input").get(1).hasAttr("checked"));
    }

    @Test
    void keepsPreviewElements() {
        Document clean = sanitize(
            "<chart data-yaml=\"true\" data-line=\"3\">type: pie</chart>"
                + "<flowchart>st=>start</flowchart><mermaid>graph</mermaid>"
                + "<pre data-raw=\"x\" class=\"c\"><code class=\"language-js\">x</code></pre>"
                + "<span class=\"math math-inline\" style=\"color:red\">x</span>");

        assertEquals("true", clean.selectFirst("chart").attr("data-yaml"));
        assertEquals("3", clean.selectFirst("chart").attr("data-line"));
        assertNotNull(clean.selectFirst("flowchart"));
        assertNotNull(clean.selectFirst("mermaid"));
        assertEquals("x", clean.selectFirst("pre").attr("data-raw"));
        assertTrue(clean.selectFirst("code").hasClass("language-js"));
        assertFalse(clean.selectFirst("span").hasAttr("style"));
    }

    @Test
    void leavesInputDocumentUntouched() {
        Document dirty = Jsoup.parseBodyFragment("<script>x</script><p id=\"a\">p</p>");
        String before = dirty.body().html();

        sanitizer.sanitize(dirty, schema);

        assertEquals(before, dirty.body().html());
    }

    @Test
    void urlCheckFollowsSchemePosition() {
        Set<String> web = Set.of("http", "https");

        assertTrue(HypertextSanitizer.isSafeUrl("page.html#a:b", web));
        assertTrue(HypertextSanitizer.isSafeUrl("./a/b:c", web));
        assertTrue(HypertextSanitizer.isSafeUrl("?q=a:b", web));
        assertFalse(HypertextSanitizer.isSafeUrl(" vbscript:x", web));
        assertFalse(HypertextSanitizer.isSafeUrl("javascript\n:x", web));
    }
}
