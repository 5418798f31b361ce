package com.williamcallahan.notepreview.service.render;

import com.williamcallahan.notepreview.domain.preview.UiCodeFence;
import com.williamcallahan.notepreview.domain.preview.UiElement;
import org.jsoup.nodes.Element;

import java.util.concurrent.CompletableFuture;

/**
 * Renders {@code pre} blocks as themed code fences.
 */
public class CodeFenceRenderHandler implements NodeRenderHandler {

    private static final String LANGUAGE_CLASS_PREFIX = "language-";

    @Override
    public CompletableFuture<UiElement> render(Element element, NodeRenderContext context) {
        Element code = null;
        for (Element child : element.children()) {
            if ("code".equals(child.normalName())) {
                code = child;
                break;
            }
        }
        String language = "";
        if (code != null) {
            for (String className : code.classNames()) {
                if (className.startsWith(LANGUAGE_CLASS_PREFIX)) {
                    language = className.substring(LANGUAGE_CLASS_PREFIX.length());
                    break;
                }
            }
        }
        // data-raw holds the unprocessed block text
        String source = element.hasAttr("data-raw")
            ? element.attr("data-raw")
            : (code != null ? code.wholeText() : element.wholeText());
        return CompletableFuture.completedFuture(
            new UiCodeFence(language, source, context.configuration().codeBlockTheme()));
    }
}
