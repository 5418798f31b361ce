package com.williamcallahan.notepreview.service.render;

import com.williamcallahan.notepreview.domain.preview.UiAnchor;
import com.williamcallahan.notepreview.domain.preview.UiElement;
import org.jsoup.nodes.Element;

import java.util.concurrent.CompletableFuture;

/**
 * Renders {@code a} as an anchor whose click opens notes in-app and everything else in the
 * external browser.
 */
public class AnchorRenderHandler implements NodeRenderHandler {

    public static final String NOTE_LINK_CLASS = "markdown__custom__note_link";

    @Override
    public CompletableFuture<UiElement> render(Element element, NodeRenderContext context) {
        String href = element.attr("href");
        NoteLinkNavigator navigator = new NoteLinkNavigator(context.bindings());
        return context.renderChildren(element)
            .thenApply(children -> new UiAnchor(href, NOTE_LINK_CLASS, children, () -> navigator.open(href)));
    }
}
