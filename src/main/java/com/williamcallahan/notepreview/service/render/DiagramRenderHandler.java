package com.williamcallahan.notepreview.service.render;

import com.williamcallahan.notepreview.domain.preview.DiagramKind;
import com.williamcallahan.notepreview.domain.preview.UiDiagram;
import com.williamcallahan.notepreview.domain.preview.UiElement;
import org.jsoup.nodes.Element;

import java.util.concurrent.CompletableFuture;

/**
 * Renders {@code flowchart}, {@code chart} and {@code mermaid} blocks. Drawing is left to the
 * diagram components, which receive the raw block text.
 */
public class DiagramRenderHandler implements NodeRenderHandler {

    @Override
    public CompletableFuture<UiElement> render(Element element, NodeRenderContext context) {
        return DiagramKind.fromTagName(element.normalName())
            .<CompletableFuture<UiElement>>map(kind -> CompletableFuture.completedFuture(new UiDiagram(
                kind,
                element.wholeText(),
                kind == DiagramKind.CHART && Boolean.parseBoolean(element.attr("data-yaml"))
            )))
            .orElseGet(() -> GenericElementHandler.INSTANCE.render(element, context));
    }
}
