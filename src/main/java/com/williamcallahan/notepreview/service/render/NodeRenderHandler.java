package com.williamcallahan.notepreview.service.render;

import com.williamcallahan.notepreview.domain.preview.UiElement;
import org.jsoup.nodes.Element;

import java.util.concurrent.CompletableFuture;

/**
 * Renders one sanitized element into a UI element.
 *
 * <p>Handlers are called synchronously in document order; any counter they take from the
 * {@link NodeRenderContext} must be taken before returning. The returned future may complete
 * later.</p>
 */
@FunctionalInterface
public interface NodeRenderHandler {

    CompletableFuture<UiElement> render(Element element, NodeRenderContext context);
}
