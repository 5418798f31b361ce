package com.williamcallahan.notepreview.service.render;

import com.williamcallahan.notepreview.domain.preview.UiElement;
import com.williamcallahan.notepreview.domain.preview.UiMath;
import org.jsoup.nodes.Element;

import java.util.concurrent.CompletableFuture;

/**
 * Renders {@code span.math-inline} and {@code div.math-display}; other spans and divs stay generic.
 */
public class MathRenderHandler implements NodeRenderHandler {

    @Override
    public CompletableFuture<UiElement> render(Element element, NodeRenderContext context) {
        if ("span".equals(element.normalName()) && element.hasClass("math-inline")) {
            return CompletableFuture.completedFuture(new UiMath(element.wholeText(), false));
        }
        if ("div".equals(element.normalName()) && element.hasClass("math-display")) {
            return CompletableFuture.completedFuture(new UiMath(element.wholeText(), true));
        }
        return GenericElementHandler.INSTANCE.render(element, context);
    }
}
