package com.williamcallahan.notepreview.service.render;

import com.williamcallahan.notepreview.domain.preview.UiCheckbox;
import com.williamcallahan.notepreview.domain.preview.UiElement;
import com.williamcallahan.notepreview.service.markdown.CheckboxToggler;
import com.williamcallahan.notepreview.service.workspace.ContentUpdater;
import org.jsoup.nodes.Element;

import java.util.concurrent.CompletableFuture;

/**
 * Renders checkbox inputs as interactive task checkboxes numbered in document order.
 * Other inputs stay generic.
 */
public class CheckboxRenderHandler implements NodeRenderHandler {

    @Override
    public CompletableFuture<UiElement> render(Element element, NodeRenderContext context) {
        if (!"checkbox".equalsIgnoreCase(element.attr("type"))) {
            return GenericElementHandler.INSTANCE.render(element, context);
        }
        int index = context.nextCheckboxIndex();
        ContentUpdater contentUpdater = context.bindings().contentUpdater();
        UiCheckbox checkbox = new UiCheckbox(
            index,
            element.hasAttr("checked"),
            () -> contentUpdater.updateContent(previous -> CheckboxToggler.toggle(previous, index))
        );
        return CompletableFuture.completedFuture(checkbox);
    }
}
