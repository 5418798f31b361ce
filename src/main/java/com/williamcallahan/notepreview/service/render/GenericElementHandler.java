package com.williamcallahan.notepreview.service.render;

import com.williamcallahan.notepreview.domain.preview.UiElement;
import com.williamcallahan.notepreview.domain.preview.UiGenericElement;
import com.williamcallahan.notepreview.domain.preview.UiText;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Default handler: keeps the element as is with its attributes and rendered children.
 */
public final class GenericElementHandler implements NodeRenderHandler {

    public static final GenericElementHandler INSTANCE = new GenericElementHandler();

    private GenericElementHandler() {}

    @Override
    public CompletableFuture<UiElement> render(Element element, NodeRenderContext context) {
        Map<String, String> properties = properties(element);
        return context.renderChildren(element)
            .thenApply(children -> new UiGenericElement(element.normalName(), properties, children));
    }

    /**
     * Fallback used when a dedicated handler fails: attributes plus the element's text, without
     * running any handler again.
     */
    static UiElement degraded(Element element) {
        String text = element.text();
        List<UiElement> children = text.isEmpty()
            ? List.of()
            : List.of(new UiText(text));
        return new UiGenericElement(element.normalName(), properties(element), children);
    }

    static Map<String, String> properties(Element element) {
        Map<String, String> properties = new LinkedHashMap<>();
        for (Attribute attribute : element.attributes()) {
            properties.put(attribute.getKey(), attribute.getValue());
        }
        return properties;
    }
}
