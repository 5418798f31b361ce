package com.williamcallahan.notepreview.service.render;

import com.williamcallahan.notepreview.domain.preview.RenderConfiguration;
import com.williamcallahan.notepreview.domain.preview.UiElement;
import com.williamcallahan.notepreview.domain.preview.UiText;
import com.williamcallahan.notepreview.service.workspace.PreviewBindings;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Turns a sanitized hypertext document into UI elements through per-tag handlers.
 *
 * <p>Handlers are invoked synchronously in document order, so counters such as the checkbox
 * index are deterministic. Their futures are awaited before the tree is completed. A handler
 * that throws, or whose future fails, is replaced by a generic element for that node.</p>
 */
public class NodeRenderDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(NodeRenderDispatcher.class);

    private final Map<String, NodeRenderHandler> handlers;
    private final NodeRenderHandler defaultHandler;

    public NodeRenderDispatcher(Map<String, NodeRenderHandler> handlers) {
        this(handlers, GenericElementHandler.INSTANCE);
    }

    public NodeRenderDispatcher(Map<String, NodeRenderHandler> handlers, NodeRenderHandler defaultHandler) {
        Map<String, NodeRenderHandler> normalized = new LinkedHashMap<>();
        if (handlers != null) {
            handlers.forEach((tag, handler) -> normalized.put(tag.toLowerCase(Locale.ROOT), handler));
        }
        this.handlers = Map.copyOf(normalized);
        this.defaultHandler = defaultHandler == null ? GenericElementHandler.INSTANCE : defaultHandler;
    }

    /**
     * Dispatcher with the preview's handlers for images, anchors, checkboxes, code fences,
     * diagrams and math.
     */
    public static NodeRenderDispatcher standard() {
        Map<String, NodeRenderHandler> handlers = new LinkedHashMap<>();
        handlers.put("img", new ImageRenderHandler());
        handlers.put("a", new AnchorRenderHandler());
        handlers.put("input", new CheckboxRenderHandler());
        handlers.put("pre", new CodeFenceRenderHandler());
        DiagramRenderHandler diagrams = new DiagramRenderHandler();
        handlers.put("flowchart", diagrams);
        handlers.put("chart", diagrams);
        handlers.put("mermaid", diagrams);
        MathRenderHandler math = new MathRenderHandler();
        handlers.put("span", math);
        handlers.put("div", math);
        return new NodeRenderDispatcher(handlers);
    }

    /**
     * Starts a render pass. Each pass gets its own checkbox counter.
     */
    public NodeRenderContext newPass(RenderConfiguration configuration, PreviewBindings bindings) {
        return new NodeRenderContext(this, configuration, bindings);
    }

    public CompletableFuture<List<UiElement>> render(Document document, RenderConfiguration configuration,
                                                     PreviewBindings bindings) {
        return render(document, newPass(configuration, bindings));
    }

    public CompletableFuture<List<UiElement>> render(Document document, NodeRenderContext context) {
        if (document == null) {
            return CompletableFuture.completedFuture(List.of());
        }
        return renderChildren(document.body(), context);
    }

    CompletableFuture<List<UiElement>> renderChildren(Element parent, NodeRenderContext context) {
        List<CompletableFuture<UiElement>> pending = new ArrayList<>(parent.childNodeSize());
        for (Node child : parent.childNodes()) {
            if (child instanceof TextNode textNode) {
                pending.add(CompletableFuture.completedFuture(new UiText(textNode.getWholeText())));
            } else if (child instanceof Element element) {
                pending.add(renderElement(element, context));
            }
        }
        return CompletableFuture.allOf(pending.toArray(CompletableFuture[]::new))
            .thenApply(ignored -> pending.stream().map(CompletableFuture::join).toList());
    }

    private CompletableFuture<UiElement> renderElement(Element element, NodeRenderContext context) {
        NodeRenderHandler handler = handlers.getOrDefault(element.normalName(), defaultHandler);
        CompletableFuture<UiElement> rendered;
        try {
            rendered = handler.render(element, context);
        } catch (RuntimeException | StackOverflowError handlerFailure) {
            logger.warn("Render handler for <{}> failed, using generic element: {}",
                element.normalName(), handlerFailure.toString());
            return CompletableFuture.completedFuture(GenericElementHandler.degraded(element));
        }
        if (rendered == null) {
            return CompletableFuture.completedFuture(GenericElementHandler.degraded(element));
        }
        return rendered.exceptionally(renderFailure -> {
            logger.warn("Render handler for <{}> completed exceptionally, using generic element: {}",
                element.normalName(), renderFailure.getMessage());
            return GenericElementHandler.degraded(element);
        });
    }

    public boolean hasHandler(String tagName) {
        return tagName != null && handlers.containsKey(tagName.toLowerCase(Locale.ROOT));
    }
}
