package com.williamcallahan.notepreview.service.render;

import com.williamcallahan.notepreview.domain.preview.RenderConfiguration;
import com.williamcallahan.notepreview.domain.preview.UiElement;
import com.williamcallahan.notepreview.service.workspace.PreviewBindings;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * State of one render pass: configuration, view collaborators and the checkbox counter.
 *
 * <p>A context must not be reused across passes; the checkbox counter starts at 0 for each.</p>
 */
public final class NodeRenderContext {

    private final NodeRenderDispatcher dispatcher;
    private final RenderConfiguration configuration;
    private final PreviewBindings bindings;
    private final AtomicInteger checkboxCounter = new AtomicInteger();

    NodeRenderContext(NodeRenderDispatcher dispatcher, RenderConfiguration configuration, PreviewBindings bindings) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.configuration = configuration == null ? RenderConfiguration.defaults() : configuration;
        this.bindings = bindings == null ? PreviewBindings.headless() : bindings;
    }

    public RenderConfiguration configuration() {
        return configuration;
    }

    public PreviewBindings bindings() {
        return bindings;
    }

    /**
     * Takes the next checkbox index of this pass.
     */
    public int nextCheckboxIndex() {
        return checkboxCounter.getAndIncrement();
    }

    /**
     * Renders the child nodes of an element through the dispatcher, in document order.
     */
    public CompletableFuture<List<UiElement>> renderChildren(Element element) {
        return dispatcher.renderChildren(element, this);
    }
}
