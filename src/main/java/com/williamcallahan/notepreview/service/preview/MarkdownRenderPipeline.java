package com.williamcallahan.notepreview.service.preview;

import com.williamcallahan.notepreview.domain.preview.RenderConfiguration;
import com.williamcallahan.notepreview.domain.preview.RenderedPreview;
import com.williamcallahan.notepreview.service.markdown.HypertextPipeline;
import com.williamcallahan.notepreview.service.render.NodeRenderDispatcher;
import com.williamcallahan.notepreview.service.workspace.PreviewBindings;
import org.jsoup.nodes.Document;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Full preview pipeline from markdown source to UI elements, run on the preview executor.
 */
public class MarkdownRenderPipeline {

    private final HypertextPipeline hypertextPipeline;
    private final NodeRenderDispatcher dispatcher;
    private final Executor previewExecutor;

    public MarkdownRenderPipeline(HypertextPipeline hypertextPipeline, NodeRenderDispatcher dispatcher,
                                  Executor previewExecutor) {
        this.hypertextPipeline = Objects.requireNonNull(hypertextPipeline, "hypertextPipeline");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.previewExecutor = Objects.requireNonNull(previewExecutor, "previewExecutor");
    }

    /**
     * Renders a source asynchronously. Parsing through sanitizing completes on the preview
     * executor; the result completes once every render handler has.
     *
     * @param sequence run number stamped onto the result
     */
    public CompletableFuture<RenderedPreview> render(String source, RenderConfiguration configuration,
                                                     PreviewBindings bindings, long sequence) {
        RenderConfiguration effective = configuration == null ? RenderConfiguration.defaults() : configuration;
        long startTime = System.currentTimeMillis();
        return CompletableFuture.supplyAsync(() -> hypertextPipeline.process(source), previewExecutor)
            .thenCompose(document -> dispatcher.render(document, effective, bindings))
            .thenApply(elements -> new RenderedPreview(
                elements,
                effective.theme(),
                effective.styleOverrides(),
                sequence,
                System.currentTimeMillis() - startTime
            ));
    }

    /**
     * Sanitized HTML of a source, for callers that display hypertext directly.
     */
    public String renderHtml(String source) {
        Document document = hypertextPipeline.process(source);
        return document.body().html();
    }

    public HypertextPipeline hypertextPipeline() {
        return hypertextPipeline;
    }
}
