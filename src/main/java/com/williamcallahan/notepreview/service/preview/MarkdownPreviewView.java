package com.williamcallahan.notepreview.service.preview;

import com.williamcallahan.notepreview.domain.preview.RenderConfiguration;
import com.williamcallahan.notepreview.domain.preview.RenderedPreview;
import com.williamcallahan.notepreview.service.workspace.PreviewBindings;

import java.util.Objects;

/**
 * Owner of one displayed preview: holds the latest content and configuration and keeps the
 * rendered output in step with them through its {@link PreviewRenderController}.
 *
 * <p>After each finished run the view re-requests its latest values, so edits made while a run
 * was in flight are rendered next.</p>
 */
public class MarkdownPreviewView {

    private final PreviewRenderController controller;

    private volatile String content;
    private volatile RenderConfiguration configuration;
    private volatile RenderedPreview displayed = RenderedPreview.empty();

    public MarkdownPreviewView(MarkdownRenderPipeline pipeline, PreviewBindings bindings,
                               String initialContent, RenderConfiguration initialConfiguration) {
        Objects.requireNonNull(pipeline, "pipeline");
        PreviewBindings viewBindings = bindings == null ? PreviewBindings.headless() : bindings;
        this.content = initialContent == null ? "" : initialContent;
        this.configuration = initialConfiguration == null ? RenderConfiguration.defaults() : initialConfiguration;
        this.controller = new PreviewRenderController(
            (source, runConfiguration, sequence) -> pipeline.render(source, runConfiguration, viewBindings, sequence));
        controller.addDisplayListener(rendered -> displayed = rendered);
        controller.addCompletionListener(this::requestLatest);
        requestLatest();
    }

    public void setContent(String newContent) {
        content = newContent == null ? "" : newContent;
        requestLatest();
    }

    public void setConfiguration(RenderConfiguration newConfiguration) {
        configuration = newConfiguration == null ? RenderConfiguration.defaults() : newConfiguration;
        requestLatest();
    }

    public String content() {
        return content;
    }

    /**
     * Re-renders because a resource the output depends on (a code highlighting mode, for one)
     * finished loading.
     */
    public void onDependentResourceLoaded() {
        controller.onDependentResourceLoaded();
    }

    /**
     * Whether the "rendering..." indicator should show.
     */
    public boolean isRendering() {
        return controller.isRendering();
    }

    /**
     * Latest rendered output, with the current theme and style overrides applied.
     */
    public RenderedPreview current() {
        RenderedPreview rendered = displayed;
        RenderConfiguration current = configuration;
        return new RenderedPreview(
            rendered.elements(),
            current.theme(),
            current.styleOverrides(),
            rendered.sequence(),
            rendered.renderTimeMs()
        );
    }

    public void dispose() {
        controller.dispose();
    }

    PreviewRenderController controller() {
        return controller;
    }

    private void requestLatest() {
        controller.request(content, configuration);
    }
}
