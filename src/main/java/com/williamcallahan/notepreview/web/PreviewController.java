package com.williamcallahan.notepreview.web;

import com.williamcallahan.notepreview.config.AppProperties;
import com.williamcallahan.notepreview.domain.preview.RenderConfiguration;
import com.williamcallahan.notepreview.domain.preview.RenderedPreview;
import com.williamcallahan.notepreview.service.preview.MarkdownRenderPipeline;
import com.williamcallahan.notepreview.service.workspace.PreviewBindings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * REST controller exposing the preview pipeline without a view.
 * Rendering uses headless bindings: links do not navigate and checkboxes do not write back.
 */
@RestController
@RequestMapping("/api/preview")
public class PreviewController {

    private static final Logger logger = LoggerFactory.getLogger(PreviewController.class);
    private static final long RENDER_TIMEOUT_SECONDS = 30;

    private final MarkdownRenderPipeline renderPipeline;
    private final AppProperties appProperties;
    private final PreviewResponseBuilder responseBuilder;

    public PreviewController(MarkdownRenderPipeline renderPipeline, AppProperties appProperties,
                             PreviewResponseBuilder responseBuilder) {
        this.renderPipeline = renderPipeline;
        this.appProperties = appProperties;
        this.responseBuilder = responseBuilder;
    }

    /**
     * Renders markdown into sanitized HTML and the preview element tree.
     *
     * @param request A JSON object containing the markdown to render. Expected format:
     *                <pre>{@code
     *                  {
     *                    "content": "Your **markdown** text here.",
     *                    "codeBlockTheme": "material-darker"
     *                  }
     *                }</pre>
     * @return the rendered preview, a 400 error body when no content is given, or a 500/504
     *         error body when rendering fails or times out
     */
    @PostMapping(value = "/render",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> render(@RequestBody PreviewRenderRequest request) {
        if (request == null || request.content() == null) {
            return responseBuilder.invalidRequest("content is required");
        }
        RenderConfiguration defaults = appProperties.getTheme().toRenderConfiguration();
        RenderConfiguration configuration = new RenderConfiguration(
            request.theme() != null ? request.theme() : defaults.theme(),
            request.codeBlockTheme() != null ? request.codeBlockTheme() : defaults.codeBlockTheme(),
            request.styleOverrides()
        );
        try {
            logger.debug("Rendering preview of length: {}", request.content().length());
            RenderedPreview rendered = renderPipeline
                .render(request.content(), configuration, PreviewBindings.headless(), 0L)
                .orTimeout(RENDER_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .join();
            String html = renderPipeline.renderHtml(request.content());
            return ResponseEntity.ok(new PreviewRenderResponse(
                html,
                rendered.elements(),
                rendered.theme(),
                rendered.styleOverrides(),
                rendered.renderTimeMs()
            ));
        } catch (CompletionException renderFailure) {
            Throwable cause = renderFailure.getCause() != null ? renderFailure.getCause() : renderFailure;
            logger.error("Error rendering preview", cause);
            return responseBuilder.renderFailure(cause);
        }
    }

    /**
     * Retrieves statistics about the server-side hypertext cache.
     *
     * @return hit count, miss count, eviction count, size and hit rate
     */
    @GetMapping("/cache/stats")
    public ResponseEntity<Map<String, Object>> getCacheStats() {
        var hypertextPipeline = renderPipeline.hypertextPipeline();
        var stats = hypertextPipeline.cacheStats();
        return ResponseEntity.ok(Map.of(
            "hitCount", stats.hitCount(),
            "missCount", stats.missCount(),
            "evictionCount", stats.evictionCount(),
            "size", hypertextPipeline.cachedDocuments(),
            "hitRate", String.format("%.2f%%", stats.hitRate() * 100)
        ));
    }

    /**
     * Clears the server-side hypertext cache.
     */
    @PostMapping("/cache/clear")
    public ResponseEntity<Map<String, Object>> clearCache() {
        var hypertextPipeline = renderPipeline.hypertextPipeline();
        long evicted = hypertextPipeline.cachedDocuments();
        hypertextPipeline.clearCache();
        return responseBuilder.cacheCleared(evicted);
    }
}
