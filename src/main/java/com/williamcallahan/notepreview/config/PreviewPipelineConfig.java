package com.williamcallahan.notepreview.config;

import com.williamcallahan.notepreview.service.markdown.HypertextBridge;
import com.williamcallahan.notepreview.service.markdown.HypertextPipeline;
import com.williamcallahan.notepreview.service.markdown.HypertextSanitizer;
import com.williamcallahan.notepreview.service.markdown.MarkdownParserFrontend;
import com.williamcallahan.notepreview.service.markdown.SanitizationSchema;
import com.williamcallahan.notepreview.service.markdown.transform.TransformChain;
import com.williamcallahan.notepreview.service.preview.MarkdownRenderPipeline;
import com.williamcallahan.notepreview.service.render.NodeRenderDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the preview pipeline stages from {@link AppProperties}.
 */
@Configuration
public class PreviewPipelineConfig {
    private static final Logger log = LoggerFactory.getLogger(PreviewPipelineConfig.class);

    @Bean
    public MarkdownParserFrontend markdownParserFrontend() {
        return new MarkdownParserFrontend();
    }

    @Bean
    public TransformChain transformChain(AppProperties appProperties) {
        AppProperties.Preview preview = appProperties.getPreview();
        TransformChain chain = TransformChain.standard(preview.getPlantUmlServer(), preview.getAdmonitionTag());
        log.info("Preview transform chain: {}", chain.stageNames());
        return chain;
    }

    @Bean
    public HypertextBridge hypertextBridge() {
        return new HypertextBridge();
    }

    @Bean
    public HypertextSanitizer hypertextSanitizer() {
        return new HypertextSanitizer();
    }

    @Bean
    public SanitizationSchema sanitizationSchema(AppProperties appProperties) {
        return SanitizationSchema.preview().withClobberPrefix(appProperties.getPreview().getClobberPrefix());
    }

    @Bean
    public HypertextPipeline hypertextPipeline(MarkdownParserFrontend parser, TransformChain transformChain,
                                               HypertextBridge bridge, HypertextSanitizer sanitizer,
                                               SanitizationSchema schema, AppProperties appProperties) {
        AppProperties.Preview preview = appProperties.getPreview();
        return new HypertextPipeline(parser, transformChain, bridge, sanitizer, schema,
            preview.getMaxInputLength(), preview.getCacheSize(), preview.getCacheTtl());
    }

    @Bean
    public NodeRenderDispatcher nodeRenderDispatcher() {
        return NodeRenderDispatcher.standard();
    }

    /**
     * Single thread every preview run is scheduled on.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService previewExecutor() {
        AtomicInteger threadCount = new AtomicInteger();
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "preview-render-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public MarkdownRenderPipeline markdownRenderPipeline(HypertextPipeline hypertextPipeline,
                                                         NodeRenderDispatcher nodeRenderDispatcher,
                                                         ExecutorService previewExecutor) {
        return new MarkdownRenderPipeline(hypertextPipeline, nodeRenderDispatcher, previewExecutor);
    }
}
