package com.williamcallahan.notepreview.config;

import com.williamcallahan.notepreview.domain.preview.RenderConfiguration;
import com.williamcallahan.notepreview.service.markdown.HypertextPipeline;
import com.williamcallahan.notepreview.service.markdown.SanitizationSchema;
import com.williamcallahan.notepreview.service.markdown.transform.AdmonitionTransform;
import com.williamcallahan.notepreview.service.markdown.transform.PlantUmlTransform;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Preview preview = new Preview();
    private Theme theme = new Theme();

    /**
     * Rejects settings the pipeline cannot run with.
     *
     * @throws IllegalArgumentException when a setting is out of range
     */
    @PostConstruct
    public void validateConfiguration() {
        if (preview.getPlantUmlServer() == null || preview.getPlantUmlServer().isBlank()) {
            throw new IllegalArgumentException("app.preview.plant-uml-server must not be blank");
        }
        if (preview.getMaxInputLength() <= 0) {
            throw new IllegalArgumentException("app.preview.max-input-length must be positive, got " + preview.getMaxInputLength());
        }
        if (preview.getCacheSize() < 0) {
            throw new IllegalArgumentException("app.preview.cache-size must not be negative, got " + preview.getCacheSize());
        }
        if (preview.getCacheTtl() == null || preview.getCacheTtl().isNegative() || preview.getCacheTtl().isZero()) {
            throw new IllegalArgumentException("app.preview.cache-ttl must be a positive duration");
        }
        if (preview.getAdmonitionTag() == null || preview.getAdmonitionTag().isBlank()) {
            throw new IllegalArgumentException("app.preview.admonition-tag must not be blank");
        }
    }

    public Preview getPreview() {
        return preview;
    }

    public void setPreview(Preview preview) {
        this.preview = preview;
    }

    public Theme getTheme() {
        return theme;
    }

    public void setTheme(Theme theme) {
        this.theme = theme;
    }

    public static class Preview {
        private String plantUmlServer = PlantUmlTransform.DEFAULT_SERVER;
        private int maxInputLength = HypertextPipeline.DEFAULT_MAX_INPUT_LENGTH;
        private int cacheSize = HypertextPipeline.DEFAULT_CACHE_SIZE;
        private Duration cacheTtl = HypertextPipeline.DEFAULT_CACHE_DURATION;
        private String clobberPrefix = SanitizationSchema.DEFAULT_CLOBBER_PREFIX;
        private String admonitionTag = AdmonitionTransform.DEFAULT_TAG;

        public String getPlantUmlServer() { return plantUmlServer; }
        public void setPlantUmlServer(String plantUmlServer) { this.plantUmlServer = plantUmlServer; }

        public int getMaxInputLength() { return maxInputLength; }
        public void setMaxInputLength(int maxInputLength) { this.maxInputLength = maxInputLength; }

        public int getCacheSize() { return cacheSize; }
        public void setCacheSize(int cacheSize) { this.cacheSize = cacheSize; }

        public Duration getCacheTtl() { return cacheTtl; }
        public void setCacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; }

        public String getClobberPrefix() { return clobberPrefix; }
        public void setClobberPrefix(String clobberPrefix) { this.clobberPrefix = clobberPrefix; }

        public String getAdmonitionTag() { return admonitionTag; }
        public void setAdmonitionTag(String admonitionTag) { this.admonitionTag = admonitionTag; }
    }

    public static class Theme {
        private String general = RenderConfiguration.DEFAULT_THEME;
        private String codeBlock = RenderConfiguration.DEFAULT_CODE_BLOCK_THEME;
        private String previewStyle = "default";

        public String getGeneral() { return general; }
        public void setGeneral(String general) { this.general = general; }

        public String getCodeBlock() { return codeBlock; }
        public void setCodeBlock(String codeBlock) { this.codeBlock = codeBlock; }

        public String getPreviewStyle() { return previewStyle; }
        public void setPreviewStyle(String previewStyle) { this.previewStyle = previewStyle; }

        /**
         * Render configuration built from the configured defaults.
         */
        public RenderConfiguration toRenderConfiguration() {
            return new RenderConfiguration(general, codeBlock, "");
        }
    }
}
