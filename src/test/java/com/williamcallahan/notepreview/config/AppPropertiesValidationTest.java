package com.williamcallahan.notepreview.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

/**
 * Verifies validation of the preview settings.
 */
class AppPropertiesValidationTest {

    @Test
    void acceptsDefaults() {
        assertDoesNotThrow(new AppProperties()::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveMaxInputLength() {
        AppProperties appProperties = new AppProperties();
        appProperties.getPreview().setMaxInputLength(0);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNegativeCacheSize() {
        AppProperties appProperties = new AppProperties();
        appProperties.getPreview().setCacheSize(-1);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsZeroCacheTtl() {
        AppProperties appProperties = new AppProperties();
        appProperties.getPreview().setCacheTtl(Duration.ZERO);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsBlankPlantUmlServerAndAdmonitionTag() {
        AppProperties server = new AppProperties();
        server.getPreview().setPlantUmlServer(" ");
        AppProperties tag = new AppProperties();
        tag.getPreview().setAdmonitionTag("");

        assertThrows(IllegalArgumentException.class, server::validateConfiguration);
        assertThrows(IllegalArgumentException.class, tag::validateConfiguration);
    }

    @Test
    void themeDefaultsBecomeRenderConfiguration() {
        AppProperties appProperties = new AppProperties();
        appProperties.getTheme().setCodeBlock("solarized");

        assertEquals("solarized", appProperties.getTheme().toRenderConfiguration().codeBlockTheme());
        assertEquals("dark", appProperties.getTheme().toRenderConfiguration().theme());
    }
}
