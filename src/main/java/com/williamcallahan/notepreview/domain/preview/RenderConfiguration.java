package com.williamcallahan.notepreview.domain.preview;

/**
 * Presentation settings handed to the preview on every render request.
 *
 * <p>Only {@code codeBlockTheme} takes part in the re-render decision; {@code theme} and
 * {@code styleOverrides} are carried into the output untouched.</p>
 *
 * @param theme application theme, applied as a class on the preview container
 * @param codeBlockTheme syntax highlighting theme for code fences
 * @param styleOverrides user stylesheet appended to the preview container
 */
public record RenderConfiguration(String theme, String codeBlockTheme, String styleOverrides) {

    public static final String DEFAULT_THEME = "dark";
    public static final String DEFAULT_CODE_BLOCK_THEME = "material-darker";

    public RenderConfiguration {
        theme = theme == null || theme.isBlank() ? DEFAULT_THEME : theme;
        codeBlockTheme = codeBlockTheme == null || codeBlockTheme.isBlank() ? DEFAULT_CODE_BLOCK_THEME : codeBlockTheme;
        styleOverrides = styleOverrides == null ? "" : styleOverrides;
    }

    public static RenderConfiguration defaults() {
        return new RenderConfiguration(DEFAULT_THEME, DEFAULT_CODE_BLOCK_THEME, "");
    }

    public RenderConfiguration withCodeBlockTheme(String newCodeBlockTheme) {
        return new RenderConfiguration(theme, newCodeBlockTheme, styleOverrides);
    }
}
