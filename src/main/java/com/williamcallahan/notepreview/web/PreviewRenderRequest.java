package com.williamcallahan.notepreview.web;

/**
 * Body of {@code POST /api/preview/render}.
 *
 * @param content markdown source to render
 * @param codeBlockTheme code fence theme, configured default when absent
 * @param theme preview container theme, configured default when absent
 * @param styleOverrides user stylesheet carried into the response
 */
public record PreviewRenderRequest(String content, String codeBlockTheme, String theme, String styleOverrides) {
}
