package com.williamcallahan.notepreview.web;

import com.williamcallahan.notepreview.domain.preview.UiElement;

import java.util.List;

/**
 * Rendered preview returned by {@code POST /api/preview/render}.
 *
 * @param html sanitized hypertext
 * @param elements UI element tree built from the hypertext
 * @param theme theme class for the preview container
 * @param styleOverrides user stylesheet for the preview container
 * @param renderTimeMs pipeline wall time
 */
public record PreviewRenderResponse(
    String html,
    List<UiElement> elements,
    String theme,
    String styleOverrides,
    long renderTimeMs
) {
}
