package com.williamcallahan.notepreview.domain.preview;

import java.util.List;

/**
 * Output of one completed render run, ready for display.
 *
 * @param elements top-level UI elements in document order
 * @param theme theme class for the preview container
 * @param styleOverrides user stylesheet for the preview container
 * @param sequence run sequence number that produced this output
 * @param renderTimeMs wall time spent in the pipeline
 */
public record RenderedPreview(
    List<UiElement> elements,
    String theme,
    String styleOverrides,
    long sequence,
    long renderTimeMs
) {

    public RenderedPreview {
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    public static RenderedPreview empty() {
        return new RenderedPreview(List.of(), RenderConfiguration.DEFAULT_THEME, "", 0L, 0L);
    }
}
