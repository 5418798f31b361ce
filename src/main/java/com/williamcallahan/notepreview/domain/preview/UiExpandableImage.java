package com.williamcallahan.notepreview.domain.preview;

/**
 * Image loaded from its {@code src}, expandable to full size on click.
 */
public record UiExpandableImage(String src, String alt, String title) implements UiElement {
}
