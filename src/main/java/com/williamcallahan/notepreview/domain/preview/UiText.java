package com.williamcallahan.notepreview.domain.preview;

/**
 * Literal text.
 */
public record UiText(String text) implements UiElement {

    public UiText {
        text = text == null ? "" : text;
    }
}
