package com.williamcallahan.notepreview.domain.preview;

/**
 * TeX formula handed to the math typesetter.
 */
public record UiMath(String tex, boolean display) implements UiElement {
}
