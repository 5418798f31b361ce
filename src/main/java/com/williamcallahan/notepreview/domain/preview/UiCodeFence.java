package com.williamcallahan.notepreview.domain.preview;

/**
 * Code block handed to the syntax highlighter.
 *
 * @param language fence info language, empty when none was given
 * @param code raw code
 * @param codeBlockTheme highlighting theme
 */
public record UiCodeFence(String language, String code, String codeBlockTheme) implements UiElement {
}
