package com.williamcallahan.notepreview.domain.preview;

/**
 * Flowchart, chart or mermaid block.
 *
 * @param kind diagram component to use
 * @param payload raw block text
 * @param yaml whether a chart payload is YAML rather than JSON
 */
public record UiDiagram(DiagramKind kind, String payload, boolean yaml) implements UiElement {
}
