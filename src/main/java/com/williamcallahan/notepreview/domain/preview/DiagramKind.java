package com.williamcallahan.notepreview.domain.preview;

import java.util.Locale;
import java.util.Optional;

/**
 * Diagram blocks rendered by dedicated components.
 */
public enum DiagramKind {
    FLOWCHART("flowchart"),
    CHART("chart"),
    MERMAID("mermaid");

    private final String tagName;

    DiagramKind(String tagName) {
        this.tagName = tagName;
    }

    public String getTagName() {
        return tagName;
    }

    public static Optional<DiagramKind> fromTagName(String tagName) {
        if (tagName == null) {
            return Optional.empty();
        }
        String normalized = tagName.toLowerCase(Locale.ROOT);
        for (DiagramKind kind : values()) {
            if (kind.tagName.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
