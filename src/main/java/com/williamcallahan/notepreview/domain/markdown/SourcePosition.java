package com.williamcallahan.notepreview.domain.markdown;

/**
 * One-based line and column where a syntax node starts in the source.
 *
 * @param line one-based line number
 * @param column one-based column number
 */
public record SourcePosition(int line, int column) {

    public SourcePosition {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("Source position must be one-based: " + line + ":" + column);
        }
    }
}
