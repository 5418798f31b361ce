package com.williamcallahan.notepreview.service.markdown;

import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.sequence.BasedSequence;

/**
 * Flexmark node for a {@code $...$} or {@code $$...$$} span found inside a paragraph.
 * The TeX body keeps its source characters, backslash escapes included.
 */
public class InlineMath extends Node {
    private final BasedSequence openingMarker;
    private final BasedSequence text;
    private final BasedSequence closingMarker;

    public InlineMath(BasedSequence openingMarker, BasedSequence text, BasedSequence closingMarker) {
        super(openingMarker.baseSubSequence(openingMarker.getStartOffset(), closingMarker.getEndOffset()));
        this.openingMarker = openingMarker;
        this.text = text;
        this.closingMarker = closingMarker;
    }

    public BasedSequence getOpeningMarker() {
        return openingMarker;
    }

    public BasedSequence getText() {
        return text;
    }

    public BasedSequence getClosingMarker() {
        return closingMarker;
    }

    @Override
    public BasedSequence[] getSegments() {
        return new BasedSequence[]{openingMarker, text, closingMarker};
    }
}
