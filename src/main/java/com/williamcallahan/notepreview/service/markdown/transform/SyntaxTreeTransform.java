package com.williamcallahan.notepreview.service.markdown.transform;

import com.williamcallahan.notepreview.domain.markdown.SyntaxNode;

/**
 * One stage of the syntax tree transform chain.
 *
 * <p>Implementations are pure and total: they return a new tree and leave a tree without
 * the construct they target unchanged.</p>
 */
public interface SyntaxTreeTransform {

    /**
     * Short name used in logs.
     */
    String name();

    SyntaxNode apply(SyntaxNode root);
}
