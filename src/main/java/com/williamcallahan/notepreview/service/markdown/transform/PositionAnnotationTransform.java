package com.williamcallahan.notepreview.service.markdown.transform;

import com.williamcallahan.notepreview.domain.markdown.SyntaxNode;
import com.williamcallahan.notepreview.domain.markdown.SyntaxNodeType;

import java.util.List;

/**
 * Stamps the source line onto every positioned element node as {@code data-line}.
 */
public class PositionAnnotationTransform implements SyntaxTreeTransform {

    @Override
    public String name() {
        return "position";
    }

    @Override
    public SyntaxNode apply(SyntaxNode root) {
        return SyntaxTrees.rewriteBottomUp(root, node -> {
            if (node.position() == null || node.is(SyntaxNodeType.TEXT) || node.is(SyntaxNodeType.DOCUMENT)) {
                return List.of(node);
            }
            return List.of(node.withAttribute(SyntaxNode.ATTR_DATA_LINE, node.position().line()));
        });
    }
}
