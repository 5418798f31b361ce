package com.williamcallahan.notepreview.service.markdown.transform;

import com.williamcallahan.notepreview.domain.markdown.SyntaxNode;
import com.williamcallahan.notepreview.domain.markdown.SyntaxNodeType;

import java.util.List;
import java.util.Locale;

/**
 * Rewrites code blocks fenced as {@code flowchart}, {@code chart}, {@code chart(yaml)} or
 * {@code mermaid} into typed diagram blocks carrying the raw block text.
 */
public class ChartBlockTransform implements SyntaxTreeTransform {

    @Override
    public String name() {
        return "charts";
    }

    @Override
    public SyntaxNode apply(SyntaxNode root) {
        return SyntaxTrees.rewriteBottomUp(root, node -> {
            if (!node.is(SyntaxNodeType.CODE_BLOCK)) {
                return List.of(node);
            }
            String language = node.stringAttribute(SyntaxNode.ATTR_LANGUAGE, "").toLowerCase(Locale.ROOT);
            return switch (language) {
                case "flowchart" -> List.of(diagram(SyntaxNodeType.FLOWCHART, node, false));
                case "chart" -> List.of(diagram(SyntaxNodeType.CHART, node, false));
                case "chart(yaml)" -> List.of(diagram(SyntaxNodeType.CHART, node, true));
                case "mermaid" -> List.of(diagram(SyntaxNodeType.MERMAID, node, false));
                default -> List.of(node);
            };
        });
    }

    private static SyntaxNode diagram(SyntaxNodeType type, SyntaxNode codeBlock, boolean yaml) {
        SyntaxNode diagram = SyntaxNode.leaf(type, codeBlock.value(), codeBlock.position());
        return type == SyntaxNodeType.CHART ? diagram.withAttribute(SyntaxNode.ATTR_YAML, yaml) : diagram;
    }
}
