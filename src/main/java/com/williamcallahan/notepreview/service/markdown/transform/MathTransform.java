package com.williamcallahan.notepreview.service.markdown.transform;

import com.williamcallahan.notepreview.domain.markdown.SyntaxNode;
import com.williamcallahan.notepreview.domain.markdown.SyntaxNodeType;

import java.util.List;
import java.util.Locale;

/**
 * Recognizes display TeX and leaves it unrendered for the typesetter:
 * {@code $$...$$} paragraphs and {@code math} code blocks become {@link SyntaxNodeType#MATH_BLOCK}.
 * Inline {@code $...$} spans are already {@link SyntaxNodeType#MATH_INLINE} nodes from the parser.
 */
public class MathTransform implements SyntaxTreeTransform {

    private static final String BLOCK_DELIMITER = "$$";

    @Override
    public String name() {
        return "math";
    }

    @Override
    public SyntaxNode apply(SyntaxNode root) {
        return SyntaxTrees.rewriteBottomUp(root, node -> switch (node.type()) {
            case PARAGRAPH -> List.of(blockMath(node));
            case CODE_BLOCK -> List.of(mathCodeBlock(node));
            default -> List.of(node);
        });
    }

    private SyntaxNode blockMath(SyntaxNode paragraph) {
        String raw = stripQuoteMarkers(paragraph.stringAttribute(SyntaxNode.ATTR_RAW, paragraph.plainText())).trim();
        if (raw.length() < 2 * BLOCK_DELIMITER.length()
            || !raw.startsWith(BLOCK_DELIMITER)
            || !raw.endsWith(BLOCK_DELIMITER)) {
            return paragraph;
        }
        String tex = raw.substring(BLOCK_DELIMITER.length(), raw.length() - BLOCK_DELIMITER.length()).trim();
        if (tex.isEmpty() || tex.contains(BLOCK_DELIMITER)) {
            return paragraph;
        }
        return SyntaxNode.leaf(SyntaxNodeType.MATH_BLOCK, tex, paragraph.position());
    }

    private SyntaxNode mathCodeBlock(SyntaxNode codeBlock) {
        String language = codeBlock.stringAttribute(SyntaxNode.ATTR_LANGUAGE, "").toLowerCase(Locale.ROOT);
        if (!language.equals("math")) {
            return codeBlock;
        }
        return SyntaxNode.leaf(SyntaxNodeType.MATH_BLOCK, codeBlock.value().trim(), codeBlock.position());
    }

    private static String stripQuoteMarkers(String raw) {
        if (raw.indexOf('>') < 0) {
            return raw;
        }
        StringBuilder stripped = new StringBuilder(raw.length());
        for (String line : raw.split("\n", -1)) {
            int cursor = 0;
            while (cursor < line.length() && (line.charAt(cursor) == '>' || line.charAt(cursor) == ' ')) {
                cursor++;
            }
            if (stripped.length() > 0) {
                stripped.append('\n');
            }
            stripped.append(line.substring(cursor));
        }
        return stripped.toString();
    }
}
