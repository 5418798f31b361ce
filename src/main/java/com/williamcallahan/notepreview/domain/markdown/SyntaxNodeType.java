package com.williamcallahan.notepreview.domain.markdown;

/**
 * Closed set of node kinds a syntax tree may contain.
 * Standard markdown kinds come from the parser; the rest are produced by transforms.
 */
public enum SyntaxNodeType {
    DOCUMENT,
    PARAGRAPH,
    HEADING,
    TEXT,
    EMPHASIS,
    STRONG,
    STRIKETHROUGH,
    CODE_SPAN,
    CODE_BLOCK,
    BLOCK_QUOTE,
    BULLET_LIST,
    ORDERED_LIST,
    LIST_ITEM,
    LINK,
    IMAGE,
    RAW_HTML_BLOCK,
    RAW_HTML_INLINE,
    SOFT_BREAK,
    HARD_BREAK,
    THEMATIC_BREAK,
    TABLE,
    TABLE_HEAD,
    TABLE_BODY,
    TABLE_ROW,
    TABLE_CELL,
    EMOJI,

    // Extension kinds
    ADMONITION,
    MATH_INLINE,
    MATH_BLOCK,
    FLOWCHART,
    CHART,
    MERMAID;

    /**
     * Returns whether nodes of this kind sit inside a paragraph-level flow.
     */
    public boolean isInline() {
        return switch (this) {
            case TEXT, EMPHASIS, STRONG, STRIKETHROUGH, CODE_SPAN, LINK, IMAGE,
                 RAW_HTML_INLINE, SOFT_BREAK, HARD_BREAK, EMOJI, MATH_INLINE -> true;
            default -> false;
        };
    }
}
