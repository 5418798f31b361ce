package com.williamcallahan.notepreview.service.markdown.transform;

import com.vladsch.flexmark.ext.emoji.EmojiImageType;
import com.vladsch.flexmark.ext.emoji.EmojiShortcutType;
import com.vladsch.flexmark.ext.emoji.internal.EmojiResolvedShortcut;
import com.williamcallahan.notepreview.domain.markdown.SyntaxNode;
import com.williamcallahan.notepreview.domain.markdown.SyntaxNodeType;

import java.util.List;

/**
 * Replaces {@code :shortcode:} nodes with the matching Unicode emoji from Flexmark's emoji
 * reference (GitHub and emoji-cheat-sheet names). Shortcodes without a Unicode form stay literal.
 * Code spans and code blocks never contain shortcode nodes.
 */
public class EmojiShortcodeTransform implements SyntaxTreeTransform {

    @Override
    public String name() {
        return "emoji";
    }

    @Override
    public SyntaxNode apply(SyntaxNode root) {
        return SyntaxTrees.rewriteBottomUp(root, node -> node.is(SyntaxNodeType.EMOJI)
            ? List.of(SyntaxNode.leaf(SyntaxNodeType.TEXT, resolve(node.value()), node.position()))
            : List.of(node));
    }

    /**
     * Resolves a shortcode name to its emoji, or back to {@code :name:} when unknown.
     */
    static String resolve(String shortcode) {
        EmojiResolvedShortcut resolved = EmojiResolvedShortcut.getEmojiText(
            shortcode, EmojiShortcutType.ANY_GITHUB_PREFERRED, EmojiImageType.UNICODE_ONLY, "");
        if (resolved.emoji != null && resolved.isUnicode && resolved.emojiText != null) {
            return resolved.emojiText;
        }
        return ":" + shortcode + ":";
    }
}
