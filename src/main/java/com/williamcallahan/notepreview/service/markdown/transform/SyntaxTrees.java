package com.williamcallahan.notepreview.service.markdown.transform;

import com.williamcallahan.notepreview.domain.markdown.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Tree rewriting helpers shared by the transforms.
 */
final class SyntaxTrees {
    private SyntaxTrees() {}

    /**
     * Rewrites a tree bottom-up. The rewriter receives each node with already rewritten children
     * and may return any number of replacement nodes.
     */
    static SyntaxNode rewriteBottomUp(SyntaxNode root, Function<SyntaxNode, List<SyntaxNode>> rewriter) {
        List<SyntaxNode> rewritten = rewriteNode(root, rewriter);
        if (rewritten.size() == 1) {
            return rewritten.get(0);
        }
        return root.withChildren(rewritten);
    }

    private static List<SyntaxNode> rewriteNode(SyntaxNode node, Function<SyntaxNode, List<SyntaxNode>> rewriter) {
        SyntaxNode current = node;
        if (node.hasChildren()) {
            List<SyntaxNode> newChildren = new ArrayList<>(node.children().size());
            boolean changed = false;
            for (SyntaxNode child : node.children()) {
                List<SyntaxNode> replacement = rewriteNode(child, rewriter);
                if (replacement.size() != 1 || replacement.get(0) != child) {
                    changed = true;
                }
                newChildren.addAll(replacement);
            }
            if (changed) {
                current = node.withChildren(newChildren);
            }
        }
        return rewriter.apply(current);
    }

    /**
     * Applies a sibling-list rewrite to every child list of the tree, deepest first.
     */
    static SyntaxNode rewriteChildLists(SyntaxNode root, Function<List<SyntaxNode>, List<SyntaxNode>> listRewriter) {
        if (!root.hasChildren()) {
            return root;
        }
        List<SyntaxNode> children = new ArrayList<>(root.children().size());
        for (SyntaxNode child : root.children()) {
            children.add(rewriteChildLists(child, listRewriter));
        }
        return root.withChildren(listRewriter.apply(children));
    }
}
