package com.williamcallahan.notepreview.service.markdown.transform;

import com.williamcallahan.notepreview.domain.markdown.SyntaxNode;
import com.williamcallahan.notepreview.domain.markdown.SyntaxNodeType;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Assigns GitHub-style anchor slugs to headings.
 *
 * <p>Slugs are unique per document: a repeated heading gets {@code -1}, {@code -2}, ... appended,
 * skipping suffixes that would collide with a slug already taken.</p>
 */
public class HeadingSlugTransform implements SyntaxTreeTransform {

    private static final Pattern DISALLOWED = Pattern.compile("[^\\p{L}\\p{M}\\p{Nd}\\p{Pc} -]");

    @Override
    public String name() {
        return "slug";
    }

    @Override
    public SyntaxNode apply(SyntaxNode root) {
        SlugRegistry registry = new SlugRegistry();
        return SyntaxTrees.rewriteBottomUp(root, node -> node.is(SyntaxNodeType.HEADING)
            ? List.of(node.withAttribute(SyntaxNode.ATTR_SLUG, registry.slug(node.plainText())))
            : List.of(node));
    }

    /**
     * Base slug of a heading text, without disambiguation.
     */
    public static String slugify(String headingText) {
        if (headingText == null) {
            return "";
        }
        String lowered = headingText.trim().toLowerCase(Locale.ROOT);
        return DISALLOWED.matcher(lowered).replaceAll("").replace(' ', '-');
    }

    /**
     * Per-document slug occurrences.
     */
    static final class SlugRegistry {
        private final Map<String, Integer> occurrences = new HashMap<>();

        String slug(String headingText) {
            String original = slugify(headingText);
            String candidate = original;
            while (occurrences.containsKey(candidate)) {
                int next = occurrences.merge(original, 1, Integer::sum);
                candidate = original + "-" + next;
            }
            occurrences.put(candidate, 0);
            return candidate;
        }
    }
}
