package com.williamcallahan.notepreview.service.markdown.transform;

import com.williamcallahan.notepreview.domain.markdown.SyntaxNode;
import com.williamcallahan.notepreview.domain.markdown.SyntaxNodeType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns fenced callouts into {@link SyntaxNodeType#ADMONITION} blocks:
 *
 * <pre>
 * :::warning Careful
 * Content, any markdown.
 * :::
 * </pre>
 *
 * Markers are recognized at the start of a paragraph; content may span several blocks and
 * admonitions may nest. A closing marker swallowed by lazy continuation into the last paragraph
 * of a list or block quote still closes. An opening marker without a matching close stays
 * literal text.
 */
public class AdmonitionTransform implements SyntaxTreeTransform {

    public static final String DEFAULT_TAG = ":::";

    private static final Map<String, String> ICONS = new LinkedHashMap<>();

    static {
        ICONS.put("note", "ℹ️");
        ICONS.put("tip", "💡");
        ICONS.put("info", "ℹ️");
        ICONS.put("important", "❗");
        ICONS.put("caution", "⚠️");
        ICONS.put("warning", "⚠️");
        ICONS.put("danger", "🔥");
        ICONS.put("success", "✅");
        ICONS.put("secondary", "📝");
    }

    private static final Set<SyntaxNodeType> TRAILING_CONTAINERS = EnumSet.of(
        SyntaxNodeType.BULLET_LIST, SyntaxNodeType.ORDERED_LIST, SyntaxNodeType.LIST_ITEM, SyntaxNodeType.BLOCK_QUOTE);

    private final String tag;
    private final Pattern openingMarker;

    public AdmonitionTransform() {
        this(DEFAULT_TAG);
    }

    public AdmonitionTransform(String tag) {
        this.tag = tag == null || tag.isBlank() ? DEFAULT_TAG : tag.trim();
        this.openingMarker = Pattern.compile("^" + Pattern.quote(this.tag) + "\\s*([A-Za-z]+)(?:\\s+(.*))?$");
    }

    @Override
    public String name() {
        return "admonition";
    }

    @Override
    public SyntaxNode apply(SyntaxNode root) {
        return SyntaxTrees.rewriteChildLists(root, this::rewriteSiblings);
    }

    /**
     * Icon shown for an admonition kind, if the kind is recognized.
     */
    public static Optional<String> iconFor(String kind) {
        return Optional.ofNullable(kind == null ? null : ICONS.get(kind.toLowerCase(Locale.ROOT)));
    }

    private List<SyntaxNode> rewriteSiblings(List<SyntaxNode> siblings) {
        List<SyntaxNode> rewritten = new ArrayList<>(siblings.size());
        int index = 0;
        while (index < siblings.size()) {
            SyntaxNode candidate = siblings.get(index);
            Optional<Opening> opening = opening(candidate);
            if (opening.isEmpty()) {
                rewritten.add(candidate);
                index++;
                continue;
            }
            Optional<Match> match = collect(opening.get(), siblings, index);
            if (match.isEmpty()) {
                rewritten.add(candidate);
                index++;
                continue;
            }
            rewritten.add(match.get().admonition());
            index = match.get().nextIndex();
        }
        return rewritten;
    }

    private Optional<Match> collect(Opening opening, List<SyntaxNode> siblings, int openingIndex) {
        List<SyntaxNode> content = new ArrayList<>();
        List<List<SyntaxNode>> remainder = opening.remainingLines();
        if (!remainder.isEmpty() && isClosingLine(remainder.get(remainder.size() - 1))) {
            addParagraph(content, remainder.subList(0, remainder.size() - 1), opening.paragraph());
            return Optional.of(new Match(admonition(opening, content), openingIndex + 1));
        }
        addParagraph(content, remainder, opening.paragraph());

        int depth = 0;
        for (int index = openingIndex + 1; index < siblings.size(); index++) {
            SyntaxNode sibling = siblings.get(index);
            if (sibling.is(SyntaxNodeType.PARAGRAPH)) {
                List<List<SyntaxNode>> lines = lines(sibling);
                Optional<Opening> nested = opening(sibling);
                boolean closes = !lines.isEmpty() && isClosingLine(lines.get(lines.size() - 1));
                if (nested.isPresent() && !closes) {
                    depth++;
                } else if (nested.isEmpty() && closes) {
                    if (depth == 0) {
                        addParagraph(content, lines.subList(0, lines.size() - 1), sibling);
                        return Optional.of(new Match(admonition(opening, content), index + 1));
                    }
                    depth--;
                }
            } else if (TRAILING_CONTAINERS.contains(sibling.type())) {
                Optional<SyntaxNode> closed = withoutTrailingClose(sibling);
                if (closed.isPresent()) {
                    if (depth == 0) {
                        content.add(closed.get());
                        return Optional.of(new Match(admonition(opening, content), index + 1));
                    }
                    depth--;
                }
            }
            content.add(sibling);
        }
        return Optional.empty();
    }

    /**
     * Returns the container without the closing marker that ends its last paragraph, or empty
     * when its last paragraph does not end with one.
     */
    private Optional<SyntaxNode> withoutTrailingClose(SyntaxNode node) {
        if (node.is(SyntaxNodeType.PARAGRAPH)) {
            List<List<SyntaxNode>> lines = lines(node);
            if (lines.size() < 2 || !isClosingLine(lines.get(lines.size() - 1))) {
                return Optional.empty();
            }
            String raw = node.stringAttribute(SyntaxNode.ATTR_RAW, null);
            SyntaxNode trimmed = node.withChildren(joinLines(lines.subList(0, lines.size() - 1)));
            return Optional.of(raw == null || raw.lastIndexOf('\n') < 0
                ? trimmed
                : trimmed.withAttribute(SyntaxNode.ATTR_RAW, raw.substring(0, raw.lastIndexOf('\n'))));
        }
        if (!TRAILING_CONTAINERS.contains(node.type()) || !node.hasChildren()) {
            return Optional.empty();
        }
        List<SyntaxNode> children = node.children();
        int last = children.size() - 1;
        return withoutTrailingClose(children.get(last)).map(closedChild -> {
            List<SyntaxNode> updated = new ArrayList<>(children);
            updated.set(last, closedChild);
            return node.withChildren(updated);
        });
    }

    private SyntaxNode admonition(Opening opening, List<SyntaxNode> content) {
        String kind = opening.kind();
        return SyntaxNode.of(SyntaxNodeType.ADMONITION, rewriteSiblings(content), opening.paragraph().position())
            .withAttribute(SyntaxNode.ATTR_KIND, kind)
            .withAttribute(SyntaxNode.ATTR_TITLE, opening.title().isEmpty() ? kind : opening.title())
            .withAttribute(SyntaxNode.ATTR_ICON, ICONS.get(kind));
    }

    private Optional<Opening> opening(SyntaxNode node) {
        if (!node.is(SyntaxNodeType.PARAGRAPH)) {
            return Optional.empty();
        }
        List<List<SyntaxNode>> lines = lines(node);
        if (lines.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = openingMarker.matcher(lineText(lines.get(0)).trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String kind = matcher.group(1).toLowerCase(Locale.ROOT);
        if (!ICONS.containsKey(kind)) {
            return Optional.empty();
        }
        String title = matcher.group(2) == null ? "" : matcher.group(2).trim();
        return Optional.of(new Opening(node, kind, title, lines.subList(1, lines.size())));
    }

    private boolean isClosingLine(List<SyntaxNode> line) {
        return lineText(line).trim().equals(tag);
    }

    private static void addParagraph(List<SyntaxNode> content, List<List<SyntaxNode>> lines, SyntaxNode source) {
        List<SyntaxNode> inline = joinLines(lines);
        if (inline.isEmpty() || lineText(inline).isBlank()) {
            return;
        }
        SyntaxNode first = inline.get(0);
        content.add(SyntaxNode.of(
            SyntaxNodeType.PARAGRAPH,
            inline,
            first.position() != null ? first.position() : source.position()
        ));
    }

    private static List<SyntaxNode> joinLines(List<List<SyntaxNode>> lines) {
        List<SyntaxNode> inline = new ArrayList<>();
        for (List<SyntaxNode> line : lines) {
            if (!inline.isEmpty()) {
                inline.add(SyntaxNode.leaf(SyntaxNodeType.SOFT_BREAK, "", null));
            }
            inline.addAll(line);
        }
        return inline;
    }

    private static List<List<SyntaxNode>> lines(SyntaxNode paragraph) {
        List<List<SyntaxNode>> lines = new ArrayList<>();
        List<SyntaxNode> current = new ArrayList<>();
        for (SyntaxNode child : paragraph.children()) {
            if (child.is(SyntaxNodeType.SOFT_BREAK) || child.is(SyntaxNodeType.HARD_BREAK)) {
                lines.add(current);
                current = new ArrayList<>();
            } else {
                current.add(child);
            }
        }
        lines.add(current);
        return lines;
    }

    private static String lineText(List<SyntaxNode> line) {
        return SyntaxNode.of(SyntaxNodeType.PARAGRAPH, line, null).plainText();
    }

    private record Opening(SyntaxNode paragraph, String kind, String title, List<List<SyntaxNode>> remainingLines) {}

    private record Match(SyntaxNode admonition, int nextIndex) {}
}
