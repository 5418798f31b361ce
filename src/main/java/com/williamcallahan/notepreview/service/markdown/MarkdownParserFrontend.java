package com.williamcallahan.notepreview.service.markdown;

import com.vladsch.flexmark.ast.AutoLink;
import com.vladsch.flexmark.ast.BlockQuote;
import com.vladsch.flexmark.ast.BulletList;
import com.vladsch.flexmark.ast.Code;
import com.vladsch.flexmark.ast.Emphasis;
import com.vladsch.flexmark.ast.FencedCodeBlock;
import com.vladsch.flexmark.ast.HardLineBreak;
import com.vladsch.flexmark.ast.Heading;
import com.vladsch.flexmark.ast.HtmlBlockBase;
import com.vladsch.flexmark.ast.HtmlEntity;
import com.vladsch.flexmark.ast.HtmlInlineBase;
import com.vladsch.flexmark.ast.Image;
import com.vladsch.flexmark.ast.ImageRef;
import com.vladsch.flexmark.ast.IndentedCodeBlock;
import com.vladsch.flexmark.ast.Link;
import com.vladsch.flexmark.ast.LinkRef;
import com.vladsch.flexmark.ast.ListBlock;
import com.vladsch.flexmark.ast.ListItem;
import com.vladsch.flexmark.ast.MailLink;
import com.vladsch.flexmark.ast.OrderedList;
import com.vladsch.flexmark.ast.Paragraph;
import com.vladsch.flexmark.ast.Reference;
import com.vladsch.flexmark.ast.SoftLineBreak;
import com.vladsch.flexmark.ast.StrongEmphasis;
import com.vladsch.flexmark.ast.Text;
import com.vladsch.flexmark.ast.ThematicBreak;
import com.vladsch.flexmark.ext.autolink.AutolinkExtension;
import com.vladsch.flexmark.ext.emoji.Emoji;
import com.vladsch.flexmark.ext.emoji.EmojiExtension;
import com.vladsch.flexmark.ext.gfm.strikethrough.Strikethrough;
import com.vladsch.flexmark.ext.gfm.strikethrough.StrikethroughExtension;
import com.vladsch.flexmark.ext.gfm.tasklist.TaskListExtension;
import com.vladsch.flexmark.ext.gfm.tasklist.TaskListItem;
import com.vladsch.flexmark.ext.tables.TableBlock;
import com.vladsch.flexmark.ext.tables.TableBody;
import com.vladsch.flexmark.ext.tables.TableCell;
import com.vladsch.flexmark.ext.tables.TableHead;
import com.vladsch.flexmark.ext.tables.TableRow;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Block;
import com.vladsch.flexmark.util.ast.Document;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.data.MutableDataSet;
import com.williamcallahan.notepreview.domain.markdown.SourcePosition;
import com.williamcallahan.notepreview.domain.markdown.SyntaxNode;
import com.williamcallahan.notepreview.domain.markdown.SyntaxNodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses markdown with Flexmark and converts the Flexmark AST into the preview syntax tree.
 *
 * <p>Parsing is permissive: any input yields a tree. Should Flexmark fail, the source is returned
 * as a single literal paragraph. Blocks nested deeper than {@value #MAX_NESTING_DEPTH} levels are
 * kept as literal text so later stages stay within a bounded depth.</p>
 */
public class MarkdownParserFrontend {

    private static final Logger logger = LoggerFactory.getLogger(MarkdownParserFrontend.class);

    static final int MAX_NESTING_DEPTH = 64;

    private final Parser parser;

    public MarkdownParserFrontend() {
        MutableDataSet options = new MutableDataSet()
            .set(Parser.EXTENSIONS, Arrays.asList(
                TablesExtension.create(),
                StrikethroughExtension.create(),
                TaskListExtension.create(),
                AutolinkExtension.create(),
                EmojiExtension.create(),
                InlineMathExtension.create()
            ))
            .set(Parser.BLANK_LINES_IN_AST, false)
            .set(Parser.HTML_BLOCK_DEEP_PARSER, false)
            .set(Parser.INDENTED_CODE_NO_TRAILING_BLANK_LINES, true)
            .set(TablesExtension.COLUMN_SPANS, false)
            .set(TablesExtension.APPEND_MISSING_COLUMNS, true)
            .set(TablesExtension.DISCARD_EXTRA_COLUMNS, true)
            .set(TablesExtension.HEADER_SEPARATOR_COLUMN_MATCH, true);

        this.parser = Parser.builder(options).build();
    }

    /**
     * Parses markdown source into a syntax tree rooted at a {@link SyntaxNodeType#DOCUMENT} node.
     *
     * @param source markdown text, null is treated as empty
     * @return syntax tree, never null
     */
    public SyntaxNode parse(String source) {
        String markdown = source == null ? "" : source;
        try {
            Document document = parser.parse(markdown);
            return new AstConversion(markdown, document).convert();
        } catch (RuntimeException | StackOverflowError parseFailure) {
            logger.warn("Markdown parsing failed; rendering source as literal text: {}", parseFailure.toString());
            return literalDocument(markdown);
        }
    }

    /**
     * Source offsets of the state character inside each task marker ({@code [ ]}, {@code [x]}),
     * in document order. Markers Flexmark does not treat as tasks, such as those in code, are
     * not included.
     */
    List<Integer> taskStateOffsets(String source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        try {
            List<Integer> offsets = new ArrayList<>();
            for (Node node : parser.parse(source).getDescendants()) {
                if (node instanceof TaskListItem taskItem) {
                    offsets.add(taskItem.getMarkerSuffix().getStartOffset() + 1);
                }
            }
            return offsets;
        } catch (RuntimeException | StackOverflowError parseFailure) {
            logger.warn("Markdown parsing failed; no task markers located: {}", parseFailure.toString());
            return List.of();
        }
    }

    private static SyntaxNode literalDocument(String markdown) {
        SourcePosition start = new SourcePosition(1, 1);
        if (markdown.isEmpty()) {
            return SyntaxNode.of(SyntaxNodeType.DOCUMENT, List.of(), start);
        }
        SyntaxNode paragraph = SyntaxNode.of(
            SyntaxNodeType.PARAGRAPH,
            List.of(SyntaxNode.leaf(SyntaxNodeType.TEXT, markdown, start)),
            start
        );
        return SyntaxNode.of(SyntaxNodeType.DOCUMENT, List.of(paragraph), start);
    }

    /**
     * One conversion pass over a Flexmark document.
     */
    private static final class AstConversion {
        private final Document document;
        private final int[] lineStarts;
        private int depth;
        private boolean truncated;

        AstConversion(String markdown, Document document) {
            this.document = document;
            this.lineStarts = computeLineStarts(markdown);
        }

        SyntaxNode convert() {
            return SyntaxNode.of(SyntaxNodeType.DOCUMENT, convertChildren(document), new SourcePosition(1, 1));
        }

        private List<SyntaxNode> convertChildren(Node parent) {
            List<SyntaxNode> converted = new ArrayList<>();
            depth++;
            try {
                for (Node child = parent.getFirstChild(); child != null; child = child.getNext()) {
                    convertInto(child, converted);
                }
            } finally {
                depth--;
            }
            return converted;
        }

        private void convertInto(Node node, List<SyntaxNode> out) {
            SourcePosition position = positionOf(node);

            if (depth > MAX_NESTING_DEPTH) {
                if (!truncated) {
                    truncated = true;
                    logger.warn("Markdown nesting exceeds {} levels at line {}; keeping the rest as text",
                        MAX_NESTING_DEPTH, position.line());
                }
                out.add(SyntaxNode.leaf(SyntaxNodeType.TEXT, node.getChars().toString(), position));
            } else if (node instanceof Paragraph) {
                out.add(container(SyntaxNodeType.PARAGRAPH, node, position)
                    .withAttribute(SyntaxNode.ATTR_RAW, node.getChars().toString()));
            } else if (node instanceof Heading heading) {
                out.add(container(SyntaxNodeType.HEADING, node, position)
                    .withAttribute(SyntaxNode.ATTR_LEVEL, heading.getLevel()));
            } else if (node instanceof Text) {
                out.add(SyntaxNode.leaf(SyntaxNodeType.TEXT, unescaped(node.getChars()), position)
                    .withAttribute(SyntaxNode.ATTR_RAW, node.getChars().toString()));
            } else if (node instanceof HtmlEntity) {
                out.add(SyntaxNode.leaf(SyntaxNodeType.TEXT, unescaped(node.getChars()), position));
            } else if (node instanceof StrongEmphasis) {
                out.add(container(SyntaxNodeType.STRONG, node, position));
            } else if (node instanceof Emphasis) {
                out.add(container(SyntaxNodeType.EMPHASIS, node, position));
            } else if (node instanceof Strikethrough) {
                out.add(container(SyntaxNodeType.STRIKETHROUGH, node, position));
            } else if (node instanceof InlineMath math) {
                out.add(SyntaxNode.leaf(SyntaxNodeType.MATH_INLINE, math.getText().toString(), position));
            } else if (node instanceof Emoji emoji) {
                out.add(SyntaxNode.leaf(SyntaxNodeType.EMOJI, emoji.getText().toString(), position));
            } else if (node instanceof Code code) {
                out.add(SyntaxNode.leaf(SyntaxNodeType.CODE_SPAN, code.getText().toString(), position));
            } else if (node instanceof FencedCodeBlock fenced) {
                out.add(SyntaxNode.leaf(SyntaxNodeType.CODE_BLOCK, fenced.getContentChars().toString(), position)
                    .withAttribute(SyntaxNode.ATTR_LANGUAGE, infoLanguage(fenced.getInfo().toString())));
            } else if (node instanceof IndentedCodeBlock indented) {
                out.add(SyntaxNode.leaf(SyntaxNodeType.CODE_BLOCK, indented.getContentChars().toString(), position)
                    .withAttribute(SyntaxNode.ATTR_LANGUAGE, ""));
            } else if (node instanceof BlockQuote) {
                out.add(container(SyntaxNodeType.BLOCK_QUOTE, node, position));
            } else if (node instanceof ListBlock list) {
                SyntaxNodeType listType = node instanceof BulletList ? SyntaxNodeType.BULLET_LIST : SyntaxNodeType.ORDERED_LIST;
                SyntaxNode converted = container(listType, node, position)
                    .withAttribute(SyntaxNode.ATTR_TIGHT, list.isTight());
                if (list instanceof OrderedList ordered) {
                    converted = converted.withAttribute(SyntaxNode.ATTR_START, ordered.getStartNumber());
                }
                out.add(converted);
            } else if (node instanceof TaskListItem taskItem) {
                out.add(container(SyntaxNodeType.LIST_ITEM, node, position)
                    .withAttribute(SyntaxNode.ATTR_TASK, true)
                    .withAttribute(SyntaxNode.ATTR_CHECKED, taskItem.isItemDoneMarker()));
            } else if (node instanceof ListItem) {
                out.add(container(SyntaxNodeType.LIST_ITEM, node, position));
            } else if (node instanceof Image image) {
                out.add(image(position, unescaped(image.getUrl()), unescaped(image.getTitle()), plainText(node)));
            } else if (node instanceof Link link) {
                out.add(link(node, position, unescaped(link.getUrl()), unescaped(link.getTitle())));
            } else if (node instanceof ImageRef imageRef) {
                Reference reference = imageRef.isDefined() ? imageRef.getReferenceNode(document) : null;
                if (reference == null) {
                    out.add(SyntaxNode.leaf(SyntaxNodeType.TEXT, unescaped(node.getChars()), position));
                } else {
                    out.add(image(position, unescaped(reference.getUrl()), unescaped(reference.getTitle()), plainText(node)));
                }
            } else if (node instanceof LinkRef linkRef) {
                Reference reference = linkRef.isDefined() ? linkRef.getReferenceNode(document) : null;
                if (reference == null) {
                    out.add(SyntaxNode.leaf(SyntaxNodeType.TEXT, unescaped(node.getChars()), position));
                } else {
                    out.add(link(node, position, unescaped(reference.getUrl()), unescaped(reference.getTitle())));
                }
            } else if (node instanceof MailLink mailLink) {
                String address = mailLink.getText().toString();
                out.add(SyntaxNode.of(SyntaxNodeType.LINK, List.of(SyntaxNode.text(address)), position)
                    .withAttribute(SyntaxNode.ATTR_URL, "mailto:" + address));
            } else if (node instanceof AutoLink autoLink) {
                String target = autoLink.getText().toString();
                String url = target.toLowerCase(Locale.ROOT).startsWith("www.") ? "http://" + target : target;
                out.add(SyntaxNode.of(SyntaxNodeType.LINK, List.of(SyntaxNode.text(target)), position)
                    .withAttribute(SyntaxNode.ATTR_URL, url));
            } else if (node instanceof HtmlBlockBase) {
                out.add(SyntaxNode.leaf(SyntaxNodeType.RAW_HTML_BLOCK, node.getChars().toString(), position));
            } else if (node instanceof HtmlInlineBase) {
                out.add(SyntaxNode.leaf(SyntaxNodeType.RAW_HTML_INLINE, node.getChars().toString(), position));
            } else if (node instanceof SoftLineBreak) {
                out.add(SyntaxNode.leaf(SyntaxNodeType.SOFT_BREAK, "", position));
            } else if (node instanceof HardLineBreak) {
                out.add(SyntaxNode.leaf(SyntaxNodeType.HARD_BREAK, "", position));
            } else if (node instanceof ThematicBreak) {
                out.add(SyntaxNode.leaf(SyntaxNodeType.THEMATIC_BREAK, "", position));
            } else if (node instanceof TableBlock) {
                out.add(container(SyntaxNodeType.TABLE, node, position));
            } else if (node instanceof TableHead) {
                out.add(container(SyntaxNodeType.TABLE_HEAD, node, position));
            } else if (node instanceof TableBody) {
                out.add(container(SyntaxNodeType.TABLE_BODY, node, position));
            } else if (node instanceof TableRow) {
                out.add(container(SyntaxNodeType.TABLE_ROW, node, position));
            } else if (node instanceof TableCell cell) {
                SyntaxNode converted = container(SyntaxNodeType.TABLE_CELL, node, position)
                    .withAttribute(SyntaxNode.ATTR_HEADER, cell.isHeader());
                if (cell.getAlignment() != null) {
                    converted = converted.withAttribute(SyntaxNode.ATTR_ALIGN, cell.getAlignment().name().toLowerCase(Locale.ROOT));
                }
                out.add(converted);
            } else if (node instanceof Reference) {
                // definitions only feed reference links
            } else if (node.hasChildren()) {
                // transparent wrappers (TextBase, table separators with content, ...)
                out.addAll(convertChildren(node));
            } else if (!(node instanceof Block) && node.getChars().length() > 0) {
                out.add(SyntaxNode.leaf(SyntaxNodeType.TEXT, unescaped(node.getChars()), position));
            } else {
                logger.debug("Skipping unsupported markdown node {}", node.getClass().getSimpleName());
            }
        }

        private SyntaxNode container(SyntaxNodeType type, Node node, SourcePosition position) {
            return SyntaxNode.of(type, convertChildren(node), position);
        }

        private SyntaxNode link(Node node, SourcePosition position, String url, String title) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put(SyntaxNode.ATTR_URL, url);
            if (!title.isEmpty()) {
                attributes.put(SyntaxNode.ATTR_TITLE, title);
            }
            return new SyntaxNode(SyntaxNodeType.LINK, "", attributes, convertChildren(node), position);
        }

        private SyntaxNode image(SourcePosition position, String url, String title, String alt) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put(SyntaxNode.ATTR_URL, url);
            attributes.put(SyntaxNode.ATTR_ALT, alt);
            if (!title.isEmpty()) {
                attributes.put(SyntaxNode.ATTR_TITLE, title);
            }
            return new SyntaxNode(SyntaxNodeType.IMAGE, "", attributes, List.of(), position);
        }

        private String plainText(Node node) {
            return SyntaxNode.of(SyntaxNodeType.PARAGRAPH, convertChildren(node), null).plainText();
        }

        private SourcePosition positionOf(Node node) {
            int offset = Math.max(0, node.getStartOffset());
            int lineIndex = Arrays.binarySearch(lineStarts, offset);
            if (lineIndex < 0) {
                lineIndex = -lineIndex - 2;
            }
            lineIndex = Math.max(0, lineIndex);
            return new SourcePosition(lineIndex + 1, offset - lineStarts[lineIndex] + 1);
        }

        private static int[] computeLineStarts(String markdown) {
            List<Integer> starts = new ArrayList<>();
            starts.add(0);
            for (int index = 0; index < markdown.length(); index++) {
                if (markdown.charAt(index) == '\n') {
                    starts.add(index + 1);
                }
            }
            int[] result = new int[starts.size()];
            for (int index = 0; index < result.length; index++) {
                result[index] = starts.get(index);
            }
            return result;
        }

        private static String unescaped(CharSequence chars) {
            if (chars == null) {
                return "";
            }
            if (chars instanceof com.vladsch.flexmark.util.sequence.BasedSequence based) {
                return String.valueOf(based.unescape());
            }
            return chars.toString();
        }

        private static String infoLanguage(String info) {
            String trimmed = info == null ? "" : info.trim();
            int whitespace = 0;
            while (whitespace < trimmed.length() && !Character.isWhitespace(trimmed.charAt(whitespace))) {
                whitespace++;
            }
            return trimmed.substring(0, whitespace);
        }
    }
}
