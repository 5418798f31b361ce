package com.williamcallahan.notepreview.service.markdown;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between stored note ids ({@code note:<uuid>}) and the bare ids used as link targets.
 *
 * <p>Links to other notes are written as {@code [title](note:<uuid>)}. The {@code note:} prefix
 * looks like a URL scheme, which the sanitizer would reject, so it is removed before parsing and
 * re-added when the link is followed.</p>
 */
public final class NoteLinkRewriter {

    public static final String NOTE_ID_PREFIX = "note:";

    private static final String UUID = "[0-9A-Fa-f]{8}-[0-9A-Fa-f]{4}-[0-9A-Fa-f]{4}-[0-9A-Fa-f]{4}-[0-9A-Fa-f]{12}";
    private static final Pattern NOTE_LINK_ID = Pattern.compile("^" + UUID + "$");

    // "](note:<id>" in inline links, "]: note:<id>" in reference definitions
    private static final Pattern PREFIXED_INLINE_TARGET =
        Pattern.compile("(\\]\\(\\s*<?)(?:" + NOTE_ID_PREFIX + ")+(" + UUID + ")");
    private static final Pattern PREFIXED_REFERENCE_TARGET =
        Pattern.compile("(?m)(^ {0,3}\\[[^\\]\\n]+\\]:[ \\t]*<?)(?:" + NOTE_ID_PREFIX + ")+(" + UUID + ")");

    private NoteLinkRewriter() {}

    /**
     * Returns whether a link target is a bare note id rather than a URL.
     */
    public static boolean isNoteLinkId(String linkTarget) {
        return linkTarget != null && NOTE_LINK_ID.matcher(linkTarget).matches();
    }

    /**
     * Removes the {@code note:} prefix from every link target that points at a note.
     * Repeated prefixes are collapsed, so applying this twice equals applying it once.
     *
     * @param markdown note source
     * @return source whose note links use bare ids
     */
    public static String removePrefixFromNoteLinks(String markdown) {
        if (markdown == null || markdown.isEmpty() || !markdown.contains(NOTE_ID_PREFIX)) {
            return markdown == null ? "" : markdown;
        }
        String inlineRewritten = stripPrefix(PREFIXED_INLINE_TARGET, markdown);
        return stripPrefix(PREFIXED_REFERENCE_TARGET, inlineRewritten);
    }

    /**
     * Restores the stored form of a note id.
     */
    public static String prependNoteIdPrefix(String noteId) {
        if (noteId == null || noteId.isEmpty()) {
            return NOTE_ID_PREFIX;
        }
        return noteId.startsWith(NOTE_ID_PREFIX) ? noteId : NOTE_ID_PREFIX + noteId;
    }

    private static String stripPrefix(Pattern pattern, String markdown) {
        Matcher matcher = pattern.matcher(markdown);
        StringBuilder rewritten = new StringBuilder(markdown.length());
        while (matcher.find()) {
            matcher.appendReplacement(rewritten, Matcher.quoteReplacement(matcher.group(1) + matcher.group(2)));
        }
        matcher.appendTail(rewritten);
        return rewritten.toString();
    }
}
