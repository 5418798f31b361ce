package com.williamcallahan.notepreview.service.markdown;

import com.vladsch.flexmark.parser.InlineParser;
import com.vladsch.flexmark.parser.InlineParserExtension;
import com.vladsch.flexmark.parser.InlineParserExtensionFactory;
import com.vladsch.flexmark.parser.LightInlineParser;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.data.MutableDataHolder;
import com.vladsch.flexmark.util.sequence.BasedSequence;

import java.util.Set;

/**
 * Flexmark extension recognizing inline TeX delimited by {@code $} or {@code $$}.
 *
 * <p>Delimiters are matched on the paragraph source before emphasis and backslash escapes are
 * processed, so {@code $a*b*c$} and {@code $\{x\}$} reach the typesetter unchanged.</p>
 */
public class InlineMathExtension implements Parser.ParserExtension {

    private InlineMathExtension() {
    }

    public static InlineMathExtension create() {
        return new InlineMathExtension();
    }

    @Override
    public void parserOptions(MutableDataHolder options) {
        // no options
    }

    @Override
    public void extend(Parser.Builder parserBuilder) {
        parserBuilder.customInlineParserExtensionFactory(new InlineMathParser.Factory());
    }

    static final class InlineMathParser implements InlineParserExtension {
        private static final char DOLLAR = '$';

        @Override
        public void finalizeDocument(InlineParser inlineParser) {
        }

        @Override
        public void finalizeBlock(InlineParser inlineParser) {
        }

        @Override
        public boolean parse(LightInlineParser inlineParser) {
            BasedSequence input = inlineParser.getInput();
            int index = inlineParser.getIndex();
            if (index > 0 && input.charAt(index - 1) == DOLLAR) {
                return false;
            }
            int runLength = runLength(input, index);
            if (runLength > 2) {
                return false;
            }
            int contentStart = index + runLength;
            int closing = findClosing(input, contentStart, runLength);
            if (closing < 0) {
                return false;
            }
            inlineParser.flushTextNode();
            inlineParser.getBlock().appendChild(new InlineMath(
                input.subSequence(index, contentStart),
                input.subSequence(contentStart, closing),
                input.subSequence(closing, closing + runLength)
            ));
            inlineParser.setIndex(closing + runLength);
            return true;
        }

        /**
         * Finds a closing run of exactly {@code runLength} dollars. Content must be non-empty and
         * must not start or end with whitespace, so prices like "$5 and $10" stay text. A dollar
         * preceded by a backslash never closes.
         */
        private static int findClosing(BasedSequence input, int contentStart, int runLength) {
            if (contentStart >= input.length() || Character.isWhitespace(input.charAt(contentStart))) {
                return -1;
            }
            int cursor = contentStart;
            while (cursor < input.length()) {
                char current = input.charAt(cursor);
                if (current == '\\') {
                    cursor += 2;
                } else if (current == DOLLAR) {
                    int closingRun = runLength(input, cursor);
                    boolean spaced = Character.isWhitespace(input.charAt(cursor - 1));
                    boolean followedByDigit = cursor + closingRun < input.length()
                        && Character.isDigit(input.charAt(cursor + closingRun));
                    if (closingRun == runLength && cursor > contentStart && !spaced && !followedByDigit) {
                        return cursor;
                    }
                    cursor += closingRun;
                } else {
                    cursor++;
                }
            }
            return -1;
        }

        private static int runLength(BasedSequence input, int start) {
            int length = 0;
            while (start + length < input.length() && input.charAt(start + length) == DOLLAR) {
                length++;
            }
            return length;
        }

        static final class Factory implements InlineParserExtensionFactory {
            @Override
            public Set<Class<?>> getAfterDependents() {
                return null;
            }

            @Override
            public CharSequence getCharacters() {
                return "$";
            }

            @Override
            public Set<Class<?>> getBeforeDependents() {
                return null;
            }

            @Override
            public InlineParserExtension apply(LightInlineParser lightInlineParser) {
                return new InlineMathParser();
            }

            @Override
            public boolean affectsGlobalScope() {
                return false;
            }
        }
    }
}
