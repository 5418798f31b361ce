package com.williamcallahan.notepreview.service.markdown;

import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.safety.Cleaner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Allow-list filter between the hypertext bridge and the render dispatcher.
 *
 * <p>Elements outside the schema are unwrapped, keeping their children, except stripped tags
 * whose subtree is discarded. Attributes outside the schema are dropped, as are URL attributes
 * whose scheme is not allowed. The input document is never modified. On internal failure the
 * result is an empty document.</p>
 */
public class HypertextSanitizer {
    private static final Logger logger = LoggerFactory.getLogger(HypertextSanitizer.class);

    public Document sanitize(Document dirty, SanitizationSchema schema) {
        if (dirty == null || schema == null) {
            return Document.createShell("");
        }
        try {
            Document stripped = dirty.clone();
            for (String tag : schema.strippedTags()) {
                stripped.select(tag).remove();
            }
            Document cleaned = new Cleaner(schema.toSafelist()).clean(stripped);
            for (Element element : cleaned.body().getAllElements()) {
                enforceProtocols(element, schema);
                enforceRequired(element, schema);
                enforceClobberPrefix(element, schema);
            }
            return cleaned;
        } catch (RuntimeException | StackOverflowError sanitizeFailure) {
            logger.error("Sanitization failed, discarding document", sanitizeFailure);
            return Document.createShell("");
        }
    }

    /**
     * Whether a URL value is acceptable for an attribute allowing the given schemes. Values without
     * a scheme (relative URLs, fragments) are always acceptable.
     */
    static boolean isSafeUrl(String value, Set<String> allowedProtocols) {
        String normalized = stripControlAndWhitespace(value);
        int colon = normalized.indexOf(':');
        if (colon < 0) {
            return true;
        }
        int slash = normalized.indexOf('/');
        int questionMark = normalized.indexOf('?');
        int numberSign = normalized.indexOf('#');
        if ((slash > -1 && colon > slash)
            || (questionMark > -1 && colon > questionMark)
            || (numberSign > -1 && colon > numberSign)) {
            return true;
        }
        return allowedProtocols.contains(normalized.substring(0, colon).toLowerCase(Locale.ROOT));
    }

    private static void enforceProtocols(Element element, SanitizationSchema schema) {
        List<String> rejected = new ArrayList<>();
        for (Attribute attribute : element.attributes()) {
            Set<String> allowed = schema.protocolsFor(attribute.getKey());
            if (!allowed.isEmpty() && !isSafeUrl(attribute.getValue(), allowed)) {
                rejected.add(attribute.getKey());
            }
        }
        for (String attributeName : rejected) {
            logger.debug("Dropping unsafe {} on <{}>", attributeName, element.tagName());
            element.removeAttr(attributeName);
        }
    }

    private static void enforceRequired(Element element, SanitizationSchema schema) {
        Map<String, String> required = schema.required().get(element.normalName());
        if (required == null) {
            return;
        }
        required.forEach(element::attr);
    }

    private static void enforceClobberPrefix(Element element, SanitizationSchema schema) {
        String prefix = schema.clobberPrefix();
        if (prefix.isEmpty()) {
            return;
        }
        for (String attributeName : schema.clobber()) {
            if (element.hasAttr(attributeName)) {
                String attributeValue = element.attr(attributeName);
                if (!attributeValue.startsWith(prefix)) {
                    element.attr(attributeName, prefix + attributeValue);
                }
            }
        }
    }

    private static String stripControlAndWhitespace(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder normalized = new StringBuilder(value.length());
        for (int index = 0; index < value.length(); index++) {
            char character = value.charAt(index);
            if (!Character.isISOControl(character) && !Character.isWhitespace(character)) {
                normalized.append(character);
            }
        }
        return normalized.toString();
    }
}
