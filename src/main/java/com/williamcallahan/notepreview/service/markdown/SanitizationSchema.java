package com.williamcallahan.notepreview.service.markdown;

import org.jsoup.safety.Safelist;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Allow-list policy applied by {@link HypertextSanitizer}.
 *
 * @param tagNames permitted element names
 * @param attributes permitted attribute names per element name, {@link #ALL_TAGS} for every element
 * @param protocols permitted URL schemes per attribute name
 * @param strip element names removed together with their subtree
 * @param clobberPrefix prefix forced onto clobberable attribute values
 * @param clobber attribute names whose values get the clobber prefix
 * @param required attribute values forced onto an element, per element name
 */
public record SanitizationSchema(
    Set<String> tagNames,
    Map<String, Set<String>> attributes,
    Map<String, Set<String>> protocols,
    Set<String> strip,
    String clobberPrefix,
    Set<String> clobber,
    Map<String, Map<String, String>> required
) {

    public static final String ALL_TAGS = "*";
    public static final String DEFAULT_CLOBBER_PREFIX = "user-content-";

    private static final Set<String> GITHUB_TAGS = Set.of(
        "h1", "h2", "h3", "h4", "h5", "h6", "h7", "h8", "br", "b", "i", "strong", "em", "a", "pre",
        "code", "img", "tt", "div", "ins", "del", "sup", "sub", "p", "ol", "ul", "table", "thead",
        "tbody", "tfoot", "blockquote", "dl", "dt", "dd", "kbd", "q", "samp", "var", "hr", "ruby",
        "rt", "rp", "li", "tr", "td", "th", "s", "strike", "summary", "details", "caption", "figure",
        "figcaption", "abbr", "bdo", "cite", "dfn", "mark", "small", "span", "time", "wbr", "input"
    );

    private static final Set<String> GITHUB_GLOBAL_ATTRIBUTES = Set.of(
        "abbr", "accept", "accept-charset", "accesskey", "action", "align", "alt", "aria-describedby",
        "aria-hidden", "aria-label", "aria-labelledby", "axis", "border", "cellpadding", "cellspacing",
        "char", "charoff", "charset", "checked", "clear", "cols", "colspan", "color", "compact",
        "coords", "datetime", "dir", "disabled", "enctype", "for", "frame", "headers", "height",
        "hreflang", "hspace", "ismap", "id", "label", "lang", "maxlength", "media", "method",
        "multiple", "name", "nohref", "noshade", "nowrap", "open", "prompt", "readonly", "rel", "rev",
        "rows", "rowspan", "rules", "scope", "selected", "shape", "size", "span", "start", "summary",
        "tabindex", "target", "title", "type", "usemap", "valign", "value", "vspace", "width",
        "itemprop"
    );

    public SanitizationSchema {
        tagNames = normalizedSet(tagNames);
        attributes = normalizedMap(attributes);
        protocols = normalizedMap(protocols);
        strip = normalizedSet(strip);
        clobberPrefix = clobberPrefix == null ? "" : clobberPrefix;
        clobber = normalizedSet(clobber);
        Map<String, Map<String, String>> requiredCopy = new LinkedHashMap<>();
        if (required != null) {
            required.forEach((tag, values) -> requiredCopy.put(tag.toLowerCase(Locale.ROOT), Map.copyOf(values)));
        }
        required = Collections.unmodifiableMap(requiredCopy);
    }

    /**
     * GitHub's sanitization rules.
     */
    public static SanitizationSchema githubDefault() {
        Map<String, Set<String>> attributes = new LinkedHashMap<>();
        attributes.put(ALL_TAGS, GITHUB_GLOBAL_ATTRIBUTES);
        attributes.put("a", Set.of("href"));
        attributes.put("img", Set.of("src", "longdesc"));
        attributes.put("input", Set.of("type", "disabled"));
        attributes.put("li", Set.of("class"));
        attributes.put("div", Set.of("itemscope", "itemtype"));
        attributes.put("blockquote", Set.of("cite"));
        attributes.put("del", Set.of("cite"));
        attributes.put("ins", Set.of("cite"));
        attributes.put("q", Set.of("cite"));

        Map<String, Set<String>> protocols = new LinkedHashMap<>();
        protocols.put("href", Set.of("http", "https", "mailto"));
        protocols.put("cite", Set.of("http", "https"));
        protocols.put("src", Set.of("http", "https"));
        protocols.put("longdesc", Set.of("http", "https"));

        return new SanitizationSchema(
            GITHUB_TAGS,
            attributes,
            protocols,
            Set.of("script"),
            DEFAULT_CLOBBER_PREFIX,
            Set.of("name", "id"),
            Map.of("input", Map.of("type", "checkbox", "disabled", "disabled"))
        );
    }

    /**
     * GitHub's rules extended with the elements the preview renders itself: diagrams, inline svg,
     * embedded frames, and the class and source line attributes on every element.
     */
    public static SanitizationSchema preview() {
        SanitizationSchema github = githubDefault();
        Map<String, Set<String>> attributes = new LinkedHashMap<>(github.attributes());
        attributes.put(ALL_TAGS, union(github.attributes().get(ALL_TAGS), Set.of("class", "align", "data-line")));
        attributes.put("input", union(github.attributes().get("input"), Set.of("checked")));
        attributes.put("pre", Set.of("data-raw"));
        attributes.put("iframe", Set.of("src"));
        attributes.put("path", Set.of("d"));
        attributes.put("svg", Set.of("viewbox"));
        attributes.put("chart", Set.of("data-yaml"));

        return new SanitizationSchema(
            union(github.tagNames(), Set.of("svg", "path", "mermaid", "flowchart", "chart", "iframe")),
            attributes,
            github.protocols(),
            github.strip(),
            github.clobberPrefix(),
            github.clobber(),
            github.required()
        );
    }

    public SanitizationSchema withClobberPrefix(String prefix) {
        return new SanitizationSchema(tagNames, attributes, protocols, strip, prefix, clobber, required);
    }

    public boolean allowsTag(String tagName) {
        return tagName != null && tagNames.contains(tagName.toLowerCase(Locale.ROOT));
    }

    /**
     * URL schemes permitted for an attribute, empty when the attribute is not a URL attribute.
     */
    public Set<String> protocolsFor(String attributeName) {
        return protocols.getOrDefault(attributeName.toLowerCase(Locale.ROOT), Set.of());
    }

    /**
     * Tag and attribute rules as a jsoup safelist. URL protocols, required values and clobbering
     * are not expressed here; the sanitizer enforces them after cleaning.
     */
    public Safelist toSafelist() {
        Safelist safelist = new Safelist();
        safelist.addTags(tagNames.toArray(String[]::new));
        attributes.forEach((tag, names) -> {
            if (names.isEmpty()) {
                return;
            }
            String target = ALL_TAGS.equals(tag) ? ":all" : tag;
            safelist.addAttributes(target, names.toArray(String[]::new));
        });
        return safelist;
    }

    private static Set<String> union(Set<String> first, Set<String> second) {
        Set<String> merged = new LinkedHashSet<>(first == null ? Set.of() : first);
        merged.addAll(second);
        return merged;
    }

    private static Set<String> normalizedSet(Set<String> values) {
        if (values == null) {
            return Set.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String value : values) {
            normalized.add(value.toLowerCase(Locale.ROOT));
        }
        return Collections.unmodifiableSet(normalized);
    }

    private static Map<String, Set<String>> normalizedMap(Map<String, Set<String>> values) {
        if (values == null) {
            return Map.of();
        }
        Map<String, Set<String>> normalized = new LinkedHashMap<>();
        values.forEach((key, entries) -> normalized.put(key.toLowerCase(Locale.ROOT), normalizedSet(entries)));
        return Collections.unmodifiableMap(normalized);
    }

    /**
     * Attribute names permitted on a tag, global ones included.
     */
    public Set<String> attributesFor(String tagName) {
        Set<String> allowed = new LinkedHashSet<>(attributes.getOrDefault(ALL_TAGS, Set.of()));
        allowed.addAll(attributes.getOrDefault(tagName.toLowerCase(Locale.ROOT), Set.of()));
        return allowed;
    }

    List<String> strippedTags() {
        return List.copyOf(strip);
    }
}
