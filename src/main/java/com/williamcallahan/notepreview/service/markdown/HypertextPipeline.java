package com.williamcallahan.notepreview.service.markdown;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.williamcallahan.notepreview.domain.markdown.SyntaxNode;
import com.williamcallahan.notepreview.service.markdown.transform.TransformChain;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Runs the source-to-hypertext half of the preview pipeline: note-link rewrite, parse,
 * transforms, hypertext bridge and sanitizer.
 *
 * <p>Sanitized documents are cached by rewritten source. Callers always receive a private copy
 * and may mutate it freely.</p>
 */
public class HypertextPipeline {

    private static final Logger logger = LoggerFactory.getLogger(HypertextPipeline.class);

    public static final int DEFAULT_MAX_INPUT_LENGTH = 100000;
    public static final int DEFAULT_CACHE_SIZE = 500;
    public static final Duration DEFAULT_CACHE_DURATION = Duration.ofMinutes(30);

    private final MarkdownParserFrontend parser;
    private final TransformChain transforms;
    private final HypertextBridge bridge;
    private final HypertextSanitizer sanitizer;
    private final SanitizationSchema schema;
    private final int maxInputLength;
    private final Cache<String, Document> documentCache;

    public HypertextPipeline(
        MarkdownParserFrontend parser,
        TransformChain transforms,
        HypertextBridge bridge,
        HypertextSanitizer sanitizer,
        SanitizationSchema schema,
        int maxInputLength,
        int cacheSize,
        Duration cacheDuration
    ) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.transforms = Objects.requireNonNull(transforms, "transforms");
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer");
        this.schema = Objects.requireNonNull(schema, "schema");
        this.maxInputLength = maxInputLength > 0 ? maxInputLength : DEFAULT_MAX_INPUT_LENGTH;
        this.documentCache = Caffeine.newBuilder()
            .maximumSize(Math.max(0, cacheSize))
            .expireAfterWrite(cacheDuration == null ? DEFAULT_CACHE_DURATION : cacheDuration)
            .recordStats()
            .build();
    }

    /**
     * Pipeline with default components and limits.
     */
    public static HypertextPipeline withDefaults() {
        return new HypertextPipeline(
            new MarkdownParserFrontend(),
            TransformChain.standard(),
            new HypertextBridge(),
            new HypertextSanitizer(),
            SanitizationSchema.preview(),
            DEFAULT_MAX_INPUT_LENGTH,
            DEFAULT_CACHE_SIZE,
            DEFAULT_CACHE_DURATION
        );
    }

    /**
     * Produces the sanitized hypertext for a markdown source.
     *
     * @param markdown note source, null treated as empty
     * @return sanitized document owned by the caller
     */
    public Document process(String markdown) {
        String source = markdown == null ? "" : markdown;
        if (source.length() > maxInputLength) {
            logger.warn("Markdown input exceeds maximum length: {} > {}", source.length(), maxInputLength);
            source = source.substring(0, maxInputLength);
        }
        String rewritten = NoteLinkRewriter.removePrefixFromNoteLinks(source);

        Document cached = documentCache.getIfPresent(rewritten);
        if (cached != null) {
            logger.debug("Cache hit for preview hypertext");
            return cached.clone();
        }

        SyntaxNode syntaxTree = parser.parse(rewritten);
        SyntaxNode transformed = transforms.apply(syntaxTree);
        Document hypertext = bridge.toHypertext(transformed, true);
        Document sanitized = sanitizer.sanitize(hypertext, schema);
        documentCache.put(rewritten, sanitized);
        return sanitized.clone();
    }

    public CacheStats cacheStats() {
        return documentCache.stats();
    }

    public long cachedDocuments() {
        return documentCache.estimatedSize();
    }

    public void clearCache() {
        documentCache.invalidateAll();
        logger.info("Preview hypertext cache cleared");
    }
}
