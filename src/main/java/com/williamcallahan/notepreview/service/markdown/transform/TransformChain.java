package com.williamcallahan.notepreview.service.markdown.transform;

import com.williamcallahan.notepreview.domain.markdown.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Applies syntax tree transforms in a fixed order.
 *
 * <p>A stage that throws is logged and skipped; its input passes through to the next stage.</p>
 */
public class TransformChain {
    private static final Logger logger = LoggerFactory.getLogger(TransformChain.class);

    private final List<SyntaxTreeTransform> transforms;

    public TransformChain(List<SyntaxTreeTransform> transforms) {
        this.transforms = List.copyOf(Objects.requireNonNull(transforms, "transforms"));
    }

    /**
     * Standard preview chain: emoji, admonitions, math, diagrams, heading slugs, source lines.
     */
    public static TransformChain standard(String plantUmlServer, String admonitionTag) {
        return new TransformChain(List.of(
            new EmojiShortcodeTransform(),
            new AdmonitionTransform(admonitionTag),
            new MathTransform(),
            new PlantUmlTransform(plantUmlServer),
            new ChartBlockTransform(),
            new HeadingSlugTransform(),
            new PositionAnnotationTransform()
        ));
    }

    public static TransformChain standard() {
        return standard(PlantUmlTransform.DEFAULT_SERVER, AdmonitionTransform.DEFAULT_TAG);
    }

    public SyntaxNode apply(SyntaxNode root) {
        SyntaxNode current = root;
        for (SyntaxTreeTransform transform : transforms) {
            try {
                SyntaxNode transformed = transform.apply(current);
                if (transformed != null) {
                    current = transformed;
                } else {
                    logger.warn("Transform '{}' returned no tree, keeping its input", transform.name());
                }
            } catch (RuntimeException | StackOverflowError transformFailure) {
                logger.warn("Transform '{}' failed, skipping it: {}", transform.name(), transformFailure.toString());
                logger.debug("Transform failure details", transformFailure);
            }
        }
        return current;
    }

    public List<String> stageNames() {
        return transforms.stream().map(SyntaxTreeTransform::name).toList();
    }
}
