package com.williamcallahan.notepreview.service.markdown.transform;

import com.williamcallahan.notepreview.domain.markdown.SyntaxNode;
import com.williamcallahan.notepreview.domain.markdown.SyntaxNodeType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites {@code plantuml} code blocks into images served by a PlantUML server.
 */
public class PlantUmlTransform implements SyntaxTreeTransform {

    public static final String DEFAULT_SERVER = "http://www.plantuml.com/plantuml";
    static final String ALT_TEXT = "uml diagram";

    private static final Set<String> LANGUAGES = Set.of("plantuml", "puml");

    private final String server;

    public PlantUmlTransform() {
        this(DEFAULT_SERVER);
    }

    public PlantUmlTransform(String server) {
        String configured = server == null || server.isBlank() ? DEFAULT_SERVER : server.trim();
        this.server = configured.endsWith("/") ? configured.substring(0, configured.length() - 1) : configured;
    }

    @Override
    public String name() {
        return "plantuml";
    }

    @Override
    public SyntaxNode apply(SyntaxNode root) {
        return SyntaxTrees.rewriteBottomUp(root, node -> {
            if (!node.is(SyntaxNodeType.CODE_BLOCK)) {
                return List.of(node);
            }
            String language = node.stringAttribute(SyntaxNode.ATTR_LANGUAGE, "").toLowerCase(Locale.ROOT);
            if (!LANGUAGES.contains(language)) {
                return List.of(node);
            }
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put(SyntaxNode.ATTR_URL, diagramUrl(node.value()));
            attributes.put(SyntaxNode.ATTR_ALT, ALT_TEXT);
            SyntaxNode image = new SyntaxNode(SyntaxNodeType.IMAGE, "", attributes, List.of(), node.position());
            return List.of(SyntaxNode.of(SyntaxNodeType.PARAGRAPH, List.of(image), node.position()));
        });
    }

    /**
     * SVG rendering URL for the given diagram source.
     */
    public String diagramUrl(String diagramSource) {
        return server + "/svg/" + PlantUmlEncoder.encode(diagramSource.strip());
    }
}
