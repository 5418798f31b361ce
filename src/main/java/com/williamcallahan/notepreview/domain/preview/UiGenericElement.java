package com.williamcallahan.notepreview.domain.preview;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Collections;

/**
 * Passthrough element for every tag without a dedicated handler.
 *
 * @param tagName element name
 * @param properties sanitized attributes
 * @param children rendered children
 */
public record UiGenericElement(String tagName, Map<String, String> properties, List<UiElement> children)
    implements UiElement {

    public UiGenericElement {
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        children = children == null ? List.of() : List.copyOf(children);
    }

    public String property(String name) {
        return properties.get(name);
    }
}
