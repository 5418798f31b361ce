package com.williamcallahan.notepreview.domain.preview;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Node of the rendered preview tree produced by the node-render dispatcher.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "element")
@JsonSubTypes({
    @JsonSubTypes.Type(value = UiText.class, name = "text"),
    @JsonSubTypes.Type(value = UiGenericElement.class, name = "element"),
    @JsonSubTypes.Type(value = UiAnchor.class, name = "anchor"),
    @JsonSubTypes.Type(value = UiAttachmentImage.class, name = "attachment-image"),
    @JsonSubTypes.Type(value = UiExpandableImage.class, name = "image"),
    @JsonSubTypes.Type(value = UiCheckbox.class, name = "checkbox"),
    @JsonSubTypes.Type(value = UiCodeFence.class, name = "code-fence"),
    @JsonSubTypes.Type(value = UiDiagram.class, name = "diagram"),
    @JsonSubTypes.Type(value = UiMath.class, name = "math")
})
public sealed interface UiElement
    permits UiText, UiGenericElement, UiAnchor, UiAttachmentImage, UiExpandableImage,
            UiCheckbox, UiCodeFence, UiDiagram, UiMath {
}
