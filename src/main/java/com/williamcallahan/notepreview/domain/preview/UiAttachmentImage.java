package com.williamcallahan.notepreview.domain.preview;

/**
 * Image backed by a note attachment.
 */
public record UiAttachmentImage(AttachmentMetadata attachment, String alt, String title) implements UiElement {
}
