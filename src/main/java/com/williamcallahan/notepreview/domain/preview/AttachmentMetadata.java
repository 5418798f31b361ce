package com.williamcallahan.notepreview.domain.preview;

import java.util.Objects;

/**
 * Attachment stored alongside a note.
 *
 * @param id attachment identifier
 * @param mimeType content type of the blob
 * @param backingReference storage-specific reference to the blob (object URL, file path)
 */
public record AttachmentMetadata(String id, String mimeType, String backingReference) {

    public AttachmentMetadata {
        Objects.requireNonNull(id, "Attachment id cannot be null");
        mimeType = mimeType == null ? "application/octet-stream" : mimeType;
        backingReference = backingReference == null ? "" : backingReference;
    }
}
