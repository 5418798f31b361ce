package com.williamcallahan.notepreview.service.workspace;

import com.williamcallahan.notepreview.domain.preview.StorageSummary;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Storage layer as seen by the preview: active storage, known storages and note path lookup.
 */
public interface NoteWorkspace {

    /**
     * Storage the user is currently browsing, if any.
     */
    Optional<String> activeStorageId();

    /**
     * All storages known to the application, in display order.
     */
    List<StorageSummary> listStorages();

    /**
     * Resolves the folder pathname of a note.
     *
     * @param storageId storage to look in
     * @param prefixedNoteId note id in stored form ({@code note:<uuid>})
     * @return pathname, or empty when the storage does not hold the note
     */
    CompletableFuture<Optional<String>> resolveNotePath(String storageId, String prefixedNoteId);
}
