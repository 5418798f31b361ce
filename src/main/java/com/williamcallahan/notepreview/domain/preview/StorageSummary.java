package com.williamcallahan.notepreview.domain.preview;

import java.util.Objects;
import java.util.Set;

/**
 * A known note storage and the prefixed ids of the notes it holds.
 *
 * @param id storage identifier
 * @param noteIds note ids in stored form ({@code note:<uuid>})
 */
public record StorageSummary(String id, Set<String> noteIds) {

    public StorageSummary {
        Objects.requireNonNull(id, "Storage id cannot be null");
        noteIds = noteIds == null ? Set.of() : Set.copyOf(noteIds);
    }

    public boolean containsNote(String prefixedNoteId) {
        return noteIds.contains(prefixedNoteId);
    }
}
