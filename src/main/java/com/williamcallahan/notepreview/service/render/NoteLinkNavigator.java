package com.williamcallahan.notepreview.service.render;

import com.williamcallahan.notepreview.domain.preview.LinkNavigationOutcome;
import com.williamcallahan.notepreview.domain.preview.StorageSummary;
import com.williamcallahan.notepreview.service.markdown.NoteLinkRewriter;
import com.williamcallahan.notepreview.service.workspace.PreviewBindings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Click behaviour of preview anchors.
 *
 * <p>Note ids are resolved across storages: the active storage wins when it holds the note,
 * otherwise the first listed storage holding it, otherwise the active storage is tried anyway.</p>
 */
public class NoteLinkNavigator {
    private static final Logger logger = LoggerFactory.getLogger(NoteLinkNavigator.class);

    static final String INVALID_NAVIGATION_TITLE = "Invalid navigation!";
    static final String INVALID_NAVIGATION_DESCRIPTION = "Cannot open note link without storage information.";
    static final String INVALID_LINK_TITLE = "Note link invalid!";
    static final String INVALID_LINK_DESCRIPTION = "The note link you are trying to open is invalid.";

    private final PreviewBindings bindings;

    public NoteLinkNavigator(PreviewBindings bindings) {
        this.bindings = Objects.requireNonNull(bindings, "bindings");
    }

    public CompletableFuture<LinkNavigationOutcome> open(String href) {
        if (href == null || href.isEmpty()) {
            return CompletableFuture.completedFuture(LinkNavigationOutcome.IGNORED);
        }
        if (NoteLinkRewriter.isNoteLinkId(href)) {
            return openNote(href);
        }
        bindings.browser().open(href);
        return CompletableFuture.completedFuture(LinkNavigationOutcome.OPENED_EXTERNALLY);
    }

    private CompletableFuture<LinkNavigationOutcome> openNote(String noteId) {
        Optional<String> activeStorageId = bindings.workspace().activeStorageId();
        if (activeStorageId.isEmpty()) {
            bindings.notifications().notify(INVALID_NAVIGATION_TITLE, INVALID_NAVIGATION_DESCRIPTION);
            return CompletableFuture.completedFuture(LinkNavigationOutcome.NO_STORAGE_CONTEXT);
        }
        String prefixedNoteId = NoteLinkRewriter.prependNoteIdPrefix(noteId);
        String storageId = storageHolding(activeStorageId.get(), prefixedNoteId);

        CompletableFuture<Optional<String>> lookup;
        try {
            lookup = bindings.workspace().resolveNotePath(storageId, prefixedNoteId);
        } catch (RuntimeException lookupFailure) {
            lookup = CompletableFuture.failedFuture(lookupFailure);
        }
        return lookup.handle((pathname, failure) -> {
            if (failure != null) {
                logger.debug("Note path lookup failed for {}: {}", prefixedNoteId, failure.getMessage());
            }
            if (failure != null || pathname == null || pathname.isEmpty()) {
                bindings.notifications().notify(INVALID_LINK_TITLE, INVALID_LINK_DESCRIPTION);
                return LinkNavigationOutcome.NOTE_NOT_FOUND;
            }
            bindings.navigator().navigateTo(noteLocation(storageId, pathname.get(), noteId));
            return LinkNavigationOutcome.NAVIGATED;
        });
    }

    private String storageHolding(String activeStorageId, String prefixedNoteId) {
        for (StorageSummary storage : bindings.workspace().listStorages()) {
            if (storage.id().equals(activeStorageId) && storage.containsNote(prefixedNoteId)) {
                return activeStorageId;
            }
        }
        for (StorageSummary storage : bindings.workspace().listStorages()) {
            if (storage.containsNote(prefixedNoteId)) {
                return storage.id();
            }
        }
        return activeStorageId;
    }

    /**
     * In-app location of a note: {@code /app/storages/{storageId}/notes{pathname}/{noteId}}, where a
     * root pathname contributes no segment.
     */
    static String noteLocation(String storageId, String pathname, String noteId) {
        String folder = "/".equals(pathname) ? "" : pathname;
        return "/app/storages/" + storageId + "/notes" + folder + "/" + noteId;
    }
}
