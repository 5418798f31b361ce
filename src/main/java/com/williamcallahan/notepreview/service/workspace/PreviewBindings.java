package com.williamcallahan.notepreview.service.workspace;

import com.williamcallahan.notepreview.domain.preview.AttachmentMetadata;
import com.williamcallahan.notepreview.domain.preview.StorageSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Collaborators one preview view renders against.
 *
 * @param attachments attachments of the previewed note, keyed by the name used in image sources
 * @param workspace storage lookups for note links
 * @param navigator in-app navigation
 * @param notifications user-visible messages
 * @param browser external URL opener
 * @param contentUpdater note content writer used by checkboxes
 */
public record PreviewBindings(
    Map<String, AttachmentMetadata> attachments,
    NoteWorkspace workspace,
    Navigator navigator,
    NotificationSink notifications,
    ExternalBrowser browser,
    ContentUpdater contentUpdater
) {

    private static final Logger logger = LoggerFactory.getLogger(PreviewBindings.class);

    public PreviewBindings {
        attachments = attachments == null ? Map.of() : Map.copyOf(attachments);
        Objects.requireNonNull(workspace, "Workspace cannot be null");
        Objects.requireNonNull(navigator, "Navigator cannot be null");
        Objects.requireNonNull(notifications, "Notification sink cannot be null");
        Objects.requireNonNull(browser, "External browser cannot be null");
        Objects.requireNonNull(contentUpdater, "Content updater cannot be null");
    }

    /**
     * Bindings for rendering without a view: no storages, navigation and content updates are
     * ignored, notifications go to the log.
     */
    public static PreviewBindings headless() {
        return new PreviewBindings(
            Map.of(),
            new NoteWorkspace() {
                @Override
                public Optional<String> activeStorageId() {
                    return Optional.empty();
                }

                @Override
                public List<StorageSummary> listStorages() {
                    return List.of();
                }

                @Override
                public CompletableFuture<Optional<String>> resolveNotePath(String storageId, String prefixedNoteId) {
                    return CompletableFuture.completedFuture(Optional.empty());
                }
            },
            path -> logger.debug("Ignoring navigation to {} without a view", path),
            (title, description) -> logger.info("Preview notification: {} - {}", title, description),
            url -> logger.debug("Ignoring external link {} without a view", url),
            updater -> logger.debug("Ignoring content update without a view")
        );
    }

    public PreviewBindings withAttachments(Map<String, AttachmentMetadata> newAttachments) {
        return new PreviewBindings(newAttachments, workspace, navigator, notifications, browser, contentUpdater);
    }
}
