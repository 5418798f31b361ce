package com.williamcallahan.notepreview.service.render;

import com.williamcallahan.notepreview.domain.preview.LinkNavigationOutcome;
import com.williamcallahan.notepreview.domain.preview.StorageSummary;
import com.williamcallahan.notepreview.service.workspace.ContentUpdater;
import com.williamcallahan.notepreview.service.workspace.ExternalBrowser;
import com.williamcallahan.notepreview.service.workspace.Navigator;
import com.williamcallahan.notepreview.service.workspace.NoteWorkspace;
import com.williamcallahan.notepreview.service.workspace.NotificationSink;
import com.williamcallahan.notepreview.service.workspace.PreviewBindings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class NoteLinkNavigatorTest {

    private static final String NOTE_ID = "3f2504e0-4f89-11d3-9a0c-0305e82c3301";
    private static final String PREFIXED = "note:" + NOTE_ID;

    private NoteWorkspace workspace;
    private Navigator navigator;
    private NotificationSink notifications;
    private ExternalBrowser browser;
    private NoteLinkNavigator linkNavigator;

    @BeforeEach
    void setUp() {
        workspace = mock(NoteWorkspace.class);
        navigator = mock(Navigator.class);
        notifications = mock(NotificationSink.class);
        browser = mock(ExternalBrowser.class);
        PreviewBindings bindings = new PreviewBindings(
            Map.of(), workspace, navigator, notifications, browser, mock(ContentUpdater.class));
        linkNavigator = new NoteLinkNavigator(bindings);
    }

    @Test
    @DisplayName("Should open the note in the storage that holds it")
    void navigatesAcrossStorages() {
        when(workspace.activeStorageId()).thenReturn(Optional.of("active"));
        when(workspace.listStorages()).thenReturn(List.of(
            new StorageSummary("active", Set.of()),
            new StorageSummary("archive", Set.of(PREFIXED))
        ));
        when(workspace.resolveNotePath("archive", PREFIXED))
            .thenReturn(CompletableFuture.completedFuture(Optional.of("/projects/java")));

        assertEquals(LinkNavigationOutcome.NAVIGATED, linkNavigator.open(NOTE_ID).join());

        verify(navigator).navigateTo("/app/storages/archive/notes/projects/java/" + NOTE_ID);
        verifyNoInteractions(notifications, browser);
    }

    @Test
    void prefersActiveStorageAndDropsRootPathname() {
        when(workspace.activeStorageId()).thenReturn(Optional.of("active"));
        when(workspace.listStorages()).thenReturn(List.of(
            new StorageSummary("other", Set.of(PREFIXED)),
            new StorageSummary("active", Set.of(PREFIXED))
        ));
        when(workspace.resolveNotePath("active", PREFIXED))
            .thenReturn(CompletableFuture.completedFuture(Optional.of("/")));

        linkNavigator.open(NOTE_ID).join();

        verify(navigator).navigateTo("/app/storages/active/notes/" + NOTE_ID);
    }

    @Test
    @DisplayName("Should notify when no storage is active")
    void notifiesWithoutStorage() {
        when(workspace.activeStorageId()).thenReturn(Optional.empty());

        assertEquals(LinkNavigationOutcome.NO_STORAGE_CONTEXT, linkNavigator.open(NOTE_ID).join());

        verify(notifications).notify("Invalid navigation!", "Cannot open note link without storage information.");
        verify(workspace, never()).resolveNotePath(anyString(), anyString());
        verifyNoInteractions(navigator);
    }

    @Test
    @DisplayName("Should notify when the note cannot be resolved")
    void notifiesWhenNoteMissing() {
        when(workspace.activeStorageId()).thenReturn(Optional.of("active"));
        when(workspace.listStorages()).thenReturn(List.of());
        when(workspace.resolveNotePath("active", PREFIXED))
            .thenReturn(CompletableFuture.completedFuture(Optional.empty()));

        assertEquals(LinkNavigationOutcome.NOTE_NOT_FOUND, linkNavigator.open(NOTE_ID).join());

        verify(notifications).notify("Note link invalid!", "The note link you are trying to open is invalid.");
        verifyNoInteractions(navigator);
    }

    @Test
    void treatsLookupFailureAsMissingNote() {
        when(workspace.activeStorageId()).thenReturn(Optional.of("active"));
        when(workspace.listStorages()).thenReturn(List.of());
        when(workspace.resolveNotePath("active", PREFIXED))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("db closed")));

        assertEquals(LinkNavigationOutcome.NOTE_NOT_FOUND, linkNavigator.open(NOTE_ID).join());
        verify(notifications).notify(NoteLinkNavigator.INVALID_LINK_TITLE, NoteLinkNavigator.INVALID_LINK_DESCRIPTION);
    }

    @Test
    void opensOtherLinksExternally() {
        assertEquals(LinkNavigationOutcome.OPENED_EXTERNALLY, linkNavigator.open("https://example.com/a").join());
        assertEquals(LinkNavigationOutcome.IGNORED, linkNavigator.open("").join());

        verify(browser).open("https://example.com/a");
        verifyNoInteractions(workspace, navigator);
    }
}
