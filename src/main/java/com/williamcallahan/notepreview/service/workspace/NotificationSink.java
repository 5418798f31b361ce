package com.williamcallahan.notepreview.service.workspace;

/**
 * Shows a user-visible message (toast).
 */
@FunctionalInterface
public interface NotificationSink {

    void notify(String title, String description);
}
