package com.williamcallahan.notepreview.service.workspace;

/**
 * Opens a URL outside the application.
 */
@FunctionalInterface
public interface ExternalBrowser {

    void open(String url);
}
