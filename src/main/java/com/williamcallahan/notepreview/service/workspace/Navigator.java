package com.williamcallahan.notepreview.service.workspace;

/**
 * Routes the application to an in-app location.
 */
@FunctionalInterface
public interface Navigator {

    void navigateTo(String path);
}
