package com.williamcallahan.notepreview.service.workspace;

import java.util.function.UnaryOperator;

/**
 * Writes changes back into the note being previewed.
 */
@FunctionalInterface
public interface ContentUpdater {

    /**
     * Applies an update computed from the latest note content.
     */
    void updateContent(UnaryOperator<String> updater);

    /**
     * Replaces the note content.
     */
    default void updateContent(String newContent) {
        updateContent(previous -> newContent);
    }
}
