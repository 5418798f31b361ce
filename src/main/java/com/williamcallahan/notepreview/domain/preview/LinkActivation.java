package com.williamcallahan.notepreview.domain.preview;

import java.util.concurrent.CompletableFuture;

/**
 * Click behaviour bound to a rendered anchor.
 */
@FunctionalInterface
public interface LinkActivation {

    CompletableFuture<LinkNavigationOutcome> activate();
}
