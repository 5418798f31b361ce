package com.williamcallahan.notepreview.domain.preview;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Anchor whose default navigation is replaced by {@link LinkActivation}.
 */
public record UiAnchor(
    String href,
    String className,
    List<UiElement> children,
    @JsonIgnore LinkActivation activation
) implements UiElement {

    public UiAnchor {
        href = href == null ? "" : href;
        children = children == null ? List.of() : List.copyOf(children);
        activation = activation == null
            ? () -> CompletableFuture.completedFuture(LinkNavigationOutcome.IGNORED)
            : activation;
    }

    /**
     * Runs the click behaviour of this anchor.
     */
    public CompletableFuture<LinkNavigationOutcome> click() {
        return activation.activate();
    }
}
