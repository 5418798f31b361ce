package com.williamcallahan.notepreview.domain.preview;

/**
 * What happened when a rendered link was activated.
 */
public enum LinkNavigationOutcome {
    /** Note link resolved and the navigator was asked to open it. */
    NAVIGATED,
    /** Ordinary URL handed to the external browser. */
    OPENED_EXTERNALLY,
    /** Note link activated without an active storage; the user was notified. */
    NO_STORAGE_CONTEXT,
    /** Note id not found or lookup failed; the user was notified. */
    NOTE_NOT_FOUND,
    /** Link without a target. */
    IGNORED
}
