package com.williamcallahan.notepreview.domain.preview;

/**
 * Phase of the preview render state machine.
 */
public enum RenderPhase {
    IDLE,
    RENDERING
}
