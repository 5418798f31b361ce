package com.williamcallahan.notepreview.domain.preview;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Interactive task-list checkbox.
 *
 * @param index position of this checkbox among the checkboxes of its render pass
 * @param checked current state
 * @param toggleAction writes the flipped state back into the note source
 */
public record UiCheckbox(int index, boolean checked, @JsonIgnore Runnable toggleAction) implements UiElement {

    public UiCheckbox {
        toggleAction = toggleAction == null ? () -> { } : toggleAction;
    }

    public void toggle() {
        toggleAction.run();
    }
}
