package com.williamcallahan.notepreview.service.markdown;

import java.util.List;

/**
 * Flips task-list markers in markdown source by checkbox index.
 *
 * <p>Indices count task list items in document order starting at 0, the same order in which the
 * render dispatcher numbers checkboxes. Marker positions come from the Flexmark parse, so
 * bracket text inside code blocks or paragraphs is never mistaken for a task.</p>
 */
public final class CheckboxToggler {

    private static final MarkdownParserFrontend PARSER = new MarkdownParserFrontend();

    private CheckboxToggler() {}

    /**
     * Returns the source with the task marker at {@code index} flipped, or the source unchanged
     * when there is no such marker.
     */
    public static String toggle(String source, int index) {
        if (source == null || index < 0) {
            return source;
        }
        List<Integer> stateOffsets = PARSER.taskStateOffsets(source);
        if (index >= stateOffsets.size()) {
            return source;
        }
        int stateIndex = stateOffsets.get(index);
        if (stateIndex < 0 || stateIndex >= source.length()) {
            return source;
        }
        char flipped = source.charAt(stateIndex) == ' ' ? 'x' : ' ';
        return source.substring(0, stateIndex) + flipped + source.substring(stateIndex + 1);
    }

    /**
     * Counts the task list items.
     */
    public static int countTasks(String source) {
        return PARSER.taskStateOffsets(source).size();
    }
}
