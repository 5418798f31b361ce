package com.williamcallahan.notepreview.service.markdown;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CheckboxTogglerTest {

    private static final String TASKS = "- [ ] first\n- [x] second\n* [X] third\n";

    @Test
    @DisplayName("Should flip the marker at the given index only")
    void flipsIndexedMarker() {
        assertEquals("- [x] first\n- [x] second\n* [X] third\n", CheckboxToggler.toggle(TASKS, 0));
        assertEquals("- [ ] first\n- [ ] second\n* [X] third\n", CheckboxToggler.toggle(TASKS, 1));
        assertEquals("- [ ] first\n- [x] second\n* [ ] third\n", CheckboxToggler.toggle(TASKS, 2));
    }

    @Test
    @DisplayName("Should ignore markers inside fenced code")
    void skipsFencedCode() {
        String source = "```\n- [ ] not a task\n```\n- [ ] real\n";

        assertEquals("```\n- [ ] not a task\n```\n- [x] real\n", CheckboxToggler.toggle(source, 0));
        assertEquals(1, CheckboxToggler.countTasks(source));
    }

    @Test
    @DisplayName("Should ignore markers inside indented code")
    void skipsIndentedCode() {
        String source = "Text\n\n    - [ ] code\n\n- [ ] real\n";

        assertEquals("Text\n\n    - [ ] code\n\n- [x] real\n", CheckboxToggler.toggle(source, 0));
        assertEquals(1, CheckboxToggler.countTasks(source));
    }

    @Test
    void handlesOrderedAndQuotedItems() {
        String source = "1. [ ] one\n> - [ ] quoted\n  - [ ] nested\n";

        assertEquals(3, CheckboxToggler.countTasks(source));
        assertEquals("1. [ ] one\n> - [x] quoted\n  - [ ] nested\n", CheckboxToggler.toggle(source, 1));
        assertEquals("1. [ ] one\n> - [ ] quoted\n  - [x] nested\n", CheckboxToggler.toggle(source, 2));
    }

    @Test
    void leavesSourceUnchangedForMissingIndex() {
        assertEquals(TASKS, CheckboxToggler.toggle(TASKS, 3));
        assertEquals(TASKS, CheckboxToggler.toggle(TASKS, -1));
        assertNull(CheckboxToggler.toggle(null, 0));
        assertEquals(0, CheckboxToggler.countTasks("plain [ ] text"));
    }
}
