package io.hearthwarrio.autoapply.core.diff;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ChangeDetectorTest {

    private static final String STEP_ONE = "<html><body><form>"
            + "<input name=\"first\" id=\"first\"><input name=\"last\" id=\"last\">"
            + "<input name=\"email\" id=\"email\" type=\"email\"><button id=\"next\">Next</button>"
            + "</form></body></html>";

    @Test
    void samePageIsPreserved() {
        DomSnapshot page = DomSnapshot.parse(STEP_ONE);

        assertEquals(1.0, ChangeDetector.preservedRatio(page, DomSnapshot.parse(STEP_ONE)));
        assertFalse(ChangeDetector.hasChanged(page, DomSnapshot.parse(STEP_ONE), 0.69));
    }

    @Test
    void valueChangesDoNotCount() {
        DomSnapshot after = DomSnapshot.parse(STEP_ONE.replace("id=\"first\"", "id=\"first\" value=\"Alex\""));

        assertFalse(ChangeDetector.hasChanged(DomSnapshot.parse(STEP_ONE), after, 0.69));
    }

    @Test
    void nextStepWithDifferentFieldsHasChanged() {
        DomSnapshot after = DomSnapshot.parse("<html><body><form>"
                + "<input name=\"school\" id=\"school\"><input name=\"degree\" id=\"degree\">"
                + "<button id=\"next\">Next</button></form></body></html>");

        assertEquals(0.25, ChangeDetector.preservedRatio(DomSnapshot.parse(STEP_ONE), after), 1e-9);
        assertTrue(ChangeDetector.hasChanged(DomSnapshot.parse(STEP_ONE), after, 0.69));
    }

    @Test
    void pageWithoutControlsCountsAsChanged() {
        DomSnapshot empty = DomSnapshot.parse("<html><body><p>Loading</p></body></html>");

        assertEquals(0.0, ChangeDetector.preservedRatio(empty, empty));
    }
}
