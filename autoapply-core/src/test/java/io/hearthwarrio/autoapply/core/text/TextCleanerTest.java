package io.hearthwarrio.autoapply.core.text;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TextCleanerTest {

    @Test
    void dropsSymbolsAndCollapsesWhitespace() {
        assertEquals("First Name *", TextCleaner.clean("  First\n\tName  * "));
        assertEquals("Salary expectations ()", TextCleaner.clean("Salary expectations ($)"));
        assertEquals("Are you 18", TextCleaner.clean("Are you 18?"));
    }

    @Test
    void keepsBasicPunctuationAndLetters() {
        assertEquals("Zürich, Switzerland (remote)", TextCleaner.clean("Zürich, Switzerland (remote)"));
        assertEquals("Resume", TextCleaner.clean("Resume ✓"));
    }

    @Test
    void nullIsEmpty() {
        assertEquals("", TextCleaner.clean(null));
        assertEquals(0, TextCleaner.wordCount(null));
        assertEquals(0, TextCleaner.wordCount("   "));
    }

    @Test
    void countsWords() {
        assertEquals(4, TextCleaner.wordCount(" What is your\n desired"));
    }
}
