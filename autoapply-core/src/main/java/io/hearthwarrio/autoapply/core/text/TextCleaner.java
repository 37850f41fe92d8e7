package io.hearthwarrio.autoapply.core.text;

import java.util.regex.Pattern;

/**
 * Normalizes visible text taken from the page.
 */
public final class TextCleaner {

    private static final Pattern UNWANTED = Pattern.compile("[^\\w\\s.,;:*()\"\\-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextCleaner() {
        // utility class
    }

    /**
     * Keeps word characters and basic punctuation, collapses whitespace, trims.
     */
    public static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        String t = UNWANTED.matcher(raw.strip()).replaceAll("");
        return WHITESPACE.matcher(t).replaceAll(" ").strip();
    }

    public static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return WHITESPACE.split(text.strip()).length;
    }
}
