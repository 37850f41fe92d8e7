package io.hearthwarrio.autoapply.core.text;

import io.hearthwarrio.autoapply.core.model.PageItem;
import io.hearthwarrio.autoapply.core.model.SearchKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * "Does any of these properties contain any of these substrings?"
 * <p>
 * Matching is case-insensitive unless {@link #caseSensitive()} is set. With
 * {@link #normalizeWhitespace()} all whitespace is removed from both sides before comparing.
 * With {@link #exact()} values must equal a substring instead of containing it.
 * <p>
 * Instances are immutable; the switch methods return modified copies.
 */
public final class TextQuery {

    private final List<SearchKey> keys;
    private final List<String> substrings;
    private final boolean caseSensitive;
    private final boolean normalizeWhitespace;
    private final boolean exact;

    private TextQuery(List<SearchKey> keys, List<String> substrings,
                      boolean caseSensitive, boolean normalizeWhitespace, boolean exact) {
        this.keys = keys;
        this.substrings = substrings;
        this.caseSensitive = caseSensitive;
        this.normalizeWhitespace = normalizeWhitespace;
        this.exact = exact;
    }

    public static TextQuery of(List<SearchKey> keys, List<String> substrings) {
        Objects.requireNonNull(keys, "keys must not be null");
        Objects.requireNonNull(substrings, "substrings must not be null");
        return new TextQuery(List.copyOf(keys), List.copyOf(substrings), false, false, false);
    }

    /**
     * Query over raw strings; keys are ignored by {@link #matchesText(String)}.
     */
    public static TextQuery any(List<String> substrings) {
        return of(List.of(), substrings);
    }

    public TextQuery caseSensitive() {
        return new TextQuery(keys, substrings, true, normalizeWhitespace, exact);
    }

    public TextQuery caseSensitive(boolean on) {
        return new TextQuery(keys, substrings, on, normalizeWhitespace, exact);
    }

    public TextQuery normalizeWhitespace() {
        return new TextQuery(keys, substrings, caseSensitive, true, exact);
    }

    public TextQuery normalizeWhitespace(boolean on) {
        return new TextQuery(keys, substrings, caseSensitive, on, exact);
    }

    public TextQuery exact() {
        return new TextQuery(keys, substrings, caseSensitive, normalizeWhitespace, true);
    }

    public TextQuery exact(boolean on) {
        return new TextQuery(keys, substrings, caseSensitive, normalizeWhitespace, on);
    }

    public TextQuery withKeys(List<SearchKey> keys) {
        return new TextQuery(List.copyOf(keys), substrings, caseSensitive, normalizeWhitespace, exact);
    }

    public boolean matches(PageItem item) {
        if (item == null || substrings.isEmpty()) {
            return false;
        }
        for (SearchKey key : keys) {
            if (matchesText(item.valueOf(key))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Keys whose values match, in key order.
     */
    public List<SearchKey> matchingKeys(PageItem item) {
        List<SearchKey> out = new ArrayList<>();
        if (item == null) {
            return out;
        }
        for (SearchKey key : keys) {
            if (matchesText(item.valueOf(key))) {
                out.add(key);
            }
        }
        return out;
    }

    public boolean matchesText(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        String v = normalize(value);
        for (String s : substrings) {
            String n = normalize(s);
            if (exact ? v.equals(n) : v.contains(n)) {
                return true;
            }
        }
        return false;
    }

    String normalize(String text) {
        String t = text == null ? "" : text;
        if (normalizeWhitespace) {
            t = t.replaceAll("\\s+", "");
        }
        return caseSensitive ? t : t.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "TextQuery{" + keys + " ~ " + substrings
                + (caseSensitive ? ", cs" : "") + (normalizeWhitespace ? ", ws" : "") + (exact ? ", exact" : "") + "}";
    }
}
