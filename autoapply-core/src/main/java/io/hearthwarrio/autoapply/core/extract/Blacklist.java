package io.hearthwarrio.autoapply.core.extract;

import io.hearthwarrio.autoapply.core.config.KeywordTable;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Full and partial blacklist checks over candidate strings.
 * <p>
 * Full: a lower-cased candidate equals an entry. Partial: a candidate contains an entry, case-insensitively.
 * Null and empty candidates never match a partial table.
 */
public final class Blacklist {

    private final KeywordTables tables;

    public Blacklist(KeywordTables tables) {
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
    }

    public boolean full(KeywordTable table, String... candidates) {
        List<String> entries = tables.get(table);
        for (String c : candidates) {
            if (c != null && entries.contains(c.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    public boolean partial(KeywordTable table, String... candidates) {
        return partial(table, Arrays.asList(candidates));
    }

    public boolean partial(KeywordTable table, List<String> candidates) {
        List<String> entries = tables.get(table);
        for (String c : candidates) {
            if (c == null || c.isEmpty()) {
                continue;
            }
            String v = c.toLowerCase(Locale.ROOT);
            for (String e : entries) {
                if (v.contains(e.toLowerCase(Locale.ROOT))) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Partial match against every attribute value of the element.
     */
    public boolean attributeValue(KeywordTable table, Element element) {
        for (Attribute a : element.attributes()) {
            if (partial(table, a.getValue())) {
                return true;
            }
        }
        return false;
    }
}
