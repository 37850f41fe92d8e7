package io.hearthwarrio.autoapply.core.diff;

import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Finds elements that appeared between two captures.
 */
public final class NewElementFinder {

    /**
     * Queries for anything a user can fill in.
     */
    public static final List<String> FIELD_QUERIES = List.of("//input", "//textarea", "//select", "//button");

    /**
     * Queries for anything a user can click to move on.
     */
    public static final List<String> BUTTON_QUERIES = List.of(
            "//button", "//input[@type='button']", "//input[@type='submit']", "//*[@role='button']");

    private NewElementFinder() {
        // utility class
    }

    /**
     * Elements of the later capture matching the queries whose serialized form did not exist before.
     *
     * @param queries bare tag names or XPath expressions
     */
    public static List<Element> find(DomSnapshot before, DomSnapshot after, List<String> queries) {
        Objects.requireNonNull(before, "before must not be null");
        Objects.requireNonNull(after, "after must not be null");
        Set<String> known = new HashSet<>();
        for (Element e : before.select(queries)) {
            known.add(e.outerHtml());
        }
        List<Element> out = new ArrayList<>();
        for (Element e : after.select(queries)) {
            if (!known.contains(e.outerHtml())) {
                out.add(e);
            }
        }
        return out;
    }
}
