package io.hearthwarrio.autoapply.core.diff;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parsed serialized DOM capture.
 */
public final class DomSnapshot {

    private static final Pattern NAMESPACED_TAG = Pattern.compile("<[a-zA-Z0-9]+:[a-zA-Z0-9]+");
    private static final Pattern TAG_NAME = Pattern.compile("[a-zA-Z][a-zA-Z0-9]*");

    private final String html;
    private final Document document;

    private DomSnapshot(String html, Document document) {
        this.html = html;
        this.document = document;
    }

    public static DomSnapshot parse(String html) {
        String h = html == null ? "" : html;
        return new DomSnapshot(h, Jsoup.parse(h));
    }

    public String html() {
        return html;
    }

    public Document document() {
        return document;
    }

    public Element body() {
        return document.body();
    }

    /**
     * Whether the markup uses prefixed (namespaced) tags; positional paths are unreliable then.
     */
    public boolean hasNamespaces() {
        return hasNamespaces(html);
    }

    public static boolean hasNamespaces(String html) {
        return html != null && NAMESPACED_TAG.matcher(html).find();
    }

    /**
     * Elements matching any of the queries, in query order without duplicates.
     * A query is a bare tag name or an XPath expression.
     */
    public List<Element> select(List<String> queries) {
        Objects.requireNonNull(queries, "queries must not be null");
        Set<Element> out = new LinkedHashSet<>();
        for (String q : queries) {
            Elements found = TAG_NAME.matcher(q).matches()
                    ? document.getElementsByTag(q)
                    : document.selectXpath(q);
            out.addAll(found);
        }
        return new ArrayList<>(out);
    }
}
