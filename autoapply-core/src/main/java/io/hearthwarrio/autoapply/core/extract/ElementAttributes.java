package io.hearthwarrio.autoapply.core.extract;

import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Attribute lookups shared by the extractor.
 */
public final class ElementAttributes {

    private ElementAttributes() {
        // utility class
    }

    /**
     * Attributes whose name is {@code sub}, ends with {@code -sub} or {@code _sub}, or starts with {@code aria-sub}.
     *
     * @return lower-cased name to value, in attribute order; empty when nothing matches
     */
    public static Map<String, String> search(Element element, List<String> subs) {
        Objects.requireNonNull(element, "element must not be null");
        Map<String, String> out = new LinkedHashMap<>();
        for (Attribute a : element.attributes()) {
            String name = a.getKey().toLowerCase(Locale.ROOT);
            for (String sub : subs) {
                String s = sub.toLowerCase(Locale.ROOT);
                if (name.equals(s) || name.endsWith("-" + s) || name.endsWith("_" + s) || name.startsWith("aria-" + s)) {
                    out.put(name, a.getValue());
                    break;
                }
            }
        }
        return out;
    }

    /**
     * First attribute whose value contains any of the substrings, case-insensitively.
     */
    public static Optional<Map.Entry<String, String>> searchValue(Element element, List<String> substrings) {
        Objects.requireNonNull(element, "element must not be null");
        for (Attribute a : element.attributes()) {
            String v = a.getValue() == null ? "" : a.getValue().toLowerCase(Locale.ROOT);
            for (String s : substrings) {
                if (v.contains(s.toLowerCase(Locale.ROOT))) {
                    return Optional.of(Map.entry(a.getKey(), a.getValue()));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * A value of a {@link #search(Element, List) searched} attribute that differs from the plain attribute of that name,
     * e.g. {@code data-automation-id} next to {@code id}.
     */
    public static String custom(Element element, String sub) {
        String plain = element.hasAttr(sub) ? element.attr(sub) : null;
        for (String v : search(element, List.of(sub)).values()) {
            if (!v.equals(plain)) {
                return v;
            }
        }
        return "";
    }

    /**
     * Value of the attribute, or an empty string.
     */
    public static String get(Element element, String name) {
        return element.hasAttr(name) ? element.attr(name) : "";
    }

    public static boolean isInside(Element element, List<String> tags) {
        for (Element p : element.parents()) {
            if (tags.contains(p.normalName())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Combobox, {@code aria-autocomplete=list}, a {@code list} attribute, or "listbox" anywhere in an attribute.
     */
    public static boolean isListType(Element element) {
        return "combobox".equals(element.attr("role"))
                || "list".equals(element.attr("aria-autocomplete"))
                || element.hasAttr("list")
                || searchValue(element, List.of("listbox")).isPresent();
    }

    /**
     * Any attribute named {@code hidden}, {@code *-hidden}, {@code aria-hidden} etc. set to {@code true}.
     */
    public static boolean isMarkedHidden(Element element) {
        for (String v : search(element, List.of("hidden")).values()) {
            if ("true".equalsIgnoreCase(v)) {
                return true;
            }
        }
        return false;
    }
}
