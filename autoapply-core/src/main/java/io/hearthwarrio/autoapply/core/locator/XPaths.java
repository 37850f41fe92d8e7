package io.hearthwarrio.autoapply.core.locator;

import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * XPath string helpers shared by locator synthesis and revalidation.
 */
public final class XPaths {

    private static final Pattern PREDICATES = Pattern.compile("\\[[^\\]]*\\]");
    private static final Pattern XPATH_NAME = Pattern.compile("[A-Za-z_][\\w\\-.]*");
    private static final Pattern STEP_TAG = Pattern.compile("[A-Za-z][\\w\\-:]*|\\*");

    private XPaths() {
        // utility class
    }

    /**
     * Quotes a value for use inside an XPath expression, falling back to {@code concat()} when it
     * contains both quote kinds.
     */
    public static String literal(String value) {
        if (value == null) {
            return "''";
        }
        if (!value.contains("'")) {
            return "'" + value + "'";
        }
        if (!value.contains("\"")) {
            return "\"" + value + "\"";
        }

        String[] parts = value.split("'", -1);
        StringBuilder sb = new StringBuilder("concat(");
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append(", \"'\", ");
            }
            sb.append("'").append(parts[i]).append("'");
        }
        sb.append(")");
        return sb.toString();
    }

    /**
     * Absolute expressions start with a single slash.
     */
    public static boolean isAbsolute(String xpath) {
        if (xpath == null) {
            return false;
        }
        String x = xpath.strip();
        return x.startsWith("/") && !x.startsWith("//");
    }

    /**
     * Whether the last step of the expression selects the given tag.
     */
    public static boolean matchesTag(String xpath, String tagName) {
        if (xpath == null || xpath.isBlank() || tagName == null || tagName.isBlank()) {
            return false;
        }
        String cleaned = PREDICATES.matcher(xpath.strip()).replaceAll("");
        String[] parts = cleaned.replaceAll("^/+|/+$", "").split("/");
        String last = parts[parts.length - 1];
        if ("*".equals(last)) {
            return "*".equals(tagName);
        }
        int colon = last.lastIndexOf(':');
        return (colon >= 0 ? last.substring(colon + 1) : last).equalsIgnoreCase(tagName);
    }

    /**
     * {@code //tag[..][..]} from every attribute of the element, in source order.
     * <ul>
     *   <li>empty values become presence tests: {@code [@required]}</li>
     *   <li>values that look like inline script become {@code contains()} tests on their head</li>
     *   <li>attribute names that cannot appear in an XPath name test are skipped</li>
     * </ul>
     */
    public static String relative(Element element) {
        StringBuilder sb = new StringBuilder("//").append(tagOf(element));
        for (Attribute a : element.attributes()) {
            String name = a.getKey();
            if (name.isEmpty() || !isXPathName(name)) {
                continue;
            }
            String value = a.getValue();
            if (value == null || value.isEmpty()) {
                sb.append("[@").append(name).append(']');
            } else if (value.contains("(") || value.contains("\"") || value.contains("&quot;")) {
                sb.append("[contains(@").append(name).append(", ").append(literal(scriptHead(value))).append(")]");
            } else {
                sb.append("[@").append(name).append('=').append(literal(value)).append(']');
            }
        }
        return sb.toString();
    }

    /**
     * Shortest of the parts before {@code (}, {@code &quot;} and {@code "}.
     */
    static String scriptHead(String value) {
        String best = value.split("\\(", -1)[0].strip();
        for (String sep : new String[]{"&quot;", "\""}) {
            String head = value.split(Pattern.quote(sep), -1)[0].strip();
            if (head.length() < best.length()) {
                best = head;
            }
        }
        return best;
    }

    /**
     * Position-indexed path from the document root: {@code /html/body/div[2]/input[1]}.
     */
    public static String absolute(Element element) {
        String tag = tagOf(element);
        Element parent = element.parent();
        if (isRootLike(parent)) {
            return "/" + tag;
        }
        if ("body".equals(tag) && "html".equals(tagOf(parent))) {
            return "/html/body";
        }
        return absolute(parent) + "/" + tag + "[" + sameTagIndex(element) + "]";
    }

    /**
     * {@link #absolute(Element)} of every element of the document, computed in one walk.
     */
    public static Set<String> absolutePaths(Document document) {
        Set<String> out = new HashSet<>();
        for (Element top : document.children()) {
            collectAbsolute(top, "/" + tagOf(top), out);
        }
        return out;
    }

    private static void collectAbsolute(Element element, String path, Set<String> out) {
        out.add(path);
        String tag = tagOf(element);
        Map<String, Integer> seen = new HashMap<>();
        for (Element child : element.children()) {
            String childTag = tagOf(child);
            int ix = seen.merge(child.normalName(), 1, Integer::sum);
            String childPath = "body".equals(childTag) && "html".equals(tag)
                    ? "/html/body"
                    : path + "/" + childTag + "[" + ix + "]";
            collectAbsolute(child, childPath, out);
        }
    }

    /**
     * Position-indexed path from {@code ancestor} (exclusive) down to the element, e.g. {@code /div[2]/input[1]}.
     * Empty when the element is the ancestor; null when it is not a descendant.
     */
    public static String pathBelow(Element ancestor, Element element) {
        List<String> steps = new ArrayList<>();
        Element cur = element;
        while (cur != null && cur != ancestor) {
            steps.add(0, "/" + tagOf(cur) + "[" + sameTagIndex(cur) + "]");
            cur = cur.parent();
        }
        if (cur == null) {
            return null;
        }
        return String.join("", steps);
    }

    /**
     * Splits a single-step expression {@code //tag[p1][p2]} into its tag and predicates.
     *
     * @return tag followed by predicates, or an empty list when the expression has more than one step
     */
    public static List<String> splitStep(String xpath) {
        if (xpath == null || !xpath.startsWith("//")) {
            return List.of();
        }
        int i = 2;
        while (i < xpath.length() && xpath.charAt(i) != '[') {
            i++;
        }
        String tag = xpath.substring(2, i);
        if (!STEP_TAG.matcher(tag).matches()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        out.add(tag);
        while (i < xpath.length()) {
            if (xpath.charAt(i) != '[') {
                return List.of();
            }
            int end = predicateEnd(xpath, i);
            if (end < 0) {
                return List.of();
            }
            out.add(xpath.substring(i, end + 1));
            i = end + 1;
        }
        return out;
    }

    private static int predicateEnd(String s, int open) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    static String tagOf(Element element) {
        return element.normalName().toLowerCase(Locale.ROOT);
    }

    private static int sameTagIndex(Element element) {
        int ix = 1;
        Element sib = element.previousElementSibling();
        while (sib != null) {
            if (sib.normalName().equals(element.normalName())) {
                ix++;
            }
            sib = sib.previousElementSibling();
        }
        return ix;
    }

    private static boolean isRootLike(Element e) {
        return e == null || "#root".equals(e.normalName());
    }

    private static boolean isXPathName(String name) {
        return XPATH_NAME.matcher(name).matches();
    }
}
