package io.hearthwarrio.autoapply.core.diff;

import io.hearthwarrio.autoapply.core.locator.XPaths;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Top-down structural diff of two DOM captures.
 * <p>
 * Top-level body children of the later capture are paired with the first earlier child of the same
 * tag and attributes; paired nodes are compared child by child, by position. A node present only
 * in the later capture, or whose tag, attributes or leading text differ, is reported as changed.
 * Each node is visited at most once. Parent paths are looked up in a set built from one walk of the
 * earlier capture, never by querying the earlier document again.
 */
public final class HtmlDiff {

    private HtmlDiff() {
        // utility class
    }

    public static DiffResult diff(String before, String after) {
        return diff(DomSnapshot.parse(before), DomSnapshot.parse(after));
    }

    public static DiffResult diff(DomSnapshot before, DomSnapshot after) {
        Objects.requireNonNull(before, "before must not be null");
        Objects.requireNonNull(after, "after must not be null");

        List<Element> changed = new ArrayList<>();
        Set<String> ancestors = new LinkedHashSet<>();
        Set<String> earlierPaths = XPaths.absolutePaths(before.document());
        Element bodyX = before.body();
        Element bodyY = after.body();
        List<Element> childrenX = bodyX == null ? List.of() : bodyX.children();
        for (Element childY : bodyY == null ? List.<Element>of() : bodyY.children()) {
            Element matched = null;
            for (Element childX : childrenX) {
                if (sameNode(childX, childY)) {
                    matched = childX;
                    break;
                }
            }
            compare(matched, childY, earlierPaths, changed, ancestors);
        }
        if (changed.isEmpty()) {
            return DiffResult.empty();
        }
        return new DiffResult(changed, new ArrayList<>(ancestors));
    }

    private static void compare(Element x, Element y, Set<String> earlierPaths, List<Element> changed, Set<String> ancestors) {
        if (y == null) {
            return;
        }
        if (x == null) {
            Element parentY = y.parent();
            if (parentY != null && !"#root".equals(parentY.normalName())) {
                String parentPath = XPaths.absolute(parentY);
                if (earlierPaths.contains(parentPath)) {
                    ancestors.add(parentPath);
                }
            }
            changed.add(y);
            return;
        }
        if (!sameNode(x, y) || !leadingText(x).equals(leadingText(y))) {
            changed.add(y);
            return;
        }
        List<Element> cx = x.children();
        List<Element> cy = y.children();
        for (int i = 0; i < cy.size(); i++) {
            compare(i < cx.size() ? cx.get(i) : null, cy.get(i), earlierPaths, changed, ancestors);
        }
    }

    static boolean sameNode(Element a, Element b) {
        return a.normalName().equals(b.normalName()) && attributes(a).equals(attributes(b));
    }

    private static Map<String, String> attributes(Element e) {
        Map<String, String> m = new HashMap<>();
        for (Attribute a : e.attributes()) {
            m.put(a.getKey(), a.getValue());
        }
        return m;
    }

    private static String leadingText(Element e) {
        if (e.childNodeSize() > 0 && e.childNode(0) instanceof TextNode t) {
            return t.text().strip();
        }
        return "";
    }
}
