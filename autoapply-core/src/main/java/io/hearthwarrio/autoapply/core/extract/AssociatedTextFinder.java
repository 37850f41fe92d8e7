package io.hearthwarrio.autoapply.core.extract;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.Setting;
import io.hearthwarrio.autoapply.core.locator.XPaths;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds caption text for a control by walking backwards through its ancestors.
 * <p>
 * At every level the last heading, paragraph or label that precedes the control (or wraps it) wins.
 * Positional steps with an index above 1 on the way up mark repeated rows; crossing too many of them,
 * or one far from the control, stops the walk so a caption shared by all rows is not attributed to one.
 */
public final class AssociatedTextFinder {

    private static final Pattern STEP_INDEX = Pattern.compile("\\[(\\d+)\\]$");
    private static final String CAPTION_QUERY = "label, h1, h2, h3, h4, h5, h6, p";
    private static final List<String> FIELDSET_CAPTION_TAGS = List.of("h1", "h2", "h3", "h4", "h5", "h6", "p", "label");

    private static final int SPLIT_FREE_LEVELS = 4;
    private static final int MAX_SPLIT_INDEX = 5;
    private static final int MAX_SPLITS = 2;
    private static final int MAX_FIELDSET_CAPTIONS = 3;
    private static final double FIELDSET_WINDOW = 33.33;

    private final int maxLevels;

    public AssociatedTextFinder(AutofillSettings settings) {
        this.maxLevels = Objects.requireNonNull(settings, "settings must not be null")
                .getInt(Setting.ASSOCIATED_TEXT_MAX_LEVELS);
    }

    public Optional<String> find(Element element) {
        Objects.requireNonNull(element, "element must not be null");
        String type = element.attr("type");
        boolean optionItem = "radio".equals(type) || "checkbox".equals(type);
        String path = XPaths.absolute(element);
        List<String> steps = steps(path);

        if (!optionItem) {
            Element label = outermost(element, "label");
            if (label != null && !label.text().isEmpty()) {
                return Optional.of(label.text());
            }
        }

        Element fieldset = element.closest("fieldset");
        if (fieldset != null && fieldset != element && fieldsetIsClose(steps)) {
            List<String> captions = fieldsetCaptions(fieldset);
            if (captions.size() <= MAX_FIELDSET_CAPTIONS) {
                String joined = String.join("\n", captions);
                return joined.isEmpty() ? Optional.empty() : Optional.of(joined);
            }
        }

        Set<String> optionTexts = new HashSet<>();
        int splitsLeft = MAX_SPLITS;
        Element ancestor = element;
        for (int i = 1; i <= maxLevels; i++) {
            if (i > steps.size()) {
                break;
            }
            String step = steps.get(steps.size() - i);
            Matcher m = STEP_INDEX.matcher(step);
            if (m.find()) {
                int index = Integer.parseInt(m.group(1));
                if (optionItem && i <= SPLIT_FREE_LEVELS) {
                    collectSiblingTexts(ancestor, optionTexts);
                }
                if ((i > SPLIT_FREE_LEVELS && index != 1) || index > MAX_SPLIT_INDEX || splitsLeft == -1) {
                    if (i > SPLIT_FREE_LEVELS && ancestor.parent() != null) {
                        Optional<String> open = firstLine(ancestor.parent(), optionItem);
                        if (open.isPresent()) {
                            return open;
                        }
                    }
                    break;
                }
                if (index != 1) {
                    splitsLeft--;
                }
            }

            ancestor = ancestor.parent();
            if (ancestor == null || "#root".equals(ancestor.normalName()) || "body".equals(ancestor.normalName())) {
                break;
            }

            String found = null;
            for (Element caption : ancestor.select(CAPTION_QUERY)) {
                String text = captionText(caption);
                if (text.isEmpty() || optionTexts.contains(text)) {
                    continue;
                }
                if (precedes(caption, element) || caption == element || isAncestor(caption, element)) {
                    if (optionItem) {
                        return Optional.of(text);
                    }
                    found = text;
                }
            }
            if (found != null) {
                return Optional.of(found);
            }
            if (i == maxLevels) {
                return firstLine(ancestor, optionItem);
            }
        }
        return Optional.empty();
    }

    static List<String> steps(String absolutePath) {
        List<String> out = new ArrayList<>();
        for (String s : absolutePath.split("/")) {
            if (!s.isEmpty()) {
                out.add(s);
            }
        }
        return out;
    }

    private static boolean fieldsetIsClose(List<String> steps) {
        int window = (int) ((steps.size() * FIELDSET_WINDOW) / 100);
        for (int i = steps.size() - window; i < steps.size(); i++) {
            if (i >= 0 && steps.get(i).contains("fieldset")) {
                return true;
            }
        }
        return false;
    }

    private static List<String> fieldsetCaptions(Element fieldset) {
        List<String> out = new ArrayList<>();
        for (String tag : FIELDSET_CAPTION_TAGS) {
            for (Element e : fieldset.getElementsByTag(tag)) {
                String text = e.text().strip();
                if (text.split("\\s+").length > 2) {
                    out.add(text);
                }
            }
        }
        return out;
    }

    /**
     * Direct texts of the same-tag siblings up to this node: these are option captions, not the question.
     */
    private static void collectSiblingTexts(Element node, Set<String> target) {
        Element parent = node.parent();
        if (parent == null) {
            return;
        }
        for (Element sib : parent.children()) {
            if (!sib.normalName().equals(node.normalName())) {
                continue;
            }
            target.add(directText(sib));
            if (sib == node) {
                break;
            }
        }
    }

    private static String directText(Element e) {
        List<String> parts = new ArrayList<>();
        for (Node n : e.childNodes()) {
            if (n instanceof TextNode t) {
                parts.add(t.text().strip());
            } else if (n instanceof Element c && !"button".equals(c.normalName())) {
                parts.add(c.text().strip());
            }
        }
        return String.join(" ", parts).strip();
    }

    /**
     * Text of the element without the text of nested buttons, whitespace collapsed.
     */
    static String captionText(Element e) {
        StringBuilder sb = new StringBuilder();
        appendText(e, sb);
        return sb.toString().replaceAll("\\s+", " ").strip();
    }

    private static void appendText(Element e, StringBuilder sb) {
        for (Node n : e.childNodes()) {
            if (n instanceof TextNode t) {
                sb.append(t.text().strip());
            } else if (n instanceof Element c && !"button".equals(c.normalName())) {
                appendText(c, sb);
            }
        }
    }

    private static Optional<String> firstLine(Element e, boolean optionItem) {
        List<String> lines = textLines(e);
        if (lines.isEmpty()) {
            return Optional.empty();
        }
        int limit = optionItem ? 9 : 6;
        return lines.size() < limit ? Optional.of(lines.get(0)) : Optional.empty();
    }

    /**
     * Non-blank text nodes below the element, one per line, skipping scripts and styles.
     */
    static List<String> textLines(Element e) {
        List<String> out = new ArrayList<>();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode t && !isScript(node.parent())) {
                String s = t.text().strip();
                if (!s.isEmpty()) {
                    out.add(s);
                }
            }
        }, e);
        return out;
    }

    private static boolean isScript(Node parent) {
        return parent instanceof Element p && ("script".equals(p.normalName()) || "style".equals(p.normalName()));
    }

    private static Element outermost(Element element, String tag) {
        Element found = null;
        for (Element p : element.parents()) {
            if (tag.equals(p.normalName())) {
                found = p;
            }
        }
        return found;
    }

    private static boolean isAncestor(Element candidate, Element element) {
        for (Element p : element.parents()) {
            if (p == candidate) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether {@code a} starts before {@code b} in document order and does not contain it.
     */
    static boolean precedes(Element a, Element b) {
        List<Element> pa = chain(a);
        List<Element> pb = chain(b);
        int i = 0;
        while (i < pa.size() && i < pb.size() && pa.get(i) == pb.get(i)) {
            i++;
        }
        if (i == pa.size() || i == pb.size()) {
            return false;
        }
        return pa.get(i).elementSiblingIndex() < pb.get(i).elementSiblingIndex();
    }

    private static List<Element> chain(Element e) {
        List<Element> out = new ArrayList<>();
        for (Element cur = e; cur != null; cur = cur.parent()) {
            out.add(0, cur);
        }
        return out;
    }
}
