package io.hearthwarrio.autoapply.core.extract;

import io.hearthwarrio.autoapply.core.locator.XPaths;
import io.hearthwarrio.autoapply.core.model.Locator;
import io.hearthwarrio.autoapply.core.session.BrowserSession;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Decides whether a form control must be filled in.
 * <p>
 * Markup signals come from the snapshot element; visible error hints and the constraint validation API
 * are asked of the live page.
 */
public final class RequiredDetector {

    private static final List<String> CLASS_MARKERS = List.of("required", "error", "has-error");

    private final BrowserSession session;

    public RequiredDetector(BrowserSession session) {
        this.session = Objects.requireNonNull(session, "session must not be null");
    }

    public boolean isRequired(Element element, Locator locator, boolean namespaced) {
        if (element.hasAttr("required")) {
            return true;
        }
        if (element.hasAttr("data-required")) {
            String v = element.attr("data-required").strip().toLowerCase(Locale.ROOT);
            if (v.isEmpty() || "true".equals(v) || "1".equals(v)) {
                return true;
            }
        }
        if (ElementAttributes.search(element, List.of("required")).containsValue("true")) {
            return true;
        }
        if ("true".equals(element.attr("aria-invalid"))) {
            return true;
        }
        String cls = element.attr("class").toLowerCase(Locale.ROOT);
        for (String m : CLASS_MARKERS) {
            if (cls.contains(m)) {
                return true;
            }
        }
        if (!namespaced && hasVisibleErrorHint(element)) {
            return true;
        }
        try {
            return session.failsValidation(locator.expression());
        } catch (RuntimeException e) {
            // detached or non-validatable element
            return false;
        }
    }

    /**
     * Whether a sibling subtree shows "required" text or an error-classed element.
     */
    private boolean hasVisibleErrorHint(Element element) {
        Element parent = element.parent();
        if (parent == null || "#root".equals(parent.normalName())) {
            return false;
        }
        for (Element e : parent.getAllElements()) {
            if (e == parent) {
                continue;
            }
            if (e.ownText().contains("required") || e.attr("class").contains("error")) {
                if (session.isDisplayed(XPaths.absolute(e))) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Label-derived signal: a tag label starting or ending with {@code *}, or a text label ending with it.
     */
    public static boolean hasRequiredMarker(String tagLabel, String textLabel) {
        boolean tag = tagLabel != null && !tagLabel.isEmpty()
                && (tagLabel.charAt(0) == '*' || tagLabel.charAt(tagLabel.length() - 1) == '*');
        boolean text = textLabel != null && !textLabel.isEmpty() && textLabel.charAt(textLabel.length() - 1) == '*';
        return tag || text;
    }
}
