package io.hearthwarrio.autoapply.core.locator;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.Setting;
import io.hearthwarrio.autoapply.core.model.Locator;
import io.hearthwarrio.autoapply.core.session.BrowserSession;
import io.hearthwarrio.autoapply.core.strategy.FirstSuccess;
import io.hearthwarrio.autoapply.core.strategy.Outcome;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Synthesizes and revalidates {@link Locator}s against the live page.
 * <p>
 * Elements come from a parsed snapshot of the page; uniqueness is always checked against the live
 * document through {@link BrowserSession#count(String)}. A locator this engine returns matched
 * exactly one live element at the time it was returned.
 */
public final class LocatorEngine {

    private static final Logger log = LoggerFactory.getLogger(LocatorEngine.class);

    private static final Pattern SAFE_VOLATILE = Pattern.compile(
            "\\[@[^=\\]]*value[^=\\]]*=[^\\]]*\\]|\\[@tabindex=[^\\]]*\\]");

    private static final Pattern AGGRESSIVE_VOLATILE_KEEP_ID = Pattern.compile(
            "\\[@(?:class|tabindex|placeholder|style|autocomplete|data-[^=\\]]*|[^=\\]]*value[^=\\]]*)=[^\\]]*\\]");

    private static final Pattern AGGRESSIVE_VOLATILE = Pattern.compile(
            "\\[@(?:id|class|tabindex|placeholder|style|autocomplete|data-[^=\\]]*|[^=\\]]*value[^=\\]]*)=[^\\]]*\\]");

    private final BrowserSession session;
    private final int parentLevels;
    private final FirstSuccess<Locator, Locator> revalidation;

    public LocatorEngine(BrowserSession session, AutofillSettings settings) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.parentLevels = Objects.requireNonNull(settings, "settings must not be null")
                .getInt(Setting.PARENT_FALLBACK_LEVELS);
        this.revalidation = FirstSuccess.<Locator, Locator>named("locator revalidation")
                .then("as-is", l -> relativeIf(l, l.relative()))
                .then("reduced", l -> l.relative() == null ? Optional.empty() : relativeIf(l, reduce(l.relative())))
                .then("safe-clean", l -> relativeIf(l, clean(l.relative(), SAFE_VOLATILE)))
                .then("aggressive-clean-keep-id", l -> relativeIf(l, clean(l.relative(), AGGRESSIVE_VOLATILE_KEEP_ID)))
                .then("aggressive-clean", l -> relativeIf(l, clean(l.relative(), AGGRESSIVE_VOLATILE)))
                .then("absolute", l -> isUnique(l.absolute()) ? Optional.of(Locator.of(null, l.absolute())) : Optional.empty());
    }

    /**
     * Locator for an element of a snapshot of the current page.
     *
     * @param namespaced whether the document uses XML namespaces (absolute paths are unreliable then)
     * @return empty when no expression matches exactly one live element
     */
    public Optional<Locator> synthesize(Element element, boolean namespaced) {
        Objects.requireNonNull(element, "element must not be null");
        String relative = XPaths.relative(element);
        String absolute = namespaced ? null : XPaths.absolute(element);

        boolean relativeOk = isUnique(relative);
        boolean absoluteOk = absolute != null && isUnique(absolute);
        if (relativeOk || absoluteOk) {
            return Optional.of(Locator.of(relativeOk ? relative : null, absoluteOk ? absolute : null));
        }

        Optional<String> viaParent = viaParent(element);
        if (viaParent.isPresent()) {
            return Optional.of(Locator.of(viaParent.get(), null));
        }
        log.debug("No unique locator for <{}>: {}", element.normalName(), relative);
        return Optional.empty();
    }

    /**
     * Locator for an element revealed by an interaction, taken from a later capture of the page.
     * <p>
     * Tries the element's own relative expression, then that expression scoped under each of the
     * known ancestor paths, then its absolute path, then the parent fallback. Last comes a positional
     * path appended to each ancestor path: the element is located under the ancestor in its own
     * capture, or by its serialized form in a fresh snapshot of the page when that capture does not
     * contain the ancestor.
     */
    public Optional<Locator> synthesizeRevealed(Element element, List<String> ancestorPaths, boolean namespaced) {
        Objects.requireNonNull(element, "element must not be null");
        String relative = XPaths.relative(element);
        if (isUnique(relative)) {
            return Optional.of(Locator.of(relative, null));
        }
        if (ancestorPaths != null) {
            for (String ancestor : ancestorPaths) {
                String scoped = stripTrailingSlash(ancestor) + relative;
                if (isUnique(scoped)) {
                    return Optional.of(Locator.of(scoped, null));
                }
            }
        }
        if (!namespaced) {
            String absolute = XPaths.absolute(element);
            if (isUnique(absolute)) {
                return Optional.of(Locator.of(null, absolute));
            }
        }
        Optional<String> viaParent = viaParent(element);
        if (viaParent.isPresent()) {
            return Optional.of(Locator.of(viaParent.get(), null));
        }
        return viaAncestorPrefix(element, ancestorPaths).map(x -> Locator.of(x, null));
    }

    /**
     * Re-checks a stored locator before an interaction, recovering it when the page re-rendered.
     * <p>
     * The tagged outcome names the recovery step that succeeded; a failed outcome means the element
     * is misplaced, which callers treat as retryable.
     */
    public Outcome<Locator> revalidate(Locator locator) {
        Objects.requireNonNull(locator, "locator must not be null");
        Outcome<Locator> outcome = revalidation.evaluate(locator);
        if (outcome.isSuccess() && !"as-is".equals(outcome.strategy())) {
            log.info("Recovered locator via {}: {}", outcome.strategy(), outcome.value());
        } else if (!outcome.isSuccess()) {
            log.warn("Element misplaced, no unique match for {}", locator);
        }
        return outcome;
    }

    /**
     * True unless the relative expression matches exactly one element. Absolute-only locators are
     * checked by their absolute path.
     */
    public boolean isMisplaced(Locator locator) {
        if (locator == null) {
            return true;
        }
        return locator.relative() != null ? !isUnique(locator.relative()) : !isUnique(locator.absolute());
    }

    public boolean isUnique(String xpath) {
        if (xpath == null || xpath.isBlank()) {
            return false;
        }
        try {
            return session.count(xpath) == 1;
        } catch (RuntimeException e) {
            // invalid expression or driver quirks: just treat as non-unique
            return false;
        }
    }

    /**
     * Longest predicate prefix of a single-step expression that matches uniquely, then the bare tag.
     */
    String reduce(String relative) {
        List<String> parts = XPaths.splitStep(relative);
        if (parts.isEmpty()) {
            return null;
        }
        String base = "//" + parts.get(0);
        for (int i = parts.size() - 1; i >= 1; i--) {
            String candidate = base + String.join("", parts.subList(1, i + 1));
            if (isUnique(candidate)) {
                return candidate;
            }
        }
        return isUnique(base) ? base : null;
    }

    static String clean(String xpath, Pattern volatileAttributes) {
        if (xpath == null) {
            return null;
        }
        return volatileAttributes.matcher(xpath).replaceAll("").strip();
    }

    private Optional<String> viaParent(Element element) {
        Element ancestor = element.parent();
        for (int level = 1; level <= parentLevels && ancestor != null && !"#root".equals(ancestor.normalName()); level++) {
            String ancestorXpath = XPaths.relative(ancestor);
            if (isUnique(ancestorXpath)) {
                String candidate = ancestorXpath + XPaths.pathBelow(ancestor, element);
                if (isUnique(candidate)) {
                    return Optional.of(candidate);
                }
                return Optional.empty();
            }
            ancestor = ancestor.parent();
        }
        return Optional.empty();
    }

    private Optional<String> viaAncestorPrefix(Element element, List<String> ancestorPaths) {
        if (ancestorPaths == null || ancestorPaths.isEmpty()) {
            return Optional.empty();
        }
        Document live = null;
        for (String prefix : ancestorPaths) {
            List<Element> roots = select(element.ownerDocument(), prefix);
            List<Element> targets = List.of(element);
            if (roots.stream().noneMatch(root -> XPaths.pathBelow(root, element) != null)) {
                if (live == null) {
                    live = Jsoup.parse(session.snapshot());
                }
                roots = select(live, prefix);
                targets = fingerprintMatches(roots, element);
                if (targets.size() != 1) {
                    continue;
                }
            }
            for (Element root : roots) {
                String below = XPaths.pathBelow(root, targets.get(0));
                if (below == null || below.isEmpty()) {
                    continue;
                }
                String candidate = stripTrailingSlash(prefix) + below;
                if (isUnique(candidate)) {
                    log.debug("Located <{}> by position under {}", element.normalName(), prefix);
                    return Optional.of(candidate);
                }
            }
        }
        log.debug("No unique locator for revealed <{}>", element.normalName());
        return Optional.empty();
    }

    private static List<Element> fingerprintMatches(List<Element> roots, Element element) {
        String fingerprint = element.outerHtml();
        List<Element> matches = new ArrayList<>();
        for (Element root : roots) {
            for (Element candidate : root.getAllElements()) {
                if (candidate != root
                        && candidate.normalName().equals(element.normalName())
                        && candidate.outerHtml().equals(fingerprint)) {
                    matches.add(candidate);
                }
            }
        }
        return matches;
    }

    private static List<Element> select(Document document, String xpath) {
        if (document == null || xpath == null || xpath.isBlank()) {
            return List.of();
        }
        try {
            return document.selectXpath(xpath);
        } catch (RuntimeException e) {
            // jsoup rejects some expressions the browser accepts
            return List.of();
        }
    }

    private Optional<Locator> relativeIf(Locator original, String candidate) {
        if (candidate == null || candidate.isBlank() || !isUnique(candidate)) {
            return Optional.empty();
        }
        return Optional.of(Locator.of(candidate, original.absolute()));
    }

    private static String stripTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}
