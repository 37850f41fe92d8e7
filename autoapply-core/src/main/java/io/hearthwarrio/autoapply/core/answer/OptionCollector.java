package io.hearthwarrio.autoapply.core.answer;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.KeywordTable;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.config.Setting;
import io.hearthwarrio.autoapply.core.diff.DiffResult;
import io.hearthwarrio.autoapply.core.diff.DomSnapshot;
import io.hearthwarrio.autoapply.core.diff.HtmlDiff;
import io.hearthwarrio.autoapply.core.extract.Blacklist;
import io.hearthwarrio.autoapply.core.locator.LocatorEngine;
import io.hearthwarrio.autoapply.core.model.Locator;
import io.hearthwarrio.autoapply.core.session.BrowserSession;
import io.hearthwarrio.autoapply.core.text.OptionMatcher;
import io.hearthwarrio.autoapply.core.text.TextCleaner;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Discovers the options a custom list or multiselect reveals when it is clicked, typed into or scrolled.
 * <p>
 * Options are read from the DOM delta of the interaction, never from the whole page. Each returned
 * option maps its visible text to a locator that was unique at collection time; iteration order is
 * page order.
 */
public final class OptionCollector {

    private static final Logger log = LoggerFactory.getLogger(OptionCollector.class);

    private static final String NESTED_BUTTONS =
            ".//*[self::button or (self::input and (@type='button' or @type='submit')) or @role='button']";
    private static final int SCROLL_PIXELS = 300;
    private static final int NO_PADDING = 0;

    private final BrowserSession session;
    private final LocatorEngine locators;
    private final Blacklist blacklist;
    private final Duration settle;
    private final int searchSimilarity;

    public OptionCollector(BrowserSession session, LocatorEngine locators, KeywordTables tables, AutofillSettings settings) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.locators = Objects.requireNonNull(locators, "locators must not be null");
        this.blacklist = new Blacklist(Objects.requireNonNull(tables, "tables must not be null"));
        Objects.requireNonNull(settings, "settings must not be null");
        this.settle = settings.seconds(Setting.STABLE_DOM_TIMEOUT_SECONDS);
        this.searchSimilarity = settings.getInt(Setting.SEARCH_CANDIDATE_SIMILARITY);
    }

    /**
     * Clicks the target and returns the options that appeared after it.
     *
     * @param reference  options must follow this element in document order; null disables the check
     * @param searchPlan terms to type when the click focuses a search box, and the answers they should surface
     */
    public Map<String, Locator> open(Locator target, String reference, SearchPlan searchPlan) {
        Objects.requireNonNull(target, "target must not be null");
        DomSnapshot before = DomSnapshot.parse(session.snapshot());
        session.click(target.expression());
        session.waitUntilStable(settle, NO_PADDING);

        if (searchPlan != null && !searchPlan.isEmpty() && activeIsInput()) {
            Optional<Map<String, Locator>> found = search(searchPlan);
            if (found.isPresent()) {
                return found.get();
            }
        }
        DomSnapshot after = DomSnapshot.parse(session.snapshot());
        Map<String, Locator> options = extract(HtmlDiff.diff(before, after), reference, after.hasNamespaces());
        if (options.isEmpty()) {
            options = focusedListbox(reference, after.hasNamespaces());
        }
        log.debug("Click on {} revealed {} options", target, options.size());
        return options;
    }

    /**
     * Scrolls the list that holds {@code anchor} and returns the options that were not visible before.
     */
    public Map<String, Locator> scroll(Locator anchor, Collection<String> known, String reference) {
        return scroll(anchor, known, reference, SCROLL_PIXELS);
    }

    /**
     * Scrolls the list back towards its start, for relocating an option that scrolled out of view.
     */
    public Map<String, Locator> scrollBack(Locator anchor, String reference) {
        return scroll(anchor, null, reference, -SCROLL_PIXELS);
    }

    private Map<String, Locator> scroll(Locator anchor, Collection<String> known, String reference, int pixels) {
        Objects.requireNonNull(anchor, "anchor must not be null");
        DomSnapshot before = DomSnapshot.parse(session.snapshot());
        session.scrollWithin(anchor.expression(), pixels);
        session.waitUntilStable(settle, NO_PADDING);
        DomSnapshot after = DomSnapshot.parse(session.snapshot());
        Map<String, Locator> options = extract(HtmlDiff.diff(before, after), reference, after.hasNamespaces());
        if (known != null) {
            options.keySet().removeAll(known);
        }
        return options;
    }

    /**
     * Types each search term into the focused box until one surfaces an option close to an expected answer.
     */
    private Optional<Map<String, Locator>> search(SearchPlan plan) {
        for (String term : plan.terms()) {
            DomSnapshot before = DomSnapshot.parse(session.snapshot());
            session.typeIntoActive(term);
            session.waitUntilStable(settle, NO_PADDING);
            DomSnapshot after = DomSnapshot.parse(session.snapshot());
            DiffResult diff = HtmlDiff.diff(before, after);
            if (diff.isEmpty()) {
                session.pressEnter();
                session.waitUntilStable(settle, NO_PADDING);
                after = DomSnapshot.parse(session.snapshot());
                diff = HtmlDiff.diff(before, after);
            }
            Map<String, Locator> options = extract(diff, null, after.hasNamespaces());
            for (String expected : plan.expected()) {
                List<OptionMatcher.RankedOption<Locator>> ranked = OptionMatcher.rank(options, expected, searchSimilarity, 1);
                if (!ranked.isEmpty()) {
                    OptionMatcher.RankedOption<Locator> best = ranked.get(0);
                    log.debug("Search '{}' surfaced '{}' ({}%)", term, best.text(), best.similarity());
                    Map<String, Locator> out = new LinkedHashMap<>();
                    out.put(best.text(), best.target());
                    return Optional.of(out);
                }
            }
            session.clearActive();
        }
        return Optional.empty();
    }

    private boolean activeIsInput() {
        String html = session.activeElementHtml();
        return html != null && html.stripLeading().regionMatches(true, 0, "<input", 0, 6);
    }

    private Map<String, Locator> focusedListbox(String reference, boolean namespaced) {
        String html = session.activeElementHtml();
        if (html == null || html.isBlank()) {
            return new LinkedHashMap<>();
        }
        DomSnapshot fragment = DomSnapshot.parse(html);
        Element body = fragment.body();
        if (body == null) {
            return new LinkedHashMap<>();
        }
        Element root = body.firstElementChild();
        if (root == null || !"ul".equals(root.normalName()) || !"listbox".equals(root.attr("role"))) {
            return new LinkedHashMap<>();
        }
        return collect(root.getAllElements(), List.of(), reference, namespaced);
    }

    /**
     * Options carried by the changed elements of a diff.
     */
    Map<String, Locator> extract(DiffResult diff, String reference, boolean namespaced) {
        if (diff.isEmpty()) {
            return new LinkedHashMap<>();
        }
        List<Element> all = new ArrayList<>();
        for (Element root : diff.changed()) {
            all.addAll(root.getAllElements());
        }
        return collect(all, diff.ancestorPaths(), reference, namespaced);
    }

    private Map<String, Locator> collect(List<Element> elements, List<String> ancestorPaths, String reference, boolean namespaced) {
        Map<String, Locator> options = new LinkedHashMap<>();
        for (Element el : elements) {
            List<Element> inputs = el.select("input");
            inputs.remove(el);
            List<Element> buttons = el.selectXpath(NESTED_BUTTONS);
            if (inputs.size() > 1 || buttons.size() > 1) {
                continue;
            }
            String text = TextCleaner.clean(el.text());
            if (text.isEmpty() || options.containsKey(text)) {
                continue;
            }
            if (inputs.size() == 1 && accept(options, text, inputs.get(0), ancestorPaths, reference, namespaced)) {
                continue;
            }
            if (buttons.size() == 1 && accept(options, text, buttons.get(0), ancestorPaths, reference, namespaced)) {
                continue;
            }
            if (blacklist.partial(KeywordTable.OPTION_PLACEHOLDER_BLACKLIST, text) || hasTextChild(el)) {
                continue;
            }
            accept(options, text, el, ancestorPaths, reference, namespaced);
        }
        return options;
    }

    private boolean accept(Map<String, Locator> options, String text, Element target, List<String> ancestorPaths,
                           String reference, boolean namespaced) {
        if (blacklist.partial(KeywordTable.LIST_OPTION_BLACKLIST_PARTIAL, text)) {
            return false;
        }
        Optional<Locator> locator = locators.synthesizeRevealed(target, ancestorPaths, namespaced);
        if (locator.isEmpty()) {
            return false;
        }
        if (reference != null && !session.isAfter(locator.get().expression(), reference)) {
            return false;
        }
        options.put(text, locator.get());
        return true;
    }

    private static boolean hasTextChild(Element el) {
        for (Element child : el.children()) {
            String t = child.text().strip();
            if (!t.isEmpty() && !"*".equals(t)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Search terms to type into a searchable list, with the answers each term is expected to surface.
     */
    public static final class SearchPlan {

        private static final SearchPlan NONE = new SearchPlan(List.of(), List.of());

        private final List<String> terms;
        private final List<String> expected;

        private SearchPlan(List<String> terms, List<String> expected) {
            this.terms = List.copyOf(terms);
            this.expected = List.copyOf(expected);
        }

        public static SearchPlan of(List<String> terms, List<String> expected) {
            return new SearchPlan(terms, expected);
        }

        public static SearchPlan none() {
            return NONE;
        }

        public List<String> terms() {
            return terms;
        }

        public List<String> expected() {
            return expected;
        }

        public boolean isEmpty() {
            return terms.isEmpty() || expected.isEmpty();
        }
    }
}
