package io.hearthwarrio.autoapply.core.answer;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.KeywordTable;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.config.Setting;
import io.hearthwarrio.autoapply.core.extract.Blacklist;
import io.hearthwarrio.autoapply.core.locator.XPaths;
import io.hearthwarrio.autoapply.core.model.FieldDescriptor;
import io.hearthwarrio.autoapply.core.model.Locator;
import io.hearthwarrio.autoapply.core.model.SectionCategory;
import io.hearthwarrio.autoapply.core.session.BrowserSession;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Walks a nested multiselect (category, subcategory, leaf) down to one leaf.
 * <p>
 * Each level is opened by clicking the previous choice. Options load while scrolling, so a deterministic
 * profile match is attempted after every scroll pass; when the level has no such match, the oracle chooses
 * from everything collected at that level. The chosen option is then relocated by its label, scrolling
 * back through the list, because only the most recently rendered options still have valid locators.
 * A choice whose locator ends in an {@code input} is a leaf and ends the walk.
 */
public final class MultiselectDriller {

    private static final Logger log = LoggerFactory.getLogger(MultiselectDriller.class);

    private final BrowserSession session;
    private final OptionCollector collector;
    private final AnswerEngine engine;
    private final ProfileLookup lookup;
    private final Blacklist blacklist;
    private final KeywordTables tables;
    private final int maxLevels;

    public MultiselectDriller(BrowserSession session,
                              OptionCollector collector,
                              AnswerEngine engine,
                              ProfileLookup lookup,
                              KeywordTables tables,
                              AutofillSettings settings) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.collector = Objects.requireNonNull(collector, "collector must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.lookup = Objects.requireNonNull(lookup, "lookup must not be null");
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
        this.blacklist = new Blacklist(tables);
        this.maxLevels = Objects.requireNonNull(settings, "settings must not be null").getInt(Setting.MULTISELECT_MAX_LEVELS);
    }

    public Result drill(FieldDescriptor field) {
        Objects.requireNonNull(field, "field must not be null");
        Locator target = field.getLocator();
        String reference = target.expression();
        OptionCollector.SearchPlan plan = lookup.searchPlan(field);
        List<String> path = new ArrayList<>();
        String source = Decision.PROFILE;

        for (int level = 0; level < maxLevels; level++) {
            Map<String, Locator> current = collector.open(target, reference, plan);
            if (current.isEmpty()) {
                if (path.isEmpty() && field.inSection(SectionCategory.EDUCATION) && activeText().isEmpty()) {
                    return Result.failed(path, "education list shows no options");
                }
                // search or a single Enter already settled the value
                return Result.selected(path, level, source);
            }
            if (current.size() == 1 && !path.isEmpty() && current.containsKey(path.get(path.size() - 1))
                    && path.get(path.size() - 1).equals(activeText())) {
                return Result.selected(path, level, source);
            }

            Map<String, Locator> all = new LinkedHashMap<>(current);
            Optional<String> match = engine.choiceRules().progressive(field, keys(current));
            while (match.isEmpty()) {
                Locator anchor = lastUnique(current);
                if (anchor == null) {
                    break;
                }
                Map<String, Locator> more = collector.scroll(anchor, all.keySet(), reference);
                if (more.isEmpty()) {
                    break;
                }
                current = more;
                all.putAll(more);
                match = engine.choiceRules().progressive(field, keys(current));
            }

            String label;
            Locator chosen;
            if (match.isPresent()) {
                label = match.get();
                chosen = current.get(label);
            } else {
                Map<String, Locator> filtered = filter(all);
                Decision d = engine.resolveChoice(field, keys(filtered));
                if (d.isSkip()) {
                    log.info("Multiselect {} left empty: {}", field, d.value());
                    return Result.skipped(path, d.value());
                }
                label = d.option();
                source = d.source();
                Optional<Locator> relocated = relocate(label, current, reference);
                if (relocated.isEmpty()) {
                    log.warn("Option '{}' not found again while tracing back", label);
                    return Result.failed(path, "option '" + label + "' not found again");
                }
                chosen = relocated.get();
            }

            path.add(label);
            if (isLeaf(chosen)) {
                session.click(chosen.expression());
                log.info("Multiselect {} -> {} ({} levels)", field, path, level + 1);
                return Result.selected(path, level + 1, source);
            }
            target = chosen;
        }
        log.warn("Multiselect {} still open after {} levels", field, maxLevels);
        return Result.failed(path, "more than " + maxLevels + " levels");
    }

    private Optional<Locator> relocate(String label, Map<String, Locator> current, String reference) {
        Map<String, Locator> visible = current;
        for (;;) {
            Locator l = visible.get(label);
            if (l != null && session.count(l.expression()) == 1) {
                return Optional.of(l);
            }
            Locator anchor = firstUnique(visible);
            if (anchor == null) {
                return Optional.empty();
            }
            Map<String, Locator> earlier = collector.scrollBack(anchor, reference);
            if (earlier.isEmpty() || earlier.keySet().equals(visible.keySet())) {
                return Optional.empty();
            }
            visible = earlier;
        }
    }

    private Map<String, Locator> filter(Map<String, Locator> options) {
        List<String> xpathKeywords = tables.get(KeywordTable.MULTISELECT_XPATH_KEYWORD_BLACKLIST);
        Map<String, Locator> out = new LinkedHashMap<>();
        for (Map.Entry<String, Locator> e : options.entrySet()) {
            if (blacklist.full(KeywordTable.MULTISELECT_OPTION_BLACKLIST_FULL, e.getKey())) {
                continue;
            }
            if (containsAny(e.getValue().expression(), xpathKeywords)) {
                continue;
            }
            out.put(e.getKey(), e.getValue());
        }
        return out;
    }

    private Locator firstUnique(Map<String, Locator> options) {
        for (Locator l : options.values()) {
            if (session.count(l.expression()) == 1) {
                return l;
            }
        }
        return null;
    }

    private String activeText() {
        String html = session.activeElementHtml();
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text().strip();
    }

    static boolean isLeaf(Locator locator) {
        return XPaths.matchesTag(locator.expression(), "input");
    }

    private Locator lastUnique(Map<String, Locator> options) {
        Locator l = null;
        for (Locator v : options.values()) {
            if (session.count(v.expression()) == 1) {
                l = v;
            }
        }
        return l;
    }

    private static List<String> keys(Map<String, Locator> options) {
        return new ArrayList<>(options.keySet());
    }

    private static boolean containsAny(String value, List<String> keywords) {
        String v = value.toLowerCase(Locale.ROOT);
        for (String k : keywords) {
            if (v.contains(k.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Outcome of one walk: the labels clicked from the top level down, and how many levels were opened.
     */
    public static final class Result {

        public enum Status { SELECTED, SKIPPED, FAILED }

        private final Status status;
        private final List<String> path;
        private final int levels;
        private final String source;
        private final String reason;

        private Result(Status status, List<String> path, int levels, String source, String reason) {
            this.status = status;
            this.path = List.copyOf(path);
            this.levels = levels;
            this.source = source;
            this.reason = reason;
        }

        static Result selected(List<String> path, int levels, String source) {
            return new Result(Status.SELECTED, path, levels, source, null);
        }

        static Result skipped(List<String> path, String reason) {
            return new Result(Status.SKIPPED, path, path.size(), null, reason);
        }

        static Result failed(List<String> path, String reason) {
            return new Result(Status.FAILED, path, path.size(), null, reason);
        }

        public Status status() {
            return status;
        }

        public boolean isFailure() {
            return status == Status.FAILED;
        }

        public List<String> path() {
            return path;
        }

        public int levels() {
            return levels;
        }

        /**
         * Where the last choice came from, one of the {@link Decision} source names; null unless selected.
         */
        public String source() {
            return source;
        }

        public String reason() {
            return reason;
        }

        @Override
        public String toString() {
            return "Result{" + status + " " + path + (reason == null ? "" : ", " + reason) + "}";
        }
    }
}
