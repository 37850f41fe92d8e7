package io.hearthwarrio.autoapply.core.answer;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.KeywordTable;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.config.Setting;
import io.hearthwarrio.autoapply.core.diff.DomSnapshot;
import io.hearthwarrio.autoapply.core.diff.HtmlDiff;
import io.hearthwarrio.autoapply.core.diff.NewElementFinder;
import io.hearthwarrio.autoapply.core.extract.Blacklist;
import io.hearthwarrio.autoapply.core.locator.LocatorEngine;
import io.hearthwarrio.autoapply.core.locator.XPaths;
import io.hearthwarrio.autoapply.core.logging.DecisionLogger;
import io.hearthwarrio.autoapply.core.logging.DecisionLoggers;
import io.hearthwarrio.autoapply.core.model.FieldDescriptor;
import io.hearthwarrio.autoapply.core.model.FieldType;
import io.hearthwarrio.autoapply.core.model.Locator;
import io.hearthwarrio.autoapply.core.model.SearchKey;
import io.hearthwarrio.autoapply.core.model.SectionCategory;
import io.hearthwarrio.autoapply.core.model.SectionTag;
import io.hearthwarrio.autoapply.core.model.UploadKind;
import io.hearthwarrio.autoapply.core.session.BrowserSession;
import io.hearthwarrio.autoapply.core.strategy.Outcome;
import io.hearthwarrio.autoapply.core.text.TextQuery;
import io.hearthwarrio.autoapply.core.text.TextRelevanceEvaluator;
import io.hearthwarrio.autoapply.core.upload.FileUploader;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Carries out the decision for one field on the live page.
 * <p>
 * Every interaction starts by revalidating the field's locator; a field that cannot be re-identified
 * comes back {@link FieldOutcome.Status#MISPLACED} so the navigator can re-parse. Clicks that may reveal
 * follow-up questions (radios, selects, checkboxes, hidden-control buttons) report the new elements that
 * appeared after the field.
 */
public final class FieldInteractor {

    private static final Logger log = LoggerFactory.getLogger(FieldInteractor.class);

    private static final List<String> REVEAL_QUERIES = List.of(
            "//input", "//textarea", "//select", "//button", "//*[@role='button']");
    private static final String ITEM_SELECTED = "1 item selected";
    private static final String DEFAULT_DATE_FORMAT = "MMDDYYYY";

    private final BrowserSession session;
    private final LocatorEngine locators;
    private final AnswerEngine engine;
    private final OptionCollector collector;
    private final MultiselectDriller driller;
    private final FileUploader uploader;
    private final ProfileLookup lookup;
    private final Blacklist blacklist;
    private final KeywordTables tables;
    private final TextRelevanceEvaluator relevance;
    private final DecisionLogger decisions;
    private final Clock clock;
    private final Duration settle;

    public FieldInteractor(BrowserSession session,
                           LocatorEngine locators,
                           AnswerEngine engine,
                           OptionCollector collector,
                           MultiselectDriller driller,
                           FileUploader uploader,
                           ProfileLookup lookup,
                           KeywordTables tables,
                           AutofillSettings settings,
                           TextRelevanceEvaluator relevance,
                           DecisionLogger decisions,
                           Clock clock) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.locators = Objects.requireNonNull(locators, "locators must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.collector = Objects.requireNonNull(collector, "collector must not be null");
        this.driller = Objects.requireNonNull(driller, "driller must not be null");
        this.uploader = Objects.requireNonNull(uploader, "uploader must not be null");
        this.lookup = Objects.requireNonNull(lookup, "lookup must not be null");
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
        this.blacklist = new Blacklist(tables);
        this.relevance = Objects.requireNonNull(relevance, "relevance must not be null");
        this.decisions = decisions == null ? DecisionLoggers.noop() : decisions;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.settle = Objects.requireNonNull(settings, "settings must not be null").seconds(Setting.STABLE_DOM_TIMEOUT_SECONDS);
    }

    public FieldOutcome resolve(FieldDescriptor field, InteractionContext ctx) {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(ctx, "ctx must not be null");
        if (!revalidate(field)) {
            return field.isRequired() ? FieldOutcome.misplaced() : FieldOutcome.skipped("optional field misplaced");
        }
        String xpath = field.getLocator().expression();
        if (field.getType() != FieldType.FILE && field.getType() != FieldType.BUTTON
                && (!session.isDisplayed(xpath) || !session.isEnabled(xpath))) {
            // option groups hide their native inputs behind styled labels
            if (!field.getType().isOptionGroup()) {
                return record(field, FieldOutcome.skipped("not interactable"));
            }
        }
        FieldOutcome outcome = switch (field.getType()) {
            case TEXT, TEXTAREA, EMAIL, PASSWORD, NUMBER, URL, TEL -> text(field, ctx);
            case SELECT -> select(field);
            case RADIO -> radio(field);
            case CHECKBOX -> checkbox(field);
            case LIST -> list(field);
            case MULTISELECT -> multiselect(field);
            case DATE, DATELIST -> date(field);
            case FILE -> file(field, ctx);
            case BUTTON -> button(field);
            case HIDDEN, OTHER -> FieldOutcome.skipped("no interaction for " + field.getType().code());
        };
        return record(field, outcome);
    }

    // ---------------------------------------------------------------- text

    private FieldOutcome text(FieldDescriptor field, InteractionContext ctx) {
        String xpath = field.getLocator().expression();
        SectionTag tag = field.getSection();
        if (tag != null && tag.is(SectionCategory.VERIFICATION)) {
            String code = ctx.verificationCode();
            if (code != null && ctx.verificationCells() == 1) {
                session.type(xpath, code, true);
                return FieldOutcome.resolved(Decision.value(code, Decision.PROFILE));
            }
            int position = tag.getOrdinal() - 1;
            if (code == null || position < 0 || position >= code.length()) {
                return FieldOutcome.failed("no verification code character for cell " + tag.getOrdinal());
            }
            String digit = String.valueOf(code.charAt(position));
            session.type(xpath, digit, true);
            return FieldOutcome.resolved(Decision.value(digit, Decision.PROFILE));
        }

        Decision d = engine.resolveText(field);
        if (d.isSkip()) {
            return FieldOutcome.skipped(d.value());
        }
        String current = session.attribute(xpath, "value");
        if (d.value().equals(current)) {
            return FieldOutcome.resolved(d);
        }
        session.type(xpath, d.value(), true);
        return FieldOutcome.resolved(d);
    }

    // ---------------------------------------------------------------- choices

    private FieldOutcome select(FieldDescriptor field) {
        List<String> options = new ArrayList<>(field.getChoices().keySet());
        Decision d = engine.resolveChoice(field, options);
        if (d.isSkip()) {
            return FieldOutcome.skipped(d.value());
        }
        String xpath = field.getLocator().expression();
        DomSnapshot before = DomSnapshot.parse(session.snapshot());
        session.selectByVisibleText(xpath, d.option());
        return revealedAfter(d, before, xpath);
    }

    private FieldOutcome radio(FieldDescriptor field) {
        List<String> options = new ArrayList<>(field.getChoices().keySet());
        Decision d = engine.resolveChoice(field, options);
        if (d.isSkip()) {
            return FieldOutcome.skipped(d.value());
        }
        Optional<Locator> choice = choiceLocator(field, d.option());
        if (choice.isEmpty()) {
            return missingChoice(field, d.option());
        }
        DomSnapshot before = DomSnapshot.parse(session.snapshot());
        session.click(choice.get().expression());
        return revealedAfter(d, before, field.getLocator().expression());
    }

    private FieldOutcome checkbox(FieldDescriptor field) {
        List<String> options = new ArrayList<>(field.getChoices().keySet());
        Decision d = engine.resolveMultiple(field, options);
        if (d.isSkip()) {
            return FieldOutcome.skipped(d.value());
        }
        DomSnapshot before = DomSnapshot.parse(session.snapshot());
        for (String option : d.options()) {
            Optional<Locator> choice = choiceLocator(field, option);
            if (choice.isEmpty()) {
                return missingChoice(field, option);
            }
            String x = choice.get().expression();
            if (session.isSelected(x)) {
                continue;
            }
            session.click(x);
            if (!session.isSelected(x)) {
                log.debug("Checkbox '{}' did not stick, clicking again", option);
                session.click(x);
            }
            if (!session.isSelected(x) && field.isRequired()) {
                return FieldOutcome.failed("checkbox '" + option + "' stays unticked");
            }
        }
        return revealedAfter(d, before, field.getLocator().expression());
    }

    private FieldOutcome list(FieldDescriptor field) {
        String xpath = field.getLocator().expression();
        if (blacklist.full(KeywordTable.ESCAPE_REFRESH_LIST_FULL, field.primaryLabel())
                || blacklist.partial(KeywordTable.ESCAPE_REFRESH_LIST_PARTIAL, field.primaryLabel())) {
            String shown = session.text(xpath);
            if (shown != null && !shown.isBlank()) {
                return FieldOutcome.skipped("already answered: " + shown.strip());
            }
        }
        Map<String, Locator> options = collector.open(field.getLocator(), xpath, lookup.searchPlan(field));
        if (options.isEmpty()) {
            return FieldOutcome.skipped("list revealed no options");
        }
        List<String> texts = new ArrayList<>(options.keySet());
        Optional<String> progressive = engine.choiceRules().progressive(field, texts);
        Decision d = progressive.isPresent()
                ? Decision.select(progressive.get(), Decision.PROFILE)
                : engine.resolveChoice(field, texts);
        if (d.isSkip()) {
            session.pressEscape();
            return FieldOutcome.skipped(d.value());
        }
        session.click(options.get(d.option()).expression());
        return FieldOutcome.resolved(d);
    }

    private FieldOutcome multiselect(FieldDescriptor field) {
        String xpath = field.getLocator().expression();
        if (TextQuery.of(SearchKey.FIELD, tables.get(KeywordTable.ESCAPE_REFRESH_MULTISELECT_PARTIAL))
                .normalizeWhitespace().matches(field)) {
            String around = session.text("(" + xpath + ")/../..");
            if (around != null && around.toLowerCase(Locale.ROOT).contains(ITEM_SELECTED)) {
                return FieldOutcome.skipped("option already selected");
            }
        }
        MultiselectDriller.Result r = driller.drill(field);
        return switch (r.status()) {
            case SELECTED -> r.path().isEmpty()
                    ? FieldOutcome.resolved(Decision.value("", Decision.PROFILE))
                    : FieldOutcome.resolved(Decision.select(r.path(), r.source()));
            case SKIPPED -> FieldOutcome.skipped(r.reason());
            case FAILED -> FieldOutcome.failed(r.reason());
        };
    }

    // ---------------------------------------------------------------- dates

    private FieldOutcome date(FieldDescriptor field) {
        SectionTag tag = field.getSection();
        String format = tag == null ? null : tag.getFormat();
        if (format == null || format.isEmpty()) {
            if (!field.isRequired()) {
                return FieldOutcome.skipped("date without a known format");
            }
            format = DEFAULT_DATE_FORMAT;
        }

        Optional<String> value;
        String subtype = tag == null ? null : tag.getSubtype();
        String dateFormat = format;
        if (ProfileLookup.inProfileSection(field)) {
            value = lookup.sectionValue(field).flatMap(v -> DateFormatter.format(v, dateFormat));
        } else if (subtype == null || subtype.isEmpty() || SectionCategory.OTHER.label().equalsIgnoreCase(subtype)) {
            value = Optional.of(DateFormatter.today(format, LocalDate.now(clock)));
        } else {
            value = Optional.empty();
        }
        if (value.isEmpty()) {
            return field.isRequired()
                    ? FieldOutcome.failed("no date for required " + subtype)
                    : FieldOutcome.skipped("no date for " + subtype);
        }

        Decision d = Decision.value(value.get(), Decision.PROFILE);
        String xpath = field.getLocator().expression();
        if (field.getType() == FieldType.DATELIST) {
            Map<String, Locator> options = collector.open(field.getLocator(), xpath, OptionCollector.SearchPlan.none());
            if (options.isEmpty()) {
                return FieldOutcome.skipped("date list revealed no options");
            }
            Decision chosen = engine.chooseKnown(new ArrayList<>(options.keySet()), value.get());
            if (chosen.isSkip()) {
                return FieldOutcome.skipped(chosen.value());
            }
            session.click(options.get(chosen.option()).expression());
            return FieldOutcome.resolved(chosen);
        }
        if (value.get().equals(session.attribute(xpath, "value"))) {
            return FieldOutcome.resolved(d);
        }
        if ("spinbutton".equals(session.attribute(xpath, "role"))) {
            session.click(xpath);
            session.typeIntoActive(digits(value.get()));
        } else {
            session.type(xpath, value.get(), true);
        }
        return FieldOutcome.resolved(d);
    }

    // ---------------------------------------------------------------- uploads and buttons

    private FieldOutcome file(FieldDescriptor field, InteractionContext ctx) {
        Optional<Path> resume = lookup.profile().resumePath();
        boolean isResume = field.getUploadKind() == UploadKind.RESUME;
        if (!isResume && !field.isRequired()) {
            return FieldOutcome.skipped("optional non-resume upload");
        }
        if (resume.isEmpty()) {
            return field.isRequired() ? FieldOutcome.failed("no resume in profile") : FieldOutcome.skipped("no resume in profile");
        }
        Path file = resume.get();
        if (uploader.isAttached(file)) {
            return FieldOutcome.resolved(Decision.value(file.getFileName().toString(), Decision.PROFILE));
        }
        boolean ok = "input".equals(field.getTagName())
                ? uploader.uploadToInput(field.getLocator(), file)
                        || uploader.uploadThroughButton(field.getLocator(), file, ctx.caller())
                : uploader.uploadThroughButton(field.getLocator(), file, ctx.caller());
        if (!ok) {
            return field.isRequired() ? FieldOutcome.failed("upload did not attach") : FieldOutcome.skipped("upload did not attach");
        }
        return FieldOutcome.resolved(Decision.value(file.getFileName().toString(), Decision.PROFILE));
    }

    private FieldOutcome button(FieldDescriptor field) {
        String xpath = field.getLocator().expression();
        DomSnapshot before = DomSnapshot.parse(session.snapshot());
        session.click(xpath);
        return revealedAfter(Decision.value("click", Decision.RULE), before, xpath);
    }

    // ---------------------------------------------------------------- helpers

    private boolean revalidate(FieldDescriptor field) {
        Outcome<Locator> outcome = locators.revalidate(field.getLocator());
        if (!outcome.isSuccess()) {
            return false;
        }
        if (!outcome.value().equals(field.getLocator())) {
            field.setLocator(outcome.value());
        }
        return true;
    }

    private Optional<Locator> choiceLocator(FieldDescriptor field, String option) {
        Locator stored = field.getChoices().get(option);
        if (stored == null) {
            return Optional.empty();
        }
        Outcome<Locator> outcome = locators.revalidate(stored);
        return outcome.toOptional();
    }

    private FieldOutcome missingChoice(FieldDescriptor field, String option) {
        return field.isRequired()
                ? FieldOutcome.misplaced()
                : FieldOutcome.skipped("option '" + option + "' misplaced");
    }

    /**
     * Waits for the page to settle and reports visible fields and buttons that appeared after the reference.
     */
    private FieldOutcome revealedAfter(Decision d, DomSnapshot before, String reference) {
        session.waitUntilStable(settle, 0);
        DomSnapshot after = DomSnapshot.parse(session.snapshot());
        List<Element> candidates = NewElementFinder.find(before, after, REVEAL_QUERIES);
        if (candidates.isEmpty()) {
            return FieldOutcome.resolved(d);
        }
        List<Element> revealed = new ArrayList<>();
        for (Element e : candidates) {
            if (blacklist.partial(KeywordTable.NEW_BUTTON_TEXT_BLACKLIST_PARTIAL, e.text())
                    || blacklist.partial(KeywordTable.NEW_BUTTON_ID_BLACKLIST_PARTIAL, e.id())) {
                continue;
            }
            String x = XPaths.relative(e);
            if (session.count(x) == 1 && (!session.isDisplayed(x) || !session.isAfter(x, reference))) {
                continue;
            }
            revealed.add(e);
        }
        if (!revealed.isEmpty()) {
            log.info("Answer {} revealed {} new elements", d, revealed.size());
        }
        return FieldOutcome.resolved(d, revealed, HtmlDiff.diff(before, after).ancestorPaths());
    }

    private FieldOutcome record(FieldDescriptor field, FieldOutcome outcome) {
        String decision = switch (outcome.status()) {
            case RESOLVED -> outcome.decision() == null ? "resolved" : outcome.decision().toString();
            case SKIPPED -> "skip (" + outcome.reason() + ")";
            case FAILED -> "failed (" + outcome.reason() + ")";
            case MISPLACED -> "misplaced";
        };
        String source = outcome.decision() == null ? Decision.RULE : outcome.decision().source();
        DecisionLoggers.log(decisions, describe(field), field.getLocator(), decision, source,
                () -> relevance.normalizedMetadata(field, TextRelevanceEvaluator.DEFAULT_THRESHOLD));
        if (outcome.status() == FieldOutcome.Status.FAILED) {
            log.warn("Field {} failed: {}", field, outcome.reason());
        } else {
            log.debug("Field {} -> {}", field, outcome);
        }
        return outcome;
    }

    private static String describe(FieldDescriptor field) {
        String label = field.primaryLabel();
        if (label != null && !label.isBlank()) {
            return label;
        }
        SectionTag tag = field.getSection();
        if (tag != null && tag.getSubtype() != null) {
            return tag.getCategory().label() + " #" + tag.getOrdinal() + " " + tag.getSubtype();
        }
        return field.getLocator().expression();
    }

    private static String digits(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            if (Character.isDigit(s.charAt(i))) {
                sb.append(s.charAt(i));
            }
        }
        return sb.toString();
    }
}
