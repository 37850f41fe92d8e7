package io.hearthwarrio.autoapply.core.runtime;

import io.hearthwarrio.autoapply.core.answer.AnswerEngine;
import io.hearthwarrio.autoapply.core.answer.FieldInteractor;
import io.hearthwarrio.autoapply.core.answer.MultiselectDriller;
import io.hearthwarrio.autoapply.core.answer.OptionCollector;
import io.hearthwarrio.autoapply.core.answer.ProfileLookup;
import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.config.Profile;
import io.hearthwarrio.autoapply.core.extract.PageExtractor;
import io.hearthwarrio.autoapply.core.locator.LocatorEngine;
import io.hearthwarrio.autoapply.core.logging.DecisionLogger;
import io.hearthwarrio.autoapply.core.logging.DecisionLoggers;
import io.hearthwarrio.autoapply.core.navigation.ActionClicker;
import io.hearthwarrio.autoapply.core.navigation.ActionSelector;
import io.hearthwarrio.autoapply.core.navigation.ApplicationNavigator;
import io.hearthwarrio.autoapply.core.navigation.AuthResolver;
import io.hearthwarrio.autoapply.core.navigation.PageResolver;
import io.hearthwarrio.autoapply.core.navigation.SectionExpander;
import io.hearthwarrio.autoapply.core.navigation.StateDetector;
import io.hearthwarrio.autoapply.core.session.BrowserSession;
import io.hearthwarrio.autoapply.core.session.NativeFileDialog;
import io.hearthwarrio.autoapply.core.session.ReasoningOracle;
import io.hearthwarrio.autoapply.core.session.VerificationMailbox;
import io.hearthwarrio.autoapply.core.text.QuestionBuilder;
import io.hearthwarrio.autoapply.core.text.TextRelevanceEvaluator;
import io.hearthwarrio.autoapply.core.upload.FileUploader;
import io.hearthwarrio.autoapply.core.upload.UploadQueue;

import java.time.Clock;
import java.util.Objects;
import java.util.function.Function;

/**
 * Wires the per-session object graph of a job around shared, read-only collaborators.
 * <p>
 * Everything built by {@link #create(BrowserSession)} belongs to that session; only the settings,
 * tables, profile, oracle, mailbox and upload queue are shared between workers.
 */
public final class NavigatorFactory {

    private final AutofillSettings settings;
    private final KeywordTables tables;
    private final Profile profile;
    private final ReasoningOracle oracle;
    private VerificationMailbox mailbox = VerificationMailbox.NONE;
    private NativeFileDialog fileDialog = NativeFileDialog.NONE;
    private UploadQueue uploads = UploadQueue.global();
    private Function<BrowserSession, DecisionLogger> decisions = session -> DecisionLoggers.noop();
    private TextRelevanceEvaluator relevance;
    private Clock clock = Clock.systemDefaultZone();

    public NavigatorFactory(AutofillSettings settings, KeywordTables tables, Profile profile, ReasoningOracle oracle) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
        this.profile = Objects.requireNonNull(profile, "profile must not be null");
        this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
    }

    // ----------- configuration -----------

    public NavigatorFactory withMailbox(VerificationMailbox mailbox) {
        this.mailbox = mailbox == null ? VerificationMailbox.NONE : mailbox;
        return this;
    }

    public NavigatorFactory withFileDialog(NativeFileDialog fileDialog) {
        this.fileDialog = fileDialog == null ? NativeFileDialog.NONE : fileDialog;
        return this;
    }

    /**
     * Defaults to the process-wide queue; tests may isolate themselves with their own.
     */
    public NavigatorFactory withUploads(UploadQueue uploads) {
        this.uploads = Objects.requireNonNull(uploads, "uploads must not be null");
        return this;
    }

    public NavigatorFactory withDecisionLogger(DecisionLogger logger) {
        DecisionLogger shared = logger == null ? DecisionLoggers.noop() : logger;
        this.decisions = session -> shared;
        return this;
    }

    /**
     * For loggers bound to one browser, e.g. ones that attach screenshots.
     */
    public NavigatorFactory withSessionDecisionLogger(Function<BrowserSession, DecisionLogger> perSession) {
        this.decisions = Objects.requireNonNull(perSession, "perSession must not be null");
        return this;
    }

    public synchronized NavigatorFactory withRelevance(TextRelevanceEvaluator relevance) {
        this.relevance = relevance;
        return this;
    }

    public NavigatorFactory withClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        return this;
    }

    public ApplicationNavigator create(BrowserSession session) {
        Objects.requireNonNull(session, "session must not be null");
        TextRelevanceEvaluator relevance = relevance();
        LocatorEngine locators = new LocatorEngine(session, settings);
        PageExtractor extractor = new PageExtractor(session, locators, settings, tables, profile);

        ProfileLookup lookup = new ProfileLookup(profile, tables);
        QuestionBuilder questions = new QuestionBuilder(relevance, oracle, settings);
        AnswerEngine engine = new AnswerEngine(lookup, tables, settings, questions, oracle);
        OptionCollector collector = new OptionCollector(session, locators, tables, settings);
        MultiselectDriller driller = new MultiselectDriller(session, collector, engine, lookup, tables, settings);
        FileUploader uploader = new FileUploader(session, fileDialog, uploads, locators, settings);
        FieldInteractor interactor = new FieldInteractor(session, locators, engine, collector, driller, uploader,
                lookup, tables, settings, relevance, decisionLogger(session), clock);

        ActionSelector selector = new ActionSelector(tables);
        ActionClicker clicker = new ActionClicker(session, locators, tables, settings);
        AuthResolver auth = new AuthResolver(session, clicker, mailbox, tables, settings, clock);
        PageResolver resolver = new PageResolver(session, extractor, interactor, uploader, selector, clicker,
                auth, tables, profile, settings);
        SectionExpander expander = new SectionExpander(session, extractor, clicker, tables, profile, settings);

        return new ApplicationNavigator(session, extractor, new StateDetector(tables), resolver, expander,
                selector, clicker, tables, profile, settings, clock);
    }

    private synchronized TextRelevanceEvaluator relevance() {
        if (relevance == null) {
            relevance = TextRelevanceEvaluator.withBundledLexicon();
        }
        return relevance;
    }

    private DecisionLogger decisionLogger(BrowserSession session) {
        DecisionLogger logger = decisions.apply(session);
        return logger == null ? DecisionLoggers.noop() : logger;
    }

    public AutofillSettings settings() {
        return settings;
    }
}
