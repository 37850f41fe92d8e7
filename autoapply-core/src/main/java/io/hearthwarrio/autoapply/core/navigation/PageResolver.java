package io.hearthwarrio.autoapply.core.navigation;

import io.hearthwarrio.autoapply.core.answer.FieldInteractor;
import io.hearthwarrio.autoapply.core.answer.FieldOutcome;
import io.hearthwarrio.autoapply.core.answer.InteractionContext;
import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.KeywordTable;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.config.Profile;
import io.hearthwarrio.autoapply.core.config.Setting;
import io.hearthwarrio.autoapply.core.extract.PageExtractor;
import io.hearthwarrio.autoapply.core.extract.ParseContext;
import io.hearthwarrio.autoapply.core.model.AuthType;
import io.hearthwarrio.autoapply.core.model.ButtonDescriptor;
import io.hearthwarrio.autoapply.core.model.FieldDescriptor;
import io.hearthwarrio.autoapply.core.model.FieldType;
import io.hearthwarrio.autoapply.core.model.LabelSource;
import io.hearthwarrio.autoapply.core.model.NavigationState;
import io.hearthwarrio.autoapply.core.model.PageModel;
import io.hearthwarrio.autoapply.core.model.SectionCategory;
import io.hearthwarrio.autoapply.core.model.UploadKind;
import io.hearthwarrio.autoapply.core.session.BrowserSession;
import io.hearthwarrio.autoapply.core.upload.FileUploader;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves one parsed page of the form: fills every field in document order, then clicks the control
 * that should move the flow on and reacts to what the click did.
 * <p>
 * A click that reveals new controls inserts them into the model and resolves the page again one level
 * deeper; a click without effect retries earlier "parent" controls (which may own a dialog) and then any
 * remaining candidate. Recursion is bounded by {@link Setting#NAVIGATION_MAX_DEPTH}.
 */
public final class PageResolver {

    private static final Logger log = LoggerFactory.getLogger(PageResolver.class);

    static final int PAGE_ERROR_MAX_FIELDS = 2;
    private static final int RELOAD_PADDING_SECONDS = 2;

    private final BrowserSession session;
    private final PageExtractor extractor;
    private final FieldInteractor interactor;
    private final FileUploader uploader;
    private final ActionSelector selector;
    private final ActionClicker clicker;
    private final AuthResolver auth;
    private final KeywordTables tables;
    private final Profile profile;
    private final int maxDepth;
    private final Duration settle;

    public PageResolver(BrowserSession session,
                        PageExtractor extractor,
                        FieldInteractor interactor,
                        FileUploader uploader,
                        ActionSelector selector,
                        ActionClicker clicker,
                        AuthResolver auth,
                        KeywordTables tables,
                        Profile profile,
                        AutofillSettings settings) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.interactor = Objects.requireNonNull(interactor, "interactor must not be null");
        this.uploader = Objects.requireNonNull(uploader, "uploader must not be null");
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.clicker = Objects.requireNonNull(clicker, "clicker must not be null");
        this.auth = Objects.requireNonNull(auth, "auth must not be null");
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
        this.profile = Objects.requireNonNull(profile, "profile must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        this.maxDepth = settings.getInt(Setting.NAVIGATION_MAX_DEPTH);
        this.settle = settings.seconds(Setting.STABLE_DOM_TIMEOUT_SECONDS);
    }

    /**
     * @param caller identity of the job, used when queuing for the file picker
     * @return true when the page moved on (or must be parsed again), false on a dead end
     */
    public boolean resolve(PageCapture capture, NavigationState state, String caller) {
        Objects.requireNonNull(capture, "capture must not be null");
        Objects.requireNonNull(state, "state must not be null");
        PageRun run = new PageRun(capture.page(), capture.context(), state, InteractionContext.root(caller));
        return resolve(run, 0);
    }

    private boolean resolve(PageRun run, int depth) {
        if (depth >= maxDepth) {
            log.warn("Maximum resolution depth {} reached on {}", maxDepth, run.page.getMetadata().getUrl());
            return false;
        }
        PageSignals signals = new PageSignals(run.page, tables);
        if (run.page.fieldCount() <= PAGE_ERROR_MAX_FIELDS
                && signals.textPresent(session.pageText(), KeywordTable.PAGE_ERROR_TEXT)) {
            log.warn("Page reports an error, reloading");
            session.refresh();
            session.waitUntilStable(settle, RELOAD_PADDING_SECONDS);
            return true;
        }

        ActionItem authItem = null;
        if (run.state == NavigationState.AUTH) {
            AuthPlan plan = auth.classify(run.page);
            if (plan.status() != AuthPlan.Status.PLANNED) {
                return plan.status() == AuthPlan.Status.HANDLED;
            }
            run.authPlan = plan;
            authItem = plan.item();
            if (!prepareAuth(run, plan, signals)) {
                return false;
            }
        }

        if (run.state == NavigationState.LOGGED_IN && depth == 0) {
            // best effort; required uploads fail their own fields later
            uploadFiles(run);
        }

        processFields(run);

        Optional<ActionItem> ack = selector.acknowledge(run.page);
        Optional<ActionItem> progress = Optional.empty();
        if (run.state == NavigationState.LOGGED_IN) {
            progress = selector.progress(run.page);
            if (progress.isEmpty()) {
                log.error("No progress control on {}", run.page.getMetadata().getUrl());
                return false;
            }
        }
        List<ActionItem> candidates = new ArrayList<>(3);
        candidates.add(ack.orElse(null));
        candidates.add(progress.orElse(null));
        candidates.add(authItem);

        ActionItem item = run.graph.selectFresh(candidates, clicker::isLive);
        if (item == null) {
            log.error("No actionable control to proceed on {}", run.page.getMetadata().getUrl());
            return false;
        }

        ClickOutcome outcome = clicker.click(item);
        if (outcome.kind() == ClickOutcome.Kind.ADVANCED) {
            log.info("Form advanced via {}", item);
            return true;
        }
        if (clicker.isLive(item)) {
            run.graph.recordIneffective(item);
        }

        if (outcome.kind() == ClickOutcome.Kind.NEW_ELEMENTS_REVEALED) {
            int added = synchronize(run, outcome.revealed(), outcome.ancestorPaths(), run.index, null);
            if (added > 0) {
                return resolve(run.deeper(), depth + 1);
            }
            log.info("Revealed elements held nothing to resolve");
        }

        log.warn("Clicking {} changed nothing", item);
        if (run.state == NavigationState.AUTH && item.equals(authItem)) {
            AuthResolver.Lock lock = auth.resolveVerificationLock(run.authPlan, session.pageText());
            if (lock != AuthResolver.Lock.ABSENT) {
                return lock == AuthResolver.Lock.RETRY;
            }
            if (auth.toggle(run.authPlan, item)) {
                return true;
            }
        }

        for (ActionItem parent : run.graph.parents()) {
            if (!clicker.isLive(parent)) {
                log.info("Earlier control {} is gone", parent);
                run.graph.drop(parent);
                continue;
            }
            log.info("Retrying earlier control {}", parent);
            if (clicker.click(parent).kind() == ClickOutcome.Kind.ADVANCED) {
                return true;
            }
            run.graph.unwindTo(parent, clicker.isLive(parent));
            return resolve(run.deeper(), depth + 1);
        }

        for (ActionItem c : candidates) {
            if (c != null && !c.equals(item)) {
                log.info("Trying the remaining candidate {}", c);
                return resolve(run.deeper(), depth + 1);
            }
        }
        log.error("Control {} could not move the page on", item);
        return false;
    }

    /**
     * Verify pages need a code from the mailbox before their cells can be filled; other auth pages need
     * at least one credential field.
     */
    private boolean prepareAuth(PageRun run, AuthPlan plan, PageSignals signals) {
        if (plan.type() != AuthType.VERIFY) {
            return true;
        }
        int cells = signals.verificationFields().size();
        if (AuthResolver.CODE_CELLS.contains(cells)) {
            Optional<String> code = auth.awaitCode(cells);
            if (code.isEmpty()) {
                log.error("No verification code for {} cells", cells);
                return false;
            }
            run.interaction = run.interaction.withVerificationCode(code.get(), cells);
            return true;
        }
        if (signals.emailFields().isEmpty() && signals.passwordFields().isEmpty()) {
            log.error("Verify page without code cells or credential fields");
            return false;
        }
        return true;
    }

    private void processFields(PageRun run) {
        while (run.index < run.page.fieldCount()) {
            FieldDescriptor field = run.page.field(run.index);
            if (!field.getType().isResolvable()) {
                // uploads run once per page
                run.index++;
                continue;
            }
            FieldOutcome outcome = interactor.resolve(field, run.interaction);
            switch (outcome.status()) {
                case MISPLACED:
                    remap(run, field);
                    continue;
                case RESOLVED:
                    if (!outcome.revealed().isEmpty()) {
                        synchronize(run, outcome.revealed(), outcome.ancestorPaths(), run.index + 1, question(field));
                    }
                    break;
                case FAILED:
                    if (field.getType() == FieldType.MULTISELECT && field.inSection(SectionCategory.EDUCATION)
                            && removeEducationSection(run, field)) {
                        continue;
                    }
                    log.error("Unable to resolve {} field '{}': {}", field.getType().code(), field.primaryLabel(), outcome.reason());
                    break;
                default:
                    break;
            }
            run.index++;
        }
    }

    /**
     * Parses the page again and resumes at the first field that shares an identity with the lost one.
     * Without a match the lost field is skipped and the old model kept.
     */
    private void remap(PageRun run, FieldDescriptor lost) {
        if (run.remappedAt == run.index) {
            log.warn("Field '{}' is still misplaced after remapping, skipping", lost.primaryLabel());
            run.index++;
            return;
        }
        run.remappedAt = run.index;
        PageCapture capture = PageCapture.take(session, extractor, profile);
        PageModel fresh = capture.page();
        if (fresh.fieldCount() == run.page.fieldCount()) {
            run.replace(capture);
            log.info("Remapped page, resuming at field {}", run.index);
            return;
        }
        for (int i = 0; i < fresh.fieldCount(); i++) {
            if (sharesIdentity(lost, fresh.field(i))) {
                run.replace(capture);
                run.index = i;
                run.remappedAt = i;
                log.info("Remapped page, resuming at field {}", i);
                return;
            }
        }
        log.error("Field '{}' disappeared from the page", lost.primaryLabel());
        run.index++;
    }

    static boolean sharesIdentity(FieldDescriptor a, FieldDescriptor b) {
        if (equalNonEmpty(a.getId(), b.getId())
                || equalNonEmpty(a.getCustomId(), b.getCustomId())
                || equalNonEmpty(a.getName(), b.getName())) {
            return true;
        }
        for (LabelSource s : LabelSource.values()) {
            if (equalNonEmpty(a.label(s), b.label(s))) {
                return true;
            }
        }
        return false;
    }

    private static boolean equalNonEmpty(String a, String b) {
        return !a.isEmpty() && a.equals(b);
    }

    /**
     * Inserts revealed fields at {@code position} and appends revealed buttons.
     *
     * @return number of controls added to the model
     */
    private int synchronize(PageRun run, List<Element> elements, List<String> ancestorPaths, int position, String parentLabel) {
        PageExtractor.Revealed revealed = extractor.extractRevealed(elements, ancestorPaths, run.context, parentLabel);
        int at = position;
        for (FieldDescriptor f : revealed.fields()) {
            run.page.insertField(at++, f);
        }
        for (ButtonDescriptor b : revealed.buttons()) {
            run.page.addButton(b);
        }
        int added = revealed.fields().size() + revealed.buttons().size();
        if (added > 0) {
            log.info("Synchronized {} fields and {} buttons", revealed.fields().size(), revealed.buttons().size());
        }
        return added;
    }

    /**
     * An education block whose degree or school cannot be chosen is removed, and its fields skipped.
     * The block's remove button is counted after the work experience blocks when education comes last.
     */
    private boolean removeEducationSection(PageRun run, FieldDescriptor field) {
        int ordinal = field.getSection().getOrdinal();
        int number = run.context.lastSection() == SectionCategory.EDUCATION
                ? run.context.primaryOrdinal(SectionCategory.WORK_EXPERIENCE) + ordinal
                : ordinal;
        List<ButtonDescriptor> removes = new PageSignals(run.page, tables).buttons(KeywordTable.REMOVE_SECTION_IDENTIFIERS);
        if (number < 1 || removes.size() < number) {
            return false;
        }
        ActionItem remove = ActionItem.of(removes.get(number - 1), ActionItem.Role.OTHER);
        if (!clicker.isLive(remove)) {
            return false;
        }
        session.click(remove.locator().expression());
        session.waitUntilStable(settle, 0);
        log.info("Removed education section {}", ordinal);
        while (run.index < run.page.fieldCount()) {
            FieldDescriptor f = run.page.field(run.index);
            if (!f.inSection(SectionCategory.EDUCATION) || f.getSection().getOrdinal() != ordinal) {
                break;
            }
            run.index++;
        }
        return true;
    }

    /**
     * Resume fields first (falling back to resume upload buttons), then required uploads of other kinds.
     */
    private void uploadFiles(PageRun run) {
        boolean resumeUploaded = false;
        for (FieldDescriptor f : run.page.fieldsOfType(FieldType.FILE)) {
            if (f.getUploadKind() == UploadKind.RESUME) {
                resumeUploaded |= interactor.resolve(f, run.interaction).status() == FieldOutcome.Status.RESOLVED;
            }
        }
        Optional<Path> resume = profile.resumePath();
        if (!resumeUploaded && resume.isPresent()) {
            for (ButtonDescriptor b : run.page.getButtons()) {
                if (b.getUploadKind() != UploadKind.RESUME) {
                    continue;
                }
                if (uploader.uploadThroughButton(b.getLocator(), resume.get(), run.interaction.caller())) {
                    break;
                }
                log.error("Resume upload through '{}' failed", b.getText());
            }
        }
        for (FieldDescriptor f : run.page.fieldsOfType(FieldType.FILE)) {
            if (f.getUploadKind() != UploadKind.RESUME && f.isRequired()) {
                interactor.resolve(f, run.interaction);
            }
        }
    }

    private static String question(FieldDescriptor field) {
        List<String> parts = new ArrayList<>(4);
        for (LabelSource s : new LabelSource[]{LabelSource.TAG, LabelSource.TEXT, LabelSource.ATTRIBUTE, LabelSource.CUSTOM}) {
            String v = field.label(s);
            if (!v.isEmpty()) {
                parts.add(v);
            }
        }
        return String.join("\n", parts);
    }

    /**
     * Mutable state of one page resolution, shared by the recursive calls.
     */
    private static final class PageRun {
        private PageModel page;
        private ParseContext context;
        private final NavigationState state;
        private final ActionGraph graph = new ActionGraph();
        private InteractionContext interaction;
        private AuthPlan authPlan;
        private int index;
        private int remappedAt = -1;

        PageRun(PageModel page, ParseContext context, NavigationState state, InteractionContext interaction) {
            this.page = page;
            this.context = context;
            this.state = state;
            this.interaction = interaction;
        }

        void replace(PageCapture capture) {
            page = capture.page();
            context = capture.context();
        }

        PageRun deeper() {
            interaction = interaction.deeper();
            return this;
        }
    }
}
