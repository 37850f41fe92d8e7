package io.hearthwarrio.autoapply.core.navigation;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.KeywordTable;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.config.Profile;
import io.hearthwarrio.autoapply.core.config.Setting;
import io.hearthwarrio.autoapply.core.diff.DomSnapshot;
import io.hearthwarrio.autoapply.core.extract.Blacklist;
import io.hearthwarrio.autoapply.core.extract.PageExtractor;
import io.hearthwarrio.autoapply.core.locator.XPaths;
import io.hearthwarrio.autoapply.core.model.NavigationState;
import io.hearthwarrio.autoapply.core.model.PageModel;
import io.hearthwarrio.autoapply.core.session.BrowserSession;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Drives one job from the posting URL to a submitted application.
 * <p>
 * Each iteration parses the page, lets the state detector advance the forward-only state, and resolves
 * the page for that state. The job succeeds once {@link NavigationState#SUBMITTED} is observed; it
 * fails on a dead end or when the iteration or time budget runs out.
 */
public final class ApplicationNavigator {

    private static final Logger log = LoggerFactory.getLogger(ApplicationNavigator.class);

    private final BrowserSession session;
    private final PageExtractor extractor;
    private final StateDetector detector;
    private final PageResolver resolver;
    private final SectionExpander expander;
    private final ActionSelector selector;
    private final ActionClicker clicker;
    private final Blacklist blacklist;
    private final Profile profile;
    private final Clock clock;
    private final int maxIterations;
    private final Duration maxDuration;
    private final Duration settle;

    private NavigationStateTracker tracker = new NavigationStateTracker();

    public ApplicationNavigator(BrowserSession session,
                                PageExtractor extractor,
                                StateDetector detector,
                                PageResolver resolver,
                                SectionExpander expander,
                                ActionSelector selector,
                                ActionClicker clicker,
                                KeywordTables tables,
                                Profile profile,
                                AutofillSettings settings,
                                Clock clock) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.expander = Objects.requireNonNull(expander, "expander must not be null");
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.clicker = Objects.requireNonNull(clicker, "clicker must not be null");
        this.blacklist = new Blacklist(Objects.requireNonNull(tables, "tables must not be null"));
        this.profile = Objects.requireNonNull(profile, "profile must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        this.maxIterations = settings.getInt(Setting.JOB_MAX_ITERATIONS);
        this.maxDuration = settings.minutes(Setting.JOB_MAX_MINUTES);
        this.settle = settings.seconds(Setting.STABLE_DOM_TIMEOUT_SECONDS);
    }

    /**
     * @param caller identity of the job, used when queuing for the file picker
     * @return true when the application was submitted, false when the job ran out of time or iterations
     * @throws NavigationException when a page offers no way forward
     */
    public boolean apply(String url, String caller) {
        Objects.requireNonNull(url, "url must not be null");
        tracker = new NavigationStateTracker();
        Instant start = clock.instant();
        session.open(url);
        session.waitUntilStable(settle, 0);

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            Duration elapsed = Duration.between(start, clock.instant());
            if (elapsed.compareTo(maxDuration) > 0) {
                log.warn("Job exceeded {} minutes: {}", maxDuration.toMinutes(), url);
                return false;
            }
            log.info("Iteration {} | elapsed {}s | {}", iteration, elapsed.toSeconds(), session.currentUrl());

            PageCapture capture = PageCapture.take(session, extractor, profile);
            Optional<NavigationState> observed = detector.detect(capture.page(), session.pageText(), tracker.current());
            NavigationState state = tracker.observe(observed.orElse(tracker.current()));
            if (state == NavigationState.SUBMITTED) {
                log.info("Application submitted: {}", url);
                return true;
            }

            boolean resolved;
            if (state == NavigationState.DESCRIPTION) {
                resolved = resolveDescription(capture.page());
            } else {
                if (state == NavigationState.LOGGED_IN) {
                    capture = expander.expand(capture);
                }
                resolved = resolver.resolve(capture, state, caller);
            }
            if (!resolved) {
                throw new NavigationException("Could not resolve " + state + " page of " + url);
            }
        }
        log.error("Job ran out of iterations: {}", url);
        return false;
    }

    /**
     * State history of the last job, starting with the initial state.
     */
    public NavigationStateTracker tracker() {
        return tracker;
    }

    /**
     * Opens the apply control's target, or clicks it, or follows the first visible embedded form.
     */
    boolean resolveDescription(PageModel page) {
        Optional<ActionItem> apply = selector.apply(page);
        if (apply.isPresent()) {
            ActionItem item = apply.get();
            if (item.href() != null) {
                log.info("Opening apply link {}", item.href());
                session.open(item.href());
                session.waitUntilStable(settle, 0);
            } else {
                clicker.click(item);
            }
            return true;
        }
        DomSnapshot snapshot = DomSnapshot.parse(session.snapshot());
        for (Element frame : snapshot.document().select("iframe[src]")) {
            String src = frame.attr("src");
            if (blacklist.partial(KeywordTable.IFRAME_SOURCE_BLACKLIST, src)) {
                continue;
            }
            String xpath = "//iframe[@src=" + XPaths.literal(src) + "]";
            if (session.count(xpath) > 0 && session.isDisplayed(xpath)) {
                log.info("Following embedded form {}", src);
                session.open(frame.absUrl("src").isEmpty() ? src : frame.absUrl("src"));
                session.waitUntilStable(settle, 0);
                return true;
            }
        }
        log.error("Failed to resolve description page {}", page.getMetadata().getUrl());
        return false;
    }
}
