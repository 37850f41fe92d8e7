package io.hearthwarrio.autoapply.core.runtime;

import io.hearthwarrio.autoapply.core.navigation.ApplicationNavigator;
import io.hearthwarrio.autoapply.core.session.BrowserSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs a single application job in its own browser session.
 * <p>
 * Any runtime failure ends the job as failed; the session is always closed.
 */
public final class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final SessionFactory sessions;
    private final NavigatorFactory navigators;

    public JobRunner(SessionFactory sessions, NavigatorFactory navigators) {
        this.sessions = Objects.requireNonNull(sessions, "sessions must not be null");
        this.navigators = Objects.requireNonNull(navigators, "navigators must not be null");
    }

    public boolean run(String url, String caller) {
        Objects.requireNonNull(url, "url must not be null");
        BrowserSession session = null;
        try {
            session = sessions.open();
            ApplicationNavigator navigator = navigators.create(session);
            boolean result = navigator.apply(url, caller);
            log.info("Job completed for {}: {}", url, result ? "submitted" : "failed");
            return result;
        } catch (RuntimeException e) {
            log.error("Job failed for {}", url, e);
            return false;
        } finally {
            if (session != null) {
                closeQuietly(session, url);
            }
        }
    }

    private static void closeQuietly(BrowserSession session, String url) {
        try {
            session.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close browser session after {}", url, e);
        }
    }
}
