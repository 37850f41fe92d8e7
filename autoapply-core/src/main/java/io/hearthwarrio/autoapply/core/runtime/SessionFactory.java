package io.hearthwarrio.autoapply.core.runtime;

import io.hearthwarrio.autoapply.core.session.BrowserSession;

/**
 * Opens a fresh browser session per job. Sessions are never shared between jobs.
 */
@FunctionalInterface
public interface SessionFactory {

    BrowserSession open();
}
