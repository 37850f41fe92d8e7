package io.hearthwarrio.autoapply.core.logging;

import io.hearthwarrio.autoapply.core.model.Locator;

/**
 * Receives every decision the autofiller makes about a page item.
 * <p>
 * Implementations may log to stdout, Allure, files, etc.
 * <p>
 * Note: {@link #detail()} is checked before the caller renders the optional parts
 * (locator, metadata dump), so cheap loggers stay cheap.
 */
@FunctionalInterface
public interface DecisionLogger {

    /**
     * @param target   human readable target (field label, button text)
     * @param locator  locator used for the interaction (may be null when not requested)
     * @param decision what was done, e.g. {@code value='Jane'}, {@code select='Yes'}, {@code skip}
     * @param source   where the decision came from: profile, rule, oracle, navigation
     * @param details  normalized field metadata (may be null when not requested)
     */
    void logDecision(String target, Locator locator, String decision, String source, String details);

    /**
     * Declares how much data this logger needs.
     * <p>
     * Default is {@link LogDetail#WITH_LOCATOR}, which keeps lambda loggers useful.
     */
    default LogDetail detail() {
        return LogDetail.WITH_LOCATOR;
    }
}
