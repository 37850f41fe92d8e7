package io.hearthwarrio.autoapply.core.logging;

import io.hearthwarrio.autoapply.core.model.Locator;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Helpers around {@link DecisionLogger}.
 */
public final class DecisionLoggers {

    private static final DecisionLogger NOOP = new DecisionLogger() {
        @Override
        public void logDecision(String target, Locator locator, String decision, String source, String details) {
            // nothing
        }

        @Override
        public LogDetail detail() {
            return LogDetail.NONE;
        }
    };

    private DecisionLoggers() {
        // utility class
    }

    public static DecisionLogger noop() {
        return NOOP;
    }

    /**
     * Forwards one decision, trimming the optional parts to what the logger asked for.
     *
     * @param details rendered only when the logger wants {@link LogDetail#FULL}
     */
    public static void log(DecisionLogger logger,
                           String target,
                           Locator locator,
                           String decision,
                           String source,
                           Supplier<String> details) {
        Objects.requireNonNull(logger, "logger must not be null");
        LogDetail detail = logger.detail();
        if (detail == null || detail == LogDetail.NONE) {
            return;
        }
        logger.logDecision(
                target,
                detail.includesLocator() ? locator : null,
                decision,
                source,
                detail == LogDetail.FULL && details != null ? details.get() : null);
    }
}
