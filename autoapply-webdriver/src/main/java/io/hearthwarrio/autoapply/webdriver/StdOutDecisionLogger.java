package io.hearthwarrio.autoapply.webdriver;

import io.hearthwarrio.autoapply.core.logging.DecisionLogger;
import io.hearthwarrio.autoapply.core.logging.LogDetail;
import io.hearthwarrio.autoapply.core.model.Locator;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Default stdout logger for autofill decisions.
 * <p>
 * One line per decision, for example:
 * {@code [AutoApply] field='First Name', decision=value='Jane', source=profile, xpath=//input[@id='first']}
 */
public final class StdOutDecisionLogger implements DecisionLogger {

    private final LogDetail detail;
    private final PrintStream out;

    public StdOutDecisionLogger(LogDetail detail) {
        this(detail, System.out);
    }

    StdOutDecisionLogger(LogDetail detail, PrintStream out) {
        this.detail = Objects.requireNonNull(detail, "detail must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public LogDetail detail() {
        return detail;
    }

    @Override
    public void logDecision(String target, Locator locator, String decision, String source, String details) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("[AutoApply] field='").append(safe(target)).append('\'')
                .append(", decision=").append(nullSafe(decision))
                .append(", source=").append(nullSafe(source));

        if (detail.includesLocator() && locator != null) {
            sb.append(", xpath=").append(locator.expression());
        }
        if (detail == LogDetail.FULL && details != null && !details.isEmpty()) {
            sb.append(", metadata=").append(details.replace('\n', ' '));
        }

        out.println(sb);
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }

    private static String nullSafe(String s) {
        return s == null ? "null" : s;
    }
}
