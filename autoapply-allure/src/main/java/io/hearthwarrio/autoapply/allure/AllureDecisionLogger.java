package io.hearthwarrio.autoapply.allure;

import io.hearthwarrio.autoapply.core.logging.DecisionLogger;
import io.hearthwarrio.autoapply.core.logging.LogDetail;
import io.hearthwarrio.autoapply.core.model.Locator;
import io.qameta.allure.Allure;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Allure logger for autofill decisions: one step per decision with a text attachment.
 * <p>
 * Failed and misplaced fields always get a screenshot; other decisions only when
 * {@code attachScreenshot} is set. Lives in autoapply-allure so core and webdriver stay free of Allure.
 */
public final class AllureDecisionLogger implements DecisionLogger {

    private final WebDriver driver;
    private final LogDetail detail;
    private final boolean attachScreenshot;

    public AllureDecisionLogger(WebDriver driver, LogDetail detail, boolean attachScreenshot) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.detail = detail == null ? LogDetail.NONE : detail;
        this.attachScreenshot = attachScreenshot;
    }

    @Override
    public LogDetail detail() {
        return detail;
    }

    @Override
    public void logDecision(String target, Locator locator, String decision, String source, String details) {
        String title = "AutoApply: " + safe(target) + " - " + nullSafe(decision);

        Allure.step(title, () -> {
            Allure.addAttachment(
                    "Decision",
                    "text/plain",
                    new ByteArrayInputStream(render(target, locator, decision, source, details)
                            .getBytes(StandardCharsets.UTF_8)),
                    ".txt"
            );

            if (shouldCapture(decision) && driver instanceof TakesScreenshot ts) {
                byte[] png = ts.getScreenshotAs(OutputType.BYTES);
                Allure.addAttachment(
                        "Screenshot",
                        "image/png",
                        new ByteArrayInputStream(png),
                        ".png"
                );
            }
        });
    }

    boolean shouldCapture(String decision) {
        if (attachScreenshot) {
            return true;
        }
        String d = safe(decision);
        return d.startsWith("failed") || d.startsWith("misplaced");
    }

    String render(String target, Locator locator, String decision, String source, String details) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("field: ").append(safe(target)).append('\n')
                .append("decision: ").append(nullSafe(decision)).append('\n')
                .append("source: ").append(nullSafe(source)).append('\n');

        if (detail.includesLocator() && locator != null) {
            sb.append("xpath(relative): ").append(nullSafe(locator.relative())).append('\n')
                    .append("xpath(absolute): ").append(nullSafe(locator.absolute())).append('\n');
        }
        if (detail == LogDetail.FULL && details != null) {
            sb.append("metadata:\n").append(details).append('\n');
        }
        return sb.toString();
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }

    private static String nullSafe(String s) {
        return s == null ? "null" : s;
    }
}
