package io.hearthwarrio.autoapply.webdriver;

import io.hearthwarrio.autoapply.core.logging.LogDetail;
import io.hearthwarrio.autoapply.core.model.Locator;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class StdOutDecisionLoggerTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    @Test
    void decisionOnlyOmitsLocatorAndMetadata() {
        new StdOutDecisionLogger(LogDetail.DECISION_ONLY, out)
                .logDecision("First Name", Locator.of("//input[@id='first']"), "value='Alex'", "profile", "Tag: First Name");

        assertEquals("[AutoApply] field='First Name', decision=value='Alex', source=profile", line());
    }

    @Test
    void locatorDetailAppendsXpath() {
        new StdOutDecisionLogger(LogDetail.WITH_LOCATOR, out)
                .logDecision("Email", Locator.of("//input[@id='email']"), "value='alex@example.com'", "profile", null);

        assertTrue(line().endsWith(", xpath=//input[@id='email']"));
    }

    @Test
    void fullDetailFlattensMetadata() {
        new StdOutDecisionLogger(LogDetail.FULL, out)
                .logDecision("Sponsorship", Locator.of("//fieldset[1]"), "select 'Yes'", "rule", "Tag: Sponsorship\nType: radio");

        String line = line();
        assertTrue(line.contains(", xpath=//fieldset[1]"));
        assertTrue(line.endsWith(", metadata=Tag: Sponsorship Type: radio"));
    }

    @Test
    void nullsAreRenderedSafely() {
        new StdOutDecisionLogger(LogDetail.FULL, out).logDecision(null, null, null, null, "");

        assertEquals("[AutoApply] field='', decision=null, source=null", line());
    }

    private String line() {
        return buffer.toString(StandardCharsets.UTF_8).strip();
    }
}
