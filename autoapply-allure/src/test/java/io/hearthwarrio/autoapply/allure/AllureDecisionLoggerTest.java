package io.hearthwarrio.autoapply.allure;

import io.hearthwarrio.autoapply.core.logging.DecisionLogger;
import io.hearthwarrio.autoapply.core.logging.LogDetail;
import io.hearthwarrio.autoapply.core.model.Locator;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.WebDriver;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

public class AllureDecisionLoggerTest {

    private final WebDriver driver = mock(WebDriver.class);
    private final Locator locator = Locator.of("//input[@id='city']", "/html/body/form[1]/input[3]");

    @Test
    void decisionOnlyRendersThreeLines() {
        AllureDecisionLogger logger = new AllureDecisionLogger(driver, LogDetail.DECISION_ONLY, false);

        String text = logger.render("City", locator, "value='Austin'", "profile", "Tag: City");

        assertEquals("field: City\ndecision: value='Austin'\nsource: profile\n", text);
    }

    @Test
    void locatorDetailIncludesBothPaths() {
        AllureDecisionLogger logger = new AllureDecisionLogger(driver, LogDetail.WITH_LOCATOR, false);

        String text = logger.render("City", locator, "value='Austin'", "profile", "Tag: City");

        assertTrue(text.contains("xpath(relative): //input[@id='city']\n"));
        assertTrue(text.contains("xpath(absolute): /html/body/form[1]/input[3]\n"));
        assertFalse(text.contains("metadata:"));
    }

    @Test
    void fullDetailKeepsMetadataBlock() {
        AllureDecisionLogger logger = new AllureDecisionLogger(driver, LogDetail.FULL, true);

        String text = logger.render("City", locator, "value='Austin'", "profile", "Tag: City\nType: text");

        assertTrue(text.endsWith("metadata:\nTag: City\nType: text\n"));
    }

    @Test
    void failuresAreCapturedEvenWithoutScreenshots() {
        AllureDecisionLogger logger = new AllureDecisionLogger(driver, LogDetail.DECISION_ONLY, false);

        assertTrue(logger.shouldCapture("failed (not interactable)"));
        assertTrue(logger.shouldCapture("misplaced"));
        assertFalse(logger.shouldCapture("value='Austin'"));
        assertFalse(logger.shouldCapture(null));
        assertTrue(new AllureDecisionLogger(driver, LogDetail.DECISION_ONLY, true).shouldCapture("skip (optional)"));
    }

    @Test
    void missingDetailDisablesLogging() {
        AllureDecisionLogger logger = new AllureDecisionLogger(driver, null, false);

        assertEquals(LogDetail.NONE, logger.detail());
    }

    @Test
    void defaultFactoryRecordsLocators() {
        DecisionLogger logger = AutoApplyAllureLoggers.decisions(driver);

        assertEquals(LogDetail.WITH_LOCATOR, logger.detail());
        assertEquals(LogDetail.FULL, AutoApplyAllureLoggers.decisions(driver, LogDetail.FULL, true).detail());
    }

    @Test
    void driverIsRequired() {
        assertThrows(NullPointerException.class, () -> new AllureDecisionLogger(null, LogDetail.FULL, false));
    }
}
