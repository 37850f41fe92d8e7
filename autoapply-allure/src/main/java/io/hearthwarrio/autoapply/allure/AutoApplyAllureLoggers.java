package io.hearthwarrio.autoapply.allure;

import io.hearthwarrio.autoapply.core.logging.DecisionLogger;
import io.hearthwarrio.autoapply.core.logging.LogDetail;
import org.openqa.selenium.WebDriver;

/**
 * Factory methods for Allure-related AutoApply loggers.
 */
public final class AutoApplyAllureLoggers {

    private AutoApplyAllureLoggers() {
        // utility class
    }

    /**
     * Creates an Allure logger that records locators without screenshots.
     */
    public static DecisionLogger decisions(WebDriver driver) {
        return new AllureDecisionLogger(driver, LogDetail.WITH_LOCATOR, false);
    }

    /**
     * Creates an Allure logger with explicit detail and screenshot flag.
     */
    public static DecisionLogger decisions(WebDriver driver, LogDetail detail, boolean screenshots) {
        return new AllureDecisionLogger(driver, detail, screenshots);
    }
}
