package io.hearthwarrio.autoapply.webdriver;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.session.SessionException;
import io.hearthwarrio.autoapply.core.strategy.FirstSuccess;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.By;
import org.openqa.selenium.ElementClickInterceptedException;
import org.openqa.selenium.ElementNotInteractableException;
import org.openqa.selenium.InvalidSelectorException;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class SeleniumBrowserSessionTest {

    private static final String SUBMIT = "//button[@type='submit']";

    private WebDriver driver;
    private WebElement button;
    private SeleniumBrowserSession session;

    @BeforeEach
    void setUp() {
        driver = mock(WebDriver.class, withSettings().extraInterfaces(JavascriptExecutor.class));
        button = mock(WebElement.class);
        session = new SeleniumBrowserSession(driver, AutofillSettings.defaults());
    }

    @Test
    void invalidXpathCountsAsNoMatch() {
        when(driver.findElements(By.xpath("//input[")))
                .thenThrow(new InvalidSelectorException("unterminated predicate"));

        assertEquals(0, session.count("//input["));
        assertEquals(0, session.count(""));
        assertEquals(0, session.count(null));
    }

    @Test
    void clickRequiresExactlyOneMatch() {
        when(driver.findElements(By.xpath(SUBMIT))).thenReturn(List.of(button, mock(WebElement.class)));

        SessionException e = assertThrows(SessionException.class, () -> session.click(SUBMIT));
        assertTrue(e.getMessage().contains("found 2"));
        verify(button, never()).click();
    }

    @Test
    void clickFallsThroughToNextStrategy() {
        when(driver.findElements(By.xpath(SUBMIT))).thenReturn(List.of(button));
        session.withClickStrategies(FirstSuccess.<WebElement, Boolean>named("click")
                .then("overlayed", e -> {
                    throw new ElementClickInterceptedException("covered by a cookie banner");
                })
                .then("native", e -> {
                    e.click();
                    return Optional.of(Boolean.TRUE);
                }));

        session.click(SUBMIT);

        verify(button).click();
    }

    @Test
    void clickFailsWhenEveryStrategyIsRejected() {
        when(driver.findElements(By.xpath(SUBMIT))).thenReturn(List.of(button));
        session.withClickStrategies(FirstSuccess.<WebElement, Boolean>named("click")
                .then("overlayed", e -> {
                    throw new ElementClickInterceptedException("covered");
                })
                .then("inert", e -> Optional.empty()));

        SessionException e = assertThrows(SessionException.class, () -> session.click(SUBMIT));
        assertTrue(e.getMessage().contains(SUBMIT));
    }

    @Test
    void typingUsesNativeKeysWhenAccepted() {
        String xpath = "//input[@id='email']";
        when(driver.findElements(By.xpath(xpath))).thenReturn(List.of(button));

        session.type(xpath, "alex@example.com", true);

        verify(button).clear();
        verify(button).sendKeys("alex@example.com");
        verify((JavascriptExecutor) driver, never()).executeScript(eq(InteractionStrategies.SET_VALUE), any());
    }

    @Test
    void typingFallsBackToScriptedValue() {
        String xpath = "//input[@id='email']";
        WebElement input = mock(WebElement.class);
        when(driver.findElements(By.xpath(xpath))).thenReturn(List.of(input));
        doThrow(new ElementNotInteractableException("masked input")).when(input).sendKeys(any(CharSequence[].class));

        session.type(xpath, "alex@example.com", true);

        verify((JavascriptExecutor) driver).executeScript(InteractionStrategies.SET_VALUE, input, "alex@example.com");
    }

    @Test
    void missingElementHasNoAttributeOrText() {
        when(driver.findElements(By.xpath("//missing"))).thenReturn(List.of());

        assertNull(session.attribute("//missing", "value"));
        assertEquals("", session.text("//missing"));
        assertFalse(session.isDisplayed("//missing"));
    }

    @Test
    void openWrapsDriverFailures() {
        doThrow(new WebDriverException("net::ERR_NAME_NOT_RESOLVED")).when(driver).get("https://jobs.invalid");

        SessionException e = assertThrows(SessionException.class, () -> session.open("https://jobs.invalid"));
        assertInstanceOf(WebDriverException.class, e.getCause());
    }

    @Test
    void unchangedPageIsStable() {
        JavascriptExecutor js = (JavascriptExecutor) driver;
        when(js.executeScript("return document.readyState")).thenReturn("complete");
        when(driver.getPageSource()).thenReturn("<html><body><form></form></body></html>");
        session.withPollInterval(Duration.ofMillis(1)).withInteractionTimeout(Duration.ofSeconds(1));

        assertTrue(session.waitUntilStable(Duration.ofSeconds(2), 0));
    }

    @Test
    void closeIgnoresQuitFailures() {
        doThrow(new WebDriverException("session already gone")).when(driver).quit();

        assertDoesNotThrow(() -> session.close());
        verify(driver).quit();
    }
}
