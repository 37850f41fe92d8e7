package io.hearthwarrio.autoapply.webdriver;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.Setting;
import io.hearthwarrio.autoapply.core.session.BrowserSession;
import io.hearthwarrio.autoapply.core.session.SessionException;
import io.hearthwarrio.autoapply.core.strategy.FirstSuccess;
import io.hearthwarrio.autoapply.core.strategy.Outcome;
import org.openqa.selenium.By;
import org.openqa.selenium.InvalidSelectorException;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.Keys;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.WindowType;
import org.openqa.selenium.interactions.Actions;
import org.openqa.selenium.support.ui.Select;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Selenium WebDriver implementation of {@link BrowserSession}.
 * <p>
 * Every element is looked up fresh by XPath on each call, so no {@link WebElement} outlives a single
 * operation and stale references never leak into the core. Clicks and text entry go through
 * {@link InteractionStrategies}; a {@link SessionException} is thrown only when the whole chain fails.
 */
public class SeleniumBrowserSession implements BrowserSession {

    private static final Logger log = LoggerFactory.getLogger(SeleniumBrowserSession.class);

    /**
     * Consecutive identical page sources needed to call the DOM stable.
     */
    static final int REQUIRED_STABLE_CHECKS = 3;

    private static final String READY_STATE = "return document.readyState";
    private static final String FAILS_VALIDATION =
            "const el = arguments[0]; return !!(el.willValidate && el.validity && !el.validity.valid);";
    private static final String IS_AFTER =
            "return !!(arguments[1].compareDocumentPosition(arguments[0]) & Node.DOCUMENT_POSITION_FOLLOWING);";
    private static final String ACTIVE_ELEMENT_HTML =
            "const el = document.activeElement; return el && el !== document.body ? el.outerHTML : '';";
    private static final String SCROLL_INTO_VIEW = "arguments[0].scrollIntoView({block: 'center'});";
    private static final String SCROLL_WITHIN = "arguments[0].scrollTop = arguments[0].scrollTop + arguments[1];";

    private final WebDriver driver;
    private Duration interactionTimeout;
    private Duration pollInterval = Duration.ofMillis(500);
    private FirstSuccess<WebElement, Boolean> clicks;
    private FirstSuccess<InteractionStrategies.TypeRequest, Boolean> typing;

    public SeleniumBrowserSession(WebDriver driver, AutofillSettings settings) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        this.interactionTimeout = settings.seconds(Setting.INTERACTION_TIMEOUT_SECONDS);
        this.clicks = InteractionStrategies.clicking(driver);
        this.typing = InteractionStrategies.typing(driver);
    }

    // ----------- configuration -----------

    public SeleniumBrowserSession withInteractionTimeout(Duration timeout) {
        this.interactionTimeout = Objects.requireNonNull(timeout, "timeout must not be null");
        return this;
    }

    public SeleniumBrowserSession withPollInterval(Duration interval) {
        this.pollInterval = Objects.requireNonNull(interval, "interval must not be null");
        return this;
    }

    public SeleniumBrowserSession withClickStrategies(FirstSuccess<WebElement, Boolean> strategies) {
        this.clicks = Objects.requireNonNull(strategies, "strategies must not be null");
        return this;
    }

    public SeleniumBrowserSession withTypingStrategies(FirstSuccess<InteractionStrategies.TypeRequest, Boolean> strategies) {
        this.typing = Objects.requireNonNull(strategies, "strategies must not be null");
        return this;
    }

    public WebDriver driver() {
        return driver;
    }

    // ----------- navigation -----------

    @Override
    public void open(String url) {
        Objects.requireNonNull(url, "url must not be null");
        try {
            driver.get(url);
            awaitReadyState();
        } catch (WebDriverException e) {
            throw new SessionException("Failed to open " + url, e);
        }
    }

    @Override
    public String currentUrl() {
        return driver.getCurrentUrl();
    }

    @Override
    public String title() {
        String title = driver.getTitle();
        return title == null ? "" : title;
    }

    @Override
    public void refresh() {
        try {
            driver.navigate().refresh();
            awaitReadyState();
        } catch (WebDriverException e) {
            throw new SessionException("Failed to refresh " + currentUrl(), e);
        }
    }

    @Override
    public void visitInNewTab(String url) {
        Objects.requireNonNull(url, "url must not be null");
        String original = driver.getWindowHandle();
        try {
            driver.switchTo().newWindow(WindowType.TAB);
            driver.get(url);
            waitUntilStable(interactionTimeout, 1);
            driver.close();
        } catch (WebDriverException e) {
            throw new SessionException("Failed to visit " + url + " in a new tab", e);
        } finally {
            driver.switchTo().window(original);
        }
    }

    // ----------- queries -----------

    @Override
    public String snapshot() {
        String source = driver.getPageSource();
        return source == null ? "" : source;
    }

    @Override
    public String pageText() {
        List<WebElement> bodies = driver.findElements(By.tagName("body"));
        return bodies.isEmpty() ? "" : bodies.get(0).getText();
    }

    @Override
    public Object evaluate(String script, Object... args) {
        try {
            return InteractionStrategies.js(driver).executeScript(script, args);
        } catch (WebDriverException e) {
            throw new SessionException("Script failed", e);
        }
    }

    @Override
    public int count(String xpath) {
        return findAll(xpath).size();
    }

    @Override
    public boolean isDisplayed(String xpath) {
        List<WebElement> found = findAll(xpath);
        try {
            return !found.isEmpty() && found.get(0).isDisplayed();
        } catch (StaleElementReferenceException e) {
            return false;
        }
    }

    @Override
    public boolean isEnabled(String xpath) {
        List<WebElement> found = findAll(xpath);
        try {
            return !found.isEmpty() && found.get(0).isEnabled();
        } catch (StaleElementReferenceException e) {
            return false;
        }
    }

    @Override
    public boolean isSelected(String xpath) {
        List<WebElement> found = findAll(xpath);
        try {
            return !found.isEmpty() && found.get(0).isSelected();
        } catch (StaleElementReferenceException e) {
            return false;
        }
    }

    @Override
    public boolean failsValidation(String xpath) {
        List<WebElement> found = findAll(xpath);
        if (found.isEmpty()) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(InteractionStrategies.js(driver).executeScript(FAILS_VALIDATION, found.get(0)));
        } catch (WebDriverException e) {
            return false;
        }
    }

    @Override
    public boolean isAfter(String xpath, String referenceXpath) {
        List<WebElement> target = findAll(xpath);
        List<WebElement> reference = findAll(referenceXpath);
        if (target.isEmpty() || reference.isEmpty()) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(
                    InteractionStrategies.js(driver).executeScript(IS_AFTER, target.get(0), reference.get(0)));
        } catch (WebDriverException e) {
            return false;
        }
    }

    @Override
    public String text(String xpath) {
        List<WebElement> found = findAll(xpath);
        if (found.isEmpty()) {
            return "";
        }
        try {
            String text = found.get(0).getText();
            return text == null ? "" : text;
        } catch (StaleElementReferenceException e) {
            return "";
        }
    }

    @Override
    public String attribute(String xpath, String name) {
        List<WebElement> found = findAll(xpath);
        if (found.isEmpty()) {
            return null;
        }
        try {
            return found.get(0).getAttribute(name);
        } catch (StaleElementReferenceException e) {
            return null;
        }
    }

    @Override
    public String activeElementHtml() {
        try {
            Object html = InteractionStrategies.js(driver).executeScript(ACTIVE_ELEMENT_HTML);
            return html == null ? "" : html.toString();
        } catch (WebDriverException e) {
            return "";
        }
    }

    // ----------- interaction -----------

    @Override
    public void click(String xpath) {
        WebElement element = single(xpath);
        Outcome<Boolean> outcome = clicks.evaluate(element);
        if (!outcome.isSuccess()) {
            throw new SessionException("Click rejected for " + xpath + ": " + outcome.failures());
        }
        log.debug("Clicked {} via {}", xpath, outcome.strategy());
    }

    @Override
    public void type(String xpath, String text, boolean clearFirst) {
        WebElement element = single(xpath);
        Outcome<Boolean> outcome = typing.evaluate(new InteractionStrategies.TypeRequest(element, text, clearFirst));
        if (!outcome.isSuccess()) {
            throw new SessionException("Typing rejected for " + xpath + ": " + outcome.failures());
        }
        log.debug("Typed into {} via {}", xpath, outcome.strategy());
    }

    @Override
    public void typeIntoActive(String text) {
        try {
            new Actions(driver).sendKeys(text == null ? "" : text).perform();
        } catch (WebDriverException e) {
            throw new SessionException("Typing into the focused element failed", e);
        }
    }

    @Override
    public void clearActive() {
        try {
            new Actions(driver)
                    .keyDown(Keys.CONTROL).sendKeys("a").keyUp(Keys.CONTROL)
                    .sendKeys(Keys.BACK_SPACE)
                    .perform();
        } catch (WebDriverException e) {
            throw new SessionException("Clearing the focused element failed", e);
        }
    }

    @Override
    public void pressEnter() {
        pressKey(Keys.ENTER);
    }

    @Override
    public void pressEscape() {
        pressKey(Keys.ESCAPE);
    }

    private void pressKey(Keys key) {
        try {
            new Actions(driver).sendKeys(key).perform();
        } catch (WebDriverException e) {
            throw new SessionException("Key press failed: " + key.name(), e);
        }
    }

    @Override
    public void scrollIntoView(String xpath) {
        List<WebElement> found = findAll(xpath);
        if (found.isEmpty()) {
            return;
        }
        try {
            InteractionStrategies.js(driver).executeScript(SCROLL_INTO_VIEW, found.get(0));
        } catch (WebDriverException e) {
            log.debug("Scroll into view failed for {}: {}", xpath, e.getMessage());
        }
    }

    @Override
    public void scrollWithin(String xpath, int pixels) {
        WebElement element = single(xpath);
        try {
            InteractionStrategies.js(driver).executeScript(SCROLL_WITHIN, element, pixels);
        } catch (WebDriverException e) {
            throw new SessionException("Scroll failed for " + xpath, e);
        }
    }

    @Override
    public void selectByVisibleText(String selectXpath, String visibleText) {
        WebElement element = single(selectXpath);
        try {
            new Select(element).selectByVisibleText(visibleText);
        } catch (WebDriverException e) {
            throw new SessionException("Option '" + visibleText + "' not selectable in " + selectXpath, e);
        }
    }

    @Override
    public void uploadFile(String xpath, Path file) {
        Objects.requireNonNull(file, "file must not be null");
        WebElement element = single(xpath);
        try {
            element.sendKeys(file.toAbsolutePath().toString());
        } catch (WebDriverException e) {
            throw new SessionException("Upload of " + file + " rejected by " + xpath, e);
        }
    }

    // ----------- waiting -----------

    @Override
    public boolean waitUntilStable(Duration timeout, int paddingSeconds) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        try {
            awaitReadyState();
        } catch (TimeoutException e) {
            log.debug("Document not complete after {}s", interactionTimeout.toSeconds());
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        String previous = "";
        int stableChecks = 0;
        boolean stable = false;
        try {
            while (System.nanoTime() < deadline) {
                String current = snapshot();
                if (current.equals(previous)) {
                    stableChecks++;
                    if (stableChecks >= REQUIRED_STABLE_CHECKS) {
                        stable = true;
                        break;
                    }
                } else {
                    stableChecks = 0;
                    previous = current;
                }
                Thread.sleep(pollInterval.toMillis());
            }
            if (!stable) {
                log.warn("Page still changing after {}s: {}", timeout.toSeconds(), currentUrl());
                return false;
            }
            if (paddingSeconds > 0) {
                Thread.sleep(paddingSeconds * 1000L);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void awaitReadyState() {
        if (!(driver instanceof JavascriptExecutor executor)) {
            return;
        }
        new WebDriverWait(driver, interactionTimeout)
                .until(d -> "complete".equals(executor.executeScript(READY_STATE)));
    }

    // ----------- lookup -----------

    private List<WebElement> findAll(String xpath) {
        if (xpath == null || xpath.isBlank()) {
            return List.of();
        }
        try {
            return driver.findElements(By.xpath(xpath));
        } catch (InvalidSelectorException e) {
            log.debug("Invalid XPath {}", xpath);
            return List.of();
        }
    }

    private WebElement single(String xpath) {
        List<WebElement> found = findAll(xpath);
        if (found.size() != 1) {
            throw new SessionException("Expected exactly one element for " + xpath + " but found " + found.size());
        }
        return found.get(0);
    }

    @Override
    public void close() {
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.warn("Failed to quit the browser: {}", e.getMessage());
        }
    }
}
