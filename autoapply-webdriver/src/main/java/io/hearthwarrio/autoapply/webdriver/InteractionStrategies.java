package io.hearthwarrio.autoapply.webdriver;

import io.hearthwarrio.autoapply.core.strategy.FirstSuccess;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.Keys;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.interactions.Actions;

import java.util.Objects;
import java.util.Optional;

/**
 * Ordered click and typing fallbacks for elements that reject the plain WebDriver call.
 * <p>
 * Custom widgets (React selects, styled checkboxes, overlays) often swallow one kind of event
 * but react to another, so each chain goes from the most user-like interaction to raw DOM writes.
 */
public final class InteractionStrategies {

    static final String DISPATCH_MOUSE_EVENTS =
            "const el = arguments[0];"
                    + "['mousedown', 'mouseup', 'click'].forEach(function (type) {"
                    + "  el.dispatchEvent(new MouseEvent(type, {view: window, bubbles: true, cancelable: true}));"
                    + "});";

    static final String SCROLL_AND_CLICK =
            "arguments[0].scrollIntoView({block: 'center'}); arguments[0].click();";

    static final String SET_VALUE =
            "const el = arguments[0];"
                    + "el.focus();"
                    + "el.value = arguments[1];"
                    + "el.dispatchEvent(new Event('input', {bubbles: true}));"
                    + "el.dispatchEvent(new Event('change', {bubbles: true}));";

    private InteractionStrategies() {
        // utility class
    }

    /**
     * Text entry request for {@link #typing(WebDriver)}.
     */
    public static final class TypeRequest {
        private final WebElement element;
        private final String text;
        private final boolean clearFirst;

        public TypeRequest(WebElement element, String text, boolean clearFirst) {
            this.element = Objects.requireNonNull(element, "element must not be null");
            this.text = text == null ? "" : text;
            this.clearFirst = clearFirst;
        }

        public WebElement element() {
            return element;
        }

        public String text() {
            return text;
        }

        public boolean clearFirst() {
            return clearFirst;
        }
    }

    /**
     * Actions move-and-click, dispatched mouse events, scroll + DOM click, native click.
     */
    public static FirstSuccess<WebElement, Boolean> clicking(WebDriver driver) {
        Objects.requireNonNull(driver, "driver must not be null");
        return FirstSuccess.<WebElement, Boolean>named("click")
                .then("actions", e -> {
                    new Actions(driver).moveToElement(e).click().perform();
                    return Optional.of(Boolean.TRUE);
                })
                .then("dispatch-mouse-events", e -> {
                    js(driver).executeScript(DISPATCH_MOUSE_EVENTS, e);
                    return Optional.of(Boolean.TRUE);
                })
                .then("scroll-and-click", e -> {
                    js(driver).executeScript(SCROLL_AND_CLICK, e);
                    return Optional.of(Boolean.TRUE);
                })
                .then("native", e -> {
                    e.click();
                    return Optional.of(Boolean.TRUE);
                });
    }

    /**
     * Native clear + keys, select-all + keys, DOM value assignment with input/change events.
     */
    public static FirstSuccess<TypeRequest, Boolean> typing(WebDriver driver) {
        Objects.requireNonNull(driver, "driver must not be null");
        return FirstSuccess.<TypeRequest, Boolean>named("type")
                .then("native", r -> {
                    if (r.clearFirst()) {
                        r.element().clear();
                    }
                    r.element().sendKeys(r.text());
                    return Optional.of(Boolean.TRUE);
                })
                .then("select-all", r -> {
                    r.element().click();
                    if (r.clearFirst()) {
                        r.element().sendKeys(Keys.chord(Keys.CONTROL, "a"), Keys.BACK_SPACE);
                    }
                    r.element().sendKeys(r.text());
                    return Optional.of(Boolean.TRUE);
                })
                .then("set-value", r -> {
                    String value = r.clearFirst() ? r.text() : Objects.toString(r.element().getAttribute("value"), "") + r.text();
                    js(driver).executeScript(SET_VALUE, r.element(), value);
                    return Optional.of(Boolean.TRUE);
                });
    }

    static JavascriptExecutor js(WebDriver driver) {
        if (driver instanceof JavascriptExecutor executor) {
            return executor;
        }
        throw new UnsupportedOperationException("Driver does not execute JavaScript: " + driver.getClass().getName());
    }
}
