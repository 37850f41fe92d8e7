package io.hearthwarrio.autoapply.core.session;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Browser collaborator used by the core.
 * <p>
 * Every element is addressed by an XPath expression. Interaction methods expect the expression
 * to match exactly one element and throw {@link SessionException} otherwise; query methods
 * ({@link #count(String)}, {@link #isDisplayed(String)}, ...) never throw for missing elements.
 * <p>
 * Implementations must bound every call by their interaction timeout.
 */
public interface BrowserSession extends AutoCloseable {

    void open(String url);

    String currentUrl();

    String title();

    /**
     * Serialized DOM of the whole document.
     */
    String snapshot();

    /**
     * Visible text of the whole page.
     */
    String pageText();

    Object evaluate(String script, Object... args);

    /**
     * Number of live elements matching the expression; 0 for invalid expressions.
     */
    int count(String xpath);

    boolean isDisplayed(String xpath);

    boolean isEnabled(String xpath);

    boolean isSelected(String xpath);

    /**
     * Whether the element takes part in constraint validation and currently fails it.
     */
    boolean failsValidation(String xpath);

    /**
     * Whether the element follows the reference element in document order.
     */
    boolean isAfter(String xpath, String referenceXpath);

    String text(String xpath);

    String attribute(String xpath, String name);

    /**
     * Outer HTML of the focused element, or an empty string.
     */
    String activeElementHtml();

    void click(String xpath);

    void type(String xpath, String text, boolean clearFirst);

    /**
     * Sends keystrokes to whatever element has focus.
     */
    void typeIntoActive(String text);

    /**
     * Removes the text of the focused input.
     */
    void clearActive();

    void pressEnter();

    void pressEscape();

    void scrollIntoView(String xpath);

    /**
     * Scrolls the element's own viewport (list boxes, menus) by the given number of pixels.
     */
    void scrollWithin(String xpath, int pixels);

    void selectByVisibleText(String selectXpath, String visibleText);

    void uploadFile(String xpath, Path file);

    /**
     * Polls until a run of identical captures is observed, then waits {@code paddingSeconds}.
     *
     * @return false when the timeout elapsed first
     */
    boolean waitUntilStable(Duration timeout, int paddingSeconds);

    void refresh();

    /**
     * Opens the URL in a new tab, waits for it to settle, closes the tab and returns to the current one.
     */
    void visitInNewTab(String url);

    @Override
    void close();
}
