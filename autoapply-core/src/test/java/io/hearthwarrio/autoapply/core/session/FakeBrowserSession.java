package io.hearthwarrio.autoapply.core.session;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * In-memory {@link BrowserSession} over a jsoup document. XPath queries run against the parsed HTML;
 * clicks may trigger scripted page changes.
 */
public class FakeBrowserSession implements BrowserSession {

    private Document document;
    private String url = "about:blank";
    private final Map<String, Consumer<FakeBrowserSession>> reactions = new HashMap<>();
    private final List<String> clicks = new ArrayList<>();
    private final Map<String, String> typed = new LinkedHashMap<>();
    private final List<String> visited = new ArrayList<>();
    private boolean closed;

    public FakeBrowserSession(String html) {
        setHtml(html);
    }

    public static FakeBrowserSession of(String html) {
        return new FakeBrowserSession(html);
    }

    public void setHtml(String html) {
        this.document = Jsoup.parse(html);
    }

    public Document document() {
        return document;
    }

    /**
     * Runs {@code reaction} whenever the element at {@code xpath} is clicked.
     */
    public FakeBrowserSession onClick(String xpath, Consumer<FakeBrowserSession> reaction) {
        reactions.put(xpath, reaction);
        return this;
    }

    public List<String> clicks() {
        return clicks;
    }

    public Map<String, String> typed() {
        return typed;
    }

    public List<String> visitedInNewTab() {
        return visited;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void open(String url) {
        this.url = url;
    }

    @Override
    public String currentUrl() {
        return url;
    }

    @Override
    public String title() {
        return document.title();
    }

    @Override
    public String snapshot() {
        return document.outerHtml();
    }

    @Override
    public String pageText() {
        return document.body().text();
    }

    @Override
    public Object evaluate(String script, Object... args) {
        return null;
    }

    @Override
    public int count(String xpath) {
        return find(xpath).size();
    }

    @Override
    public boolean isDisplayed(String xpath) {
        Elements found = find(xpath);
        if (found.size() != 1) {
            return false;
        }
        for (Element e = found.first(); e != null; e = e.parent()) {
            if (e.hasAttr("hidden") || e.attr("style").replace(" ", "").contains("display:none")) {
                return false;
            }
        }
        return !"hidden".equalsIgnoreCase(found.first().attr("type"));
    }

    @Override
    public boolean isEnabled(String xpath) {
        Elements found = find(xpath);
        return found.size() == 1 && !found.first().hasAttr("disabled");
    }

    @Override
    public boolean isSelected(String xpath) {
        Elements found = find(xpath);
        return found.size() == 1 && (found.first().hasAttr("checked") || found.first().hasAttr("selected"));
    }

    @Override
    public boolean failsValidation(String xpath) {
        return false;
    }

    @Override
    public boolean isAfter(String xpath, String referenceXpath) {
        Elements a = find(xpath);
        Elements b = find(referenceXpath);
        if (a.isEmpty() || b.isEmpty()) {
            return false;
        }
        Elements all = document.getAllElements();
        return all.indexOf(a.first()) > all.indexOf(b.first());
    }

    @Override
    public String text(String xpath) {
        return single(xpath).text();
    }

    @Override
    public String attribute(String xpath, String name) {
        Element e = single(xpath);
        return e.hasAttr(name) ? e.attr(name) : null;
    }

    @Override
    public String activeElementHtml() {
        return "";
    }

    @Override
    public void click(String xpath) {
        single(xpath);
        clicks.add(xpath);
        Consumer<FakeBrowserSession> reaction = reactions.get(xpath);
        if (reaction != null) {
            reaction.accept(this);
        }
    }

    @Override
    public void type(String xpath, String text, boolean clearFirst) {
        Element e = single(xpath);
        String value = clearFirst ? text : e.attr("value") + text;
        e.attr("value", value);
        typed.put(xpath, value);
    }

    @Override
    public void typeIntoActive(String text) {
        typed.merge("(active)", text, String::concat);
    }

    @Override
    public void clearActive() {
        typed.remove("(active)");
    }

    @Override
    public void pressEnter() {
    }

    @Override
    public void pressEscape() {
    }

    @Override
    public void scrollIntoView(String xpath) {
    }

    @Override
    public void scrollWithin(String xpath, int pixels) {
    }

    @Override
    public void selectByVisibleText(String selectXpath, String visibleText) {
        Element select = single(selectXpath);
        for (Element option : select.select("option")) {
            if (option.text().equals(visibleText)) {
                option.attr("selected", "");
            } else {
                option.removeAttr("selected");
            }
        }
        typed.put(selectXpath, visibleText);
    }

    @Override
    public void uploadFile(String xpath, Path file) {
        single(xpath);
        typed.put(xpath, file.toString());
    }

    @Override
    public boolean waitUntilStable(Duration timeout, int paddingSeconds) {
        return true;
    }

    @Override
    public void refresh() {
    }

    @Override
    public void visitInNewTab(String url) {
        visited.add(url);
    }

    @Override
    public void close() {
        closed = true;
    }

    private Elements find(String xpath) {
        if (xpath == null || xpath.isBlank()) {
            return new Elements();
        }
        try {
            return document.selectXpath(xpath);
        } catch (RuntimeException e) {
            return new Elements();
        }
    }

    private Element single(String xpath) {
        Elements found = find(xpath);
        if (found.size() != 1) {
            throw new SessionException("Expected one element for " + xpath + " but found " + found.size());
        }
        return found.first();
    }
}
