package io.hearthwarrio.autoapply.core.navigation;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.KeywordTable;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.config.Setting;
import io.hearthwarrio.autoapply.core.diff.ChangeDetector;
import io.hearthwarrio.autoapply.core.diff.DomSnapshot;
import io.hearthwarrio.autoapply.core.diff.HtmlDiff;
import io.hearthwarrio.autoapply.core.diff.NewElementFinder;
import io.hearthwarrio.autoapply.core.extract.Blacklist;
import io.hearthwarrio.autoapply.core.locator.LocatorEngine;
import io.hearthwarrio.autoapply.core.locator.XPaths;
import io.hearthwarrio.autoapply.core.model.Locator;
import io.hearthwarrio.autoapply.core.session.BrowserSession;
import io.hearthwarrio.autoapply.core.strategy.Outcome;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Clicks an action item and classifies what the click did to the page.
 */
public final class ActionClicker {

    private static final Logger log = LoggerFactory.getLogger(ActionClicker.class);

    private static final int CLICK_PADDING_SECONDS = 2;

    private final BrowserSession session;
    private final LocatorEngine locators;
    private final Blacklist blacklist;
    private final List<String> revealQueries;
    private final double preservedRatio;
    private final Duration settle;

    public ActionClicker(BrowserSession session, LocatorEngine locators, KeywordTables tables, AutofillSettings settings) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.locators = Objects.requireNonNull(locators, "locators must not be null");
        this.blacklist = new Blacklist(Objects.requireNonNull(tables, "tables must not be null"));
        Objects.requireNonNull(settings, "settings must not be null");
        this.preservedRatio = settings.getDouble(Setting.PRESERVED_RATIO);
        this.settle = settings.seconds(Setting.STABLE_DOM_TIMEOUT_SECONDS);
        Set<String> queries = new LinkedHashSet<>(NewElementFinder.FIELD_QUERIES);
        queries.addAll(NewElementFinder.BUTTON_QUERIES);
        this.revealQueries = List.copyOf(queries);
    }

    /**
     * Whether the item still resolves to exactly one element, updating its locator when the chain
     * had to rebuild it.
     */
    public boolean isLive(ActionItem item) {
        Outcome<Locator> outcome = locators.revalidate(item.locator());
        if (!outcome.isSuccess()) {
            return false;
        }
        item.item().setLocator(outcome.value());
        return true;
    }

    public ClickOutcome click(ActionItem item) {
        Objects.requireNonNull(item, "item must not be null");
        if (!isLive(item)) {
            log.warn("Action item no longer on the page: {}", item);
            return ClickOutcome.noChange();
        }
        String xpath = item.locator().expression();
        if (!session.isDisplayed(xpath) || !session.isEnabled(xpath)) {
            // nothing to press; let the next parse decide what the page is
            log.info("Action item not interactable, re-parsing: {}", item);
            return ClickOutcome.advanced();
        }
        session.scrollIntoView(xpath);
        DomSnapshot before = DomSnapshot.parse(session.snapshot());
        session.click(xpath);
        log.info("Clicked {}", item);
        session.waitUntilStable(settle, CLICK_PADDING_SECONDS);
        DomSnapshot after = DomSnapshot.parse(session.snapshot());

        if (ChangeDetector.hasChanged(before, after, preservedRatio)) {
            return ClickOutcome.advanced();
        }
        List<Element> revealed = new ArrayList<>();
        for (Element e : NewElementFinder.find(before, after, revealQueries)) {
            if (isRelevant(e)) {
                revealed.add(e);
            }
        }
        if (revealed.isEmpty()) {
            return ClickOutcome.noChange();
        }
        log.info("{} revealed {} new elements", item.text(), revealed.size());
        return ClickOutcome.revealed(revealed, HtmlDiff.diff(before, after).ancestorPaths());
    }

    private boolean isRelevant(Element e) {
        if ("button".equals(e.normalName())) {
            String text = e.text().isBlank() ? e.attr("title") : e.text();
            if (blacklist.partial(KeywordTable.NEW_BUTTON_TEXT_BLACKLIST_PARTIAL, text)
                    || blacklist.partial(KeywordTable.NEW_BUTTON_ID_BLACKLIST_PARTIAL, e.id())) {
                return false;
            }
        }
        String x = XPaths.relative(e);
        return session.count(x) == 1 && session.isDisplayed(x);
    }
}
