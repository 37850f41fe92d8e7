package io.hearthwarrio.autoapply.core.navigation;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.locator.LocatorEngine;
import io.hearthwarrio.autoapply.core.model.ButtonDescriptor;
import io.hearthwarrio.autoapply.core.model.Locator;
import io.hearthwarrio.autoapply.core.session.FakeBrowserSession;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ActionClickerTest {

    private static final String FORM = "<html><body><form>"
            + "<input name=\"email\" type=\"email\">"
            + "<button id=\"add\" type=\"button\">Add education</button>"
            + "</form></body></html>";

    private static final String ADD = "//button[@id='add']";

    @Test
    void onlyUniqueVisibleElementsCountAsRevealed() {
        FakeBrowserSession session = FakeBrowserSession.of(FORM).onClick(ADD, s -> s.document().selectFirst("form")
                .append("<input name=\"school\">")
                .append("<input name=\"token\" type=\"hidden\">")
                .append("<input class=\"cell\"><input class=\"cell\">"));

        ClickOutcome outcome = clicker(session).click(add());

        assertEquals(ClickOutcome.Kind.NEW_ELEMENTS_REVEALED, outcome.kind());
        List<Element> revealed = outcome.revealed();
        assertEquals(1, revealed.size());
        assertEquals("school", revealed.get(0).attr("name"));
    }

    @Test
    void onlyAmbiguousOrHiddenElementsMeanNoChange() {
        FakeBrowserSession session = FakeBrowserSession.of(FORM).onClick(ADD, s -> s.document().selectFirst("form")
                .append("<div hidden><input name=\"degree\"></div>")
                .append("<input class=\"cell\"><input class=\"cell\">"));

        ClickOutcome outcome = clicker(session).click(add());

        assertEquals(ClickOutcome.Kind.NO_CHANGE, outcome.kind());
        assertEquals(List.of(ADD), session.clicks());
    }

    @Test
    void replacedFormCountsAsAdvanced() {
        FakeBrowserSession session = FakeBrowserSession.of(FORM).onClick(ADD, s -> s.setHtml(
                "<html><body><form><input name=\"city\"><button id=\"next\">Next</button></form></body></html>"));

        assertEquals(ClickOutcome.Kind.ADVANCED, clicker(session).click(add()).kind());
    }

    @Test
    void missingControlIsNotClicked() {
        FakeBrowserSession session = FakeBrowserSession.of("<html><body><p>Done</p></body></html>");

        assertEquals(ClickOutcome.Kind.NO_CHANGE, clicker(session).click(add()).kind());
        assertTrue(session.clicks().isEmpty());
    }

    private static ActionClicker clicker(FakeBrowserSession session) {
        AutofillSettings settings = AutofillSettings.defaults();
        return new ActionClicker(session, new LocatorEngine(session, settings), KeywordTables.defaults(), settings);
    }

    private static ActionItem add() {
        ButtonDescriptor b = new ButtonDescriptor("button", Locator.of(ADD));
        b.setText("Add education");
        return ActionItem.of(b, ActionItem.Role.PROGRESS);
    }
}
