package io.hearthwarrio.autoapply.core.navigation;

import io.hearthwarrio.autoapply.core.answer.FieldInteractor;
import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.JsonProfileStore;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.config.Profile;
import io.hearthwarrio.autoapply.core.config.Setting;
import io.hearthwarrio.autoapply.core.extract.PageExtractor;
import io.hearthwarrio.autoapply.core.extract.ParseContext;
import io.hearthwarrio.autoapply.core.model.AuthType;
import io.hearthwarrio.autoapply.core.model.ButtonDescriptor;
import io.hearthwarrio.autoapply.core.model.Locator;
import io.hearthwarrio.autoapply.core.model.NavigationState;
import io.hearthwarrio.autoapply.core.model.PageMetadata;
import io.hearthwarrio.autoapply.core.model.PageModel;
import io.hearthwarrio.autoapply.core.session.BrowserSession;
import io.hearthwarrio.autoapply.core.upload.FileUploader;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class PageResolverTest {

    private final Profile profile = JsonProfileStore.parse("{}");
    private final ActionItem next = item("//button[@id='next']", "Next", ActionItem.Role.PROGRESS);
    private final ActionItem open = item("//button[@id='open']", "Continue to form", ActionItem.Role.ACKNOWLEDGE);

    private BrowserSession session;
    private PageExtractor extractor;
    private ActionSelector selector;
    private ActionClicker clicker;
    private AuthResolver auth;
    private PageResolver resolver;

    @BeforeEach
    void setUp() {
        session = mock(BrowserSession.class);
        extractor = mock(PageExtractor.class);
        selector = mock(ActionSelector.class);
        clicker = mock(ActionClicker.class);
        auth = mock(AuthResolver.class);
        resolver = new PageResolver(session, extractor, mock(FieldInteractor.class), mock(FileUploader.class),
                selector, clicker, auth, KeywordTables.defaults(), profile, AutofillSettings.defaults());
        when(clicker.isLive(any())).thenReturn(true);
    }

    @Test
    void progressClickThatAdvancesResolvesThePage() {
        when(selector.progress(any())).thenReturn(Optional.of(next));
        when(clicker.click(next)).thenReturn(ClickOutcome.advanced());

        assertTrue(resolver.resolve(capture(), NavigationState.LOGGED_IN, "job-1"));
        verify(clicker).click(next);
    }

    @Test
    void loggedInPageWithoutProgressControlIsADeadEnd() {
        assertFalse(resolver.resolve(capture(), NavigationState.LOGGED_IN, "job-1"));
        verify(clicker, never()).click(any());
    }

    @Test
    void errorPageIsReloaded() {
        when(session.pageText()).thenReturn("Oops, something went wrong. Please try again later.");

        assertTrue(resolver.resolve(capture(), NavigationState.LOGGED_IN, "job-1"));
        verify(session).refresh();
        verify(clicker, never()).click(any());
    }

    @Test
    void ineffectiveSignUpTogglesToSignIn() {
        ActionItem create = item("//button[@id='create']", "Create account", ActionItem.Role.AUTH);
        AuthPlan plan = AuthPlan.planned(AuthType.SIGN_UP, create, Map.of(AuthType.SIGN_UP, List.of(create)));
        when(auth.classify(any())).thenReturn(plan);
        when(clicker.click(create)).thenReturn(ClickOutcome.noChange());
        when(auth.resolveVerificationLock(eq(plan), any())).thenReturn(AuthResolver.Lock.ABSENT);
        when(auth.toggle(plan, create)).thenReturn(true);

        assertTrue(resolver.resolve(capture(), NavigationState.AUTH, "job-1"));
        verify(auth).toggle(plan, create);
    }

    @Test
    void verificationLockDecidesBeforeToggling() {
        ActionItem confirm = item("//button[@id='confirm']", "Verify", ActionItem.Role.AUTH);
        AuthPlan plan = AuthPlan.planned(AuthType.SIGN_IN, confirm, Map.of());
        when(auth.classify(any())).thenReturn(plan);
        when(clicker.click(confirm)).thenReturn(ClickOutcome.noChange());
        when(auth.resolveVerificationLock(eq(plan), any())).thenReturn(AuthResolver.Lock.FAILED);

        assertFalse(resolver.resolve(capture(), NavigationState.AUTH, "job-1"));
        verify(auth, never()).toggle(any(), any());
    }

    @Test
    void mostRecentParentIsRetriedFirst() {
        when(selector.acknowledge(any())).thenReturn(Optional.of(open));
        when(selector.progress(any())).thenReturn(Optional.of(next));
        when(clicker.click(open)).thenReturn(ClickOutcome.noChange());
        when(clicker.click(next)).thenReturn(ClickOutcome.noChange(), ClickOutcome.advanced());

        assertTrue(resolver.resolve(capture(), NavigationState.LOGGED_IN, "job-1"));

        InOrder order = inOrder(clicker);
        order.verify(clicker, times(2)).click(open);
        order.verify(clicker, times(2)).click(next);
    }

    @Test
    void vanishedParentIsDroppedAndRemainingCandidateTried() {
        when(selector.acknowledge(any())).thenReturn(Optional.of(open));
        when(selector.progress(any())).thenReturn(Optional.of(next));
        // live while chosen and recorded, gone by the time it would be retried
        when(clicker.isLive(open)).thenReturn(true, true, false);
        when(clicker.click(open)).thenReturn(ClickOutcome.noChange());
        when(clicker.click(next)).thenReturn(ClickOutcome.advanced());

        assertTrue(resolver.resolve(capture(), NavigationState.LOGGED_IN, "job-1"));
        verify(clicker, times(1)).click(open);
        verify(clicker, times(1)).click(next);
    }

    @Test
    void revealedControlsAreResolvedOneLevelDeeperUpToTheDepthLimit() {
        when(selector.progress(any())).thenReturn(Optional.of(next));
        when(clicker.click(next)).thenReturn(ClickOutcome.revealed(List.of(new Element("button")), List.of()));
        ButtonDescriptor more = new ButtonDescriptor("button", Locator.of("//button[@id='more']"));
        when(extractor.extractRevealed(any(), any(), any(), any()))
                .thenReturn(new PageExtractor.Revealed(List.of(), List.of(more)));

        assertFalse(resolver.resolve(capture(), NavigationState.LOGGED_IN, "job-1"));

        int depth = AutofillSettings.defaults().getInt(Setting.NAVIGATION_MAX_DEPTH);
        verify(clicker, times(depth)).click(next);
        verify(extractor, times(depth)).extractRevealed(any(), any(), any(), any());
    }

    @Test
    void revealedControlIsClickedOnTheDeeperPass() {
        ActionItem more = item("//button[@id='more']", "Add another", ActionItem.Role.OTHER);
        when(selector.acknowledge(any())).thenReturn(Optional.empty(), Optional.of(more));
        when(selector.progress(any())).thenReturn(Optional.of(next));
        when(clicker.click(next)).thenReturn(ClickOutcome.revealed(List.of(new Element("button")), List.of()));
        when(clicker.click(more)).thenReturn(ClickOutcome.advanced());
        when(extractor.extractRevealed(any(), any(), any(), any()))
                .thenReturn(new PageExtractor.Revealed(List.of(), List.of((ButtonDescriptor) more.item())));

        assertTrue(resolver.resolve(capture(), NavigationState.LOGGED_IN, "job-1"));
        verify(clicker).click(more);
        verify(session, never()).refresh();
    }

    private PageCapture capture() {
        PageModel page = new PageModel(new PageMetadata("https://jobs.example/apply", "Apply", false),
                List.of(), List.of(), List.of());
        return new PageCapture(page, new ParseContext(profile, false));
    }

    private static ActionItem item(String xpath, String text, ActionItem.Role role) {
        ButtonDescriptor b = new ButtonDescriptor("button", Locator.of(xpath));
        b.setText(text);
        return ActionItem.of(b, role);
    }
}
