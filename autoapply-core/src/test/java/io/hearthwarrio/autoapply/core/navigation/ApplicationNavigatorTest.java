package io.hearthwarrio.autoapply.core.navigation;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.JsonProfileStore;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.config.Setting;
import io.hearthwarrio.autoapply.core.extract.PageExtractor;
import io.hearthwarrio.autoapply.core.model.LinkDescriptor;
import io.hearthwarrio.autoapply.core.model.Locator;
import io.hearthwarrio.autoapply.core.model.NavigationState;
import io.hearthwarrio.autoapply.core.model.PageMetadata;
import io.hearthwarrio.autoapply.core.model.PageModel;
import io.hearthwarrio.autoapply.core.session.BrowserSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ApplicationNavigatorTest {

    private static final String URL = "https://jobs.example/postings/42";
    private static final Instant START = Instant.parse("2026-03-02T09:00:00Z");

    private final PageModel page = new PageModel(new PageMetadata(URL, "Backend Engineer", false),
            List.of(), List.of(), List.of());

    private BrowserSession session;
    private StateDetector detector;
    private PageResolver resolver;
    private ActionSelector selector;

    @BeforeEach
    void setUp() {
        session = mock(BrowserSession.class);
        detector = mock(StateDetector.class);
        resolver = mock(PageResolver.class);
        selector = mock(ActionSelector.class);
    }

    @Test
    void submittedPageEndsTheJob() {
        when(detector.detect(any(), any(), any())).thenReturn(Optional.of(NavigationState.SUBMITTED));

        assertTrue(navigator(Clock.fixed(START, ZoneOffset.UTC)).apply(URL, "job-42"));
        verify(session).open(URL);
        verify(resolver, never()).resolve(any(), any(), any());
    }

    @Test
    void jobGivesUpAfterTheIterationLimit() {
        when(detector.detect(any(), any(), any())).thenReturn(Optional.of(NavigationState.LOGGED_IN));
        when(resolver.resolve(any(), any(), any())).thenReturn(true);

        assertFalse(navigator(Clock.fixed(START, ZoneOffset.UTC)).apply(URL, "job-42"));

        int limit = AutofillSettings.defaults().getInt(Setting.JOB_MAX_ITERATIONS);
        assertEquals(18, limit);
        verify(resolver, times(limit)).resolve(any(), eq(NavigationState.LOGGED_IN), eq("job-42"));
    }

    @Test
    void jobGivesUpAfterTheTimeLimit() {
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenReturn(START, START.plus(Duration.ofMinutes(1)), START.plus(Duration.ofMinutes(31)));
        when(detector.detect(any(), any(), any())).thenReturn(Optional.of(NavigationState.LOGGED_IN));
        when(resolver.resolve(any(), any(), any())).thenReturn(true);

        assertFalse(navigator(clock).apply(URL, "job-42"));
        verify(resolver, times(1)).resolve(any(), any(), any());
    }

    @Test
    void stateNeverMovesBackwards() {
        when(detector.detect(any(), any(), any())).thenReturn(
                Optional.of(NavigationState.LOGGED_IN),
                Optional.of(NavigationState.AUTH),
                Optional.of(NavigationState.SUBMITTED));
        when(resolver.resolve(any(), any(), any())).thenReturn(true);
        ApplicationNavigator navigator = navigator(Clock.fixed(START, ZoneOffset.UTC));

        assertTrue(navigator.apply(URL, "job-42"));

        verify(resolver, times(2)).resolve(any(), eq(NavigationState.LOGGED_IN), any());
        verify(resolver, never()).resolve(any(), eq(NavigationState.AUTH), any());
        assertEquals(List.of(NavigationState.DESCRIPTION, NavigationState.LOGGED_IN,
                        NavigationState.LOGGED_IN, NavigationState.SUBMITTED),
                navigator.tracker().history());
    }

    @Test
    void pageWithoutWayForwardFailsTheJob() {
        when(detector.detect(any(), any(), any())).thenReturn(Optional.of(NavigationState.AUTH));
        when(resolver.resolve(any(), any(), any())).thenReturn(false);

        NavigationException e = assertThrows(NavigationException.class,
                () -> navigator(Clock.fixed(START, ZoneOffset.UTC)).apply(URL, "job-42"));
        assertTrue(e.getMessage().contains("AUTH"));
    }

    @Test
    void descriptionPageFollowsTheApplyLink() {
        LinkDescriptor apply = new LinkDescriptor(Locator.of("//a[@id='apply']"));
        apply.setText("Apply now");
        apply.setHref("https://jobs.example/postings/42/apply");
        when(selector.apply(any())).thenReturn(Optional.of(ActionItem.of(apply, ActionItem.Role.APPLY)));
        when(detector.detect(any(), any(), any())).thenReturn(Optional.empty(), Optional.of(NavigationState.SUBMITTED));

        assertTrue(navigator(Clock.fixed(START, ZoneOffset.UTC)).apply(URL, "job-42"));
        verify(session).open("https://jobs.example/postings/42/apply");
        verify(resolver, never()).resolve(any(), any(), any());
    }

    private ApplicationNavigator navigator(Clock clock) {
        PageExtractor extractor = mock(PageExtractor.class);
        when(extractor.parse(any(), any())).thenReturn(page);
        SectionExpander expander = mock(SectionExpander.class);
        when(expander.expand(any())).thenAnswer(inv -> inv.getArgument(0));
        return new ApplicationNavigator(session, extractor, detector, resolver, expander, selector,
                mock(ActionClicker.class), KeywordTables.defaults(), JsonProfileStore.parse("{}"),
                AutofillSettings.defaults(), clock);
    }
}
