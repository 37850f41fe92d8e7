package io.hearthwarrio.autoapply.core.runtime;

import io.hearthwarrio.autoapply.core.navigation.ApplicationNavigator;
import io.hearthwarrio.autoapply.core.navigation.NavigationException;
import io.hearthwarrio.autoapply.core.session.BrowserSession;
import io.hearthwarrio.autoapply.core.session.SessionException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class JobRunnerTest {

    private static final String URL = "https://jobs.example.com/42";

    private final BrowserSession session = mock(BrowserSession.class);
    private final NavigatorFactory navigators = mock(NavigatorFactory.class);
    private final ApplicationNavigator navigator = mock(ApplicationNavigator.class);

    @Test
    void reportsNavigatorResultAndClosesSession() {
        when(navigators.create(session)).thenReturn(navigator);
        when(navigator.apply(URL, "worker-1")).thenReturn(true);

        boolean result = new JobRunner(() -> session, navigators).run(URL, "worker-1");

        assertTrue(result);
        verify(session).close();
    }

    @Test
    void unexpectedErrorFailsTheJobAndStillCloses() {
        when(navigators.create(session)).thenReturn(navigator);
        when(navigator.apply(any(), any())).thenThrow(new SessionException("browser crashed"));

        boolean result = new JobRunner(() -> session, navigators).run(URL, "worker-1");

        assertFalse(result);
        verify(session).close();
    }

    @Test
    void deadEndPageFailsTheJob() {
        when(navigators.create(session)).thenReturn(navigator);
        when(navigator.apply(URL, "worker-1")).thenThrow(new NavigationException("Could not resolve LOGGED_IN page"));

        assertFalse(new JobRunner(() -> session, navigators).run(URL, "worker-1"));
        verify(session).close();
    }

    @Test
    void sessionThatCannotOpenFailsTheJob() {
        SessionFactory broken = () -> {
            throw new SessionException("no driver");
        };

        assertFalse(new JobRunner(broken, navigators).run(URL, "worker-1"));
        verify(navigators, never()).create(any());
    }

    @Test
    void closeFailureDoesNotChangeTheResult() {
        when(navigators.create(session)).thenReturn(navigator);
        when(navigator.apply(URL, "worker-1")).thenReturn(true);
        doThrow(new SessionException("already gone")).when(session).close();

        assertTrue(new JobRunner(() -> session, navigators).run(URL, "worker-1"));
    }
}
