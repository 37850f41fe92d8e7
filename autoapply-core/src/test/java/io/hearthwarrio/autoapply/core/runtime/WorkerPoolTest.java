package io.hearthwarrio.autoapply.core.runtime;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.Setting;
import io.hearthwarrio.autoapply.core.session.JobQueue;
import io.hearthwarrio.autoapply.core.session.JobQueueException;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class WorkerPoolTest {

    private static final String URL = "https://jobs.example.com/7";

    private final JobQueue queue = mock(JobQueue.class);
    private final JobRunner runner = mock(JobRunner.class);
    private final AutofillSettings settings = AutofillSettings.defaults().with(Setting.QUEUE_POLL_SECONDS, 0.05);

    @Test
    void runsJobAndReportsOutcome() {
        when(queue.nextJob()).thenReturn(Optional.of(URL));
        when(runner.run(URL, "w")).thenReturn(true);

        assertTrue(new WorkerPool(queue, runner, settings).pollOnce("w"));

        verify(queue).reportResult(URL, true);
    }

    @Test
    void emptyQueueRunsNothing() {
        when(queue.nextJob()).thenReturn(Optional.empty());

        assertFalse(new WorkerPool(queue, runner, settings).pollOnce("w"));

        verifyNoInteractions(runner);
    }

    @Test
    void queueErrorIsTreatedAsEmpty() {
        when(queue.nextJob()).thenThrow(new JobQueueException("connection refused"));

        assertFalse(new WorkerPool(queue, runner, settings).pollOnce("w"));

        verifyNoInteractions(runner);
        verify(queue, never()).reportResult(anyString(), anyBoolean());
    }

    @Test
    void reportErrorDoesNotStopTheWorker() {
        when(queue.nextJob()).thenReturn(Optional.of(URL));
        when(runner.run(URL, "w")).thenReturn(false);
        doThrow(new JobQueueException("500")).when(queue).reportResult(URL, false);

        assertTrue(new WorkerPool(queue, runner, settings).pollOnce("w"));
    }

    @Test
    void startedWorkersPollUntilClosed() throws InterruptedException {
        CountDownLatch reported = new CountDownLatch(1);
        when(queue.nextJob()).thenReturn(Optional.of(URL), Optional.empty());
        when(runner.run(anyString(), anyString())).thenReturn(true);
        doAnswer(inv -> {
            reported.countDown();
            return null;
        }).when(queue).reportResult(URL, true);

        try (WorkerPool pool = new WorkerPool(queue, runner, settings)) {
            pool.start();
            assertTrue(reported.await(5, TimeUnit.SECONDS));
        }
        verify(runner).run(anyString(), org.mockito.ArgumentMatchers.startsWith("autoapply-worker-"));
    }
}
