package io.hearthwarrio.autoapply.core.runtime;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.Setting;
import io.hearthwarrio.autoapply.core.session.JobQueue;
import io.hearthwarrio.autoapply.core.session.JobQueueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of workers, each polling the job queue and running one job at a time.
 * <p>
 * Workers share nothing except the queue, the runner's shared collaborators and the upload queue.
 */
public final class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final JobQueue queue;
    private final JobRunner runner;
    private final int workerCount;
    private final Duration pollInterval;

    private volatile ExecutorService executor;

    public WorkerPool(JobQueue queue, JobRunner runner, AutofillSettings settings) {
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        this.workerCount = Math.max(1, settings.getInt(Setting.WORKER_COUNT));
        this.pollInterval = settings.seconds(Setting.QUEUE_POLL_SECONDS);
    }

    public synchronized void start() {
        if (executor != null) {
            throw new IllegalStateException("Worker pool already started");
        }
        log.info("Starting job scheduler with {} worker(s)", workerCount);
        executor = Executors.newFixedThreadPool(workerCount, new WorkerThreads());
        for (int i = 0; i < workerCount; i++) {
            executor.submit(this::work);
        }
    }

    /**
     * Takes one job from the queue and runs it.
     *
     * @return false when the queue had nothing to hand out
     */
    public boolean pollOnce(String caller) {
        Optional<String> next;
        try {
            next = queue.nextJob();
        } catch (JobQueueException e) {
            log.warn("Error fetching next job: {}", e.getMessage());
            return false;
        }
        if (next.isEmpty()) {
            return false;
        }

        String url = next.get();
        log.info("Starting job for {}", url);
        boolean success = runner.run(url, caller);
        try {
            queue.reportResult(url, success);
        } catch (JobQueueException e) {
            log.error("Failed to mark job result for {}: {}", url, e.getMessage());
        }
        return true;
    }

    private void work() {
        String caller = Thread.currentThread().getName();
        while (!Thread.currentThread().isInterrupted()) {
            if (pollOnce(caller)) {
                continue;
            }
            log.debug("No new jobs available, sleeping for {}s", pollInterval.toSeconds());
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.debug("Worker {} stopped", caller);
    }

    /**
     * Blocks until the pool is closed from another thread.
     */
    public void awaitTermination() throws InterruptedException {
        ExecutorService current = executor;
        if (current != null) {
            current.awaitTermination(Long.MAX_VALUE, TimeUnit.DAYS);
        }
    }

    @Override
    public synchronized void close() {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Workers did not stop within 30s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executor = null;
    }

    private static final class WorkerThreads implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            return new Thread(task, "autoapply-worker-" + counter.incrementAndGet());
        }
    }
}
