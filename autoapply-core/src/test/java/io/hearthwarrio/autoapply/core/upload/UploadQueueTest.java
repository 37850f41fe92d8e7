package io.hearthwarrio.autoapply.core.upload;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class UploadQueueTest {

    @Test
    void returnsTaskResult() {
        UploadQueue queue = new UploadQueue();

        assertEquals("done", queue.run("w1", () -> "done"));
        assertFalse(queue.isBusy());
    }

    @Test
    void neverRunsTwoUploadsAtOnce() throws Exception {
        UploadQueue queue = new UploadQueue();
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            Future<?>[] futures = new Future<?>[8];
            for (int i = 0; i < futures.length; i++) {
                String caller = "w" + i;
                futures[i] = pool.submit(() -> {
                    start.await();
                    return queue.run(caller, () -> {
                        int now = active.incrementAndGet();
                        maxActive.accumulateAndGet(now, Math::max);
                        try {
                            Thread.sleep(10);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        active.decrementAndGet();
                        return caller;
                    });
                });
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, maxActive.get());
        assertEquals(0, queue.waiting());
    }

    @Test
    void releasesPickerWhenTaskFails() {
        UploadQueue queue = new UploadQueue();

        assertThrows(IllegalStateException.class, () -> queue.run("w1", () -> {
            throw new IllegalStateException("dialog closed");
        }));
        assertFalse(queue.isBusy());
    }

    @Test
    void globalQueueIsShared() {
        assertSame(UploadQueue.global(), UploadQueue.global());
    }
}
