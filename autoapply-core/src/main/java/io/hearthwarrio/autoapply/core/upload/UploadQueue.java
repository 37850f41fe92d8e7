package io.hearthwarrio.autoapply.core.upload;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes every upload that may open an OS file picker.
 * <p>
 * Only one picker can be active system-wide, so all sessions share {@link #global()}. The lock is fair:
 * waiting callers are served in arrival order.
 */
public final class UploadQueue {

    private static final Logger log = LoggerFactory.getLogger(UploadQueue.class);

    private static final UploadQueue GLOBAL = new UploadQueue();

    private final ReentrantLock lock = new ReentrantLock(true);

    UploadQueue() {
    }

    public static UploadQueue global() {
        return GLOBAL;
    }

    /**
     * Runs the task while holding the picker.
     *
     * @param caller name used in logs, usually the worker thread or job url
     */
    public <T> T run(String caller, Supplier<T> task) {
        Objects.requireNonNull(task, "task must not be null");
        if (lock.isLocked()) {
            log.info("{} waits for the file picker ({} queued)", caller, lock.getQueueLength());
        }
        lock.lock();
        try {
            log.debug("{} holds the file picker", caller);
            return task.get();
        } finally {
            lock.unlock();
        }
    }

    public int waiting() {
        return lock.getQueueLength();
    }

    public boolean isBusy() {
        return lock.isLocked();
    }
}
