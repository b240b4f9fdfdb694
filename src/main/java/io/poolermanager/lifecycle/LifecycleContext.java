package io.poolermanager.lifecycle;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation shared by every long-running task of the run command.
 * <p>
 * Cancelled once, on the first termination signal. Tasks either poll {@link #isCancelled()},
 * sleep through {@link #awaitCancellation(long, TimeUnit)}, or register a callback.
 */
@Slf4j
public class LifecycleContext {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public void cancel() {
        if (cancelled.getCount() == 0) {
            return;
        }
        cancelled.countDown();
        for (Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.error("Cancellation callback failed", e);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Sleeps until cancelled or until the timeout elapses.
     *
     * @return true if the context is cancelled
     */
    public boolean awaitCancellation(long timeout, TimeUnit unit) throws InterruptedException {
        return cancelled.await(timeout, unit);
    }

    /**
     * Runs {@code callback} on cancellation, or right away if already cancelled.
     */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (isCancelled() && callbacks.remove(callback)) {
            callback.run();
        }
    }
}
