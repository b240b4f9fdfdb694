package io.poolermanager.mutation;

import io.poolermanager.store.ClusterStoreException;
import io.poolermanager.store.ConflictException;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Predicate;

/**
 * Runs an action again while it fails with a retriable error and the policy allows it.
 */
@Slf4j
public final class Retry {

    private Retry() {
        // Utility class
    }

    @FunctionalInterface
    public interface Action<T> {
        T run() throws ClusterStoreException;
    }

    /**
     * Retries only on {@link ConflictException}; any other error is returned at once.
     */
    public static <T> T onConflict(RetryPolicy policy, Action<T> action) throws ClusterStoreException {
        return onError(policy, e -> e instanceof ConflictException, action);
    }

    /**
     * @throws ClusterStoreException the first non-retriable error, or the last retriable one once
     *                               the policy is exhausted
     */
    public static <T> T onError(RetryPolicy policy, Predicate<ClusterStoreException> retriable,
                                Action<T> action) throws ClusterStoreException {
        ClusterStoreException lastError = null;
        for (int attempt = 1; attempt <= policy.getSteps(); attempt++) {
            if (attempt > 1) {
                backOff(policy.delayBeforeRetry(attempt - 1), lastError);
            }
            try {
                return action.run();
            } catch (ClusterStoreException e) {
                if (!retriable.test(e)) {
                    throw e;
                }
                lastError = e;
                log.info("Attempt {}/{} failed, will retry: {}", attempt, policy.getSteps(), e.getMessage());
            }
        }
        log.warn("Giving up after {} attempts", policy.getSteps());
        throw lastError;
    }

    private static void backOff(long delayMs, ClusterStoreException lastError) throws ClusterStoreException {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ClusterStoreException interrupted = new ClusterStoreException("Interrupted while waiting to retry", e);
            interrupted.addSuppressed(lastError);
            throw interrupted;
        }
    }
}
