package io.poolermanager.mutation;

import lombok.Getter;

import java.util.concurrent.ThreadLocalRandom;

import static io.poolermanager.config.Constants.CONFLICT_RETRY_FACTOR;
import static io.poolermanager.config.Constants.CONFLICT_RETRY_INITIAL_DELAY_MS;
import static io.poolermanager.config.Constants.CONFLICT_RETRY_JITTER;
import static io.poolermanager.config.Constants.CONFLICT_RETRY_STEPS;

/**
 * Bounded exponential backoff: at most {@code steps} attempts, waiting
 * {@code initialDelayMs * factor^(n-1)} plus up to {@code jitter} of that before the n-th retry.
 */
@Getter
public class RetryPolicy {

    private static final RetryPolicy DEFAULT_CONFLICT_POLICY = new RetryPolicy(
            CONFLICT_RETRY_STEPS, CONFLICT_RETRY_INITIAL_DELAY_MS, CONFLICT_RETRY_FACTOR, CONFLICT_RETRY_JITTER);

    private final int steps;
    private final long initialDelayMs;
    private final double factor;
    private final double jitter;

    public RetryPolicy(int steps, long initialDelayMs, double factor, double jitter) {
        if (steps < 1) {
            throw new IllegalArgumentException("steps must be at least 1, got " + steps);
        }
        if (initialDelayMs < 0 || factor < 1.0 || jitter < 0) {
            throw new IllegalArgumentException("invalid backoff: delay=" + initialDelayMs
                    + "ms factor=" + factor + " jitter=" + jitter);
        }
        this.steps = steps;
        this.initialDelayMs = initialDelayMs;
        this.factor = factor;
        this.jitter = jitter;
    }

    public static RetryPolicy defaultConflictPolicy() {
        return DEFAULT_CONFLICT_POLICY;
    }

    /**
     * Delay before retry number {@code retry} (1 for the first retry).
     */
    long delayBeforeRetry(int retry) {
        double delay = initialDelayMs * Math.pow(factor, retry - 1);
        if (jitter > 0) {
            delay += ThreadLocalRandom.current().nextDouble() * jitter * delay;
        }
        return Math.round(delay);
    }
}
