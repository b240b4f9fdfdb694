package io.poolermanager.reconciler;

import io.poolermanager.lifecycle.LifecycleContext;

/**
 * Background loop keeping the pooler configuration in line with its desired state.
 */
public interface ReconciliationLoop {

    /**
     * One-time setup before the pooler starts. A failure aborts start-up.
     */
    void init(LifecycleContext context) throws Exception;

    /**
     * Runs until the context is cancelled or {@link #stop()} is called.
     */
    void run(LifecycleContext context);

    /**
     * Requests termination. Idempotent and non-blocking: it does not wait for
     * {@link #run(LifecycleContext)} to return.
     */
    void stop();
}
