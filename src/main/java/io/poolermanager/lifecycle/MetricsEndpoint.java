package io.poolermanager.lifecycle;

/**
 * The HTTP endpoint serving metrics and probes for the pooler.
 */
public interface MetricsEndpoint {

    void shutdown() throws Exception;
}
