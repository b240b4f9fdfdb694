package io.poolermanager.reconciler;

import io.poolermanager.store.ClusterStoreException;

/**
 * Where the desired pooler configuration comes from.
 */
@FunctionalInterface
public interface PoolerConfigurationSource {

    /**
     * @return the full content of the pooler configuration file
     */
    String fetchConfiguration() throws ClusterStoreException;
}
