package io.poolermanager.store;

/**
 * Lookup of database instances by name.
 */
public interface InstanceRegistry {

    boolean exists(String namespace, String instanceName) throws ClusterStoreException;
}
