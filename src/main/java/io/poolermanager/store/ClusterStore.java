package io.poolermanager.store;

import io.poolermanager.models.Cluster;

import java.util.Map;

/**
 * Read and conditionally write cluster objects.
 * <p>
 * Writes are guarded by the revision carried in the snapshot: when the stored object changed
 * since the snapshot was read, the write is rejected with a {@link ConflictException} and
 * nothing is modified.
 */
public interface ClusterStore {

    /**
     * @throws ResourceNotFoundException if no such cluster exists
     */
    Cluster get(String namespace, String name) throws ClusterStoreException;

    /**
     * Replace the status section of the stored object with the status of {@code cluster}.
     */
    void updateStatus(Cluster cluster) throws ClusterStoreException;

    /**
     * Apply annotation changes to the stored object. A {@code null} value removes the key.
     */
    void patchAnnotations(Cluster cluster, Map<String, String> changes) throws ClusterStoreException;
}
