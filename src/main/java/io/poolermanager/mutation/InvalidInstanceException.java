package io.poolermanager.mutation;

import io.poolermanager.store.ClusterStoreException;

/**
 * The instance named in a request is not usable for that request, e.g. it is not a member of
 * the cluster.
 */
public class InvalidInstanceException extends ClusterStoreException {

    public InvalidInstanceException(String message) {
        super(message);
    }
}
