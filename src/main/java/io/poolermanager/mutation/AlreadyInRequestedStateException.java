package io.poolermanager.mutation;

import io.poolermanager.store.ClusterStoreException;

/**
 * The requested change would leave the cluster as it is. Nothing was written.
 */
public class AlreadyInRequestedStateException extends ClusterStoreException {

    public AlreadyInRequestedStateException(String message) {
        super(message);
    }
}
