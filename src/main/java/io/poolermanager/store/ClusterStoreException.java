package io.poolermanager.store;

/**
 * Failure reading or changing cluster state.
 */
public class ClusterStoreException extends Exception {

    public ClusterStoreException(String message) {
        super(message);
    }

    public ClusterStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
