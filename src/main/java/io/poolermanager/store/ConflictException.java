package io.poolermanager.store;

/**
 * The object changed between the read and the write. Re-read and try again.
 */
public class ConflictException extends ClusterStoreException {

    public ConflictException(String message) {
        super(message);
    }
}
