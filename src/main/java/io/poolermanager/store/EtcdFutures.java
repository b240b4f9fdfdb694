package io.poolermanager.store;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static io.poolermanager.config.Constants.ETCD_OPERATION_TIMEOUT_SECONDS;

final class EtcdFutures {

    private EtcdFutures() {
        // Utility class
    }

    static <T> T await(CompletableFuture<T> future, String operation) throws ClusterStoreException {
        try {
            return future.get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClusterStoreException("Interrupted while trying to " + operation, e);
        } catch (ExecutionException e) {
            throw new ClusterStoreException("Failed to " + operation, e.getCause());
        } catch (TimeoutException e) {
            throw new ClusterStoreException("Timed out trying to " + operation, e);
        }
    }
}
