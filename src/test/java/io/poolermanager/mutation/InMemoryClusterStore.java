package io.poolermanager.mutation;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.poolermanager.models.Cluster;
import io.poolermanager.store.ClusterStore;
import io.poolermanager.store.ClusterStoreException;
import io.poolermanager.store.ConflictException;
import io.poolermanager.store.InstanceRegistry;
import io.poolermanager.store.ResourceNotFoundException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Cluster store keeping revisions in memory. Concurrent writers are simulated by queueing
 * changes that are applied right before the next write, which then fails with a conflict.
 */
class InMemoryClusterStore implements ClusterStore, InstanceRegistry {

    private final ObjectMapper objectMapper;
    private final Map<String, Cluster> clusters = new HashMap<>();
    private final Set<String> instances = new HashSet<>();
    private final Deque<Consumer<Cluster>> concurrentWrites = new ArrayDeque<>();
    private long revision = 1;
    private int successfulWrites;
    private int attemptedWrites;

    InMemoryClusterStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    void put(Cluster cluster) {
        cluster.setRevision(++revision);
        clusters.put(key(cluster.getNamespace(), cluster.getName()), copy(cluster));
    }

    void addInstance(String namespace, String name) {
        instances.add(key(namespace, name));
    }

    void concurrentWrite(Consumer<Cluster> change) {
        concurrentWrites.add(change);
    }

    Cluster stored(String namespace, String name) {
        return copy(clusters.get(key(namespace, name)));
    }

    int getSuccessfulWrites() {
        return successfulWrites;
    }

    int getAttemptedWrites() {
        return attemptedWrites;
    }

    @Override
    public Cluster get(String namespace, String name) throws ClusterStoreException {
        Cluster cluster = clusters.get(key(namespace, name));
        if (cluster == null) {
            throw new ResourceNotFoundException("cluster", namespace, name);
        }
        return copy(cluster);
    }

    @Override
    public void updateStatus(Cluster cluster) throws ClusterStoreException {
        Cluster current = checkRevision(cluster);
        current.setStatus(copy(cluster).getStatus());
        commit(current);
    }

    @Override
    public void patchAnnotations(Cluster cluster, Map<String, String> changes) throws ClusterStoreException {
        Cluster current = checkRevision(cluster);
        changes.forEach((key, value) -> {
            if (value == null) {
                current.getMetadata().getAnnotations().remove(key);
            } else {
                current.getMetadata().getAnnotations().put(key, value);
            }
        });
        commit(current);
    }

    @Override
    public boolean exists(String namespace, String instanceName) {
        return instances.contains(key(namespace, instanceName));
    }

    private Cluster checkRevision(Cluster cluster) throws ClusterStoreException {
        attemptedWrites++;
        String key = key(cluster.getNamespace(), cluster.getName());
        Consumer<Cluster> concurrent = concurrentWrites.poll();
        if (concurrent != null) {
            Cluster other = copy(clusters.get(key));
            concurrent.accept(other);
            put(other);
        }
        Cluster current = copy(clusters.get(key));
        if (current.getRevision() != cluster.getRevision()) {
            throw new ConflictException("cluster " + key + " changed");
        }
        return current;
    }

    private void commit(Cluster cluster) {
        successfulWrites++;
        put(cluster);
    }

    private Cluster copy(Cluster cluster) {
        Cluster copy = objectMapper.convertValue(cluster, Cluster.class);
        copy.setRevision(cluster.getRevision());
        return copy;
    }

    private static String key(String namespace, String name) {
        return namespace + "/" + name;
    }
}
