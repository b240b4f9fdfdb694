package io.poolermanager.mutation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.poolermanager.models.Cluster;
import io.poolermanager.store.ClusterStoreException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static io.poolermanager.config.Constants.FENCED_INSTANCES_ANNOTATION;
import static io.poolermanager.config.Constants.FENCE_ALL_INSTANCES;

/**
 * Reads and writes the set of fenced instances kept in a cluster annotation as a JSON array.
 * The entry {@code "*"} fences every instance and is never combined with names.
 */
public final class FencedInstances {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private FencedInstances() {
        // Utility class
    }

    public static Set<String> read(Cluster cluster, ObjectMapper objectMapper) throws ClusterStoreException {
        String value = cluster.getAnnotation(FENCED_INSTANCES_ANNOTATION);
        if (value == null || value.isBlank()) {
            return new TreeSet<>();
        }
        try {
            List<String> names = objectMapper.readValue(value, STRING_LIST);
            return names == null ? new TreeSet<>() : new TreeSet<>(names);
        } catch (JsonProcessingException e) {
            throw new ClusterStoreException("Invalid " + FENCED_INSTANCES_ANNOTATION + " annotation on cluster "
                    + cluster.getName() + ": " + value, e);
        }
    }

    /**
     * Annotation value for {@code fenced}, or {@code null} when the annotation should be removed.
     */
    public static String write(Set<String> fenced, ObjectMapper objectMapper) throws ClusterStoreException {
        if (fenced.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(new ArrayList<>(new TreeSet<>(fenced)));
        } catch (JsonProcessingException e) {
            throw new ClusterStoreException("Failed to serialize fenced instances " + fenced, e);
        }
    }

    /**
     * @return false when {@code instance} was already fenced, directly or through {@code "*"}
     */
    public static boolean add(Set<String> fenced, String instance) {
        if (fenced.contains(FENCE_ALL_INSTANCES)) {
            return false;
        }
        if (FENCE_ALL_INSTANCES.equals(instance)) {
            fenced.clear();
            fenced.add(FENCE_ALL_INSTANCES);
            return true;
        }
        return fenced.add(instance);
    }

    /**
     * @return false when {@code instance} was not fenced
     * @throws InvalidInstanceException when a single instance is unfenced while every instance is
     */
    public static boolean remove(Set<String> fenced, String instance) throws InvalidInstanceException {
        if (FENCE_ALL_INSTANCES.equals(instance)) {
            boolean changed = !fenced.isEmpty();
            fenced.clear();
            return changed;
        }
        if (fenced.contains(FENCE_ALL_INSTANCES)) {
            throw new InvalidInstanceException("All instances are fenced, unfence \"" + FENCE_ALL_INSTANCES
                    + "\" before unfencing " + instance);
        }
        return fenced.remove(instance);
    }
}
