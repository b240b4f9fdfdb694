package io.poolermanager.mutation;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.poolermanager.models.Cluster;
import io.poolermanager.models.ClusterPhase;
import io.poolermanager.models.ClusterStatus;
import io.poolermanager.models.HibernationState;
import io.poolermanager.store.ClusterStore;
import io.poolermanager.store.ClusterStoreException;
import io.poolermanager.store.InstanceRegistry;
import io.poolermanager.store.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Set;

import static io.poolermanager.config.Constants.FENCED_INSTANCES_ANNOTATION;
import static io.poolermanager.config.Constants.FENCE_ALL_INSTANCES;
import static io.poolermanager.config.Constants.HIBERNATION_ANNOTATION;

/**
 * Operator changes to a cluster: promotion, fencing and hibernation.
 * <p>
 * Every operation reads the cluster, applies its change to that snapshot and submits it with a
 * revision precondition. On a conflict the whole read-change-submit sequence runs again on a
 * fresh snapshot, within the retry policy. The change itself depends only on the snapshot and
 * the request, so running it more than once is harmless. Validation failures are not retried.
 */
@Slf4j
public class ClusterStateMutator {

    private static final String INSTANCE_KIND = "instance";

    private final ClusterStore clusterStore;
    private final InstanceRegistry instanceRegistry;
    private final ObjectMapper objectMapper;
    private final String namespace;
    private final RetryPolicy retryPolicy;

    public ClusterStateMutator(ClusterStore clusterStore, InstanceRegistry instanceRegistry,
                               ObjectMapper objectMapper, String namespace) {
        this(clusterStore, instanceRegistry, objectMapper, namespace, RetryPolicy.defaultConflictPolicy());
    }

    public ClusterStateMutator(ClusterStore clusterStore, InstanceRegistry instanceRegistry,
                               ObjectMapper objectMapper, String namespace, RetryPolicy retryPolicy) {
        this.clusterStore = clusterStore;
        this.instanceRegistry = instanceRegistry;
        this.objectMapper = objectMapper;
        this.namespace = namespace;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Request a switchover of {@code clusterName} to {@code instanceName}.
     *
     * @throws ResourceNotFoundException if the instance or the cluster does not exist
     * @throws InvalidInstanceException  if the instance is not a member of the cluster
     */
    public void promote(String clusterName, String instanceName) throws ClusterStoreException {
        if (!instanceRegistry.exists(namespace, instanceName)) {
            throw new ResourceNotFoundException(INSTANCE_KIND, namespace, instanceName);
        }
        Retry.onConflict(retryPolicy, () -> {
            Cluster cluster = clusterStore.get(namespace, clusterName);
            applyPromotion(cluster, instanceName);
            clusterStore.updateStatus(cluster);
            return null;
        });
        log.info("[Cluster: {}] Switchover to {} requested", clusterName, instanceName);
    }

    /**
     * Fence {@code instanceName}, or every instance when it is {@code "*"}.
     */
    public void fenceOn(String clusterName, String instanceName) throws ClusterStoreException {
        applyFencing(clusterName, instanceName, true);
    }

    /**
     * Unfence {@code instanceName}, or every instance when it is {@code "*"}. An instance that is
     * fenced but no longer a member of the cluster can still be unfenced.
     */
    public void fenceOff(String clusterName, String instanceName) throws ClusterStoreException {
        applyFencing(clusterName, instanceName, false);
    }

    /**
     * @throws AlreadyInRequestedStateException if the cluster is already in {@code requested}
     */
    public void hibernate(String clusterName, HibernationState requested) throws ClusterStoreException {
        Retry.onConflict(retryPolicy, () -> {
            Cluster cluster = clusterStore.get(namespace, clusterName);
            if (hibernationState(cluster) == requested) {
                throw new AlreadyInRequestedStateException("Cluster " + clusterName + " hibernation is already "
                        + requested.getValue());
            }
            clusterStore.patchAnnotations(cluster,
                    Collections.singletonMap(HIBERNATION_ANNOTATION, requested.getValue()));
            return null;
        });
        log.info("[Cluster: {}] Hibernation set to {}", clusterName, requested.getValue());
    }

    /**
     * Hibernation state of a cluster snapshot. A missing or unrecognised annotation means off.
     */
    public static HibernationState hibernationState(Cluster cluster) {
        HibernationState state = HibernationState.fromString(cluster.getAnnotation(HIBERNATION_ANNOTATION));
        return state == null ? HibernationState.OFF : state;
    }

    static void applyPromotion(Cluster cluster, String instanceName) throws InvalidInstanceException {
        ClusterStatus status = cluster.getStatus();
        if (!status.getInstanceNames().contains(instanceName)) {
            throw new InvalidInstanceException("Instance " + instanceName + " is not a member of cluster "
                    + cluster.getName());
        }
        status.setTargetPrimary(instanceName);
        status.setPhase(ClusterPhase.SWITCHOVER.getValue());
        status.setPhaseReason("Switching over to " + instanceName);
    }

    private void applyFencing(String clusterName, String instanceName, boolean fence) throws ClusterStoreException {
        Retry.onConflict(retryPolicy, () -> {
            Cluster cluster = clusterStore.get(namespace, clusterName);
            Set<String> fenced = FencedInstances.read(cluster, objectMapper);

            if (!FENCE_ALL_INSTANCES.equals(instanceName)) {
                boolean member = cluster.getStatus().getInstanceNames().contains(instanceName);
                boolean unfencingRemovedMember = !fence && fenced.contains(instanceName);
                if (!member && !unfencingRemovedMember) {
                    throw new InvalidInstanceException("Instance " + instanceName + " is not a member of cluster "
                            + clusterName);
                }
            }

            boolean changed = fence
                    ? FencedInstances.add(fenced, instanceName)
                    : FencedInstances.remove(fenced, instanceName);
            if (!changed) {
                log.info("[Cluster: {}] Fencing of {} already {}", clusterName, instanceName, fence ? "on" : "off");
                return null;
            }
            clusterStore.patchAnnotations(cluster, Collections.singletonMap(FENCED_INSTANCES_ANNOTATION,
                    FencedInstances.write(fenced, objectMapper)));
            return null;
        });
        log.info("[Cluster: {}] Instance {} {}", clusterName, instanceName, fence ? "fenced" : "unfenced");
    }
}
