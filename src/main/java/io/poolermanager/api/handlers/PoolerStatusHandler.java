package io.poolermanager.api.handlers;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.poolermanager.PoolerInstanceManager;
import io.poolermanager.api.models.responses.ClusterStatusResponse;
import io.poolermanager.api.models.responses.ErrorResponse;
import io.poolermanager.api.models.responses.PoolerStatusResponse;
import io.poolermanager.config.PoolerManagerConfig;
import io.poolermanager.models.Cluster;
import io.poolermanager.mutation.ClusterStateMutator;
import io.poolermanager.mutation.FencedInstances;
import io.poolermanager.process.SupervisedProcess;
import io.poolermanager.store.ClusterStore;
import io.poolermanager.store.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API handler reporting on the managed pooler and on clusters of its namespace.
 *
 * Supported operations:
 * - GET /status - State of the pooler process
 * - GET /clusters/{clusterName} - Phase, primaries, members, fencing and hibernation of a cluster
 */
@Slf4j
@RestController
public class PoolerStatusHandler {

    private final PoolerInstanceManager instanceManager;
    private final PoolerManagerConfig config;
    private final ClusterStore clusterStore;
    private final ObjectMapper objectMapper;

    public PoolerStatusHandler(PoolerInstanceManager instanceManager, PoolerManagerConfig config,
                               ClusterStore clusterStore, ObjectMapper objectMapper) {
        this.instanceManager = instanceManager;
        this.config = config;
        this.clusterStore = clusterStore;
        this.objectMapper = objectMapper;
    }

    /**
     * GET /status
     */
    @GetMapping("/status")
    public ResponseEntity<Object> getPoolerStatus() {
        SupervisedProcess process = instanceManager.getProcess();
        boolean running = process != null && process.isRunning();
        PoolerStatusResponse response = PoolerStatusResponse.builder()
            .poolerName(config.getPoolerName())
            .namespace(config.getNamespace())
            .running(running)
            .pid(running ? process.pid() : null)
            .configurationFile(config.getPgbouncerIniPath().toString())
            .build();
        if (!running) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        }
        return ResponseEntity.ok(response);
    }

    /**
     * GET /clusters/{clusterName}
     */
    @GetMapping("/clusters/{clusterName}")
    public ResponseEntity<Object> getClusterStatus(@PathVariable String clusterName) {
        try {
            log.info("Getting status of cluster '{}'", clusterName);
            Cluster cluster = clusterStore.get(config.getNamespace(), clusterName);
            ClusterStatusResponse response = ClusterStatusResponse.from(cluster,
                FencedInstances.read(cluster, objectMapper), ClusterStateMutator.hibernationState(cluster));
            return ResponseEntity.ok(response);
        } catch (ResourceNotFoundException e) {
            log.warn("Cluster '{}' not found: {}", clusterName, e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Cluster " + clusterName));
        } catch (Exception e) {
            log.error("Error getting status of cluster '{}': {}", clusterName, e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.internalError(e.getMessage()));
        }
    }
}
