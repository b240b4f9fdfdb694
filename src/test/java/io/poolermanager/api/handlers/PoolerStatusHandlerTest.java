package io.poolermanager.api.handlers;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.poolermanager.PoolerInstanceManager;
import io.poolermanager.api.models.responses.ClusterStatusResponse;
import io.poolermanager.api.models.responses.ErrorResponse;
import io.poolermanager.api.models.responses.PoolerStatusResponse;
import io.poolermanager.config.ObjectMappers;
import io.poolermanager.config.PoolerManagerConfig;
import io.poolermanager.models.Cluster;
import io.poolermanager.process.SupervisedProcess;
import io.poolermanager.store.ClusterStore;
import io.poolermanager.store.ClusterStoreException;
import io.poolermanager.store.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.nio.file.Paths;
import java.util.List;

import static io.poolermanager.config.Constants.FENCED_INSTANCES_ANNOTATION;
import static io.poolermanager.config.Constants.HIBERNATION_ANNOTATION;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

class PoolerStatusHandlerTest {

    @Mock
    private PoolerInstanceManager instanceManager;

    @Mock
    private PoolerManagerConfig config;

    @Mock
    private ClusterStore clusterStore;

    @Mock
    private SupervisedProcess process;

    private final ObjectMapper objectMapper = ObjectMappers.create();
    private PoolerStatusHandler handler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(config.getPoolerName()).thenReturn("pooler-rw");
        when(config.getNamespace()).thenReturn("default");
        when(config.getPgbouncerIniPath()).thenReturn(Paths.get("/controller/configs/pgbouncer.ini"));
        handler = new PoolerStatusHandler(instanceManager, config, clusterStore, objectMapper);
    }

    @Test
    void testGetPoolerStatus_Running() {
        // Given
        when(instanceManager.getProcess()).thenReturn(process);
        when(process.isRunning()).thenReturn(true);
        when(process.pid()).thenReturn(4242L);

        // When
        ResponseEntity<Object> response = handler.getPoolerStatus();

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        PoolerStatusResponse body = (PoolerStatusResponse) response.getBody();
        assertThat(body.isRunning()).isTrue();
        assertThat(body.getPid()).isEqualTo(4242L);
        assertThat(body.getPoolerName()).isEqualTo("pooler-rw");
        assertThat(body.getConfigurationFile()).isEqualTo("/controller/configs/pgbouncer.ini");
    }

    @Test
    void testGetPoolerStatus_NotStarted() {
        // Given
        when(instanceManager.getProcess()).thenReturn(null);

        // When
        ResponseEntity<Object> response = handler.getPoolerStatus();

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        PoolerStatusResponse body = (PoolerStatusResponse) response.getBody();
        assertThat(body.isRunning()).isFalse();
        assertThat(body.getPid()).isNull();
    }

    @Test
    void testGetClusterStatus_Success() throws Exception {
        // Given
        Cluster cluster = new Cluster("default", "cluster-example");
        cluster.getStatus().getInstanceNames().addAll(List.of("cluster-example-2", "cluster-example-1"));
        cluster.getStatus().setCurrentPrimary("cluster-example-1");
        cluster.getStatus().setTargetPrimary("cluster-example-1");
        cluster.getMetadata().getAnnotations().put(FENCED_INSTANCES_ANNOTATION, "[\"cluster-example-2\"]");
        cluster.getMetadata().getAnnotations().put(HIBERNATION_ANNOTATION, "on");
        when(clusterStore.get("default", "cluster-example")).thenReturn(cluster);

        // When
        ResponseEntity<Object> response = handler.getClusterStatus("cluster-example");

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        ClusterStatusResponse body = (ClusterStatusResponse) response.getBody();
        assertThat(body.getInstances()).containsExactly("cluster-example-1", "cluster-example-2");
        assertThat(body.getFencedInstances()).containsExactly("cluster-example-2");
        assertThat(body.getHibernation()).isEqualTo("on");
        assertThat(body.getCurrentPrimary()).isEqualTo("cluster-example-1");
    }

    @Test
    void testGetClusterStatus_NotFound() throws Exception {
        // Given
        when(clusterStore.get("default", "missing"))
            .thenThrow(new ResourceNotFoundException("cluster", "default", "missing"));

        // When
        ResponseEntity<Object> response = handler.getClusterStatus("missing");

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        ErrorResponse body = (ErrorResponse) response.getBody();
        assertThat(body.getReason()).isEqualTo("Cluster missing not found");
    }

    @Test
    void testGetClusterStatus_StoreFailure() throws Exception {
        // Given
        when(clusterStore.get("default", "cluster-example"))
            .thenThrow(new ClusterStoreException("Timed out trying to read cluster"));

        // When
        ResponseEntity<Object> response = handler.getClusterStatus("cluster-example");

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        ErrorResponse body = (ErrorResponse) response.getBody();
        assertThat(body.getReason()).isEqualTo("Timed out trying to read cluster");
    }
}
