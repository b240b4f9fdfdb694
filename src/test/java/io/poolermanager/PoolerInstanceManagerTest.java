package io.poolermanager;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.poolermanager.config.PoolerManagerConfig;
import io.poolermanager.lifecycle.LifecycleContext;
import io.poolermanager.lifecycle.MetricsEndpoint;
import io.poolermanager.lifecycle.SignalRegistrar;
import io.poolermanager.logging.LogRecordSink;
import io.poolermanager.metrics.MetricsProvider;
import io.poolermanager.process.ProcessLaunchException;
import io.poolermanager.process.ProcessOutcome;
import io.poolermanager.process.ProcessSupervisor;
import io.poolermanager.process.SupervisedProcess;
import io.poolermanager.reconciler.PoolerReconciler;
import io.poolermanager.reconciler.PoolerReloader;
import io.poolermanager.store.ClusterStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static io.poolermanager.metrics.MetricsConstants.POOLER_RUNNING_METRIC_NAME;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class PoolerInstanceManagerTest {

    @Mock
    private PoolerManagerConfig config;

    @Mock
    private ProcessSupervisor supervisor;

    @Mock
    private PoolerReconciler reconciler;

    @Mock
    private MetricsEndpoint metricsEndpoint;

    @Mock
    private SignalRegistrar signalRegistrar;

    @Mock
    private LogRecordSink recordSink;

    @Mock
    private SupervisedProcess process;

    private SimpleMeterRegistry registry;
    private PoolerInstanceManager manager;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        registry = new SimpleMeterRegistry();
        when(config.getPoolerName()).thenReturn("pooler-rw");
        when(config.getPgbouncerCommand()).thenReturn("/usr/bin/pgbouncer");
        when(reconciler.getConfigurationFile()).thenReturn(Paths.get("/controller/configs/pgbouncer.ini"));
        manager = new PoolerInstanceManager(config, supervisor, reconciler, metricsEndpoint, signalRegistrar,
                recordSink, new MetricsProvider(registry, "pooler-rw"));
    }

    private double runningGauge() {
        return registry.get(POOLER_RUNNING_METRIC_NAME).gauge().value();
    }

    @Test
    void testReconcilerInitFailureDoesNotStartPooler() throws Exception {
        // Given
        doThrow(new ClusterStoreException("pooler configuration default/pooler-rw not found"))
                .when(reconciler).init(any(LifecycleContext.class));

        // When
        int exitCode = manager.run();

        // Then
        assertThat(exitCode).isEqualTo(1);
        verify(supervisor, never()).start(anyString(), anyList(), any(), any());
        verify(metricsEndpoint).shutdown();
        assertThat(manager.getProcess()).isNull();
    }

    @Test
    void testLaunchFailure() throws Exception {
        // Given
        when(supervisor.start(anyString(), anyList(), any(), any()))
                .thenThrow(new ProcessLaunchException("Failed to start /usr/bin/pgbouncer", new IOException("No such file")));

        // When
        int exitCode = manager.run();

        // Then
        assertThat(exitCode).isEqualTo(1);
        verify(metricsEndpoint).shutdown();
        verifyNoInteractions(signalRegistrar);
    }

    @Test
    void testCleanExit() throws Exception {
        // Given
        when(supervisor.start(eq("/usr/bin/pgbouncer"), eq(List.of("/controller/configs/pgbouncer.ini")), any(), any()))
                .thenReturn(process);
        when(process.waitFor()).thenReturn(ProcessOutcome.fromExitCode(0, null));

        // When
        int exitCode = manager.run();

        // Then
        assertThat(exitCode).isEqualTo(0);
        assertThat(manager.getProcess()).isSameAs(process);
        verify(signalRegistrar).register(eq("INT"), any());
        verify(signalRegistrar).register(eq("TERM"), any());
        verify(reconciler).setReloader(any());
        verify(reconciler).stop();
        assertThat(runningGauge()).isEqualTo(0.0);
    }

    @Test
    void testNonZeroExit() throws Exception {
        // Given
        when(supervisor.start(anyString(), anyList(), any(), any())).thenReturn(process);
        when(process.waitFor()).thenReturn(ProcessOutcome.fromExitCode(1, null));

        // When
        int exitCode = manager.run();

        // Then
        assertThat(exitCode).isEqualTo(1);
        verify(reconciler).stop();
    }

    @Test
    void testCopyFailureIsFailure() throws Exception {
        // Given
        when(supervisor.start(anyString(), anyList(), any(), any())).thenReturn(process);
        when(process.waitFor()).thenReturn(ProcessOutcome.fromExitCode(0, new IOException("sink failed")));

        // When
        int exitCode = manager.run();

        // Then
        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void testReloaderSignalsPooler() throws Exception {
        // Given
        when(supervisor.start(anyString(), anyList(), any(), any())).thenReturn(process);
        when(process.waitFor()).thenReturn(ProcessOutcome.fromExitCode(0, null));
        manager.run();
        ArgumentCaptor<PoolerReloader> reloader = ArgumentCaptor.forClass(PoolerReloader.class);
        verify(reconciler).setReloader(reloader.capture());

        // When
        reloader.getValue().reload();

        // Then
        verify(process).reload();
    }

    @Test
    void testSignalDuringRunStopsReconcilerOnce() throws Exception {
        // Given
        Map<String, Consumer<String>> handlers = new HashMap<>();
        doAnswer(invocation -> handlers.put(invocation.getArgument(0), invocation.getArgument(1)))
                .when(signalRegistrar).register(anyString(), any());
        when(supervisor.start(anyString(), anyList(), any(), any())).thenReturn(process);
        when(process.isRunning()).thenReturn(true);
        when(process.waitFor()).thenAnswer(invocation -> {
            handlers.get("TERM").accept("TERM");
            return ProcessOutcome.fromExitCode(0, null);
        });

        // When
        int exitCode = manager.run();

        // Then
        assertThat(exitCode).isEqualTo(0);
        InOrder inOrder = inOrder(metricsEndpoint, reconciler, process);
        inOrder.verify(metricsEndpoint).shutdown();
        inOrder.verify(reconciler).stop();
        inOrder.verify(process).interrupt();
        verify(reconciler, times(1)).stop();
        verify(metricsEndpoint, times(1)).shutdown();
    }
}
