package io.poolermanager;

import com.google.common.util.concurrent.AtomicDouble;
import io.poolermanager.config.PoolerManagerConfig;
import io.poolermanager.lifecycle.LifecycleContext;
import io.poolermanager.lifecycle.MetricsEndpoint;
import io.poolermanager.lifecycle.ShutdownCoordinator;
import io.poolermanager.lifecycle.SignalRegistrar;
import io.poolermanager.logging.LogRecordSink;
import io.poolermanager.logging.LogRecordTranslator;
import io.poolermanager.metrics.MetricsProvider;
import io.poolermanager.process.ProcessLaunchException;
import io.poolermanager.process.ProcessOutcome;
import io.poolermanager.process.ProcessSupervisor;
import io.poolermanager.process.SupervisedProcess;
import io.poolermanager.reconciler.PoolerReconciler;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

import static io.poolermanager.config.Constants.PIPE_STDERR;
import static io.poolermanager.config.Constants.PIPE_STDOUT;
import static io.poolermanager.metrics.MetricsConstants.POOLER_RUNNING_METRIC_NAME;

/**
 * Runs one pooler instance: writes its configuration, starts it, keeps its configuration
 * up to date and waits for it to terminate.
 * <p>
 * The pooler is started once. When it exits, {@link #run()} returns and the caller exits
 * the program; restarting is up to whatever runs this program.
 */
@Slf4j
public class PoolerInstanceManager {

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_FAILURE = 1;

    private final PoolerManagerConfig config;
    private final ProcessSupervisor supervisor;
    private final PoolerReconciler reconciler;
    private final MetricsEndpoint metricsEndpoint;
    private final SignalRegistrar signalRegistrar;
    private final LogRecordSink recordSink;
    private final AtomicDouble runningGauge;

    private volatile SupervisedProcess process;

    public PoolerInstanceManager(PoolerManagerConfig config, ProcessSupervisor supervisor,
                                 PoolerReconciler reconciler, MetricsEndpoint metricsEndpoint,
                                 SignalRegistrar signalRegistrar, LogRecordSink recordSink,
                                 MetricsProvider metricsProvider) {
        this.config = config;
        this.supervisor = supervisor;
        this.reconciler = reconciler;
        this.metricsEndpoint = metricsEndpoint;
        this.signalRegistrar = signalRegistrar;
        this.recordSink = recordSink;
        this.runningGauge = metricsProvider.gauge(POOLER_RUNNING_METRIC_NAME, Map.of());
    }

    /**
     * @return the process exit code for this program
     */
    public int run() {
        String poolerName = config.getPoolerName();
        LifecycleContext context = new LifecycleContext();

        try {
            reconciler.init(context);
        } catch (Exception e) {
            log.error("[Pooler: {}] Error while initializing the reconciler: {}", poolerName, e.getMessage(), e);
            shutdownMetricsEndpoint();
            return EXIT_FAILURE;
        }

        List<String> arguments = List.of(reconciler.getConfigurationFile().toString());
        SupervisedProcess started;
        try {
            started = supervisor.start(config.getPgbouncerCommand(), arguments,
                    new LogRecordTranslator(PIPE_STDOUT, recordSink),
                    new LogRecordTranslator(PIPE_STDERR, recordSink));
        } catch (ProcessLaunchException e) {
            log.error("[Pooler: {}] {}", poolerName, e.getMessage(), e.getCause());
            shutdownMetricsEndpoint();
            return EXIT_FAILURE;
        }
        process = started;
        runningGauge.set(1);
        reconciler.setReloader(started::reload);

        Thread reconcilerThread = new Thread(() -> reconciler.run(context), "pooler-reconciler");
        reconcilerThread.setDaemon(true);
        reconcilerThread.start();

        ShutdownCoordinator coordinator = new ShutdownCoordinator(context, metricsEndpoint, reconciler, started);
        coordinator.register(signalRegistrar);

        ProcessOutcome outcome;
        try {
            outcome = started.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[Pooler: {}] Interrupted while waiting for the pooler", poolerName);
            return EXIT_FAILURE;
        } finally {
            runningGauge.set(0);
            coordinator.stopReconciliationLoop();
            context.cancel();
        }

        if (outcome.isSuccess()) {
            log.info("[Pooler: {}] Pooler {}", poolerName, outcome.describe());
            return EXIT_SUCCESS;
        }
        log.error("[Pooler: {}] Pooler {}", poolerName, outcome.describe());
        return EXIT_FAILURE;
    }

    /**
     * The running pooler, or {@code null} before it is started.
     */
    public SupervisedProcess getProcess() {
        return process;
    }

    private void shutdownMetricsEndpoint() {
        try {
            metricsEndpoint.shutdown();
        } catch (Exception e) {
            log.error("Error while shutting down the metrics server", e);
        }
    }
}
