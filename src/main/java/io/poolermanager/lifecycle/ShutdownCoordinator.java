package io.poolermanager.lifecycle;

import io.poolermanager.process.SupervisedProcess;
import io.poolermanager.reconciler.ReconciliationLoop;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static io.poolermanager.config.Constants.SIGNAL_INTERRUPT;
import static io.poolermanager.config.Constants.SIGNAL_TERMINATE;

/**
 * Turns the first INT or TERM received by this process into an ordered shutdown:
 * <ol>
 *   <li>stop the metrics endpoint,</li>
 *   <li>stop the reconciliation loop,</li>
 *   <li>cancel the lifecycle context,</li>
 *   <li>send INT to the pooler if it is still running.</li>
 * </ol>
 * Each step is attempted even if an earlier one failed. Later signals are ignored.
 * The reconciliation loop is stopped at most once, whether by a signal or by
 * {@link #stopReconciliationLoop()} when the pooler exits on its own.
 * The coordinator never exits the JVM: the run command exits once the pooler has terminated.
 */
@Slf4j
public class ShutdownCoordinator {

    static final List<String> HANDLED_SIGNALS = List.of(SIGNAL_INTERRUPT, SIGNAL_TERMINATE);

    private final LifecycleContext context;
    private final MetricsEndpoint metricsEndpoint;
    private final ReconciliationLoop reconciliationLoop;
    private final SupervisedProcess process;

    private final AtomicBoolean registered = new AtomicBoolean(false);
    private final AtomicBoolean triggered = new AtomicBoolean(false);
    private final AtomicBoolean loopStopped = new AtomicBoolean(false);

    public ShutdownCoordinator(LifecycleContext context, MetricsEndpoint metricsEndpoint,
                               ReconciliationLoop reconciliationLoop, SupervisedProcess process) {
        this.context = context;
        this.metricsEndpoint = metricsEndpoint;
        this.reconciliationLoop = reconciliationLoop;
        this.process = process;
    }

    /**
     * Install the handlers. Allowed once per coordinator.
     */
    public void register(SignalRegistrar registrar) {
        if (!registered.compareAndSet(false, true)) {
            throw new IllegalStateException("Shutdown coordinator already registered");
        }
        for (String signal : HANDLED_SIGNALS) {
            registrar.register(signal, this::handleSignal);
        }
        log.info("Registered shutdown handler for signals {}", HANDLED_SIGNALS);
    }

    public boolean isTriggered() {
        return triggered.get();
    }

    void handleSignal(String signal) {
        if (!triggered.compareAndSet(false, true)) {
            log.info("Received signal {} while shutting down, ignoring", signal);
            return;
        }
        log.info("Received termination signal {}", signal);

        log.info("Shutting down web server");
        try {
            metricsEndpoint.shutdown();
            log.info("Metrics server shut down");
        } catch (Exception e) {
            log.error("Error while shutting down the metrics server", e);
        }

        stopReconciliationLoop();
        context.cancel();

        if (process != null && process.isRunning()) {
            log.info("Shutting down pooler instance (pid {})", process.pid());
            try {
                process.interrupt();
            } catch (IOException e) {
                log.error("Unable to send SIGINT to pooler instance", e);
            }
        }
    }

    /**
     * Stops the reconciliation loop unless it was already stopped.
     */
    public void stopReconciliationLoop() {
        if (!loopStopped.compareAndSet(false, true)) {
            return;
        }
        try {
            reconciliationLoop.stop();
        } catch (RuntimeException e) {
            log.error("Error while stopping the reconciliation loop", e);
        }
    }
}
