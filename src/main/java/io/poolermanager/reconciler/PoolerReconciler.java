package io.poolermanager.reconciler;

import io.poolermanager.lifecycle.LifecycleContext;
import io.poolermanager.metrics.MetricsProvider;
import io.poolermanager.store.ClusterStoreException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static io.poolermanager.metrics.MetricsConstants.RECONCILE_CYCLES_METRIC_NAME;
import static io.poolermanager.metrics.MetricsConstants.RECONCILE_RELOADS_METRIC_NAME;
import static io.poolermanager.metrics.MetricsConstants.RESULT_TAG;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Keeps the pooler configuration file in line with the stored configuration.
 * <p>
 * {@link #init(LifecycleContext)} writes the file before the pooler starts. {@link #run(LifecycleContext)}
 * then polls the source at a fixed interval; when the content differs from the file, the file is
 * replaced and the pooler is asked to reload. A failed cycle is logged and the next one runs as usual.
 */
@Slf4j
public class PoolerReconciler implements ReconciliationLoop {

    private static final String RESULT_UNCHANGED = "unchanged";
    private static final String RESULT_UPDATED = "updated";
    private static final String RESULT_ERROR = "error";

    private final String poolerName;
    private final PoolerConfigurationSource configurationSource;
    private final Path configurationFile;
    private final long intervalSeconds;
    private final MetricsProvider metricsProvider;

    private final CountDownLatch stopRequested = new CountDownLatch(1);
    private volatile PoolerReloader reloader;
    private String appliedConfiguration;

    public PoolerReconciler(String poolerName, PoolerConfigurationSource configurationSource,
                            Path configurationFile, long intervalSeconds, MetricsProvider metricsProvider) {
        this.poolerName = poolerName;
        this.configurationSource = configurationSource;
        this.configurationFile = configurationFile;
        this.intervalSeconds = intervalSeconds;
        this.metricsProvider = metricsProvider;
    }

    /**
     * Set once the pooler is running; before that configuration changes are only written to disk.
     */
    public void setReloader(PoolerReloader reloader) {
        this.reloader = reloader;
    }

    public Path getConfigurationFile() {
        return configurationFile;
    }

    @Override
    public void init(LifecycleContext context) throws ClusterStoreException, IOException {
        String configuration = configurationSource.fetchConfiguration();
        writeConfiguration(configuration);
        log.info("[Pooler: {}] Wrote initial configuration to {}", poolerName, configurationFile);
    }

    @Override
    public void run(LifecycleContext context) {
        // Wakes the wait below without going through stop()
        context.onCancel(stopRequested::countDown);
        log.info("[Pooler: {}] Reconciliation loop started, interval {}s", poolerName, intervalSeconds);
        while (!context.isCancelled()) {
            try {
                if (stopRequested.await(intervalSeconds, TimeUnit.SECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            reconcile();
        }
        log.info("[Pooler: {}] Reconciliation loop stopped", poolerName);
    }

    @Override
    public void stop() {
        stopRequested.countDown();
    }

    /**
     * One reconciliation cycle.
     *
     * @return true if the configuration file was replaced
     */
    boolean reconcile() {
        String result = RESULT_UNCHANGED;
        try {
            String configuration = configurationSource.fetchConfiguration();
            if (!configuration.equals(appliedConfiguration)) {
                writeConfiguration(configuration);
                result = RESULT_UPDATED;
                log.info("[Pooler: {}] Configuration changed, wrote {}", poolerName, configurationFile);
                reload();
            }
        } catch (ClusterStoreException | IOException e) {
            result = RESULT_ERROR;
            log.error("[Pooler: {}] Reconciliation failed: {}", poolerName, e.getMessage(), e);
        }
        if (metricsProvider != null) {
            metricsProvider.counter(RECONCILE_CYCLES_METRIC_NAME, Map.of(RESULT_TAG, result)).increment();
        }
        return RESULT_UPDATED.equals(result);
    }

    private void reload() throws IOException {
        PoolerReloader current = reloader;
        if (current == null) {
            log.info("[Pooler: {}] Pooler not started yet, skipping reload", poolerName);
            return;
        }
        try {
            current.reload();
        } catch (IOException e) {
            // Forces a rewrite and a new reload attempt on the next cycle
            appliedConfiguration = null;
            throw e;
        }
        if (metricsProvider != null) {
            metricsProvider.counter(RECONCILE_RELOADS_METRIC_NAME, Map.of()).increment();
        }
    }

    private void writeConfiguration(String configuration) throws IOException {
        Path directory = configurationFile.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        Path staging = Files.createTempFile(directory, configurationFile.getFileName().toString(), ".tmp");
        try {
            Files.writeString(staging, configuration, UTF_8);
            Files.move(staging, configurationFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(staging);
        }
        appliedConfiguration = configuration;
    }
}
