package io.poolermanager;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Suppliers;
import io.etcd.jetcd.Client;
import io.micrometer.core.instrument.MeterRegistry;
import io.poolermanager.cli.CommandTreeBuilder;
import io.poolermanager.config.ObjectMappers;
import io.poolermanager.config.PoolerManagerConfig;
import io.poolermanager.lifecycle.JvmSignalRegistrar;
import io.poolermanager.lifecycle.MetricsEndpoint;
import io.poolermanager.lifecycle.SignalRegistrar;
import io.poolermanager.lifecycle.WebServerMetricsEndpoint;
import io.poolermanager.logging.LogRecordSink;
import io.poolermanager.logging.Slf4jLogRecordSink;
import io.poolermanager.metrics.MetricsProvider;
import io.poolermanager.mutation.ClusterStateMutator;
import io.poolermanager.process.KillCommandSignaller;
import io.poolermanager.process.ProcessSupervisor;
import io.poolermanager.reconciler.PoolerConfigurationSource;
import io.poolermanager.reconciler.PoolerReconciler;
import io.poolermanager.store.ClusterStore;
import io.poolermanager.store.EtcdClusterStore;
import io.poolermanager.store.EtcdPoolerConfigurationSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.web.context.WebServerApplicationContext;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import picocli.CommandLine;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Entry point of the pooler manager.
 * <p>
 * The {@code run} command starts a Spring Boot context, which serves the metrics and status
 * endpoints and wires the pooler instance manager. The operator commands run without Spring
 * against their own etcd client. This is the only class that exits the JVM.
 */
@Slf4j
@SpringBootApplication
public class PoolerManagerApplication {

    public static void main(String[] args) {
        PoolerManagerConfig config = new PoolerManagerConfig();
        ObjectMapper objectMapper = ObjectMappers.create();

        AtomicReference<Client> etcdClient = new AtomicReference<>();
        Supplier<EtcdClusterStore> store = Suppliers.memoize(() -> {
            Client client = Client.builder().endpoints(config.getEtcdEndpoints()).build();
            etcdClient.set(client);
            return new EtcdClusterStore(client.getKVClient(), objectMapper);
        });
        Supplier<ClusterStateMutator> mutator = Suppliers.memoize(() ->
                new ClusterStateMutator(store.get(), store.get(), objectMapper, config.getNamespace()));

        CommandLine commandLine = CommandTreeBuilder.build(config.getNamespace(), store::get, mutator,
                objectMapper, PoolerManagerApplication::runPoolerManager);
        int exitCode = commandLine.execute(args);

        if (etcdClient.get() != null) {
            etcdClient.get().close();
        }
        System.exit(exitCode);
    }

    static int runPoolerManager() {
        log.info("Starting pooler manager");
        try (ConfigurableApplicationContext context = SpringApplication.run(PoolerManagerApplication.class)) {
            return context.getBean(PoolerInstanceManager.class).run();
        }
    }

    @Bean
    @Primary
    public PoolerManagerConfig config() {
        PoolerManagerConfig config = new PoolerManagerConfig();
        if (config.getPoolerName() == null) {
            throw new IllegalStateException("Pooler name is not set, use the POOLER_NAME environment variable");
        }
        log.info("Loaded configuration");
        return config;
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return ObjectMappers.create();
    }

    @Bean
    public Client etcdClient(PoolerManagerConfig config) {
        log.info("Connecting to etcd at {}", String.join(", ", config.getEtcdEndpoints()));
        return Client.builder().endpoints(config.getEtcdEndpoints()).build();
    }

    @Bean
    public ClusterStore clusterStore(Client etcdClient, ObjectMapper objectMapper) {
        return new EtcdClusterStore(etcdClient.getKVClient(), objectMapper);
    }

    @Bean
    public MetricsProvider metricsProvider(MeterRegistry meterRegistry, PoolerManagerConfig config) {
        return new MetricsProvider(meterRegistry, config.getPoolerName());
    }

    @Bean
    public PoolerConfigurationSource poolerConfigurationSource(Client etcdClient, PoolerManagerConfig config) {
        return new EtcdPoolerConfigurationSource(etcdClient.getKVClient(), config.getNamespace(), config.getPoolerName());
    }

    @Bean
    public PoolerReconciler poolerReconciler(PoolerManagerConfig config, PoolerConfigurationSource source,
                                             MetricsProvider metricsProvider) {
        log.info("Initializing PoolerReconciler for pooler {}", config.getPoolerName());
        return new PoolerReconciler(config.getPoolerName(), source, config.getPgbouncerIniPath(),
                config.getReconcileIntervalSeconds(), metricsProvider);
    }

    @Bean
    public ProcessSupervisor processSupervisor() {
        return new ProcessSupervisor(new KillCommandSignaller());
    }

    @Bean
    public LogRecordSink logRecordSink(ObjectMapper objectMapper, MetricsProvider metricsProvider) {
        return new Slf4jLogRecordSink(objectMapper, metricsProvider);
    }

    @Bean
    public MetricsEndpoint metricsEndpoint(ApplicationContext applicationContext) {
        if (applicationContext instanceof WebServerApplicationContext) {
            return new WebServerMetricsEndpoint((WebServerApplicationContext) applicationContext);
        }
        log.warn("No embedded web server, metrics endpoint shutdown is a no-op");
        return () -> { };
    }

    @Bean
    public SignalRegistrar signalRegistrar() {
        return new JvmSignalRegistrar();
    }

    @Bean
    public PoolerInstanceManager poolerInstanceManager(PoolerManagerConfig config, ProcessSupervisor supervisor,
                                                       PoolerReconciler reconciler, MetricsEndpoint metricsEndpoint,
                                                       SignalRegistrar signalRegistrar, LogRecordSink logRecordSink,
                                                       MetricsProvider metricsProvider) {
        return new PoolerInstanceManager(config, supervisor, reconciler, metricsEndpoint, signalRegistrar,
                logRecordSink, metricsProvider);
    }
}
