package io.poolermanager.config;

import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.introspector.PropertyUtils;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.function.UnaryOperator;

import static io.poolermanager.config.Constants.*;

/**
 * Configuration for the pooler manager.
 * Loads configuration from application.yml with fallbacks to constants. The pooler name and
 * namespace can also come from the POOLER_NAME and NAMESPACE environment variables, which
 * take precedence over the file.
 * <p>
 * Spring-only keys (server, management) live in the same file and are skipped here.
 */
@Slf4j
@Getter
public class PoolerManagerConfig {

    private final String[] etcdEndpoints;
    private final String namespace;
    private final String poolerName;
    private final String pgbouncerCommand;
    private final Path configsDir;
    private final long reconcileIntervalSeconds;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable to check for external config file path
    private static final String EXTERNAL_CONFIG_ENV_VAR = "POOLER_MANAGER_CONFIG_FILE";

    public PoolerManagerConfig() {
        this(loadYamlConfig(), System::getenv);
    }

    PoolerManagerConfig(ConfigModel config, UnaryOperator<String> env) {
        this.etcdEndpoints = parseEndpoints(config);
        this.namespace = firstNonBlank(env.apply(ENV_NAMESPACE), pooler(config).getNamespace(), DEFAULT_NAMESPACE);
        this.poolerName = firstNonBlank(env.apply(ENV_POOLER_NAME), pooler(config).getName(), null);
        this.pgbouncerCommand = firstNonBlank(pooler(config).getCommand(), null, PGBOUNCER_COMMAND);
        this.configsDir = Paths.get(firstNonBlank(pooler(config).getConfigsDir(), null, DEFAULT_CONFIGS_DIR));
        this.reconcileIntervalSeconds = parseReconcileIntervalSeconds(config);

        log.info("Loaded pooler manager config - etcd endpoints: {}, namespace: {}, pooler: {}, reconcile interval: {}s",
                String.join(", ", etcdEndpoints), namespace, poolerName, reconcileIntervalSeconds);
    }

    /**
     * Path of the configuration file handed to the pooling process.
     */
    public Path getPgbouncerIniPath() {
        return configsDir.resolve(PGBOUNCER_INI_FILE_NAME);
    }

    static ConfigModel parseYaml(InputStream inputStream) {
        LoaderOptions options = new LoaderOptions();
        Constructor constructor = new Constructor(ConfigModel.class, options);
        PropertyUtils propertyUtils = new PropertyUtils();
        propertyUtils.setSkipMissingProperties(true);
        constructor.setPropertyUtils(propertyUtils);

        ConfigModel config = new Yaml(constructor).load(inputStream);
        return config != null ? config : new ConfigModel();
    }

    private static ConfigModel loadYamlConfig() {
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check environment variable for external config file path
        String externalConfigPath = System.getenv(EXTERNAL_CONFIG_ENV_VAR);
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", EXTERNAL_CONFIG_ENV_VAR, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            }
        }

        // 2. If external file wasn't loaded, try classpath
        if (inputStream == null) {
            inputStream = PoolerManagerConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
        }

        try (InputStream in = inputStream) {
            ConfigModel config = parseYaml(in);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config;
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        }
    }

    private String[] parseEndpoints(ConfigModel config) {
        if (config.getEtcd() != null && config.getEtcd().getEndpoints() != null
                && !config.getEtcd().getEndpoints().isEmpty()) {
            return config.getEtcd().getEndpoints().toArray(new String[0]);
        }
        return new String[]{DEFAULT_ETCD_ENDPOINT};
    }

    private long parseReconcileIntervalSeconds(ConfigModel config) {
        if (config.getReconcile() != null && config.getReconcile().getIntervalSeconds() != null
                && config.getReconcile().getIntervalSeconds() > 0) {
            return config.getReconcile().getIntervalSeconds();
        }
        return DEFAULT_RECONCILE_INTERVAL_SECONDS;
    }

    private static Pooler pooler(ConfigModel config) {
        return config.getPooler() != null ? config.getPooler() : new Pooler();
    }

    private static String firstNonBlank(String first, String second, String fallback) {
        if (first != null && !first.isBlank()) {
            return first.trim();
        }
        if (second != null && !second.isBlank()) {
            return second.trim();
        }
        return fallback;
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Etcd etcd;
        private Pooler pooler;
        private Reconcile reconcile;
    }

    @Data
    public static class Etcd {
        private List<String> endpoints;
    }

    @Data
    public static class Pooler {
        private String name;
        private String namespace;
        private String command;
        private String configsDir;
    }

    @Data
    public static class Reconcile {
        private Long intervalSeconds;
    }
}
