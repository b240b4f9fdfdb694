package io.poolermanager.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_ETCD_ENDPOINT = "http://localhost:2379";
    public static final String DEFAULT_NAMESPACE = "default";
    public static final long DEFAULT_RECONCILE_INTERVAL_SECONDS = 30L;

    // Environment variables
    public static final String ENV_POOLER_NAME = "POOLER_NAME";
    public static final String ENV_NAMESPACE = "NAMESPACE";

    // Pooling process
    public static final String PGBOUNCER_COMMAND = "/usr/bin/pgbouncer";
    public static final String PGBOUNCER_INI_FILE_NAME = "pgbouncer.ini";
    public static final String DEFAULT_CONFIGS_DIR = "/controller/configs";
    public static final String PGBOUNCER_LOGGER_NAME = "pgbouncer";

    // Output pipes
    public static final String PIPE_STDOUT = "stdout";
    public static final String PIPE_STDERR = "stderr";

    // Signals
    public static final String SIGNAL_INTERRUPT = "INT";
    public static final String SIGNAL_TERMINATE = "TERM";
    public static final String SIGNAL_HANGUP = "HUP";

    // etcd
    public static final long ETCD_OPERATION_TIMEOUT_SECONDS = 5L;

    // etcd path segments
    public static final String PATH_DELIMITER = "/";
    public static final String PATH_CLUSTERS = "clusters";
    public static final String PATH_INSTANCES = "instances";
    public static final String PATH_POOLERS = "poolers";
    public static final String SUFFIX_CONFIG = "config";

    // Cluster annotations
    public static final String METADATA_NAMESPACE = "pooler-manager.io";
    public static final String FENCED_INSTANCES_ANNOTATION = METADATA_NAMESPACE + "/fencedInstances";
    public static final String HIBERNATION_ANNOTATION = METADATA_NAMESPACE + "/hibernation";

    // Fencing every instance of a cluster
    public static final String FENCE_ALL_INSTANCES = "*";

    // Conflict retry defaults
    public static final int CONFLICT_RETRY_STEPS = 5;
    public static final long CONFLICT_RETRY_INITIAL_DELAY_MS = 10L;
    public static final double CONFLICT_RETRY_FACTOR = 1.0;
    public static final double CONFLICT_RETRY_JITTER = 0.1;
}
