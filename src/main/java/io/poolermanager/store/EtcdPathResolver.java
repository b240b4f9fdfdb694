package io.poolermanager.store;

import java.nio.file.Paths;

import static io.poolermanager.config.Constants.PATH_CLUSTERS;
import static io.poolermanager.config.Constants.PATH_DELIMITER;
import static io.poolermanager.config.Constants.PATH_INSTANCES;
import static io.poolermanager.config.Constants.PATH_POOLERS;
import static io.poolermanager.config.Constants.SUFFIX_CONFIG;

/**
 * Etcd key layout for the objects the pooler manager reads and writes.
 * Keys are scoped by namespace. Stateless singleton.
 */
public class EtcdPathResolver {

    private static final EtcdPathResolver INSTANCE = new EtcdPathResolver();

    private EtcdPathResolver() {
    }

    public static EtcdPathResolver getInstance() {
        return INSTANCE;
    }

    /**
     * Pattern: /<namespace>/clusters/<cluster-name>
     */
    public String getClusterPath(String namespace, String clusterName) {
        return Paths.get(PATH_DELIMITER, namespace, PATH_CLUSTERS, clusterName).toString();
    }

    /**
     * Pattern: /<namespace>/instances/<instance-name>
     */
    public String getInstancePath(String namespace, String instanceName) {
        return Paths.get(PATH_DELIMITER, namespace, PATH_INSTANCES, instanceName).toString();
    }

    /**
     * Pattern: /<namespace>/poolers/<pooler-name>/config
     */
    public String getPoolerConfigPath(String namespace, String poolerName) {
        return Paths.get(PATH_DELIMITER, namespace, PATH_POOLERS, poolerName, SUFFIX_CONFIG).toString();
    }
}
