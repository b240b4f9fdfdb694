package io.poolermanager.store;

import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.kv.GetResponse;
import io.poolermanager.reconciler.PoolerConfigurationSource;

import static io.poolermanager.store.EtcdFutures.await;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Reads the pooler configuration file content stored under
 * {@code /<namespace>/poolers/<pooler-name>/config}.
 */
public class EtcdPoolerConfigurationSource implements PoolerConfigurationSource {

    private static final String POOLER_CONFIG_KIND = "pooler configuration";

    private final KV kvClient;
    private final String namespace;
    private final String poolerName;
    private final EtcdPathResolver pathResolver = EtcdPathResolver.getInstance();

    public EtcdPoolerConfigurationSource(KV kvClient, String namespace, String poolerName) {
        this.kvClient = kvClient;
        this.namespace = namespace;
        this.poolerName = poolerName;
    }

    @Override
    public String fetchConfiguration() throws ClusterStoreException {
        String key = pathResolver.getPoolerConfigPath(namespace, poolerName);
        GetResponse response = await(kvClient.get(ByteSequence.from(key, UTF_8)), "read pooler configuration " + key);
        if (response.getKvs().isEmpty()) {
            throw new ResourceNotFoundException(POOLER_CONFIG_KIND, namespace, poolerName);
        }
        return response.getKvs().get(0).getValue().toString(UTF_8);
    }
}
