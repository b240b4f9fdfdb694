package io.poolermanager.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.op.Cmp;
import io.etcd.jetcd.op.CmpTarget;
import io.etcd.jetcd.op.Op;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.PutOption;
import io.poolermanager.models.Cluster;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

import static io.poolermanager.store.EtcdFutures.await;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Cluster objects stored as JSON documents in etcd.
 * <p>
 * Writes use a compare-and-swap transaction on the key's mod revision. The stored document is
 * kept whole: only the status fields or annotations being written are replaced, everything
 * else in the document is written back untouched.
 */
@Slf4j
public class EtcdClusterStore implements ClusterStore, InstanceRegistry {

    private static final String CLUSTER_KIND = "cluster";
    private static final String METADATA_FIELD = "metadata";
    private static final String ANNOTATIONS_FIELD = "annotations";
    private static final String STATUS_FIELD = "status";

    private final KV kvClient;
    private final ObjectMapper objectMapper;
    private final EtcdPathResolver pathResolver;

    public EtcdClusterStore(KV kvClient, ObjectMapper objectMapper) {
        this.kvClient = kvClient;
        this.objectMapper = objectMapper;
        this.pathResolver = EtcdPathResolver.getInstance();
    }

    @Override
    public Cluster get(String namespace, String name) throws ClusterStoreException {
        String key = pathResolver.getClusterPath(namespace, name);
        GetResponse response = await(kvClient.get(ByteSequence.from(key, UTF_8)), "read cluster " + key);
        if (response.getKvs().isEmpty()) {
            throw new ResourceNotFoundException(CLUSTER_KIND, namespace, name);
        }

        KeyValue kv = response.getKvs().get(0);
        String json = kv.getValue().toString(UTF_8);
        try {
            JsonNode tree = objectMapper.readTree(json);
            if (!(tree instanceof ObjectNode)) {
                throw new ClusterStoreException("Cluster " + key + " is not a JSON object");
            }
            Cluster cluster = objectMapper.treeToValue(tree, Cluster.class);
            if (cluster.getName() == null) {
                cluster.getMetadata().setName(name);
            }
            if (cluster.getNamespace() == null) {
                cluster.getMetadata().setNamespace(namespace);
            }
            cluster.setRevision(kv.getModRevision());
            cluster.setDocument((ObjectNode) tree);
            log.debug("Read cluster {} at revision {}", key, kv.getModRevision());
            return cluster;
        } catch (JsonProcessingException e) {
            throw new ClusterStoreException("Failed to parse cluster " + key, e);
        }
    }

    @Override
    public void updateStatus(Cluster cluster) throws ClusterStoreException {
        compareAndPut(cluster, withStatus(cluster));
    }

    @Override
    public void patchAnnotations(Cluster cluster, Map<String, String> changes) throws ClusterStoreException {
        compareAndPut(cluster, withAnnotationChanges(cluster, changes));
    }

    @Override
    public boolean exists(String namespace, String instanceName) throws ClusterStoreException {
        String key = pathResolver.getInstancePath(namespace, instanceName);
        GetResponse response = await(kvClient.get(ByteSequence.from(key, UTF_8)), "look up instance " + key);
        return !response.getKvs().isEmpty();
    }

    private void compareAndPut(Cluster cluster, ObjectNode document) throws ClusterStoreException {
        String key = pathResolver.getClusterPath(cluster.getNamespace(), cluster.getName());
        ByteSequence keyBytes = ByteSequence.from(key, UTF_8);
        ByteSequence valueBytes;
        try {
            valueBytes = ByteSequence.from(objectMapper.writeValueAsString(document), UTF_8);
        } catch (JsonProcessingException e) {
            throw new ClusterStoreException("Failed to serialize cluster " + key, e);
        }

        TxnResponse txnResponse = await(kvClient.txn()
                .If(new Cmp(keyBytes, Cmp.Op.EQUAL, CmpTarget.modRevision(cluster.getRevision())))
                .Then(Op.put(keyBytes, valueBytes, PutOption.DEFAULT))
                .Else(Op.get(keyBytes, GetOption.DEFAULT))
                .commit(), "write cluster " + key);

        if (!txnResponse.isSucceeded()) {
            throw new ConflictException("Cluster " + key + " was modified after revision "
                    + cluster.getRevision() + ", please retry");
        }
        log.debug("Wrote cluster {} over revision {}", key, cluster.getRevision());
    }

    /**
     * The stored document with its status fields replaced by those of {@code cluster}.
     */
    ObjectNode withStatus(Cluster cluster) {
        ObjectNode document = baseDocument(cluster);
        ObjectNode statusNode = childObject(document, STATUS_FIELD);
        statusNode.setAll((ObjectNode) objectMapper.valueToTree(cluster.getStatus()));
        return document;
    }

    /**
     * The stored document with {@code changes} merged into its annotations.
     */
    ObjectNode withAnnotationChanges(Cluster cluster, Map<String, String> changes) {
        ObjectNode document = baseDocument(cluster);
        ObjectNode annotations = childObject(childObject(document, METADATA_FIELD), ANNOTATIONS_FIELD);
        for (Map.Entry<String, String> change : changes.entrySet()) {
            if (change.getValue() == null) {
                annotations.remove(change.getKey());
            } else {
                annotations.put(change.getKey(), change.getValue());
            }
        }
        return document;
    }

    private ObjectNode baseDocument(Cluster cluster) {
        if (cluster.getDocument() != null) {
            return cluster.getDocument().deepCopy();
        }
        return (ObjectNode) objectMapper.valueToTree(cluster);
    }

    private ObjectNode childObject(ObjectNode parent, String field) {
        JsonNode child = parent.get(field);
        if (child instanceof ObjectNode) {
            return (ObjectNode) child;
        }
        return parent.putObject(field);
    }
}
