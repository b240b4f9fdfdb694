package io.poolermanager.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of a database cluster object as stored by the orchestration platform.
 * <p>
 * Only the fields used by the pooler manager are mapped. The full stored document and the
 * revision it was read at travel with the snapshot so that writes keep unmapped fields and
 * can detect concurrent modifications.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Cluster {

    @JsonProperty("metadata")
    private ClusterMetadata metadata = new ClusterMetadata();

    @JsonProperty("status")
    private ClusterStatus status = new ClusterStatus();

    @JsonIgnore
    private long revision;

    @JsonIgnore
    private ObjectNode document;

    public Cluster(String namespace, String name) {
        this.metadata.setNamespace(namespace);
        this.metadata.setName(name);
    }

    public void setMetadata(ClusterMetadata metadata) {
        this.metadata = metadata != null ? metadata : new ClusterMetadata();
    }

    public void setStatus(ClusterStatus status) {
        this.status = status != null ? status : new ClusterStatus();
    }

    @JsonIgnore
    public String getName() {
        return metadata.getName();
    }

    @JsonIgnore
    public String getNamespace() {
        return metadata.getNamespace();
    }

    @JsonIgnore
    public String getAnnotation(String key) {
        return metadata.getAnnotations().get(key);
    }
}
