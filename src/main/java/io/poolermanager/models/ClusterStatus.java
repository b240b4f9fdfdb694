package io.poolermanager.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Observed state of a cluster. Phases other than a switchover are set by the cluster
 * controller and only read here.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClusterStatus {

    @JsonProperty("targetPrimary")
    private String targetPrimary;

    @JsonProperty("currentPrimary")
    private String currentPrimary;

    @JsonProperty("phase")
    private String phase;

    @JsonProperty("phaseReason")
    private String phaseReason;

    @JsonProperty("instanceNames")
    private Set<String> instanceNames = new LinkedHashSet<>();

    // An explicit null in the stored document means no members
    public void setInstanceNames(Set<String> instanceNames) {
        this.instanceNames = instanceNames != null ? instanceNames : new LinkedHashSet<>();
    }
}
