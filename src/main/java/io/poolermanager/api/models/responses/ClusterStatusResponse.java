package io.poolermanager.api.models.responses;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.poolermanager.models.Cluster;
import io.poolermanager.models.ClusterStatus;
import io.poolermanager.models.HibernationState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Operator view of a cluster, shared by the status endpoint and the status command.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ClusterStatusResponse {
    private String name;
    private String namespace;
    private String phase;
    private String phaseReason;
    private String targetPrimary;
    private String currentPrimary;
    private List<String> instances;
    private List<String> fencedInstances;
    private String hibernation;

    public static ClusterStatusResponse from(Cluster cluster, Set<String> fencedInstances,
                                             HibernationState hibernation) {
        ClusterStatus status = cluster.getStatus();
        return ClusterStatusResponse.builder()
            .name(cluster.getName())
            .namespace(cluster.getNamespace())
            .phase(status.getPhase())
            .phaseReason(status.getPhaseReason())
            .targetPrimary(status.getTargetPrimary())
            .currentPrimary(status.getCurrentPrimary())
            .instances(new ArrayList<>(new TreeSet<>(status.getInstanceNames())))
            .fencedInstances(new ArrayList<>(new TreeSet<>(fencedInstances)))
            .hibernation(hibernation.getValue())
            .build();
    }
}
