package io.poolermanager.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.poolermanager.api.models.responses.ClusterStatusResponse;
import io.poolermanager.models.Cluster;
import io.poolermanager.mutation.ClusterStateMutator;
import io.poolermanager.mutation.FencedInstances;
import io.poolermanager.store.ClusterStore;
import io.poolermanager.store.ClusterStoreException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

@Command(name = "status", description = "Show phase, primaries, fencing and hibernation of a cluster")
public class StatusCommand implements Callable<Integer> {

    private static final String NONE = "-";

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Cluster name")
    private String clusterName;

    private final String namespace;
    private final Supplier<ClusterStore> clusterStore;
    private final ObjectMapper objectMapper;

    public StatusCommand(String namespace, Supplier<ClusterStore> clusterStore, ObjectMapper objectMapper) {
        this.namespace = namespace;
        this.clusterStore = clusterStore;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() throws ClusterStoreException {
        Cluster cluster = clusterStore.get().get(namespace, clusterName);
        ClusterStatusResponse status = ClusterStatusResponse.from(cluster,
                FencedInstances.read(cluster, objectMapper), ClusterStateMutator.hibernationState(cluster));

        PrintWriter out = spec.commandLine().getOut();
        out.printf("Cluster:          %s%n", status.getName());
        out.printf("Namespace:        %s%n", status.getNamespace());
        out.printf("Phase:            %s%n", orNone(status.getPhase()));
        out.printf("Phase reason:     %s%n", orNone(status.getPhaseReason()));
        out.printf("Target primary:   %s%n", orNone(status.getTargetPrimary()));
        out.printf("Current primary:  %s%n", orNone(status.getCurrentPrimary()));
        out.printf("Instances:        %s%n", join(status.getInstances()));
        out.printf("Fenced instances: %s%n", join(status.getFencedInstances()));
        out.printf("Hibernation:      %s%n", status.getHibernation());
        out.flush();
        return 0;
    }

    private static String orNone(String value) {
        return value == null || value.isEmpty() ? NONE : value;
    }

    private static String join(List<String> values) {
        return values.isEmpty() ? NONE : String.join(", ", values);
    }
}
