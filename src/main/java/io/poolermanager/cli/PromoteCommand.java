package io.poolermanager.cli;

import io.poolermanager.mutation.ClusterStateMutator;
import io.poolermanager.store.ClusterStoreException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;
import java.util.function.Supplier;

@Command(name = "promote", description = "Promote an instance to primary of a cluster")
public class PromoteCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Cluster name")
    private String clusterName;

    @Parameters(index = "1", description = "Name of the instance to promote")
    private String instanceName;

    private final Supplier<ClusterStateMutator> mutator;

    public PromoteCommand(Supplier<ClusterStateMutator> mutator) {
        this.mutator = mutator;
    }

    @Override
    public Integer call() throws ClusterStoreException {
        mutator.get().promote(clusterName, instanceName);
        spec.commandLine().getOut().printf("Node %s in cluster %s will be promoted%n", instanceName, clusterName);
        return 0;
    }
}
