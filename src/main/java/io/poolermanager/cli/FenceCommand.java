package io.poolermanager.cli;

import io.poolermanager.mutation.ClusterStateMutator;
import io.poolermanager.store.ClusterStoreException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * {@code fence on} and {@code fence off}. The same class serves both, registered under each name.
 */
@Command(description = "Fence or unfence an instance, \"*\" for every instance of the cluster")
public class FenceCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Cluster name")
    private String clusterName;

    @Parameters(index = "1", description = "Instance name, or \"*\" for all instances")
    private String instanceName;

    private final Supplier<ClusterStateMutator> mutator;
    private final boolean fence;

    public FenceCommand(Supplier<ClusterStateMutator> mutator, boolean fence) {
        this.mutator = mutator;
        this.fence = fence;
    }

    @Override
    public Integer call() throws ClusterStoreException {
        if (fence) {
            mutator.get().fenceOn(clusterName, instanceName);
            spec.commandLine().getOut().printf("%s fenced%n", instanceName);
        } else {
            mutator.get().fenceOff(clusterName, instanceName);
            spec.commandLine().getOut().printf("%s unfenced%n", instanceName);
        }
        return 0;
    }
}
