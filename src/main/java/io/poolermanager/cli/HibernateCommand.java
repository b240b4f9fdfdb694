package io.poolermanager.cli;

import io.poolermanager.models.HibernationState;
import io.poolermanager.mutation.ClusterStateMutator;
import io.poolermanager.store.ClusterStoreException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * {@code hibernate on} and {@code hibernate off}.
 */
@Command(description = "Turn hibernation of a cluster on or off")
public class HibernateCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Cluster name")
    private String clusterName;

    private final Supplier<ClusterStateMutator> mutator;
    private final HibernationState requested;

    public HibernateCommand(Supplier<ClusterStateMutator> mutator, HibernationState requested) {
        this.mutator = mutator;
        this.requested = requested;
    }

    @Override
    public Integer call() throws ClusterStoreException {
        mutator.get().hibernate(clusterName, requested);
        spec.commandLine().getOut().printf("%s hibernation %s%n", clusterName, requested.getValue());
        return 0;
    }
}
