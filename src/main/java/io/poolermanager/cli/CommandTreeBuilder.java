package io.poolermanager.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.poolermanager.models.HibernationState;
import io.poolermanager.mutation.ClusterStateMutator;
import io.poolermanager.store.ClusterStore;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Builds the command tree of the pooler manager.
 * <p>
 * Called once at start-up. Commands get their dependencies from here; stores are supplied
 * lazily so that commands which do not need them never connect.
 * A failing command prints the error message on stderr and exits with status 1.
 */
@Slf4j
public final class CommandTreeBuilder {

    static final int EXIT_FAILURE = 1;

    private CommandTreeBuilder() {
        // Utility class
    }

    @Command(name = "pooler-manager", mixinStandardHelpOptions = true,
            description = "Runs a connection pooler and manages the state of database clusters")
    static class RootCommand {
    }

    @Command(name = "fence", mixinStandardHelpOptions = true, description = "Fence or unfence instances")
    static class FenceGroup {
    }

    @Command(name = "hibernate", mixinStandardHelpOptions = true, description = "Hibernate a cluster")
    static class HibernateGroup {
    }

    public static CommandLine build(String namespace, Supplier<ClusterStore> clusterStore,
                                    Supplier<ClusterStateMutator> mutator, ObjectMapper objectMapper,
                                    Callable<Integer> runAction) {
        CommandLine fence = new CommandLine(new FenceGroup())
                .addSubcommand("on", new FenceCommand(mutator, true))
                .addSubcommand("off", new FenceCommand(mutator, false));

        CommandLine hibernate = new CommandLine(new HibernateGroup())
                .addSubcommand("on", new HibernateCommand(mutator, HibernationState.ON))
                .addSubcommand("off", new HibernateCommand(mutator, HibernationState.OFF));

        CommandLine root = new CommandLine(new RootCommand())
                .addSubcommand("run", new RunCommand(runAction))
                .addSubcommand("promote", new PromoteCommand(mutator))
                .addSubcommand("fence", fence)
                .addSubcommand("hibernate", hibernate)
                .addSubcommand("status", new StatusCommand(namespace, clusterStore, objectMapper));

        root.setExecutionExceptionHandler((e, commandLine, parseResult) -> {
            log.debug("Command {} failed", commandLine.getCommandName(), e);
            commandLine.getErr().println(e.getMessage());
            commandLine.getErr().flush();
            return EXIT_FAILURE;
        });
        return root;
    }
}
