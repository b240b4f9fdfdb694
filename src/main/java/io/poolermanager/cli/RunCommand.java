package io.poolermanager.cli;

import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

@Command(name = "run", description = "Run the pooler and keep its configuration up to date")
public class RunCommand implements Callable<Integer> {

    private final Callable<Integer> runAction;

    public RunCommand(Callable<Integer> runAction) {
        this.runAction = runAction;
    }

    @Override
    public Integer call() throws Exception {
        return runAction.call();
    }
}
