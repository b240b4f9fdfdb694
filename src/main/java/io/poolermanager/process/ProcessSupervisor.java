package io.poolermanager.process;

import io.poolermanager.logging.LogRecordTranslator;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts the pooling process and wires its output into log record translators.
 * <p>
 * The supervisor never restarts the process: it starts it once and reports how it ended.
 * Restarting is left to whatever runs this program.
 */
@Slf4j
public class ProcessSupervisor {

    private final ProcessSignaller signaller;
    private final AtomicInteger copyThreadCounter = new AtomicInteger();

    public ProcessSupervisor(ProcessSignaller signaller) {
        this.signaller = signaller;
    }

    /**
     * Start {@code command} with {@code arguments} and return immediately.
     *
     * @throws ProcessLaunchException if the process could not be started (missing binary,
     *                                permission denied); nothing else is done in that case
     */
    public SupervisedProcess start(String command, List<String> arguments,
                                   LogRecordTranslator stdoutTranslator,
                                   LogRecordTranslator stderrTranslator) throws ProcessLaunchException {
        List<String> commandLine = new ArrayList<>();
        commandLine.add(command);
        commandLine.addAll(arguments);

        Process process;
        try {
            process = new ProcessBuilder(commandLine).start();
        } catch (IOException e) {
            log.error("Failed to start {}: {}", command, e.getMessage());
            throw new ProcessLaunchException("Failed to start " + command, e);
        }
        log.info("Started {} with arguments {} (pid {})", command, arguments, process.pid());

        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.warn("Unable to close stdin of {}: {}", command, e.getMessage());
        }

        ExecutorService copyExecutor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r);
            t.setName("pipe-copy-" + copyThreadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        return new SupervisedProcess(command, process, signaller, copyExecutor,
                stdoutTranslator, stderrTranslator);
    }
}
