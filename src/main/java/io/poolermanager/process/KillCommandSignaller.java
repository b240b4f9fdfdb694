package io.poolermanager.process;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Sends signals through {@code kill -s}. {@link Process#destroy()} can only send TERM, while
 * the pooler needs INT for a graceful shutdown and HUP for a reload.
 */
@Slf4j
public class KillCommandSignaller implements ProcessSignaller {

    private static final long KILL_TIMEOUT_SECONDS = 5;

    private final String killCommand;

    public KillCommandSignaller() {
        this("kill");
    }

    public KillCommandSignaller(String killCommand) {
        this.killCommand = killCommand;
    }

    @Override
    public void signal(long pid, String signal) throws IOException {
        log.debug("Sending SIG{} to process {}", signal, pid);
        Process kill = new ProcessBuilder(killCommand, "-s", signal, Long.toString(pid))
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .start();
        try {
            if (!kill.waitFor(KILL_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                kill.destroyForcibly();
                throw new IOException("Timeout sending SIG" + signal + " to process " + pid);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while sending SIG" + signal + " to process " + pid, e);
        }
        if (kill.exitValue() != 0) {
            throw new IOException("Unable to send SIG" + signal + " to process " + pid
                    + " (kill exit code " + kill.exitValue() + ")");
        }
    }
}
