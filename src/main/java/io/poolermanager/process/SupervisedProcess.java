package io.poolermanager.process;

import io.poolermanager.logging.LogRecordTranslator;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static io.poolermanager.config.Constants.SIGNAL_HANGUP;
import static io.poolermanager.config.Constants.SIGNAL_INTERRUPT;

/**
 * Handle on one running instance of the supervised command.
 * <p>
 * Stdout and stderr are drained concurrently into their translators by two copy tasks.
 * When one copy fails, the other one is stopped as well. {@link #waitFor()} returns once the
 * process has exited and both copies are done.
 */
@Slf4j
public class SupervisedProcess {

    /**
     * Time given to the copy tasks to drain what is left in the pipes after the process exits.
     */
    static final long COPY_DRAIN_TIMEOUT_MS = 5000;

    private static final int COPY_BUFFER_SIZE = 8192;

    private final String command;
    private final Process process;
    private final ProcessSignaller signaller;
    private final ExecutorService copyExecutor;

    private final AtomicBoolean copyAborted = new AtomicBoolean(false);
    private final AtomicReference<IOException> copyFailure = new AtomicReference<>();
    private final CompletableFuture<Void> stdoutCopy;
    private final CompletableFuture<Void> stderrCopy;

    private ProcessOutcome outcome;

    SupervisedProcess(String command, Process process, ProcessSignaller signaller,
                      ExecutorService copyExecutor, LogRecordTranslator stdoutTranslator,
                      LogRecordTranslator stderrTranslator) {
        this.command = command;
        this.process = process;
        this.signaller = signaller;
        this.copyExecutor = copyExecutor;

        InputStream stdout = process.getInputStream();
        InputStream stderr = process.getErrorStream();
        this.stdoutCopy = CompletableFuture.runAsync(
                () -> copyPipe(stdout, stdoutTranslator, stderr), copyExecutor);
        this.stderrCopy = CompletableFuture.runAsync(
                () -> copyPipe(stderr, stderrTranslator, stdout), copyExecutor);
    }

    public long pid() {
        return process.pid();
    }

    public boolean isRunning() {
        return process.isAlive();
    }

    /**
     * Blocks until the process terminates and its output has been copied.
     * Calling it again returns the same outcome.
     */
    public synchronized ProcessOutcome waitFor() throws InterruptedException {
        if (outcome != null) {
            return outcome;
        }

        int exitCode = process.waitFor();
        log.debug("Process {} ({}) exited with code {}", command, process.pid(), exitCode);

        try {
            CompletableFuture.allOf(stdoutCopy, stderrCopy).get(COPY_DRAIN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // A descendant may still hold the write end of the pipes
            log.warn("Output of {} not drained {} ms after exit, stopping the copy", command, COPY_DRAIN_TIMEOUT_MS);
            abortCopy(process.getInputStream(), process.getErrorStream());
        } catch (ExecutionException e) {
            log.error("Unexpected failure in output copy of {}", command, e.getCause());
        } finally {
            copyExecutor.shutdown();
        }

        outcome = ProcessOutcome.fromExitCode(exitCode, copyFailure.get());
        return outcome;
    }

    /**
     * Asks the process to shut down gracefully.
     */
    public void interrupt() throws IOException {
        signal(SIGNAL_INTERRUPT);
    }

    /**
     * Asks the process to reload its configuration.
     */
    public void reload() throws IOException {
        signal(SIGNAL_HANGUP);
    }

    public void signal(String signal) throws IOException {
        if (!process.isAlive()) {
            throw new IOException("Process " + command + " is not running");
        }
        signaller.signal(process.pid(), signal);
    }

    private void copyPipe(InputStream source, LogRecordTranslator destination, InputStream mirror) {
        byte[] buffer = new byte[COPY_BUFFER_SIZE];
        try {
            int read;
            while (!copyAborted.get() && (read = source.read(buffer)) != -1) {
                destination.write(buffer, 0, read);
            }
        } catch (IOException e) {
            if (!copyAborted.get()) {
                log.error("Error copying {} output of {}", destination.getPipe(), command, e);
                copyFailure.compareAndSet(null, e);
                abortCopy(mirror);
            }
        } finally {
            finishCopy(source, destination);
        }
    }

    private void abortCopy(InputStream... streams) {
        copyAborted.set(true);
        for (InputStream stream : streams) {
            try {
                stream.close();
            } catch (IOException e) {
                log.warn("Error closing output pipe of {}: {}", command, e.getMessage());
            }
        }
    }

    private void finishCopy(InputStream source, LogRecordTranslator destination) {
        try {
            // Flushes the last unterminated line
            destination.close();
        } catch (IOException e) {
            log.error("Error flushing {} output of {}", destination.getPipe(), command, e);
            copyFailure.compareAndSet(null, e);
        }
        try {
            source.close();
        } catch (IOException e) {
            log.warn("Error closing {} pipe of {}: {}", destination.getPipe(), command, e.getMessage());
        }
    }
}
