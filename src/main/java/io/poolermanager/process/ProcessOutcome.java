package io.poolermanager.process;

import lombok.Getter;

import java.io.IOException;
import java.util.Optional;

/**
 * How a supervised process ended.
 * <p>
 * The exit classification and the output copy result are independent: a process can exit
 * cleanly while copying one of its streams failed, and the other way around.
 */
@Getter
public class ProcessOutcome {

    /**
     * On POSIX systems the JDK reports death by signal N as exit code 128 + N.
     */
    static final int SIGNAL_EXIT_CODE_BASE = 128;
    private static final int MAX_SIGNAL = 64;

    public enum Termination {
        CLEAN_EXIT,
        NON_ZERO_EXIT,
        SIGNALED
    }

    private final Termination termination;
    private final int exitCode;
    private final IOException copyFailure;

    ProcessOutcome(Termination termination, int exitCode, IOException copyFailure) {
        this.termination = termination;
        this.exitCode = exitCode;
        this.copyFailure = copyFailure;
    }

    public static ProcessOutcome fromExitCode(int exitCode, IOException copyFailure) {
        Termination termination;
        if (exitCode == 0) {
            termination = Termination.CLEAN_EXIT;
        } else if (exitCode > SIGNAL_EXIT_CODE_BASE && exitCode <= SIGNAL_EXIT_CODE_BASE + MAX_SIGNAL) {
            termination = Termination.SIGNALED;
        } else {
            termination = Termination.NON_ZERO_EXIT;
        }
        return new ProcessOutcome(termination, exitCode, copyFailure);
    }

    /**
     * Signal number that terminated the process, when it was killed by one.
     */
    public Optional<Integer> getSignal() {
        if (termination != Termination.SIGNALED) {
            return Optional.empty();
        }
        return Optional.of(exitCode - SIGNAL_EXIT_CODE_BASE);
    }

    /**
     * True when the process exited with status 0 and both streams were copied completely.
     */
    public boolean isSuccess() {
        return termination == Termination.CLEAN_EXIT && copyFailure == null;
    }

    public String describe() {
        String base;
        switch (termination) {
            case CLEAN_EXIT:
                base = "exited with status 0";
                break;
            case SIGNALED:
                base = "terminated by signal " + (exitCode - SIGNAL_EXIT_CODE_BASE);
                break;
            default:
                base = "exited with status " + exitCode;
        }
        if (copyFailure != null) {
            base += " (output copy failed: " + copyFailure.getMessage() + ")";
        }
        return base;
    }

    @Override
    public String toString() {
        return "ProcessOutcome{" + describe() + "}";
    }
}
