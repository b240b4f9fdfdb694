package io.poolermanager.process;

/**
 * Thrown when the supervised command cannot be started at all.
 */
public class ProcessLaunchException extends Exception {

    public ProcessLaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
