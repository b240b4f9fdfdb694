package io.poolermanager.process;

import java.io.IOException;

/**
 * Delivers a named POSIX signal ({@code INT}, {@code HUP}, ...) to a process.
 */
@FunctionalInterface
public interface ProcessSignaller {

    void signal(long pid, String signal) throws IOException;
}
