package io.poolermanager.logging;

import java.io.IOException;

/**
 * Destination of translated log records.
 * <p>
 * A single sink is shared by the stdout and stderr translators, so implementations
 * must accept concurrent calls.
 */
@FunctionalInterface
public interface LogRecordSink {

    /**
     * Accept one record. A failure aborts copying from the stream that produced it.
     */
    void accept(LogRecord record) throws IOException;
}
