package io.poolermanager.logging;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Output stream that turns the raw output of the pooling process into {@link LogRecord}s.
 * <p>
 * Bytes are buffered until a newline arrives; every complete line is parsed and handed to
 * the sink before {@link #write(byte[], int, int)} returns. Chunk boundaries do not matter:
 * a chunk may hold several lines, part of a line, or nothing at all. An unterminated
 * trailing line is flushed on {@link #close()}.
 * <p>
 * A line longer than the maximum line length is emitted in pieces of that length, each as
 * an unmatched record, so the carry-over buffer stays bounded.
 * <p>
 * Lines in the pooler's own format, e.g.
 * <pre>2024-01-01 00:00:00.000 UTC [123] LOG message text</pre>
 * become matched records; anything else becomes an unmatched record holding the raw line.
 */
public class LogRecordTranslator extends OutputStream {

    static final Pattern LINE_PATTERN = Pattern.compile(
            "^(\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}\\.\\d{3} \\S+) \\[(\\d+)\\] (\\S+) (.+)$");

    static final int DEFAULT_MAX_LINE_LENGTH = 64 * 1024;

    private static final byte NEWLINE = '\n';

    private final String pipe;
    private final LogRecordSink sink;
    private final int maxLineLength;
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private boolean closed;

    public LogRecordTranslator(String pipe, LogRecordSink sink) {
        this(pipe, sink, DEFAULT_MAX_LINE_LENGTH);
    }

    LogRecordTranslator(String pipe, LogRecordSink sink, int maxLineLength) {
        if (maxLineLength < 1) {
            throw new IllegalArgumentException("maxLineLength must be positive");
        }
        this.pipe = pipe;
        this.sink = Objects.requireNonNull(sink, "sink");
        this.maxLineLength = maxLineLength;
    }

    public String getPipe() {
        return pipe;
    }

    @Override
    public void write(int b) throws IOException {
        write(new byte[]{(byte) b}, 0, 1);
    }

    @Override
    public synchronized void write(byte[] buffer, int offset, int length) throws IOException {
        Objects.checkFromIndexSize(offset, length, buffer.length);
        if (closed) {
            throw new IOException("log record translator for " + pipe + " is closed");
        }

        int lineStart = offset;
        int end = offset + length;
        for (int i = offset; i < end; i++) {
            if (buffer[i] == NEWLINE) {
                appendPending(buffer, lineStart, i - lineStart);
                emitPendingLine();
                lineStart = i + 1;
            }
        }
        appendPending(buffer, lineStart, end - lineStart);
    }

    /**
     * Flushes the unterminated trailing line, if any. Further writes fail.
     */
    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (pending.size() > 0) {
            emitPendingLine();
        }
    }

    /**
     * Parse one line without its terminator.
     */
    public static LogRecord translate(String pipe, String line) {
        Matcher matcher = LINE_PATTERN.matcher(line);
        if (!matcher.matches()) {
            return LogRecord.unmatched(pipe, line);
        }
        return LogRecord.builder()
                .pipe(pipe)
                .timestamp(matcher.group(1))
                .pid(matcher.group(2))
                .level(matcher.group(3))
                .message(matcher.group(4))
                .matched(true)
                .build();
    }

    private void appendPending(byte[] buffer, int offset, int length) throws IOException {
        while (length > 0) {
            if (pending.size() >= maxLineLength) {
                emitOverlongLine();
            }
            int count = Math.min(maxLineLength - pending.size(), length);
            pending.write(buffer, offset, count);
            offset += count;
            length -= count;
        }
    }

    private void emitOverlongLine() throws IOException {
        String piece = pending.toString(UTF_8);
        pending.reset();
        sink.accept(LogRecord.unmatched(pipe, piece));
    }

    private void emitPendingLine() throws IOException {
        String line = pending.toString(UTF_8);
        pending.reset();
        if (line.endsWith("\r")) {
            line = line.substring(0, line.length() - 1);
        }
        sink.accept(translate(pipe, line));
    }
}
