package com.deepagent.backend;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Output sink that keeps at most {@code limit} bytes and remembers whether more arrived.
 * Writers keep draining past the limit so the producing process never blocks.
 */
public class BoundedOutput extends OutputStream {

    private final int limit;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private boolean overflowed;

    public BoundedOutput(int limit) {
        this.limit = limit;
    }

    @Override
    public synchronized void write(int b) {
        if (buffer.size() < limit) {
            buffer.write(b);
        } else {
            overflowed = true;
        }
    }

    @Override
    public synchronized void write(byte[] bytes, int off, int len) {
        int room = limit - buffer.size();
        if (len <= room) {
            buffer.write(bytes, off, len);
            return;
        }
        if (room > 0) {
            buffer.write(bytes, off, room);
        }
        overflowed = true;
    }

    public synchronized boolean overflowed() {
        return overflowed;
    }

    public synchronized int size() {
        return buffer.size();
    }

    public synchronized String text() {
        if (!overflowed) {
            return buffer.toString(StandardCharsets.UTF_8);
        }
        byte[] bytes = buffer.toByteArray();
        return new String(bytes, 0, completeLength(bytes, bytes.length), StandardCharsets.UTF_8);
    }

    /**
     * The captured text with the truncation marker appended when the limit was hit.
     */
    public synchronized String render() {
        return overflowed ? text() + ExecuteResult.TRUNCATION_MARKER : text();
    }

    /**
     * Caps already-captured text at {@code maxBytes} UTF-8 bytes, appending the marker
     * when anything was cut.
     */
    public static ExecuteResult cap(String output, int exitCode, int maxBytes) {
        byte[] bytes = output.getBytes(StandardCharsets.UTF_8);
        if (bytes.length <= maxBytes) {
            return new ExecuteResult(output, exitCode, false);
        }
        String head = new String(bytes, 0, completeLength(bytes, maxBytes), StandardCharsets.UTF_8);
        return new ExecuteResult(head + ExecuteResult.TRUNCATION_MARKER, exitCode, true);
    }

    /**
     * Length of the longest prefix of {@code bytes[0..length)} that does not end inside a
     * multi-byte UTF-8 sequence.
     */
    static int completeLength(byte[] bytes, int length) {
        int lead = length;
        while (lead > 0 && length - lead < 3 && (bytes[lead - 1] & 0xC0) == 0x80) {
            lead--;
        }
        if (lead == 0) {
            return length;
        }
        int first = bytes[lead - 1] & 0xFF;
        int expected = first >= 0xF0 ? 4 : first >= 0xE0 ? 3 : first >= 0xC0 ? 2 : 1;
        return length - (lead - 1) < expected ? lead - 1 : length;
    }
}
