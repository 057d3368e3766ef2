package bridge.impl;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.function.Consumer;

/**
 * Turns arbitrary stdout chunks into complete lines.
 *
 * <p>Between calls the buffer holds exactly the trailing fragment after the
 * last {@code '\n'}. Lines are decoded only once complete, so a multi-byte
 * character split across chunks is never mangled, and the emitted lines are
 * the same however the chunks were cut. A trailing {@code '\r'} and
 * surrounding blanks are stripped; empty lines are dropped.</p>
 *
 * <p>Not thread-safe: owned by the one reader thread of an engine process.</p>
 */
public final class LineFramer {

    private byte[] pending = new byte[256];
    private int size;

    /** Appends {@code len} bytes and hands every completed line to {@code sink}. */
    public void feed(byte[] chunk, int off, int len, Consumer<String> sink) {
        int start = off;
        int end = off + len;
        for (int i = off; i < end; i++) {
            if (chunk[i] != '\n') continue;
            String line;
            if (size == 0) {
                line = decode(chunk, start, i - start);
            } else {
                append(chunk, start, i - start);
                line = decode(pending, 0, size);
                size = 0;
            }
            start = i + 1;
            if (!line.isEmpty()) sink.accept(line);
        }
        if (start < end) append(chunk, start, end - start);
    }

    public void feed(byte[] chunk, Consumer<String> sink) {
        feed(chunk, 0, chunk.length, sink);
    }

    /** Bytes of the incomplete last line. */
    public int pendingBytes() {
        return size;
    }

    public String pendingText() {
        return new String(pending, 0, size, StandardCharsets.UTF_8);
    }

    public void reset() {
        size = 0;
    }

    private void append(byte[] src, int off, int len) {
        if (size + len > pending.length) {
            pending = Arrays.copyOf(pending, Math.max(pending.length * 2, size + len));
        }
        System.arraycopy(src, off, pending, size, len);
        size += len;
    }

    private static String decode(byte[] buf, int off, int len) {
        return new String(buf, off, len, StandardCharsets.UTF_8).strip();
    }
}
