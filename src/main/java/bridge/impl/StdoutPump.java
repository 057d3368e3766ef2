package bridge.impl;

import bridge.constants.EngineConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.function.Consumer;

/**
 * The only reader of an engine's stdout. Blocks in {@link InputStream#read},
 * frames whatever arrives and pushes complete lines to {@code sink} in
 * emission order. Calls {@code onEnd} once when the stream ends or fails.
 */
final class StdoutPump implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(StdoutPump.class);

    private final InputStream in;
    private final LineFramer framer = new LineFramer();
    private final Consumer<String> sink;
    private final Consumer<String> onEnd;

    StdoutPump(InputStream in, Consumer<String> sink, Consumer<String> onEnd) {
        this.in = in;
        this.sink = sink;
        this.onEnd = onEnd;
    }

    @Override
    public void run() {
        byte[] buf = new byte[EngineConstants.READ_CHUNK_BYTES];
        String reason = "stdout closed";
        try {
            int n;
            while ((n = in.read(buf)) != -1) {
                framer.feed(buf, 0, n, this::emit);
            }
            if (framer.pendingBytes() > 0) {
                LOG.debug("dropping unterminated trailing output '{}'", framer.pendingText());
            }
        } catch (IOException e) {
            reason = "stdout read failed: " + e.getMessage();
        } finally {
            onEnd.accept(reason);
        }
    }

    private void emit(String line) {
        LOG.trace("<< {}", line);
        try {
            sink.accept(line);
        } catch (RuntimeException e) {
            LOG.warn("line handler failed on '{}'", line, e);
        }
    }

    static Thread start(String name, Runnable r) {
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        t.start();
        return t;
    }
}
