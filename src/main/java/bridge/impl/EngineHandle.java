package bridge.impl;

import bridge.errors.EngineCrashException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * A spawned engine process together with its command pipe.
 *
 * <p>Writes are serialised on the handle. A failed write reports the handle
 * to the owner's pipe-failure hook (outside the handle's monitor) and
 * surfaces as {@link EngineCrashException}.</p>
 */
public final class EngineHandle {
    private static final Logger LOG = LoggerFactory.getLogger(EngineHandle.class);

    private final Process process;
    private final Writer stdin;
    private final BiConsumer<EngineHandle, Throwable> onPipeFailure;
    private volatile String engineName = "";

    public EngineHandle(Process process, BiConsumer<EngineHandle, Throwable> onPipeFailure) {
        this.process = process;
        this.onPipeFailure = onPipeFailure;
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
    }

    public Process process() {
        return process;
    }

    public long pid() {
        try {
            return process.pid();
        } catch (UnsupportedOperationException e) {
            return -1;
        }
    }

    public String engineName()            { return engineName; }
    void engineName(String name)          { this.engineName = name; }

    public void send(String command) {
        send(List.of(command));
    }

    /** Writes each command followed by {@code '\n'} and flushes once. */
    public void send(List<String> commands) {
        IOException failure = null;
        synchronized (this) {
            try {
                for (String c : commands) {
                    LOG.debug(">> [{}] {}", pid(), c);
                    stdin.write(c);
                    stdin.write('\n');
                }
                stdin.flush();
            } catch (IOException e) {
                failure = e;
            }
        }
        if (failure != null) {
            onPipeFailure.accept(this, failure);
            throw new EngineCrashException("Cannot write to engine " + pid() + ": " + failure.getMessage(), failure);
        }
    }

    /** @return {@code true} if the process exited within {@code timeoutMs} */
    public boolean awaitExit(long timeoutMs) {
        try {
            return process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !process.isAlive();
        }
    }

    public void destroyForcibly() {
        process.destroyForcibly();
    }

    /** Closes the pipes; the reader threads see end-of-stream and exit. */
    void closeStreams() {
        closeQuietly(stdin);
        closeQuietly(process.getInputStream());
        closeQuietly(process.getErrorStream());
    }

    private static void closeQuietly(java.io.Closeable c) {
        try {
            c.close();
        } catch (IOException e) {
            LOG.debug("closing engine stream failed: {}", e.toString());
        }
    }

    @Override
    public String toString() {
        return "EngineHandle[pid=" + pid() + (engineName.isEmpty() ? "" : ", " + engineName) + "]";
    }
}
