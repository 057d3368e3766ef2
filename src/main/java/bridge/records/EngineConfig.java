package bridge.records;

import bridge.constants.EngineBinaryLocator;
import bridge.constants.EngineConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Immutable bridge settings.
 *
 * Use the nested {@link Builder}, or {@link #fromSystem()} to read system
 * properties and the {@code STOCKFISH_PATH} environment variable.
 *
 * @param command            executable plus arguments used to spawn the engine
 * @param handshakeTimeoutMs bound on {@code uci … readyok}
 * @param shutdownGraceMs    wait after {@code quit} before a forced kill
 * @param stopGraceMs        wait after {@code stop} for the engine's {@code bestmove}
 * @param bestMoveBufferMs   added to {@code movetime} to form the best-move deadline
 * @param analysisDepth      default {@code go depth}
 * @param analysisTimeoutMs  default analysis deadline
 * @param maxQueueDepth      waiting tickets allowed behind the active one (0 = unbounded)
 */
public record EngineConfig(
        List<String> command,
        long handshakeTimeoutMs,
        long shutdownGraceMs,
        long stopGraceMs,
        long bestMoveBufferMs,
        int  analysisDepth,
        long analysisTimeoutMs,
        int  maxQueueDepth
) {
    public static final String ENV_ENGINE_PATH = "STOCKFISH_PATH";
    private static final Logger LOG = LoggerFactory.getLogger(EngineConfig.class);

    public EngineConfig {
        command = List.copyOf(command);
        if (command.isEmpty()) throw new IllegalArgumentException("engine command is empty");
        if (analysisDepth < 1) throw new IllegalArgumentException("analysisDepth must be ≥ 1");
        if (maxQueueDepth < 0) throw new IllegalArgumentException("maxQueueDepth must be ≥ 0");
    }

    /** Settings from {@link System#getProperties()} and {@link System#getenv()}. */
    public static EngineConfig fromSystem() {
        return from(System::getProperty, System.getenv());
    }

    /**
     * @param props property lookup ({@code engine.path}, {@code engine.handshakeTimeoutMs}, …)
     * @param env   environment, consulted for {@value #ENV_ENGINE_PATH}
     */
    public static EngineConfig from(Function<String, String> props, Map<String, String> env) {
        Builder b = new Builder();
        String path = props.apply("engine.path");
        if (path == null || path.isBlank()) path = env.get(ENV_ENGINE_PATH);
        if (path == null || path.isBlank()) path = EngineBinaryLocator.defaultPath().toString();
        b.command(List.of(path));

        b.handshakeTimeoutMs(toLong(props, "engine.handshakeTimeoutMs", EngineConstants.HANDSHAKE_TIMEOUT_MS));
        b.shutdownGraceMs(toLong(props, "engine.shutdownGraceMs", EngineConstants.SHUTDOWN_GRACE_MS));
        b.stopGraceMs(toLong(props, "engine.stopGraceMs", EngineConstants.STOP_GRACE_MS));
        b.bestMoveBufferMs(toLong(props, "engine.bestMoveBufferMs", EngineConstants.BEST_MOVE_BUFFER_MS));
        b.analysisDepth((int) toLong(props, "engine.analysisDepth", EngineConstants.ANALYSIS_DEPTH));
        b.analysisTimeoutMs(toLong(props, "engine.analysisTimeoutMs", EngineConstants.ANALYSIS_TIMEOUT_MS));
        b.maxQueueDepth((int) toLong(props, "engine.maxQueueDepth", 0));
        return b.build();
    }

    /** Unset keys take the default; unparseable ones are logged and take it too. */
    private static long toLong(Function<String, String> props, String key, long d) {
        String s = props.apply(key);
        if (s == null || s.isBlank()) return d;
        try {
            return Long.parseLong(s.trim());
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring {}='{}': not a number, using {}", key, s, d);
            return d;
        }
    }

    public static class Builder {
        private List<String> command = List.of(EngineBinaryLocator.defaultPath().toString());
        private long handshakeTimeoutMs = EngineConstants.HANDSHAKE_TIMEOUT_MS;
        private long shutdownGraceMs = EngineConstants.SHUTDOWN_GRACE_MS;
        private long stopGraceMs = EngineConstants.STOP_GRACE_MS;
        private long bestMoveBufferMs = EngineConstants.BEST_MOVE_BUFFER_MS;
        private int analysisDepth = EngineConstants.ANALYSIS_DEPTH;
        private long analysisTimeoutMs = EngineConstants.ANALYSIS_TIMEOUT_MS;
        private int maxQueueDepth = 0;

        public Builder command(List<String> command) { this.command = Objects.requireNonNull(command); return this; }
        public Builder command(String executable) { this.command = List.of(executable); return this; }
        public Builder handshakeTimeoutMs(long ms) { this.handshakeTimeoutMs = ms; return this; }
        public Builder shutdownGraceMs(long ms) { this.shutdownGraceMs = ms; return this; }
        public Builder stopGraceMs(long ms) { this.stopGraceMs = ms; return this; }
        public Builder bestMoveBufferMs(long ms) { this.bestMoveBufferMs = ms; return this; }
        public Builder analysisDepth(int depth) { this.analysisDepth = depth; return this; }
        public Builder analysisTimeoutMs(long ms) { this.analysisTimeoutMs = ms; return this; }
        public Builder maxQueueDepth(int depth) { this.maxQueueDepth = depth; return this; }

        public EngineConfig build() {
            return new EngineConfig(command, handshakeTimeoutMs, shutdownGraceMs, stopGraceMs,
                    bestMoveBufferMs, analysisDepth, analysisTimeoutMs, maxQueueDepth);
        }
    }
}
