package bridge.impl;

import bridge.constants.EngineConstants;
import bridge.contracts.EngineManager;
import bridge.contracts.ProcessLauncher;
import bridge.contracts.RulesEngine;
import bridge.contracts.SessionBroker;
import bridge.errors.EngineCrashException;
import bridge.errors.EngineException;
import bridge.errors.EngineShutdownException;
import bridge.errors.EngineStartupException;
import bridge.records.AnalysisResult;
import bridge.records.BestMoveResult;
import bridge.records.EngineConfig;
import bridge.records.EngineState;
import bridge.records.EngineStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Life-cycle of the engine process plus the two request kinds.
 *
 * <p>Two monitors, always taken in this order: {@code lifecycleLock} (spawn,
 * handshake, crash, shutdown) and then the broker's own lock. Nothing waits
 * on the process while holding {@code lifecycleLock}.</p>
 */
public final class EngineManagerImpl implements EngineManager {
    private static final Logger LOG = LoggerFactory.getLogger(EngineManagerImpl.class);

    /* ── collaborators ─────────────────────────────────────────── */
    private final EngineConfig config;
    private final ProcessLauncher launcher;
    private final RulesEngine rules;
    private final SessionBroker broker;
    private final ExecutorService requestPool;

    /* ── guarded by lifecycleLock ─────────────────────────────── */
    private final Object lifecycleLock = new Object();
    private EngineHandle handle;
    private Handshake handshake;
    private CompletableFuture<Void> initFuture;

    public EngineManagerImpl(EngineConfig config, ProcessLauncher launcher, RulesEngine rules) {
        this.config = config;
        this.launcher = launcher;
        this.rules = rules;
        this.broker = new SessionBrokerImpl(config.maxQueueDepth());
        AtomicInteger n = new AtomicInteger();
        this.requestPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "engine-request-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public EngineManagerImpl(EngineConfig config, RulesEngine rules) {
        this(config, new DefaultProcessLauncher(), rules);
    }

    /* ── initialise ───────────────────────────────────────────── */

    @Override
    public void initialize() {
        try {
            initializeAsync().get();
        } catch (ExecutionException e) {
            Throwable c = e.getCause();
            if (c instanceof EngineStartupException se) throw se;
            throw new EngineStartupException("Engine initialisation failed: " + c.getMessage(), c);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineStartupException("Interrupted during engine initialisation", e);
        }
    }

    @Override
    public CompletableFuture<Void> initializeAsync() {
        synchronized (lifecycleLock) {
            EngineState s = broker.state();
            if (s.isUsable()) return CompletableFuture.completedFuture(null);
            if (s == EngineState.HANDSHAKING && initFuture != null) return initFuture;
            if (s == EngineState.TERMINATING) {
                return CompletableFuture.failedFuture(new EngineStartupException("Engine is shutting down"));
            }

            broker.beginHandshake();
            initFuture = new CompletableFuture<>();
            LOG.info("Starting engine {}", config.command());

            Process p;
            try {
                p = launcher.launch(config.command());
            } catch (IOException | RuntimeException e) {
                broker.crashed(new EngineCrashException("Engine could not be spawned", e));
                EngineStartupException se = new EngineStartupException(
                        "Failed to spawn engine " + config.command() + ": " + e.getMessage(), e);
                initFuture.completeExceptionally(se);
                return initFuture;
            }

            EngineHandle h = new EngineHandle(p, this::onPipeFailure);
            handle = h;
            Handshake hs = new Handshake(h);
            handshake = hs;

            StdoutPump.start("engine-stdout-" + h.pid(),
                    new StdoutPump(p.getInputStream(), line -> onLine(h, line), reason -> onEngineLost(h, reason)));
            StdoutPump.start("engine-stderr-" + h.pid(), () -> drainStderr(h));
            p.onExit().thenRun(() -> onEngineLost(h, "process exited with code " + exitCode(p)));

            hs.done.orTimeout(config.handshakeTimeoutMs(), TimeUnit.MILLISECONDS)
                    .whenComplete((v, ex) -> finishHandshake(h, ex));
            try {
                h.send(EngineConstants.UCI);
            } catch (EngineCrashException e) {
                hs.done.completeExceptionally(new EngineStartupException("Engine stdin not writable", e));
            }
            return initFuture;
        }
    }

    private void finishHandshake(EngineHandle h, Throwable ex) {
        synchronized (lifecycleLock) {
            if (handle != h || broker.state() != EngineState.HANDSHAKING) return;   // superseded by shutdown
            handshake = null;
            if (ex == null) {
                broker.open(h);
                LOG.info("Engine ready: {}", h);
                initFuture.complete(null);
                return;
            }
            Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
            EngineStartupException se;
            if (cause instanceof TimeoutException) {
                se = new EngineStartupException("Engine handshake timed out after " + config.handshakeTimeoutMs() + " ms");
            } else if (cause instanceof EngineStartupException ese) {
                se = ese;
            } else {
                se = new EngineStartupException("Engine handshake failed: " + cause.getMessage(), cause);
            }
            LOG.error(se.getMessage());
            handle = null;
            broker.crashed(new EngineCrashException("Engine failed to start: " + se.getMessage(), se));
            h.destroyForcibly();
            h.closeStreams();
            initFuture.completeExceptionally(se);
        }
    }

    /* ── process events ───────────────────────────────────────── */

    private void onLine(EngineHandle h, String line) {
        Handshake hs;
        synchronized (lifecycleLock) {
            hs = handle == h ? handshake : null;
        }
        if (hs != null) {
            hs.offer(line);
            return;
        }
        broker.dispatch(line);
    }

    private void onPipeFailure(EngineHandle h, Throwable cause) {
        onEngineLost(h, "stdin write failed: " + cause.getMessage());
    }

    /** Process exit, stdout EOF or broken stdin. Idempotent per handle. */
    private void onEngineLost(EngineHandle h, String reason) {
        synchronized (lifecycleLock) {
            if (handle != h) return;
            switch (broker.state()) {
                case HANDSHAKING -> {
                    if (handshake != null) {
                        handshake.done.completeExceptionally(
                                new EngineStartupException("Engine " + reason + " before the handshake completed"));
                    }
                }
                case TERMINATING -> LOG.debug("engine {} during shutdown", reason);
                default -> {
                    LOG.error("Engine {} unexpectedly: {}", h, reason);
                    handle = null;
                    broker.crashed(new EngineCrashException("Engine " + reason));
                    h.destroyForcibly();
                    h.closeStreams();
                }
            }
        }
    }

    private void drainStderr(EngineHandle h) {
        try (BufferedReader err = new BufferedReader(
                new InputStreamReader(h.process().getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = err.readLine()) != null) {
                if (!line.isBlank()) LOG.warn("engine stderr: {}", line.strip());
            }
        } catch (IOException e) {
            LOG.debug("engine stderr closed: {}", e.toString());
        }
    }

    private static String exitCode(Process p) {
        try {
            return Integer.toString(p.exitValue());
        } catch (IllegalThreadStateException e) {
            return "?";
        }
    }

    /* ── queries ──────────────────────────────────────────────── */

    @Override
    public boolean isReady() {
        return broker.state().isUsable();
    }

    @Override
    public EngineStatus status() {
        EngineHandle h;
        synchronized (lifecycleLock) {
            h = handle;
        }
        return new EngineStatus(broker.state(),
                h == null ? -1 : h.pid(),
                h == null ? "" : h.engineName(),
                broker.queuedCount(),
                broker.hasActive());
    }

    /* ── requests ─────────────────────────────────────────────── */

    @Override
    public AnalysisResult requestAnalysis(String fen) {
        return requestAnalysis(fen, config.analysisDepth(), config.analysisTimeoutMs());
    }

    @Override
    public AnalysisResult requestAnalysis(String fen, int depth) {
        return requestAnalysis(fen, depth, config.analysisTimeoutMs());
    }

    @Override
    public AnalysisResult requestAnalysis(String fen, int depth, long timeoutMs) {
        return new AnalysisRequest(broker, rules, config.stopGraceMs(), fen, depth, timeoutMs).execute();
    }

    @Override
    public BestMoveResult requestBestMove(String fen, int skillLevel) {
        return new BestMoveRequest(broker, config.stopGraceMs(), config.bestMoveBufferMs(), fen, skillLevel).execute();
    }

    @Override
    public CompletableFuture<AnalysisResult> requestAnalysisAsync(String fen, int depth, long timeoutMs) {
        return CompletableFuture.supplyAsync(() -> requestAnalysis(fen, depth, timeoutMs), requestPool);
    }

    @Override
    public CompletableFuture<BestMoveResult> requestBestMoveAsync(String fen, int skillLevel) {
        return CompletableFuture.supplyAsync(() -> requestBestMove(fen, skillLevel), requestPool);
    }

    /* ── shutdown ─────────────────────────────────────────────── */

    @Override
    public void shutdown() {
        EngineHandle h;
        synchronized (lifecycleLock) {
            EngineState s = broker.state();
            if (s == EngineState.NOT_STARTED || s == EngineState.CRASHED || s == EngineState.TERMINATING) {
                LOG.debug("shutdown ignored in state {}", s);
                return;
            }
            LOG.info("Shutting down engine {}", handle);
            broker.beginTermination(new EngineShutdownException("Engine is shutting down"));
            if (s == EngineState.HANDSHAKING && initFuture != null) {
                initFuture.completeExceptionally(new EngineStartupException("Engine shut down during handshake"));
            }
            handshake = null;
            h = handle;
        }

        if (h != null) terminate(h);

        synchronized (lifecycleLock) {
            if (handle == h) handle = null;
            broker.closed();
        }
        LOG.info("Engine stopped");
    }

    private void terminate(EngineHandle h) {
        try {
            h.send(EngineConstants.QUIT);
        } catch (EngineException e) {
            LOG.debug("quit not delivered: {}", e.getMessage());
        }
        if (!h.awaitExit(config.shutdownGraceMs())) {
            LOG.warn("Engine did not quit within {} ms, killing it", config.shutdownGraceMs());
            h.destroyForcibly();
            if (!h.awaitExit(config.shutdownGraceMs())) {
                LOG.error("Engine {} still alive after forced kill", h);
            }
        }
        h.closeStreams();
    }

    @Override
    public void close() {
        try {
            shutdown();
        } finally {
            requestPool.shutdownNow();
        }
    }

    /* ── handshake ────────────────────────────────────────────── */

    /** {@code uci} → {@code uciok}, then {@code isready} → {@code readyok}. Runs on the stdout thread. */
    private static final class Handshake {
        private final EngineHandle h;
        final CompletableFuture<Void> done = new CompletableFuture<>();
        private boolean uciOk;

        Handshake(EngineHandle h) {
            this.h = h;
        }

        void offer(String line) {
            if (done.isDone()) return;
            if (!uciOk) {
                UciLines.engineName(line).ifPresent(h::engineName);
                if (line.equals(EngineConstants.UCI_OK)) {
                    uciOk = true;
                    LOG.debug("uciok from {}, sending isready", h);
                    try {
                        h.send(EngineConstants.IS_READY);
                    } catch (EngineCrashException e) {
                        done.completeExceptionally(new EngineStartupException("Failed to send isready after uciok", e));
                    }
                }
            } else if (line.equals(EngineConstants.READY_OK)) {
                done.complete(null);
            }
        }
    }
}
