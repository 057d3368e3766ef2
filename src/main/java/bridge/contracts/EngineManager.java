package bridge.contracts;

import bridge.records.AnalysisResult;
import bridge.records.BestMoveResult;
import bridge.records.EngineStatus;

import java.util.concurrent.CompletableFuture;

/**
 * Owns the one engine process and serves analysis / best-move requests
 * against it, one conversation at a time.
 *
 * <p>An instance is created explicitly and handed to every caller; there is
 * no process-wide engine. All request methods may be called from any number
 * of threads: they queue in call order and block until their turn, their
 * result, or their deadline.</p>
 */
public interface EngineManager extends AutoCloseable {

    /**
     * Spawns the engine and completes the {@code uci}/{@code isready}
     * handshake. Returns at once when the engine is already usable; joins the
     * in-flight attempt while a handshake is running.
     *
     * @throws bridge.errors.EngineStartupException spawn failure, early exit or handshake timeout
     */
    void initialize();

    /** Non-blocking {@link #initialize()}; concurrent callers receive the same future. */
    CompletableFuture<Void> initializeAsync();

    /** {@code true} only while the engine is {@code READY} or {@code BUSY}. */
    boolean isReady();

    EngineStatus status();

    /** Analysis with the configured default depth and timeout. */
    AnalysisResult requestAnalysis(String fen);

    /** Analysis at {@code depth} with the configured default timeout. */
    AnalysisResult requestAnalysis(String fen, int depth);

    /**
     * Ranks up to three candidate moves for {@code fen} and tags the ones that mate.
     *
     * @param depth     {@code go depth} sent to the engine
     * @param timeoutMs deadline covering the wait in the queue and the conversation
     * @throws bridge.errors.InvalidPositionException rejected by the rules engine, nothing was sent
     * @throws bridge.errors.EngineTimeoutException   no {@code bestmove} before the deadline
     */
    AnalysisResult requestAnalysis(String fen, int depth, long timeoutMs);

    /**
     * One move computed under a {@code movetime} derived from {@code skillLevel}.
     *
     * @param skillLevel 0 (weakest) to 20
     * @throws IllegalArgumentException skill outside 0‥20
     */
    BestMoveResult requestBestMove(String fen, int skillLevel);

    CompletableFuture<AnalysisResult> requestAnalysisAsync(String fen, int depth, long timeoutMs);

    CompletableFuture<BestMoveResult> requestBestMoveAsync(String fen, int skillLevel);

    /**
     * Fails every queued and running request with
     * {@link bridge.errors.EngineShutdownException}, then sends {@code quit}
     * and kills the process if it outlives the grace period. No-op when
     * nothing is running.
     */
    void shutdown();

    @Override
    void close();
}
