package bridge.impl;

import bridge.contracts.ConversationHandler;
import bridge.errors.EngineException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One exclusive occupation of the engine by one request.
 *
 * <p>Three futures track it:</p>
 * <ul>
 *   <li>{@code grant}    – completed by the broker when the ticket becomes active</li>
 *   <li>{@code outcome}  – the request's result or failure</li>
 *   <li>{@code terminal} – the engine emitted the line that ends this conversation
 *       (or the ticket was aborted); the broker must not hand the engine on before it</li>
 * </ul>
 * The phase is only changed by {@link SessionBrokerImpl} under its lock.
 */
public final class Ticket<T> {

    public enum Phase { QUEUED, ACTIVE, RESOLVED }

    private final long id;
    private final long deadlineNanos;
    private final ConversationHandler<T> handler;

    private final CompletableFuture<Ticket<T>> grant    = new CompletableFuture<>();
    private final CompletableFuture<T>         outcome  = new CompletableFuture<>();
    private final CompletableFuture<Void>      terminal = new CompletableFuture<>();

    private volatile Phase phase = Phase.QUEUED;
    private volatile EngineException abortCause;

    Ticket(long id, long deadlineNanos, ConversationHandler<T> handler) {
        this.id = id;
        this.deadlineNanos = deadlineNanos;
        this.handler = handler;
    }

    /** Position in call order, starting at 1. */
    public long id()                         { return id; }
    public Phase phase()                     { return phase; }
    public CompletableFuture<Ticket<T>> granted() { return grant; }
    public CompletableFuture<T> outcome()    { return outcome; }
    public boolean terminalSeen()            { return terminal.isDone(); }

    public long remainingNanos() {
        return deadlineNanos - System.nanoTime();
    }

    /* ── broker side ──────────────────────────────────────────── */

    void activate() {
        phase = Phase.ACTIVE;
        grant.complete(this);
    }

    void resolve() {
        phase = Phase.RESOLVED;
    }

    /** Fails every stage of the ticket; used for crash, shutdown and queue withdrawal. */
    void abort(EngineException cause) {
        abortCause = cause;
        phase = Phase.RESOLVED;
        grant.completeExceptionally(cause);
        outcome.completeExceptionally(cause);
        terminal.complete(null);
    }

    EngineException abortCause() {
        return abortCause;
    }

    /** Runs on the stdout reader thread. Lines after the terminal one are ignored. */
    void deliver(String line) {
        if (terminal.isDone()) return;
        if (handler.onLine(line)) {
            terminal.complete(null);
            outcome.complete(handler.result());
        }
    }

    /* ── adapter side ─────────────────────────────────────────── */

    /**
     * Fails the outcome but keeps listening for the terminal line.
     *
     * @return {@code false} if the outcome was already settled
     */
    public boolean fail(EngineException cause) {
        return outcome.completeExceptionally(cause);
    }

    /**
     * Waits for the engine to close this conversation. An interrupt does not
     * cut the wait short; the interrupt flag is restored before returning.
     *
     * @return {@code true} if the terminal line arrived within {@code timeoutMs}
     */
    public boolean awaitTerminal(long timeoutMs) {
        long end = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        boolean interrupted = Thread.interrupted();
        try {
            while (true) {
                try {
                    terminal.get(Math.max(0L, end - System.nanoTime()), TimeUnit.NANOSECONDS);
                    return true;
                } catch (TimeoutException e) {
                    return false;
                } catch (InterruptedException e) {
                    interrupted = true;
                } catch (ExecutionException e) {
                    // terminal is only ever completed normally
                    return true;
                }
            }
        } finally {
            if (interrupted) Thread.currentThread().interrupt();
        }
    }

    @Override
    public String toString() {
        return "Ticket#" + id + "[" + phase + "]";
    }
}
