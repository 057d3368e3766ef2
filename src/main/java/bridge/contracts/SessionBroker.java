package bridge.contracts;

import bridge.errors.EngineException;
import bridge.impl.EngineHandle;
import bridge.impl.Ticket;
import bridge.records.EngineState;

import java.util.List;

/**
 * Grants exclusive use of the engine to one ticket at a time, in FIFO order,
 * and routes every stdout line to whichever ticket currently holds it.
 *
 * <p>The broker also guards the engine's {@link EngineState}: granting flips
 * {@code READY → BUSY} and releasing flips it back, atomically with picking
 * the next ticket.</p>
 */
public interface SessionBroker {

    /**
     * Queues a ticket and returns without waiting.
     *
     * @param deadlineNanos {@link System#nanoTime()} instant after which the request gives up
     * @throws bridge.errors.EngineNotReadyException never initialised
     * @throws bridge.errors.EngineCrashException    engine crashed, re-initialise first
     * @throws bridge.errors.EngineShutdownException shutdown in progress
     * @throws bridge.errors.EngineBusyException     bounded queue already full
     */
    <T> Ticket<T> enqueue(ConversationHandler<T> handler, long deadlineNanos);

    /**
     * {@link #enqueue} and block until granted.
     *
     * @throws bridge.errors.EngineTimeoutException deadline passed while still queued
     */
    <T> Ticket<T> acquire(ConversationHandler<T> handler, long deadlineNanos);

    /** Gives the engine back and grants the next ticket. Safe to call more than once. */
    void release(Ticket<?> ticket);

    /**
     * Writes {@code commands} to the engine on behalf of the active ticket.
     *
     * @throws EngineException the ticket is no longer active (its abort cause), or the pipe broke
     */
    void send(Ticket<?> ticket, List<String> commands);

    /** Delivers one complete stdout line to the active ticket, or drops it if there is none. */
    void dispatch(String line);

    EngineState state();

    /* ── life-cycle transitions driven by the manager ─────────── */

    void beginHandshake();

    /** Handshake done: attach the handle, become {@code READY}, grant the queue head. */
    void open(EngineHandle handle);

    /** Enter {@code TERMINATING}, failing every ticket with {@code cause}. */
    void beginTermination(EngineException cause);

    /** Enter {@code CRASHED}, failing every ticket with {@code cause}. */
    void crashed(EngineException cause);

    /** Back to {@code NOT_STARTED} after a completed shutdown. */
    void closed();

    int queuedCount();

    boolean hasActive();
}
