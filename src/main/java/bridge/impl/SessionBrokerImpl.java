package bridge.impl;

import bridge.contracts.ConversationHandler;
import bridge.contracts.SessionBroker;
import bridge.errors.EngineBusyException;
import bridge.errors.EngineCrashException;
import bridge.errors.EngineException;
import bridge.errors.EngineNotReadyException;
import bridge.errors.EngineShutdownException;
import bridge.errors.EngineTimeoutException;
import bridge.records.EngineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * FIFO broker behind a single monitor ({@code lock}) so that:
 * <ul>
 *   <li>at most <em>one</em> ticket is active at any instant</li>
 *   <li>tickets are granted strictly in {@link #enqueue} order</li>
 *   <li>a stdout line only ever reaches the ticket that is active when it is read</li>
 * </ul>
 * Nothing that can block (pipe writes, handler code) runs while holding the monitor.
 */
public final class SessionBrokerImpl implements SessionBroker {
    private static final Logger LOG = LoggerFactory.getLogger(SessionBrokerImpl.class);

    /* ── guarded by lock ──────────────────────────────────────── */
    private final Object lock = new Object();
    private final Deque<Ticket<?>> queue = new ArrayDeque<>();
    private Ticket<?> active;
    private EngineHandle handle;
    private EngineState state = EngineState.NOT_STARTED;
    private long nextId = 0;

    /** waiting tickets allowed behind the active one, 0 = unbounded */
    private final int maxQueueDepth;

    public SessionBrokerImpl() {
        this(0);
    }

    public SessionBrokerImpl(int maxQueueDepth) {
        this.maxQueueDepth = maxQueueDepth;
    }

    /* ── tickets ──────────────────────────────────────────────── */

    @Override
    public <T> Ticket<T> enqueue(ConversationHandler<T> handler, long deadlineNanos) {
        synchronized (lock) {
            switch (state) {
                case NOT_STARTED -> throw new EngineNotReadyException("Engine not initialised");
                case CRASHED     -> throw new EngineCrashException("Engine crashed; initialize() required");
                case TERMINATING -> throw new EngineShutdownException("Engine is shutting down");
                default -> { }
            }
            if (maxQueueDepth > 0 && queue.size() >= maxQueueDepth) {
                throw new EngineBusyException(queue.size());
            }
            Ticket<T> t = new Ticket<>(++nextId, deadlineNanos, handler);
            queue.addLast(t);
            grantNext();
            return t;
        }
    }

    @Override
    public <T> Ticket<T> acquire(ConversationHandler<T> handler, long deadlineNanos) {
        Ticket<T> t = enqueue(handler, deadlineNanos);
        try {
            t.granted().get(t.remainingNanos(), TimeUnit.NANOSECONDS);
            return t;
        } catch (TimeoutException e) {
            EngineTimeoutException te = new EngineTimeoutException(
                    "Timed out waiting for the engine behind " + queuedCount() + " other request(s)");
            if (withdraw(t, te)) throw te;
            // granted or aborted in the meantime
            release(t);
            if (t.abortCause() != null) throw t.abortCause();
            throw te;
        } catch (ExecutionException e) {
            throw asEngineException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            EngineException ie = new EngineException("Interrupted while waiting for the engine", e);
            if (!withdraw(t, ie)) release(t);
            throw ie;
        }
    }

    /** Removes a still-queued ticket. @return {@code false} if it was already granted or aborted */
    private boolean withdraw(Ticket<?> t, EngineException cause) {
        synchronized (lock) {
            if (!queue.remove(t)) return false;
            t.abort(cause);
            LOG.debug("{} withdrawn from queue: {}", t, cause.getMessage());
            return true;
        }
    }

    @Override
    public void release(Ticket<?> t) {
        synchronized (lock) {
            if (queue.remove(t)) {
                t.resolve();
                return;
            }
            if (active != t) return;                          // already released or aborted
            active = null;
            t.resolve();
            if (state == EngineState.BUSY) state = EngineState.READY;
            LOG.debug("{} released", t);
            grantNext();
        }
    }

    /** Caller holds {@code lock}. */
    private void grantNext() {
        while (active == null && state == EngineState.READY && !queue.isEmpty()) {
            Ticket<?> next = queue.pollFirst();
            if (next.granted().isDone()) continue;              // aborted while queued
            active = next;
            state = EngineState.BUSY;
            LOG.debug("{} granted", next);
            next.activate();
        }
    }

    @Override
    public void send(Ticket<?> t, List<String> commands) {
        EngineHandle h;
        synchronized (lock) {
            if (active != t || handle == null) {
                EngineException cause = t.abortCause();
                throw cause != null ? cause : new EngineException(t + " does not own the engine");
            }
            h = handle;
        }
        h.send(commands);
    }

    @Override
    public void dispatch(String line) {
        Ticket<?> t;
        synchronized (lock) {
            t = active;
        }
        if (t == null) {
            LOG.debug("no active request, discarding '{}'", line);
            return;
        }
        try {
            t.deliver(line);
        } catch (RuntimeException e) {
            LOG.warn("{} handler rejected '{}'", t, line, e);
        }
    }

    /* ── state ────────────────────────────────────────────────── */

    @Override
    public EngineState state() {
        synchronized (lock) {
            return state;
        }
    }

    @Override
    public void beginHandshake() {
        synchronized (lock) {
            state = EngineState.HANDSHAKING;
            handle = null;
        }
    }

    @Override
    public void open(EngineHandle h) {
        synchronized (lock) {
            handle = h;
            state = EngineState.READY;
            grantNext();
        }
    }

    @Override
    public void beginTermination(EngineException cause) {
        failAll(EngineState.TERMINATING, cause);
    }

    @Override
    public void crashed(EngineException cause) {
        failAll(EngineState.CRASHED, cause);
    }

    @Override
    public void closed() {
        synchronized (lock) {
            state = EngineState.NOT_STARTED;
            handle = null;
        }
    }

    private void failAll(EngineState next, EngineException cause) {
        List<Ticket<?>> doomed = new ArrayList<>();
        synchronized (lock) {
            state = next;
            handle = null;
            if (active != null) doomed.add(active);
            active = null;
            doomed.addAll(queue);
            queue.clear();
            for (Ticket<?> t : doomed) t.abort(cause);
        }
        if (!doomed.isEmpty()) {
            LOG.info("{} request(s) failed on {}: {}", doomed.size(), next, cause.getMessage());
        }
    }

    @Override
    public int queuedCount() {
        synchronized (lock) {
            return queue.size();
        }
    }

    @Override
    public boolean hasActive() {
        synchronized (lock) {
            return active != null;
        }
    }

    static EngineException asEngineException(Throwable t) {
        if (t instanceof EngineException ee) return ee;
        return new EngineException(String.valueOf(t.getMessage()), t);
    }
}
