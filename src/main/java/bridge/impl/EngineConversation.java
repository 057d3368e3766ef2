package bridge.impl;

import bridge.constants.EngineConstants;
import bridge.contracts.ConversationHandler;
import bridge.contracts.SessionBroker;
import bridge.errors.EngineException;
import bridge.errors.EngineTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Shared skeleton of a request adapter: acquire a ticket, write the command
 * sequence, wait for the handler's terminal line or the deadline, release.
 *
 * <p>On deadline the engine is told to {@code stop} and the ticket keeps the
 * engine until the engine closes the conversation or the stop grace runs out,
 * so a late {@code bestmove} cannot be read as the next request's answer.</p>
 *
 * @param <R> what {@link #execute()} returns to the caller
 */
abstract class EngineConversation<R> {
    private static final Logger LOG = LoggerFactory.getLogger(EngineConversation.class);

    protected final SessionBroker broker;
    private final long stopGraceMs;

    EngineConversation(SessionBroker broker, long stopGraceMs) {
        this.broker = broker;
        this.stopGraceMs = stopGraceMs;
    }

    abstract R execute();

    /** Short description for log and error messages. */
    abstract String describe();

    /**
     * Runs one exclusive conversation. {@link SessionBroker#release} is
     * called exactly once, whatever happens after the grant.
     */
    protected final <T> T converse(ConversationHandler<T> handler, List<String> commands, long timeoutMs) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        Ticket<T> t = broker.acquire(handler, deadline);
        try {
            broker.send(t, commands);
            return await(t, timeoutMs);
        } finally {
            broker.release(t);
        }
    }

    private <T> T await(Ticket<T> t, long timeoutMs) {
        try {
            return t.outcome().get(t.remainingNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            EngineTimeoutException te = new EngineTimeoutException(describe() + " timed out after " + timeoutMs + " ms");
            if (!t.fail(te)) return settled(t);                // finished right at the deadline
            LOG.warn("{}; sending stop", te.getMessage());
            stopAndDrain(t);
            throw te;
        } catch (ExecutionException e) {
            throw SessionBrokerImpl.asEngineException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            EngineException ie = new EngineException(describe() + " interrupted", e);
            if (t.fail(ie)) stopAndDrain(t);
            throw ie;
        }
    }

    private void stopAndDrain(Ticket<?> t) {
        try {
            broker.send(t, List.of(EngineConstants.STOP));
        } catch (EngineException e) {
            LOG.debug("stop not sent for {}: {}", t, e.getMessage());
            return;
        }
        if (!t.awaitTerminal(stopGraceMs)) {
            LOG.warn("{}: no bestmove within {} ms of stop, releasing the engine anyway", describe(), stopGraceMs);
        }
    }

    private static <T> T settled(Ticket<T> t) {
        try {
            return t.outcome().get();
        } catch (ExecutionException e) {
            throw SessionBrokerImpl.asEngineException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineException("Interrupted", e);
        }
    }
}
