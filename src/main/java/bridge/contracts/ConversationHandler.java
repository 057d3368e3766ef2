package bridge.contracts;

/**
 * Consumes the engine's output lines for one ticket, in emission order,
 * until the line that ends the conversation.
 *
 * <p>Implementations are driven from the single stdout reader thread and
 * must not block. Lines they do not understand are skipped.</p>
 *
 * @param <T> shape of the finished result
 */
public interface ConversationHandler<T> {

    /**
     * @param line one complete, trimmed, non-empty output line
     * @return {@code true} if {@code line} was the terminal line; no further lines are delivered
     */
    boolean onLine(String line);

    /** Result built from the lines seen; only called after {@link #onLine} returned {@code true}. */
    T result();
}
