package bridge.errors;

/**
 * Root of every failure the bridge reports to its callers.
 *
 * <p>A request either yields its result or one of the subclasses below;
 * the broker keeps serving the next ticket either way.</p>
 */
public class EngineException extends RuntimeException {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
