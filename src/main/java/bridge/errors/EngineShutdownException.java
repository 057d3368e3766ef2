package bridge.errors;

/** Request cancelled because {@code shutdown()} started while it was queued or running. */
public class EngineShutdownException extends EngineException {

    public EngineShutdownException(String message) {
        super(message);
    }
}
