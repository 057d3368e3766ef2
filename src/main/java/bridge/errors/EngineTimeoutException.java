package bridge.errors;

/** No terminal protocol line arrived before the ticket's deadline. */
public class EngineTimeoutException extends EngineException {

    public EngineTimeoutException(String message) {
        super(message);
    }
}
