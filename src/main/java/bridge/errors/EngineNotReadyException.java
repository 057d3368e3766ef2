package bridge.errors;

/** A request arrived before {@code initialize()} was ever called (or after a clean shutdown). */
public class EngineNotReadyException extends EngineException {

    public EngineNotReadyException(String message) {
        super(message);
    }
}
