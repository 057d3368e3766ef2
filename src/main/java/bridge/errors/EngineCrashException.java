package bridge.errors;

/**
 * The engine process exited or its pipes broke while the bridge was not
 * shutting it down. The manager stays {@code CRASHED} until the next
 * explicit {@code initialize()}.
 */
public class EngineCrashException extends EngineException {

    public EngineCrashException(String message) {
        super(message);
    }

    public EngineCrashException(String message, Throwable cause) {
        super(message, cause);
    }
}
