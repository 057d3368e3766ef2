package bridge.errors;

/** Spawn or handshake ({@code uci}/{@code uciok}, {@code isready}/{@code readyok}) failed. */
public class EngineStartupException extends EngineException {

    public EngineStartupException(String message) {
        super(message);
    }

    public EngineStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
