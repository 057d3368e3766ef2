package bridge.contracts;

/**
 * Line-oriented operator console over an {@link EngineManager}: reads
 * commands, prints one result or error line per command.
 */
public interface ConsoleHandler {

    /**
     * Processes commands until {@code quit} or end of input.
     */
    void runLoop();
}
