package bridge.contracts;

import java.io.IOException;
import java.util.List;

/**
 * Seam over {@link ProcessBuilder} so tests can hand the manager a scripted
 * {@link Process} instead of a real engine binary.
 */
@FunctionalInterface
public interface ProcessLauncher {

    /**
     * @param command executable followed by its arguments
     * @return a started process whose stdin/stdout carry the UCI dialogue
     * @throws IOException if the process cannot be started
     */
    Process launch(List<String> command) throws IOException;
}
