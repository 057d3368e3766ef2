package bridge.impl;

import bridge.contracts.ProcessLauncher;

import java.io.IOException;
import java.util.List;

/** Spawns the engine with {@link ProcessBuilder}; stderr stays separate so it can be logged. */
public final class DefaultProcessLauncher implements ProcessLauncher {

    @Override
    public Process launch(List<String> command) throws IOException {
        return new ProcessBuilder(command)
                .redirectErrorStream(false)
                .start();
    }
}
