package bridge.fakes;

import bridge.contracts.ProcessLauncher;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Hands out prepared {@link ScriptedEngineProcess}es, one per launch, in order. */
public final class ScriptedLauncher implements ProcessLauncher {

    private final Deque<ScriptedEngineProcess> prepared = new ArrayDeque<>();
    private final List<List<String>> launches = new ArrayList<>();
    private IOException failure;

    public ScriptedLauncher(ScriptedEngineProcess... processes) {
        prepared.addAll(List.of(processes));
    }

    public ScriptedLauncher then(ScriptedEngineProcess next) {
        prepared.addLast(next);
        return this;
    }

    public ScriptedLauncher failWith(IOException e) {
        failure = e;
        return this;
    }

    @Override
    public synchronized Process launch(List<String> command) throws IOException {
        launches.add(List.copyOf(command));
        if (failure != null) throw failure;
        ScriptedEngineProcess p = prepared.pollFirst();
        if (p == null) throw new IOException("no scripted engine left for " + command);
        return p;
    }

    public synchronized int launchCount() {
        return launches.size();
    }
}
