package bridge.impl;

import bridge.contracts.ConsoleHandler;
import bridge.contracts.EngineManager;
import bridge.errors.EngineException;
import bridge.records.AnalysisResult;
import bridge.records.BestMoveResult;
import bridge.records.EngineStatus;
import bridge.records.MoveCandidate;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Operator console. Commands:
 * <pre>
 * analyze [depth N] &lt;fen&gt;   →  analysis e2e4 d2d4 f1f8#
 * move &lt;skill&gt; &lt;fen&gt;        →  bestmove e2e4 | bestmove (none)
 * isready                  →  readyok | notready
 * status                   →  status READY pid 1234 name Stockfish 16 queued 0 active false
 * quit
 * </pre>
 * A trailing {@code #} marks a move that mates. Mate is only known when a
 * {@link bridge.contracts.RulesEngine} provider is installed; with the
 * syntax-only fallback no move carries {@code #}. Failures print
 * {@code error <Type>: <message>} and the loop carries on.
 */
public final class ConsoleHandlerImpl implements ConsoleHandler {

    private final EngineManager manager;
    private final InputStream in;
    private final PrintStream out;

    public ConsoleHandlerImpl(EngineManager manager, InputStream in, PrintStream out) {
        this.manager = manager;
        this.in = in;
        this.out = out;
    }

    /* ── main loop ─────────────────────────────────────────────── */
    @Override
    public void runLoop() {
        try (BufferedReader r = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = r.readLine()) != null) {
                line = line.trim();
                if (!line.isEmpty() && handle(line)) break;   // quit
            }
        } catch (IOException e) {
            out.println("error IOException: " + e.getMessage());
        }
    }

    /* ── router ───────────────────────────────────────────────── */
    private boolean handle(String cmd) {
        String[] t = cmd.split("\\s+");
        try {
            return switch (t[0]) {
                case "analyze" -> { cmdAnalyze(t); yield false; }
                case "move"    -> { cmdMove(t);    yield false; }
                case "isready" -> { out.println(manager.isReady() ? "readyok" : "notready"); yield false; }
                case "status"  -> { cmdStatus();   yield false; }
                case "quit"    -> true;
                default        -> { out.println("error unknown command: " + t[0]); yield false; }
            };
        } catch (EngineException | IllegalArgumentException e) {
            out.println("error " + e.getClass().getSimpleName() + ": " + e.getMessage());
            return false;
        }
    }

    /* ── commands ─────────────────────────────────────────────── */

    private void cmdAnalyze(String[] t) {
        int i = 1;
        Integer depth = null;
        if (t.length > 2 && "depth".equals(t[1])) {
            depth = Integer.parseInt(t[2]);
            i = 3;
        }
        String fen = join(t, i);
        AnalysisResult r = depth == null
                ? manager.requestAnalysis(fen)
                : manager.requestAnalysis(fen, depth);

        StringBuilder sb = new StringBuilder("analysis");
        for (MoveCandidate m : r.moves()) {
            sb.append(' ').append(m.move());
            if (m.isCheckmate()) sb.append('#');
        }
        out.println(sb);
    }

    private void cmdMove(String[] t) {
        if (t.length < 3) throw new IllegalArgumentException("usage: move <skill> <fen>");
        BestMoveResult r = manager.requestBestMove(join(t, 2), Integer.parseInt(t[1]));
        out.println("bestmove " + r.move().orElse("(none)"));
    }

    private void cmdStatus() {
        EngineStatus s = manager.status();
        out.println("status " + s.state()
                + " pid " + s.pid()
                + (s.engineName().isEmpty() ? "" : " name " + s.engineName())
                + " queued " + s.queued()
                + " active " + s.active());
    }

    private static String join(String[] t, int from) {
        return String.join(" ", Arrays.copyOfRange(t, Math.min(from, t.length), t.length));
    }
}
