package bridge.impl;

import bridge.constants.EngineConstants;
import bridge.records.PvCandidate;
import bridge.records.Score;

import java.util.Optional;

/**
 * Builders for the commands the bridge sends and tolerant parsers for the
 * lines it reads back. Parsers never throw on malformed input; they return
 * empty instead.
 */
public final class UciLines {

    private UciLines() {}

    /* ── outgoing ─────────────────────────────────────────────── */

    public static String positionFen(String fen)            { return "position fen " + fen.trim(); }
    public static String setOption(String name, Object v)   { return "setoption name " + name + " value " + v; }
    public static String goDepth(int depth)                 { return "go depth " + depth; }
    public static String goMoveTime(long ms)                { return "go movetime " + ms; }

    /* ── incoming ─────────────────────────────────────────────── */

    public static boolean isBestMove(String line) {
        return line.equals(EngineConstants.BEST_MOVE)
                || line.startsWith(EngineConstants.BEST_MOVE + " ");
    }

    /**
     * Move token of a {@code bestmove} line; empty for {@code none},
     * {@code (none)}, the null move {@code 0000}, or a bare {@code bestmove}.
     */
    public static Optional<String> bestMove(String line) {
        String[] t = line.trim().split("\\s+");
        if (t.length < 2 || !EngineConstants.BEST_MOVE.equals(t[0])) return Optional.empty();
        return isNullMove(t[1]) ? Optional.empty() : Optional.of(t[1]);
    }

    static boolean isNullMove(String token) {
        return token.equals("none") || token.equals("(none)") || token.equals("0000");
    }

    /**
     * Parses {@code info depth … multipv N … [score cp C | score mate M] … pv <move> …}.
     * Lines without {@code depth}, {@code multipv} or a {@code pv} move are rejected.
     */
    public static Optional<PvCandidate> parsePvInfo(String line) {
        String[] t = line.trim().split("\\s+");
        if (t.length == 0 || !EngineConstants.INFO.equals(t[0])) return Optional.empty();

        boolean hasDepth = false;
        int multiPv = -1;
        Score score = Score.NONE;
        String move = null;

        for (int i = 1; i < t.length; i++) {
            switch (t[i]) {
                case "depth" -> hasDepth = i + 1 < t.length && toInt(t[i + 1]) != null;
                case "multipv" -> {
                    Integer n = i + 1 < t.length ? toInt(t[++i]) : null;
                    if (n != null) multiPv = n;
                }
                case "score" -> {
                    if (i + 2 < t.length) {
                        Integer v = toInt(t[i + 2]);
                        if (v != null && "cp".equals(t[i + 1]))   score = Score.cp(v);
                        if (v != null && "mate".equals(t[i + 1])) score = Score.mateIn(v);
                        i += 2;
                    }
                }
                case "pv" -> {
                    if (i + 1 < t.length) move = t[i + 1];
                    i = t.length;                              // pv runs to end of line
                }
                case "string" -> i = t.length;                 // free text, nothing to read
                default -> { }
            }
        }
        if (!hasDepth || multiPv < 1 || move == null) return Optional.empty();
        return Optional.of(new PvCandidate(multiPv, move, score));
    }

    /** Value of an {@code id name …} line, if {@code line} is one. */
    public static Optional<String> engineName(String line) {
        return line.startsWith(EngineConstants.ID_NAME)
                ? Optional.of(line.substring(EngineConstants.ID_NAME.length()).trim())
                : Optional.empty();
    }

    private static Integer toInt(String s) {
        try { return Integer.parseInt(s); } catch (NumberFormatException e) { return null; }
    }
}
