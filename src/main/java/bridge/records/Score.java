package bridge.records;

/**
 * Evaluation attached to one principal variation.
 *
 * @param value centipawns, or moves-to-mate when {@code mate} is set (negative = getting mated)
 * @param mate  {@code true} for a {@code score mate M} report
 */
public record Score(int value, boolean mate) {

    public static final Score NONE = new Score(0, false);

    public static Score cp(int centipawns) { return new Score(centipawns, false); }
    public static Score mateIn(int moves)   { return new Score(moves, true); }

    @Override
    public String toString() {
        return mate ? "mate " + value : "cp " + value;
    }
}
