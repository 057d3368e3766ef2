package bridge.records;

/**
 * One ranked analysis move.
 *
 * @param move        long-algebraic move as reported by the engine
 * @param isCheckmate {@code true} if playing {@code move} mates the opponent
 */
public record MoveCandidate(String move, boolean isCheckmate) {}
