package bridge.records;

/**
 * Latest report for one multi-PV slot.
 *
 * @param multiPv 1-based rank assigned by the engine
 * @param move    first move of the variation, long algebraic ({@code e2e4}, {@code e7e8q})
 * @param score   evaluation of the line, {@link Score#NONE} when the engine sent none
 */
public record PvCandidate(int multiPv, String move, Score score) {}
