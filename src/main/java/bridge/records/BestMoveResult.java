package bridge.records;

import java.util.Optional;

/**
 * Outcome of a single timed move search.
 *
 * @param move       chosen move, empty when the side to move has no legal move
 * @param skillLevel {@code Skill Level} option the move was computed with (0‥20)
 * @param moveTimeMs {@code go movetime} budget that was sent
 */
public record BestMoveResult(Optional<String> move, int skillLevel, long moveTimeMs) {}
