package bridge.impl;

import bridge.constants.EngineConstants;
import bridge.contracts.SessionBroker;
import bridge.errors.InvalidPositionException;
import bridge.records.BestMoveResult;

import java.util.List;
import java.util.Optional;

/**
 * One move at a given strength. Higher skill gets both the stronger
 * {@code Skill Level} and more thinking time.
 */
final class BestMoveRequest extends EngineConversation<BestMoveResult> {

    private final String fen;
    private final int skillLevel;
    private final long moveTimeMs;
    private final long timeoutMs;

    BestMoveRequest(SessionBroker broker, long stopGraceMs, long bufferMs, String fen, int skillLevel) {
        super(broker, stopGraceMs);
        if (skillLevel < EngineConstants.MIN_SKILL_LEVEL || skillLevel > EngineConstants.MAX_SKILL_LEVEL) {
            throw new IllegalArgumentException("Skill level must be between " + EngineConstants.MIN_SKILL_LEVEL
                    + " and " + EngineConstants.MAX_SKILL_LEVEL + ", was " + skillLevel);
        }
        this.fen = fen;
        this.skillLevel = skillLevel;
        this.moveTimeMs = moveTimeFor(skillLevel);
        this.timeoutMs = moveTimeMs + bufferMs;
    }

    /** {@code 100 ms + round(skill / 20 × 1000 ms)}. */
    static long moveTimeFor(int skillLevel) {
        double normalized = Math.max(0.0, Math.min(1.0, skillLevel / (double) EngineConstants.MAX_SKILL_LEVEL));
        return EngineConstants.BASE_MOVE_TIME_MS + Math.round(normalized * EngineConstants.MAX_EXTRA_MOVE_TIME_MS);
    }

    long timeoutMs() {
        return timeoutMs;
    }

    @Override
    BestMoveResult execute() {
        if (fen == null || fen.isBlank()) throw new InvalidPositionException(String.valueOf(fen), "empty FEN");

        Optional<String> move = converse(new BestMoveLineHandler(), List.of(
                UciLines.positionFen(fen),
                UciLines.setOption(EngineConstants.OPTION_SKILL_LEVEL, skillLevel),
                UciLines.goMoveTime(moveTimeMs)), timeoutMs);
        return new BestMoveResult(move, skillLevel, moveTimeMs);
    }

    @Override
    String describe() {
        return "best move (skill " + skillLevel + ", movetime " + moveTimeMs + ") for '" + fen + "'";
    }
}
