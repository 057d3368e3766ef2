package bridge.impl;

import bridge.constants.EngineConstants;
import bridge.contracts.RulesEngine;
import bridge.contracts.SessionBroker;
import bridge.errors.InvalidPositionException;
import bridge.records.AnalysisResult;
import bridge.records.MoveCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Multi-PV analysis of one position: up to three ranked moves, each tagged
 * with whether it delivers mate.
 */
final class AnalysisRequest extends EngineConversation<AnalysisResult> {
    private static final Logger LOG = LoggerFactory.getLogger(AnalysisRequest.class);

    private final RulesEngine rules;
    private final String fen;
    private final int depth;
    private final long timeoutMs;

    AnalysisRequest(SessionBroker broker, RulesEngine rules, long stopGraceMs,
                    String fen, int depth, long timeoutMs) {
        super(broker, stopGraceMs);
        if (depth < 1) throw new IllegalArgumentException("depth must be ≥ 1, was " + depth);
        if (timeoutMs <= 0) throw new IllegalArgumentException("timeout must be positive, was " + timeoutMs);
        this.rules = rules;
        this.fen = fen;
        this.depth = depth;
        this.timeoutMs = timeoutMs;
    }

    @Override
    AnalysisResult execute() {
        if (fen == null || fen.isBlank()) throw new InvalidPositionException(String.valueOf(fen), "empty FEN");
        rules.validatePosition(fen);

        List<String> ranked = converse(new AnalysisLineHandler(), List.of(
                EngineConstants.NEW_GAME,
                UciLines.positionFen(fen),
                UciLines.setOption(EngineConstants.OPTION_MULTI_PV, EngineConstants.ANALYSIS_MULTI_PV),
                UciLines.goDepth(depth)), timeoutMs);

        List<MoveCandidate> moves = new ArrayList<>(ranked.size());
        for (String m : ranked) moves.add(new MoveCandidate(m, deliversMate(m)));
        LOG.debug("analysis of '{}' at depth {}: {}", fen, depth, moves);
        return new AnalysisResult(fen, depth, moves);
    }

    /** Illegal moves and rules-engine failures count as "not mate". */
    private boolean deliversMate(String move) {
        try {
            Optional<String> after = rules.applyMove(fen, move);
            if (after.isEmpty()) {
                LOG.debug("rules engine rejected engine move {} in '{}'", move, fen);
                return false;
            }
            return rules.isCheckmate(after.get());
        } catch (RuntimeException e) {
            LOG.warn("could not check {} for mate in '{}': {}", move, fen, e.toString());
            return false;
        }
    }

    @Override
    String describe() {
        return "analysis (depth " + depth + ") of '" + fen + "'";
    }
}
