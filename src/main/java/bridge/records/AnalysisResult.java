package bridge.records;

import java.util.List;

/**
 * Outcome of a multi-PV analysis.
 *
 * @param fen   analysed position
 * @param depth search depth requested from the engine
 * @param moves at most three distinct moves, best first
 */
public record AnalysisResult(String fen, int depth, List<MoveCandidate> moves) {

    public AnalysisResult {
        moves = List.copyOf(moves);
    }

    /** Just the move strings, in rank order. */
    public List<String> moveList() {
        return moves.stream().map(MoveCandidate::move).toList();
    }
}
