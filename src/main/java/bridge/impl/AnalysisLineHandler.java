package bridge.impl;

import bridge.constants.EngineConstants;
import bridge.contracts.ConversationHandler;
import bridge.records.PvCandidate;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Multi-PV grammar: keeps the latest candidate per PV slot and, on
 * {@code bestmove}, ranks them into at most {@value EngineConstants#ANALYSIS_MULTI_PV}
 * distinct moves.
 */
public final class AnalysisLineHandler implements ConversationHandler<List<String>> {

    private final Map<Integer, PvCandidate> bySlot = new TreeMap<>();
    private final int cap;
    private List<String> ranked;

    public AnalysisLineHandler() {
        this(EngineConstants.ANALYSIS_MULTI_PV);
    }

    public AnalysisLineHandler(int cap) {
        this.cap = cap;
    }

    @Override
    public boolean onLine(String line) {
        if (UciLines.isBestMove(line)) {
            ranked = rank(UciLines.bestMove(line));
            return true;
        }
        UciLines.parsePvInfo(line).ifPresent(c -> bySlot.put(c.multiPv(), c));
        return false;
    }

    @Override
    public List<String> result() {
        return ranked == null ? List.of() : ranked;
    }

    /** Latest report per slot, lowest slot first. */
    public List<PvCandidate> candidates() {
        return List.copyOf(bySlot.values());
    }

    private List<String> rank(Optional<String> best) {
        Set<String> moves = new LinkedHashSet<>();
        for (PvCandidate c : bySlot.values()) {
            if (moves.size() == cap) break;
            moves.add(c.move());
        }
        best.ifPresent(b -> {
            if (moves.size() < cap) moves.add(b);            // no-op if already ranked
        });
        return List.copyOf(moves);
    }
}
