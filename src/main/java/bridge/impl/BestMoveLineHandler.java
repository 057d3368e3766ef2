package bridge.impl;

import bridge.contracts.ConversationHandler;

import java.util.Optional;

/** Ends on the first {@code bestmove} line; {@code none} maps to empty. */
public final class BestMoveLineHandler implements ConversationHandler<Optional<String>> {

    private Optional<String> move = Optional.empty();

    @Override
    public boolean onLine(String line) {
        if (!UciLines.isBestMove(line)) return false;
        move = UciLines.bestMove(line);
        return true;
    }

    @Override
    public Optional<String> result() {
        return move;
    }
}
