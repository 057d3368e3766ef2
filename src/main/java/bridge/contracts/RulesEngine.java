package bridge.contracts;

import bridge.errors.InvalidPositionException;

import java.util.Optional;

/**
 * Chess rules as seen by the bridge. The bridge never decides legality or
 * mate itself; it asks an implementation of this interface.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader}
 * (see {@link bridge.impl.RulesEngines}) and must be thread-safe.</p>
 */
public interface RulesEngine {

    /**
     * @throws InvalidPositionException if {@code fen} is not a well-formed, playable position
     */
    void validatePosition(String fen);

    /**
     * @param uciMove long algebraic move ({@code e2e4}, {@code e7e8q})
     * @return FEN after the move, or empty if the move is illegal in {@code fen}
     */
    Optional<String> applyMove(String fen, String uciMove);

    /** {@code true} if the side to move in {@code fen} is checkmated. */
    boolean isCheckmate(String fen);
}
