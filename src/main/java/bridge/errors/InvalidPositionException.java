package bridge.errors;

/** The supplied FEN was rejected before any command reached the engine. */
public class InvalidPositionException extends EngineException {

    private final String fen;

    public InvalidPositionException(String fen, String reason) {
        super("Invalid position '" + fen + "': " + reason);
        this.fen = fen;
    }

    public String fen() {
        return fen;
    }
}
