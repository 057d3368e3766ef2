package bridge.impl;

import bridge.errors.InvalidPositionException;
import java.util.Optional;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class StructuralRulesEngineTest {

  private final StructuralRulesEngine rules = new StructuralRulesEngine();

  @ParameterizedTest
  @ValueSource(strings = {
          "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1",
          "r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1",
          "8/2p5/3p4/KP5r/1R3p1k/8/4P1P1/8 w - - 0 1",
          "rnbqkbnr/pppp1ppp/8/4p3/4P3/8/PPPP1PPP/RNBQKBNR w KQkq e6 0 2",
          "8/8/8/8/8/8/6k1/5R1K w - - 0 1",
          "  4k3/8/8/8/8/8/8/4K3 b - - 12 40  "})
  void acceptsWellFormedFen(String fen) {
    Assertions.assertDoesNotThrow(() -> rules.validatePosition(fen));
  }

  @ParameterizedTest
  @ValueSource(strings = {
          "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP w KQkq - 0 1",           // 7 ranks
          "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0",     // 5 fields
          "rnbqkbnr/pppppppp/9/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1",   // rank of 9
          "rnbqkbnr/pppppppp/44/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1",  // consecutive digits
          "rnbqkbnr/ppppxppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1",   // unknown piece
          "rnbq1bnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQ - 0 1",     // no black king
          "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBKKBNR w - - 0 1",      // two white kings
          "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR x KQkq - 0 1",   // side to move
          "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w QK - 0 1",     // castling order
          "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq e5 0 1",  // en-passant rank
          "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - -1 1",  // halfmove clock
          "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 0",   // fullmove number
          "not a fen",
          ""})
  void rejectsMalformedFen(String fen) {
    InvalidPositionException e = Assertions.assertThrows(InvalidPositionException.class,
            () -> rules.validatePosition(fen));
    Assertions.assertEquals(fen, e.fen());
  }

  @Test
  void cannotPlayMoves() {
    String start = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";
    Assertions.assertEquals(Optional.empty(), rules.applyMove(start, "e2e4"));
    Assertions.assertFalse(rules.isCheckmate(start));
  }
}
