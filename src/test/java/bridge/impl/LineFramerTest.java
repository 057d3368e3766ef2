package bridge.impl;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Framing must not depend on where the OS happens to cut stdout: the same
 * transcript fed in 1…N pieces yields the same lines and the same analysis.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class LineFramerTest {

  /* ── a realistic multi-PV transcript ──────────────────────────── */
  private static final String TRANSCRIPT = String.join("\r\n",
          "info string NNUE evaluation using nn-5af11540bbfe.nnue enabled",
          "info depth 1 seldepth 2 multipv 1 score cp 28 nodes 45 nps 45000 tbhits 0 time 1 pv e2e4",
          "info depth 1 seldepth 2 multipv 2 score cp 22 nodes 45 nps 45000 tbhits 0 time 1 pv d2d4",
          "",
          "info depth 5 seldepth 6 multipv 1 score cp 35 nodes 3012 nps 301200 time 10 pv e2e4 e7e5 g1f3",
          "info depth 5 seldepth 6 multipv 2 score cp 31 nodes 3012 nps 301200 time 10 pv d2d4 d7d5",
          "info depth 5 seldepth 5 multipv 3 score cp 20 nodes 3012 nps 301200 time 10 pv g1f3 g8f6",
          "info string évaluation terminée ♔",
          "bestmove e2e4 ponder e7e5") + "\r\n";

  private static final List<String> EXPECTED_LINES = List.of(
          "info string NNUE evaluation using nn-5af11540bbfe.nnue enabled",
          "info depth 1 seldepth 2 multipv 1 score cp 28 nodes 45 nps 45000 tbhits 0 time 1 pv e2e4",
          "info depth 1 seldepth 2 multipv 2 score cp 22 nodes 45 nps 45000 tbhits 0 time 1 pv d2d4",
          "info depth 5 seldepth 6 multipv 1 score cp 35 nodes 3012 nps 301200 time 10 pv e2e4 e7e5 g1f3",
          "info depth 5 seldepth 6 multipv 2 score cp 31 nodes 3012 nps 301200 time 10 pv d2d4 d7d5",
          "info depth 5 seldepth 5 multipv 3 score cp 20 nodes 3012 nps 301200 time 10 pv g1f3 g8f6",
          "info string évaluation terminée ♔",
          "bestmove e2e4 ponder e7e5");

  private static final byte[] BYTES = TRANSCRIPT.getBytes(StandardCharsets.UTF_8);

  /* ── JUnit parameter source: chunk counts × seeds ─────────────── */
  Stream<int[]> splits() {
    return IntStream.of(1, 2, 3, 5, 8, 13, 64, BYTES.length)
            .boxed()
            .flatMap(n -> IntStream.range(0, 4).mapToObj(seed -> new int[]{n, seed}));
  }

  @ParameterizedTest(name = "{index}: chunks/seed {0}")
  @MethodSource("splits")
  void sameLinesForAnyChunking(int[] split) {
    List<byte[]> chunks = cut(BYTES, split[0], new Random(split[1]));
    LineFramer framer = new LineFramer();
    List<String> lines = new ArrayList<>();
    for (byte[] c : chunks) framer.feed(c, lines::add);

    Assertions.assertEquals(EXPECTED_LINES, lines);
    Assertions.assertEquals(0, framer.pendingBytes());
  }

  @ParameterizedTest(name = "{index}: chunks/seed {0}")
  @MethodSource("splits")
  void sameAnalysisForAnyChunking(int[] split) {
    AnalysisLineHandler handler = new AnalysisLineHandler();
    LineFramer framer = new LineFramer();
    boolean[] done = {false};
    for (byte[] c : cut(BYTES, split[0], new Random(split[1]))) {
      framer.feed(c, line -> done[0] |= handler.onLine(line));
    }
    Assertions.assertTrue(done[0]);
    Assertions.assertEquals(List.of("e2e4", "d2d4", "g1f3"), handler.result());
  }

  @Test
  void partialLineIsHeldUntilNewline() {
    LineFramer framer = new LineFramer();
    List<String> lines = new ArrayList<>();

    framer.feed("readyo".getBytes(StandardCharsets.UTF_8), lines::add);
    Assertions.assertTrue(lines.isEmpty());
    Assertions.assertEquals("readyo", framer.pendingText());

    framer.feed("k\nbestmo".getBytes(StandardCharsets.UTF_8), lines::add);
    Assertions.assertEquals(List.of("readyok"), lines);
    Assertions.assertEquals("bestmo", framer.pendingText());
  }

  @Test
  void multiByteCharacterSplitAcrossChunks() {
    byte[] all = "info string ♔\n".getBytes(StandardCharsets.UTF_8);
    int mid = all.length - 3;                                    // inside the 3-byte king
    LineFramer framer = new LineFramer();
    List<String> lines = new ArrayList<>();
    framer.feed(Arrays.copyOfRange(all, 0, mid), lines::add);
    framer.feed(Arrays.copyOfRange(all, mid, all.length), lines::add);
    Assertions.assertEquals(List.of("info string ♔"), lines);
  }

  @Test
  void blankLinesAndCarriageReturnsAreDropped() {
    LineFramer framer = new LineFramer();
    List<String> lines = new ArrayList<>();
    framer.feed("\n\r\n   \nuciok\r\n".getBytes(StandardCharsets.UTF_8), lines::add);
    Assertions.assertEquals(List.of("uciok"), lines);
  }

  @Test
  void offsetAndLengthAreHonoured() {
    byte[] buf = "xxuciok\nyy".getBytes(StandardCharsets.UTF_8);
    LineFramer framer = new LineFramer();
    List<String> lines = new ArrayList<>();
    framer.feed(buf, 2, 6, lines::add);
    Assertions.assertEquals(List.of("uciok"), lines);
    Assertions.assertEquals(0, framer.pendingBytes());
  }

  @Test
  void resetDiscardsFragment() {
    LineFramer framer = new LineFramer();
    List<String> lines = new ArrayList<>();
    framer.feed("garbage".getBytes(StandardCharsets.UTF_8), lines::add);
    framer.reset();
    framer.feed("readyok\n".getBytes(StandardCharsets.UTF_8), lines::add);
    Assertions.assertEquals(List.of("readyok"), lines);
  }

  @Test
  void longLineGrowsBuffer() {
    String pv = "info depth 30 multipv 1 score cp 12 pv" + " e2e4 e7e5".repeat(200);
    byte[] all = (pv + "\n").getBytes(StandardCharsets.UTF_8);
    LineFramer framer = new LineFramer();
    List<String> lines = new ArrayList<>();
    for (int i = 0; i < all.length; i += 7) {
      framer.feed(all, i, Math.min(7, all.length - i), lines::add);
    }
    Assertions.assertEquals(List.of(pv), lines);
  }

  /* ── helpers ──────────────────────────────────────────────────── */

  /** Cuts {@code data} into {@code n} non-empty pieces at random points. */
  private static List<byte[]> cut(byte[] data, int n, Random rnd) {
    int pieces = Math.min(n, data.length);
    int[] cuts = rnd.ints(1, data.length).distinct().limit(pieces - 1L).sorted().toArray();
    List<byte[]> out = new ArrayList<>(pieces);
    int from = 0;
    for (int c : cuts) {
      out.add(Arrays.copyOfRange(data, from, c));
      from = c;
    }
    out.add(Arrays.copyOfRange(data, from, data.length));
    return out;
  }
}
