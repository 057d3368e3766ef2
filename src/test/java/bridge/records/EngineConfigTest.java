package bridge.records;

import bridge.constants.EngineBinaryLocator;
import bridge.constants.EngineConstants;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.*;

public class EngineConfigTest {

  private static EngineConfig from(Map<String, String> props, Map<String, String> env) {
    return EngineConfig.from(props::get, env);
  }

  @Test
  void defaults() {
    EngineConfig c = from(Map.of(), Map.of());
    Assertions.assertEquals(List.of(EngineBinaryLocator.defaultPath().toString()), c.command());
    Assertions.assertEquals(EngineConstants.HANDSHAKE_TIMEOUT_MS, c.handshakeTimeoutMs());
    Assertions.assertEquals(EngineConstants.SHUTDOWN_GRACE_MS, c.shutdownGraceMs());
    Assertions.assertEquals(EngineConstants.STOP_GRACE_MS, c.stopGraceMs());
    Assertions.assertEquals(EngineConstants.BEST_MOVE_BUFFER_MS, c.bestMoveBufferMs());
    Assertions.assertEquals(EngineConstants.ANALYSIS_DEPTH, c.analysisDepth());
    Assertions.assertEquals(EngineConstants.ANALYSIS_TIMEOUT_MS, c.analysisTimeoutMs());
    Assertions.assertEquals(0, c.maxQueueDepth());
  }

  @Test
  void environmentPathBeatsPlatformDefault() {
    EngineConfig c = from(Map.of(), Map.of("STOCKFISH_PATH", "/opt/sf/stockfish"));
    Assertions.assertEquals(List.of("/opt/sf/stockfish"), c.command());
  }

  @Test
  void propertyPathBeatsEnvironment() {
    EngineConfig c = from(Map.of("engine.path", "/usr/games/stockfish"), Map.of("STOCKFISH_PATH", "/opt/sf/stockfish"));
    Assertions.assertEquals(List.of("/usr/games/stockfish"), c.command());
  }

  @Test
  void blankPathIsIgnored() {
    EngineConfig c = from(Map.of("engine.path", "  "), Map.of("STOCKFISH_PATH", "/opt/sf/stockfish"));
    Assertions.assertEquals(List.of("/opt/sf/stockfish"), c.command());
  }

  @Test
  void numericOverridesAndGarbageFallsBack() {
    EngineConfig c = from(Map.of(
            "engine.handshakeTimeoutMs", "5000",
            "engine.analysisDepth", " 12 ",
            "engine.maxQueueDepth", "4",
            "engine.stopGraceMs", "soon",
            "engine.analysisTimeoutMs", "30s"), Map.of());
    Assertions.assertEquals(5000, c.handshakeTimeoutMs());
    Assertions.assertEquals(12, c.analysisDepth());
    Assertions.assertEquals(4, c.maxQueueDepth());
    Assertions.assertEquals(EngineConstants.STOP_GRACE_MS, c.stopGraceMs());
    Assertions.assertEquals(EngineConstants.ANALYSIS_TIMEOUT_MS, c.analysisTimeoutMs());
  }

  @Test
  void builderValidates() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new EngineConfig.Builder().command(List.of()).build());
    Assertions.assertThrows(IllegalArgumentException.class, () -> new EngineConfig.Builder().analysisDepth(0).build());
    Assertions.assertThrows(IllegalArgumentException.class, () -> new EngineConfig.Builder().maxQueueDepth(-1).build());
  }

  @Test
  void commandIsCopied() {
    List<String> cmd = new java.util.ArrayList<>(List.of("stockfish", "--threads", "2"));
    EngineConfig c = new EngineConfig.Builder().command(cmd).build();
    cmd.clear();
    Assertions.assertEquals(List.of("stockfish", "--threads", "2"), c.command());
  }

  @Test
  void usableStates() {
    for (EngineState s : EngineState.values()) {
      Assertions.assertEquals(s == EngineState.READY || s == EngineState.BUSY, s.isUsable(), s.name());
    }
  }
}
