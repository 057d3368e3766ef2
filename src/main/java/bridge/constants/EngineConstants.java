package bridge.constants;

/**
 * Protocol tokens and default budgets shared by the manager and the request adapters.
 */
public final class EngineConstants {

    private EngineConstants() {}

    /* ────────────── handshake / life-cycle ────────────── */
    public static final long HANDSHAKE_TIMEOUT_MS = 15_000;
    public static final long SHUTDOWN_GRACE_MS    = 2_000;
    /** How long a timed-out ticket keeps the engine after {@code stop}, waiting for its {@code bestmove}. */
    public static final long STOP_GRACE_MS        = 1_000;

    /* ────────────── analysis ────────────── */
    public static final int  ANALYSIS_DEPTH       = 5;
    public static final long ANALYSIS_TIMEOUT_MS  = 30_000;
    public static final int  ANALYSIS_MULTI_PV    = 3;

    /* ────────────── best move ────────────── */
    public static final int  MIN_SKILL_LEVEL      = 0;
    public static final int  MAX_SKILL_LEVEL      = 20;
    public static final long BASE_MOVE_TIME_MS    = 100;
    public static final long MAX_EXTRA_MOVE_TIME_MS = 1_000;
    public static final long BEST_MOVE_BUFFER_MS  = 7_000;

    /* ────────────── read loop ────────────── */
    public static final int  READ_CHUNK_BYTES     = 4_096;

    /* ────────────── wire tokens ────────────── */
    public static final String UCI        = "uci";
    public static final String UCI_OK     = "uciok";
    public static final String IS_READY   = "isready";
    public static final String READY_OK   = "readyok";
    public static final String NEW_GAME   = "ucinewgame";
    public static final String STOP       = "stop";
    public static final String QUIT       = "quit";
    public static final String BEST_MOVE  = "bestmove";
    public static final String INFO       = "info";
    public static final String ID_NAME    = "id name ";

    public static final String OPTION_MULTI_PV    = "MultiPV";
    public static final String OPTION_SKILL_LEVEL = "Skill Level";
}
