package bridge.records;

/**
 * Life-cycle of the single engine process.
 *
 * <pre>
 * NOT_STARTED → HANDSHAKING → READY ⇄ BUSY
 * READY | BUSY | HANDSHAKING → TERMINATING → NOT_STARTED   (shutdown)
 * any state but NOT_STARTED   → CRASHED                     (process exit / pipe failure)
 * CRASHED                     → NOT_STARTED → HANDSHAKING   (explicit initialize)
 * </pre>
 */
public enum EngineState {
    NOT_STARTED,
    HANDSHAKING,
    READY,
    BUSY,
    TERMINATING,
    CRASHED;

    /** {@code true} while requests can be granted now or after the current one. */
    public boolean isUsable() {
        return this == READY || this == BUSY;
    }
}
