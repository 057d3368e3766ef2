package bridge.errors;

/** Rejected up front because the wait queue already holds the configured maximum. */
public class EngineBusyException extends EngineException {

    private final int queueDepth;

    public EngineBusyException(int queueDepth) {
        super("Engine busy: " + queueDepth + " requests already waiting");
        this.queueDepth = queueDepth;
    }

    public int queueDepth() {
        return queueDepth;
    }
}
