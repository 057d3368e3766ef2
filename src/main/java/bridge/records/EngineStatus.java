package bridge.records;

/**
 * Point-in-time view of the manager, for health checks.
 *
 * @param state      current life-cycle state
 * @param pid        process id, {@code -1} without a live process
 * @param engineName value of the engine's {@code id name} line, empty if not yet seen
 * @param queued     tickets waiting behind the active one
 * @param active     whether a ticket currently owns the engine
 */
public record EngineStatus(EngineState state, long pid, String engineName, int queued, boolean active) {}
