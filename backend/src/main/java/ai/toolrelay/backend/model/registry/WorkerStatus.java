package ai.toolrelay.backend.model.registry;

/**
 * Liveness state of a registered worker. OFFLINE is only ever entered through
 * the health sweep.
 */
public enum WorkerStatus {
    ONLINE, OFFLINE
}
