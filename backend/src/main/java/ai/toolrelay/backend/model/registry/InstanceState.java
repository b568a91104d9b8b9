package ai.toolrelay.backend.model.registry;

/**
 * PENDING while the worker's create call is in flight, BOUND once it succeeded.
 * Only BOUND instances can be routed to.
 */
public enum InstanceState {
    PENDING, BOUND
}
