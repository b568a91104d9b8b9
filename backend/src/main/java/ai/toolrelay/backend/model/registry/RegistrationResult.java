package ai.toolrelay.backend.model.registry;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Set;

/**
 * Result of registering a worker.
 */
@Getter
@AllArgsConstructor
public class RegistrationResult {

    /**
     * Effective id, generated when the worker sent none.
     */
    private final String workerId;

    /**
     * Whether an earlier record with the same id was overwritten.
     */
    private final boolean replaced;

    /**
     * Instances that were bound to the overwritten record.
     */
    private final Set<String> invalidatedInstances;
}
