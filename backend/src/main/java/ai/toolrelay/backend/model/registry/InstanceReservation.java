package ai.toolrelay.backend.model.registry;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of {@code WorkerRegistry#reserveInstance}: either a fresh PENDING slot
 * on the selected worker, or the binding that already existed for the id.
 */
@Getter
@ToString
@AllArgsConstructor
public class InstanceReservation {

    private final String instanceId;

    private final String toolName;

    private final String workerId;

    private final String baseUrl;

    private final long workerGeneration;

    /**
     * False when the instance id was already bound and nothing was reserved.
     */
    private final boolean fresh;
}
