package ai.toolrelay.backend.model.registry;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What a single health sweep changed.
 */
@Getter
@AllArgsConstructor
public class SweepResult {

    /**
     * Workers taken OFFLINE, with the instances that were bound to them.
     */
    private final Map<String, Set<String>> offlined;

    /**
     * OFFLINE workers removed after their retention period.
     */
    private final List<String> purged;

    /**
     * Instances dropped for exceeding the idle timeout.
     */
    private final List<String> idleReleased;

    public boolean isEmpty() {
        return offlined.isEmpty() && purged.isEmpty() && idleReleased.isEmpty();
    }
}
