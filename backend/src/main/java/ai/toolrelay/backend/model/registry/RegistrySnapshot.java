package ai.toolrelay.backend.model.registry;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Consistent, detached copy of the registry taken under its lock.
 */
@Getter
@AllArgsConstructor
public class RegistrySnapshot {

    private final Instant takenAt;

    private final List<WorkerRecord> workers;

    /**
     * Tool name to the ids of ONLINE workers advertising it.
     */
    private final Map<String, Set<String>> toolIndex;

    /**
     * Every tool ever advertised or declared, including tools with no worker left.
     */
    private final Set<String> knownTools;

    private final List<InstanceMapping> instances;

    public long getOnlineWorkerCount() {
        return workers.stream().filter(WorkerRecord::isOnline).count();
    }

    public long getBoundInstanceCount() {
        return instances.stream().filter(i -> i.getState() == InstanceState.BOUND).count();
    }

    public int getInstanceCount(String workerId) {
        return (int) instances.stream().filter(i -> workerId.equals(i.getWorkerId())).count();
    }
}
