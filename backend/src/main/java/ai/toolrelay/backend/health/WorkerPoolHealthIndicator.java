package ai.toolrelay.backend.health;

import ai.toolrelay.backend.model.registry.RegistrySnapshot;
import ai.toolrelay.backend.model.registry.WorkerRecord;
import ai.toolrelay.backend.service.WorkerRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reports the worker pool DOWN while no worker is ONLINE, and lists tools
 * that were seen once but currently have no worker.
 */
@Component
@ConditionalOnProperty(name = "app.master.enabled", havingValue = "true", matchIfMissing = true)
public class WorkerPoolHealthIndicator implements HealthIndicator {

    private final WorkerRegistry workerRegistry;

    public WorkerPoolHealthIndicator(WorkerRegistry workerRegistry) {
        this.workerRegistry = workerRegistry;
    }

    @Override
    public Health health() {
        RegistrySnapshot snapshot = workerRegistry.snapshot();
        long online = snapshot.getOnlineWorkerCount();

        Map<String, Integer> workersPerTool = new TreeMap<>();
        for (String tool : snapshot.getKnownTools()) {
            workersPerTool.put(tool, snapshot.getToolIndex().getOrDefault(tool, Set.of()).size());
        }
        long uncovered = workersPerTool.values().stream().filter(count -> count == 0).count();

        Health.Builder builder = online > 0 ? Health.up() : Health.down();
        return builder
                .withDetail("onlineWorkers", online)
                .withDetail("offlineWorkers", snapshot.getWorkers().stream().filter(w -> !w.isOnline()).count())
                .withDetail("boundInstances", snapshot.getBoundInstanceCount())
                .withDetail("workersPerTool", workersPerTool)
                .withDetail("toolsWithoutWorkers", uncovered)
                .withDetail("workerIds", snapshot.getWorkers().stream().map(WorkerRecord::getWorkerId).toList())
                .build();
    }
}
