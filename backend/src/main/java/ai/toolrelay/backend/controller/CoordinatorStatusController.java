package ai.toolrelay.backend.controller;

import ai.toolrelay.backend.model.dto.CoordinatorHealthResponse;
import ai.toolrelay.backend.model.registry.RegistrySnapshot;
import ai.toolrelay.backend.service.WorkerRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only status of the worker pool.
 */
@RestController
@ConditionalOnProperty(name = "app.master.enabled", havingValue = "true", matchIfMissing = true)
public class CoordinatorStatusController {

    private final WorkerRegistry workerRegistry;

    public CoordinatorStatusController(WorkerRegistry workerRegistry) {
        this.workerRegistry = workerRegistry;
    }

    /**
     * Snapshot of workers, tool index and instance bindings. Status is
     * DEGRADED while no worker is ONLINE.
     */
    @GetMapping("/health")
    public ResponseEntity<CoordinatorHealthResponse> health() {
        RegistrySnapshot snapshot = workerRegistry.snapshot();
        long online = snapshot.getOnlineWorkerCount();

        return ResponseEntity.ok(CoordinatorHealthResponse.builder()
                .status(online > 0 ? "UP" : "DEGRADED")
                .timestamp(snapshot.getTakenAt())
                .onlineWorkers(online)
                .totalWorkers(snapshot.getWorkers().size())
                .boundInstances(snapshot.getBoundInstanceCount())
                .workers(snapshot.getWorkers())
                .toolIndex(snapshot.getToolIndex())
                .knownTools(snapshot.getKnownTools())
                .instances(snapshot.getInstances())
                .build());
    }
}
