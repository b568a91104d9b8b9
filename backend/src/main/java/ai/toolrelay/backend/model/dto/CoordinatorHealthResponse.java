package ai.toolrelay.backend.model.dto;

import ai.toolrelay.backend.model.registry.InstanceMapping;
import ai.toolrelay.backend.model.registry.WorkerRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Body of {@code GET /health}: a read-only projection of the registry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CoordinatorHealthResponse {

    /**
     * UP when at least one worker is ONLINE, DEGRADED otherwise.
     */
    private String status;

    private Instant timestamp;

    private long onlineWorkers;

    private int totalWorkers;

    private long boundInstances;

    private List<WorkerRecord> workers;

    private Map<String, Set<String>> toolIndex;

    private Set<String> knownTools;

    private List<InstanceMapping> instances;
}
