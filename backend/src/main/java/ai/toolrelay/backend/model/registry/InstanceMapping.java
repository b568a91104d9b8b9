package ai.toolrelay.backend.model.registry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Binding of one tool session to the worker that created it. The worker id
 * never changes for the life of the mapping.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class InstanceMapping {

    private String instanceId;

    private String toolName;

    private String workerId;

    private InstanceState state;

    /**
     * Opaque per-session payload forwarded to the worker on create.
     * Not echoed in status snapshots.
     */
    @JsonIgnore
    private Object identity;

    private Instant createdAt;

    private Instant lastUsedAt;

    @JsonIgnore
    private long workerGeneration;

    public InstanceMapping copy() {
        return toBuilder().build();
    }
}
