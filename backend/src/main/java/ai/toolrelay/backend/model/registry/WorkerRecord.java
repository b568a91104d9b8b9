package ai.toolrelay.backend.model.registry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * One registered worker process as seen by the coordinator.
 * Instances held inside {@code WorkerRegistry} are only touched under its lock;
 * everything handed out is a copy.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WorkerRecord {

    private String workerId;

    private String baseUrl;

    private Set<String> supportedTools;

    /**
     * Pending and bound instances on this worker. Maintained by the coordinator,
     * never self-reported.
     */
    private int activeInstanceCount;

    private Instant lastHeartbeatAt;

    private Instant registeredAt;

    private WorkerStatus status;

    /**
     * Set when the sweep takes the worker OFFLINE; drives purging after retention.
     */
    private Instant offlineSince;

    /**
     * Hostname, IP and similar. Shown on the dashboard, never used for routing.
     */
    private Map<String, Object> hostInfo;

    /**
     * Bumped every time the worker id is registered again, so that a create
     * started against the old process cannot be confirmed against the new one.
     */
    @JsonIgnore
    private long generation;

    @JsonIgnore
    public boolean isOnline() {
        return status == WorkerStatus.ONLINE;
    }

    public WorkerRecord copy() {
        return toBuilder()
                .supportedTools(supportedTools == null ? null : Collections.unmodifiableSet(new TreeSet<>(supportedTools)))
                .hostInfo(hostInfo == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(hostInfo)))
                .build();
    }
}
