package ai.toolrelay.backend.model.registry;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Where a call for an already bound instance has to go.
 */
@Getter
@ToString
@AllArgsConstructor
public class RouteTarget {

    private final String instanceId;

    private final String toolName;

    private final String workerId;

    private final String baseUrl;
}
