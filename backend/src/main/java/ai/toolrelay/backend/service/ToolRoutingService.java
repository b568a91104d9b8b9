package ai.toolrelay.backend.service;

import ai.toolrelay.backend.config.ProxyProperties;
import ai.toolrelay.backend.model.dto.CreateInstanceResponse;
import ai.toolrelay.backend.model.registry.InstanceReservation;
import ai.toolrelay.backend.model.registry.RouteTarget;
import ai.toolrelay.backend.service.exception.InstanceNotBoundException;
import ai.toolrelay.backend.service.exception.ToolRelayException;
import ai.toolrelay.backend.service.exception.ValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Proxies tool calls from callers to workers.
 *
 * <p>{@code create} places a new instance on the least loaded worker; every
 * later call on that instance goes to the same worker and never anywhere else.
 * Each inbound request makes at most one outbound call.
 */
@Slf4j
public class ToolRoutingService {

    static final String CREATE = "create";
    static final String EXECUTE = "execute";
    static final String RELEASE = "release";
    static final String CALC_REWARD = "calc_reward";

    static final String OUTCOME_SUCCESS = "success";
    static final String OUTCOME_ERROR = "error";

    private final WorkerRegistry workerRegistry;
    private final WorkerProxyClient proxyClient;
    private final ProxyProperties proxyProperties;
    private final CoordinatorMetrics metrics;

    public ToolRoutingService(WorkerRegistry workerRegistry,
                              WorkerProxyClient proxyClient,
                              ProxyProperties proxyProperties,
                              CoordinatorMetrics metrics) {
        this.workerRegistry = workerRegistry;
        this.proxyClient = proxyClient;
        this.proxyProperties = proxyProperties;
        this.metrics = metrics;
    }

    /**
     * Creates a tool instance on a worker, or returns the existing binding when
     * the id is already bound to this tool.
     *
     * @param instanceId      caller-chosen id, generated when blank
     * @param identity        opaque session payload, may be null
     * @param timeoutOverride per-request deadline, null for the configured one
     */
    public CreateInstanceResponse create(String toolName, String instanceId, JsonNode identity, Duration timeoutOverride) {
        requireToolName(toolName);
        String effectiveId = StringUtils.hasText(instanceId) ? instanceId.trim() : UUID.randomUUID().toString();

        InstanceReservation reservation = workerRegistry.reserveInstance(toolName, effectiveId, identity);
        if (!reservation.isFresh()) {
            log.debug("Instance {} already bound to worker {}, create is a no-op", effectiveId, reservation.getWorkerId());
            return CreateInstanceResponse.builder()
                    .instanceId(effectiveId)
                    .workerId(reservation.getWorkerId())
                    .created(false)
                    .build();
        }

        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("instance_id", effectiveId);
        body.set("identity", identity);

        // Confirming is part of the timed call; it fails when the worker left meanwhile
        JsonNode response = timed(toolName, CREATE, () -> {
            JsonNode answer;
            try {
                answer = proxyClient.post(reservation.getBaseUrl(), toolName, CREATE, body,
                        proxyProperties.resolveTimeout(toolName, timeoutOverride));
            } catch (RuntimeException e) {
                workerRegistry.abandonInstance(reservation);
                throw e;
            }
            workerRegistry.confirmInstance(reservation);
            return answer;
        });
        log.info("Created {} instance {} on worker {}", toolName, effectiveId, reservation.getWorkerId());

        return CreateInstanceResponse.builder()
                .instanceId(effectiveId)
                .workerId(reservation.getWorkerId())
                .created(true)
                .result(response.get("result"))
                .build();
    }

    /**
     * Runs one tool step on the worker that owns the instance and returns its
     * answer unchanged.
     */
    public JsonNode execute(String toolName, String instanceId, JsonNode parameters, Duration timeoutOverride) {
        RouteTarget target = route(toolName, instanceId);

        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("instance_id", instanceId);
        body.set("parameters", parameters == null ? JsonNodeFactory.instance.objectNode() : parameters);

        return timed(toolName, EXECUTE, () -> proxyClient.post(target.getBaseUrl(), toolName, EXECUTE, body,
                proxyProperties.resolveTimeout(toolName, timeoutOverride)));
    }

    /**
     * Asks the worker that owns the instance for the session's final reward.
     *
     * @return the worker's reward payload, unchanged
     * @throws InstanceNotBoundException if the instance has no live binding
     */
    public JsonNode calcReward(String toolName, String instanceId, Duration timeoutOverride) {
        RouteTarget target = route(toolName, instanceId);
        ObjectNode body = JsonNodeFactory.instance.objectNode().put("instance_id", instanceId);

        return timed(toolName, CALC_REWARD, () -> proxyClient.post(target.getBaseUrl(), toolName, CALC_REWARD, body,
                proxyProperties.resolveTimeout(toolName, timeoutOverride)));
    }

    /**
     * Finalizes an instance. The binding is dropped even when the worker call
     * fails, so a dead session never keeps counting against the worker.
     */
    public JsonNode release(String toolName, String instanceId, Duration timeoutOverride) {
        RouteTarget target = route(toolName, instanceId);
        ObjectNode body = JsonNodeFactory.instance.objectNode().put("instance_id", instanceId);

        try {
            return timed(toolName, RELEASE, () -> proxyClient.post(target.getBaseUrl(), toolName, RELEASE, body,
                    proxyProperties.resolveTimeout(toolName, timeoutOverride)));
        } finally {
            workerRegistry.releaseInstance(instanceId);
            log.info("Released {} instance {} from worker {}", toolName, instanceId, target.getWorkerId());
        }
    }

    private RouteTarget route(String toolName, String instanceId) {
        requireToolName(toolName);
        if (!StringUtils.hasText(instanceId)) {
            throw new ValidationException("instance_id is required");
        }
        return workerRegistry.routeInstance(instanceId, toolName);
    }

    private JsonNode timed(String toolName, String operation, Supplier<JsonNode> call) {
        long start = System.nanoTime();
        String outcome = OUTCOME_SUCCESS;
        try {
            return call.get();
        } catch (ToolRelayException e) {
            outcome = e.getErrorCode();
            throw e;
        } catch (RuntimeException e) {
            outcome = OUTCOME_ERROR;
            throw e;
        } finally {
            metrics.recordCall(toolName, operation, outcome, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private static void requireToolName(String toolName) {
        if (!StringUtils.hasText(toolName)) {
            throw new ValidationException("tool name is required");
        }
    }
}
