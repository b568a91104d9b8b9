package ai.toolrelay.backend.controller;

import ai.toolrelay.backend.model.dto.CreateInstanceRequest;
import ai.toolrelay.backend.model.dto.CreateInstanceResponse;
import ai.toolrelay.backend.model.dto.InstanceRequest;
import ai.toolrelay.backend.service.ToolRoutingService;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.annotation.Timed;
import jakarta.validation.Valid;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

/**
 * Caller-facing tool surface. Worker responses are returned unchanged.
 * A request may shorten or extend its deadline with {@code X-Timeout-Ms}.
 */
@RestController
@RequestMapping("/tools/{toolName}")
@ConditionalOnProperty(name = "app.master.enabled", havingValue = "true", matchIfMissing = true)
public class ToolRoutingController {

    static final String TIMEOUT_HEADER = "X-Timeout-Ms";

    private final ToolRoutingService toolRoutingService;

    public ToolRoutingController(ToolRoutingService toolRoutingService) {
        this.toolRoutingService = toolRoutingService;
    }

    /**
     * Creates an instance of the tool on the least loaded worker.
     *
     * @param request   optional body with {@code instance_id} and {@code identity}
     * @param timeoutMs optional deadline for the worker call in milliseconds
     * @return the binding, with {@code created=false} when the id was already bound
     */
    @PostMapping("/create")
    @Timed(value = "toolrelay.request.create", description = "Time to create a tool instance")
    public ResponseEntity<CreateInstanceResponse> create(
            @PathVariable String toolName,
            @RequestBody(required = false) CreateInstanceRequest request,
            @RequestHeader(value = TIMEOUT_HEADER, required = false) Long timeoutMs) {
        CreateInstanceRequest body = request != null ? request : new CreateInstanceRequest();
        return ResponseEntity.ok(toolRoutingService.create(toolName, body.getInstanceId(), body.getIdentity(),
                toDuration(timeoutMs)));
    }

    /**
     * Runs one step on the worker bound to the instance.
     *
     * @return the worker's {@code {response, reward_score, metrics}} unchanged
     */
    @PostMapping("/execute")
    @Timed(value = "toolrelay.request.execute", description = "Time to execute a tool step")
    public ResponseEntity<JsonNode> execute(
            @PathVariable String toolName,
            @Valid @RequestBody InstanceRequest request,
            @RequestHeader(value = TIMEOUT_HEADER, required = false) Long timeoutMs) {
        return ResponseEntity.ok(toolRoutingService.execute(toolName, request.getInstanceId(), request.getParameters(),
                toDuration(timeoutMs)));
    }

    /**
     * Finalizes the instance on its worker and drops the binding.
     */
    @PostMapping("/release")
    public ResponseEntity<JsonNode> release(
            @PathVariable String toolName,
            @Valid @RequestBody InstanceRequest request,
            @RequestHeader(value = TIMEOUT_HEADER, required = false) Long timeoutMs) {
        return ResponseEntity.ok(toolRoutingService.release(toolName, request.getInstanceId(), toDuration(timeoutMs)));
    }

    /**
     * Returns the worker's final reward for the instance.
     */
    @PostMapping("/calc_reward")
    public ResponseEntity<JsonNode> calcReward(
            @PathVariable String toolName,
            @Valid @RequestBody InstanceRequest request,
            @RequestHeader(value = TIMEOUT_HEADER, required = false) Long timeoutMs) {
        return ResponseEntity.ok(toolRoutingService.calcReward(toolName, request.getInstanceId(),
                toDuration(timeoutMs)));
    }

    private static Duration toDuration(Long timeoutMs) {
        return timeoutMs == null ? null : Duration.ofMillis(timeoutMs);
    }
}
