package ai.toolrelay.backend.worker;

import ai.toolrelay.backend.tools.Tool;
import ai.toolrelay.backend.tools.ToolExecutionException;
import ai.toolrelay.backend.tools.ToolResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tool endpoints served by a worker, called by the master's proxy.
 */
@Slf4j
@RestController
@RequestMapping("${app.worker.path-prefix:/worker}")
@ConditionalOnProperty(name = "app.worker.enabled", havingValue = "true")
public class WorkerToolController {

    private final ToolCatalog toolCatalog;
    private final WorkerAgent workerAgent;

    public WorkerToolController(ToolCatalog toolCatalog, WorkerAgent workerAgent) {
        this.toolCatalog = toolCatalog;
        this.workerAgent = workerAgent;
    }

    /**
     * Worker id, hosted tools and registration state.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("worker_id", workerAgent.getWorkerId());
        body.put("tools", toolCatalog.getToolNames());
        body.put("is_registered", workerAgent.isRegistered());
        body.put("master_url", workerAgent.getMasterUrl());
        return ResponseEntity.ok(body);
    }

    /**
     * Opens a session. A tool-level failure is reported as {@code success: false}.
     */
    @PostMapping("/{toolName}/create")
    public ResponseEntity<ObjectNode> create(@PathVariable String toolName, @RequestBody JsonNode body) {
        Tool tool = requireTool(toolName);
        String instanceId = requireInstanceId(body);
        try {
            JsonNode result = tool.create(instanceId, body.get("identity"));
            log.debug("{} created instance {}", toolName, instanceId);
            return ResponseEntity.ok(success(result));
        } catch (ToolExecutionException e) {
            log.warn("{} failed to create instance {}: {}", toolName, instanceId, e.getMessage());
            return ResponseEntity.ok(failure(e.getMessage()));
        }
    }

    /**
     * Runs one step; arguments may be nested under {@code parameters} or sent flat.
     */
    @PostMapping("/{toolName}/execute")
    public ResponseEntity<ToolResult> execute(@PathVariable String toolName, @RequestBody JsonNode body) {
        Tool tool = requireTool(toolName);
        String instanceId = requireInstanceId(body);
        return ResponseEntity.ok(tool.execute(instanceId, parametersOf(body)));
    }

    @PostMapping("/{toolName}/release")
    public ResponseEntity<ObjectNode> release(@PathVariable String toolName, @RequestBody JsonNode body) {
        Tool tool = requireTool(toolName);
        tool.release(requireInstanceId(body));
        return ResponseEntity.ok(success(null));
    }

    @PostMapping("/{toolName}/calc_reward")
    public ResponseEntity<ObjectNode> calcReward(@PathVariable String toolName, @RequestBody JsonNode body) {
        Tool tool = requireTool(toolName);
        ObjectNode response = JsonNodeFactory.instance.objectNode();
        response.put("reward_score", tool.calcReward(requireInstanceId(body)));
        return ResponseEntity.ok(response);
    }

    @ExceptionHandler(ToolExecutionException.class)
    public ResponseEntity<ObjectNode> handleToolFailure(ToolExecutionException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(failure(e.getMessage()));
    }

    @ExceptionHandler(UnknownToolException.class)
    public ResponseEntity<ObjectNode> handleUnknownTool(UnknownToolException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(failure(e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ObjectNode> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(failure(e.getMessage()));
    }

    private Tool requireTool(String toolName) {
        return toolCatalog.find(toolName)
                .orElseThrow(() -> new UnknownToolException("Tool " + toolName + " is not hosted on this worker"));
    }

    private static String requireInstanceId(JsonNode body) {
        JsonNode id = body == null ? null : body.get("instance_id");
        if (id == null || !id.isTextual() || id.asText().isBlank()) {
            throw new IllegalArgumentException("instance_id is required");
        }
        return id.asText();
    }

    // Accepts both {instance_id, parameters: {...}} and the flat {instance_id, ...arguments}
    private static JsonNode parametersOf(JsonNode body) {
        JsonNode nested = body.get("parameters");
        if (nested != null && nested.isObject()) {
            return nested;
        }
        ObjectNode flat = body.deepCopy();
        flat.remove("instance_id");
        flat.remove("parameters");
        return flat;
    }

    private static ObjectNode success(JsonNode result) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("success", true);
        node.set("result", result);
        return node;
    }

    private static ObjectNode failure(String message) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("success", false);
        node.put("error", message);
        return node;
    }

    static class UnknownToolException extends RuntimeException {
        UnknownToolException(String message) {
            super(message);
        }
    }
}
