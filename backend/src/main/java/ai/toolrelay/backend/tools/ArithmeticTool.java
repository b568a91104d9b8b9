package ai.toolrelay.backend.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Reference tool: add, subtract, multiply and divide two numbers, keeping a
 * per-instance history.
 *
 * <p>Each valid step earns 0.1 and each invalid one -0.1. The final reward
 * starts at 1.0 for a single operation and drops by 0.1 for every further one,
 * never below zero.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.worker.enabled", havingValue = "true")
public class ArithmeticTool implements Tool {

    public static final String NAME = "ArithmeticTool";

    static final double STEP_REWARD = 0.1;
    static final double STEP_PENALTY = -0.1;

    private final ConcurrentMap<String, Session> sessions = new ConcurrentHashMap<>();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public JsonNode create(String instanceId, JsonNode identity) {
        sessions.put(instanceId, new Session());
        log.debug("Created arithmetic session {}", instanceId);
        return JsonNodeFactory.instance.textNode(instanceId);
    }

    @Override
    public ToolResult execute(String instanceId, JsonNode parameters) {
        Session session = sessions.get(instanceId);
        if (session == null) {
            throw new ToolExecutionException("Unknown instance " + instanceId);
        }

        String operation = parameters == null ? "" : parameters.path("operation").asText("");
        JsonNode first = parameters == null ? null : parameters.get("operand1");
        JsonNode second = parameters == null ? null : parameters.get("operand2");

        if (operation.isEmpty()) {
            return failure("Error: missing operation");
        }
        if (first == null || second == null || !first.isNumber() || !second.isNumber()) {
            return failure("Error: operands must be numbers");
        }

        double a = first.asDouble();
        double b = second.asDouble();
        double result;
        switch (operation) {
            case "add" -> result = a + b;
            case "subtract" -> result = a - b;
            case "multiply" -> result = a * b;
            case "divide" -> {
                if (b == 0) {
                    return failure("Error: division by zero");
                }
                result = a / b;
            }
            default -> {
                return failure("Error: unsupported operation '" + operation + "'");
            }
        }

        int count = session.record(operation, first.numberValue(), second.numberValue(), result);

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("operation", operation);
        metrics.put("operand1", first.numberValue());
        metrics.put("operand2", second.numberValue());
        metrics.put("result", result);
        metrics.put("operation_count", count);

        return new ToolResult(
                "Result: " + first.asText() + " " + operation + " " + second.asText() + " = " + result,
                STEP_REWARD,
                metrics);
    }

    @Override
    public double calcReward(String instanceId) {
        Session session = sessions.get(instanceId);
        if (session == null) {
            return 0.0;
        }
        double reward = 1.0 - (session.getOperationCount() - 1) * 0.1;
        return Math.min(Math.max(reward, 0.0), 1.0);
    }

    @Override
    public void release(String instanceId) {
        if (sessions.remove(instanceId) != null) {
            log.debug("Released arithmetic session {}", instanceId);
        }
    }

    List<Map<String, Object>> history(String instanceId) {
        Session session = sessions.get(instanceId);
        return session == null ? Collections.emptyList() : session.snapshot();
    }

    private static ToolResult failure(String message) {
        return new ToolResult(message, STEP_PENALTY, Collections.emptyMap());
    }

    private static final class Session {

        private final List<Map<String, Object>> history = new ArrayList<>();

        synchronized int record(String operation, Number operand1, Number operand2, double result) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("operation", operation);
            entry.put("operand1", operand1);
            entry.put("operand2", operand2);
            entry.put("result", result);
            history.add(entry);
            return history.size();
        }

        synchronized int getOperationCount() {
            return history.size();
        }

        synchronized List<Map<String, Object>> snapshot() {
            return new ArrayList<>(history);
        }
    }
}
