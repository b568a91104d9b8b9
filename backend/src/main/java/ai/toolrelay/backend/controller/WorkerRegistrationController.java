package ai.toolrelay.backend.controller;

import ai.toolrelay.backend.model.dto.RegisterWorkerRequest;
import ai.toolrelay.backend.model.dto.RegisterWorkerResponse;
import ai.toolrelay.backend.model.registry.RegistrationResult;
import ai.toolrelay.backend.service.CoordinatorMetrics;
import ai.toolrelay.backend.service.WorkerProxyClient;
import ai.toolrelay.backend.service.WorkerRegistry;
import ai.toolrelay.backend.service.exception.ValidationException;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Worker-facing endpoints: registration, heartbeat and unregistration.
 */
@Slf4j
@RestController
@ConditionalOnProperty(name = "app.master.enabled", havingValue = "true", matchIfMissing = true)
public class WorkerRegistrationController {

    private final WorkerRegistry workerRegistry;
    private final WorkerProxyClient workerProxyClient;
    private final CoordinatorMetrics metrics;
    private final boolean verifyReachability;

    public WorkerRegistrationController(
            WorkerRegistry workerRegistry,
            WorkerProxyClient workerProxyClient,
            CoordinatorMetrics metrics,
            @Value("${app.registry.verify-worker-reachability:false}") boolean verifyReachability) {
        this.workerRegistry = workerRegistry;
        this.workerProxyClient = workerProxyClient;
        this.metrics = metrics;
        this.verifyReachability = verifyReachability;
    }

    /**
     * Registers a worker, or replaces the record of a worker id seen before.
     *
     * @param request base url, tools and optional id of the worker
     * @return the effective worker id and the instances lost by a replacement
     */
    @PostMapping("/register")
    public ResponseEntity<RegisterWorkerResponse> register(@Valid @RequestBody RegisterWorkerRequest request) {
        if (verifyReachability && !workerProxyClient.isReachable(trimSlash(request.getBaseUrl()), Duration.ofSeconds(5))) {
            throw new ValidationException("Worker at " + request.getBaseUrl() + " is not reachable");
        }

        RegistrationResult result = workerRegistry.register(
                request.getWorkerId(),
                request.getBaseUrl(),
                request.getSupportedTools(),
                request.getHostInfo());
        metrics.recordRegistration(result.isReplaced());

        if (result.isReplaced()) {
            log.info("Worker {} re-registered at {}, invalidated {} instance(s)",
                    result.getWorkerId(), request.getBaseUrl(), result.getInvalidatedInstances().size());
        } else {
            log.info("Worker {} registered at {} with tools {}",
                    result.getWorkerId(), request.getBaseUrl(), request.getSupportedTools());
        }

        return ResponseEntity.ok(RegisterWorkerResponse.builder()
                .workerId(result.getWorkerId())
                .replaced(result.isReplaced())
                .invalidatedInstances(result.getInvalidatedInstances())
                .build());
    }

    /**
     * Refreshes a worker's liveness. Answers 404 for unknown or OFFLINE ids so
     * the worker registers again.
     */
    @PutMapping("/heartbeat/{workerId}")
    public ResponseEntity<Map<String, Object>> heartbeat(@PathVariable String workerId) {
        workerRegistry.heartbeat(workerId);
        log.debug("Heartbeat from worker {}", workerId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("worker_id", workerId);
        return ResponseEntity.ok(body);
    }

    /**
     * Removes a worker on graceful shutdown or operator request.
     *
     * @return the ids of the instances that were bound to it
     */
    @DeleteMapping("/workers/{workerId}")
    public ResponseEntity<Map<String, Object>> unregister(@PathVariable String workerId) {
        Set<String> invalidated = workerRegistry.evict(workerId);
        metrics.recordEviction("unregister", invalidated.size());
        log.info("Worker {} unregistered, invalidated {} instance(s)", workerId, invalidated.size());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("worker_id", workerId);
        body.put("invalidated_instances", invalidated);
        return ResponseEntity.ok(body);
    }

    private static String trimSlash(String url) {
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
