package ai.toolrelay.backend.service;

import ai.toolrelay.backend.model.registry.SweepResult;
import lombok.extern.slf4j.Slf4j;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodic liveness sweep over the registry, independent of request traffic.
 * The scheduled future returned on start is the cancellation handle.
 */
@Slf4j
public class WorkerHealthMonitor {

    private final WorkerRegistry workerRegistry;
    private final CoordinatorMetrics metrics;
    private final Duration sweepInterval;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> sweepTask;

    public WorkerHealthMonitor(WorkerRegistry workerRegistry, CoordinatorMetrics metrics, Duration sweepInterval) {
        this.workerRegistry = workerRegistry;
        this.metrics = metrics;
        this.sweepInterval = sweepInterval;
    }

    @PostConstruct
    public synchronized void start() {
        if (sweepTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "worker-health-monitor");
            thread.setDaemon(true);
            return thread;
        });
        sweepTask = scheduler.scheduleWithFixedDelay(
                this::runSweepSafely,
                sweepInterval.toMillis(),
                sweepInterval.toMillis(),
                TimeUnit.MILLISECONDS
        );
        log.info("Worker health monitor started: sweep every {}ms, heartbeat timeout {}ms",
                sweepInterval.toMillis(), workerRegistry.getHeartbeatTimeout().toMillis());
    }

    @PreDestroy
    public synchronized void stop() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        log.info("Worker health monitor stopped");
    }

    public synchronized boolean isRunning() {
        return sweepTask != null && !sweepTask.isCancelled();
    }

    /**
     * Runs one sweep on the calling thread and reports what changed.
     */
    public SweepResult sweepOnce() {
        SweepResult result = workerRegistry.sweep();

        result.getOfflined().forEach((workerId, instances) -> {
            log.warn("Worker {} missed heartbeats for more than {}s, marked OFFLINE; invalidated {} instance(s)",
                    workerId, workerRegistry.getHeartbeatTimeout().toSeconds(), instances.size());
            metrics.recordEviction("heartbeat_timeout", instances.size());
        });
        result.getPurged().forEach(workerId -> log.info("Purged OFFLINE worker {}", workerId));
        if (!result.getIdleReleased().isEmpty()) {
            log.info("Released {} idle instance(s): {}", result.getIdleReleased().size(), result.getIdleReleased());
            metrics.recordIdleRelease(result.getIdleReleased().size());
        }
        return result;
    }

    // An exception escaping a scheduleWithFixedDelay task cancels all future runs
    private void runSweepSafely() {
        try {
            sweepOnce();
        } catch (RuntimeException e) {
            log.error("Health sweep failed: {}", e.getMessage(), e);
        }
    }
}
