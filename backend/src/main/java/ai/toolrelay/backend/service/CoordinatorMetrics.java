package ai.toolrelay.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Micrometer meters for the coordinator: pool gauges, lifecycle counters and
 * a timer per proxied tool operation.
 */
@Slf4j
public class CoordinatorMetrics {

    private final MeterRegistry meterRegistry;

    // Meters are cached by their full tag key to avoid repeated lookups
    private final ConcurrentMap<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Counter> counterCache = new ConcurrentHashMap<>();

    public CoordinatorMetrics(MeterRegistry meterRegistry, WorkerRegistry workerRegistry) {
        this.meterRegistry = meterRegistry;

        Gauge.builder("toolrelay.workers.online", workerRegistry, WorkerRegistry::onlineWorkerCount)
                .description("Workers currently ONLINE")
                .register(meterRegistry);
        Gauge.builder("toolrelay.instances.bound", workerRegistry, WorkerRegistry::boundInstanceCount)
                .description("Tool instances currently bound to a worker")
                .register(meterRegistry);
    }

    public void recordRegistration(boolean replaced) {
        counter("toolrelay.workers.registrations", "replaced", String.valueOf(replaced)).increment();
    }

    public void recordEviction(String reason, int invalidatedInstances) {
        counter("toolrelay.workers.evictions", "reason", reason).increment();
        if (invalidatedInstances > 0) {
            counter("toolrelay.instances.invalidated", "reason", reason).increment(invalidatedInstances);
        }
    }

    public void recordIdleRelease(int count) {
        if (count > 0) {
            counter("toolrelay.instances.invalidated", "reason", "idle").increment(count);
        }
    }

    /**
     * Records one proxied call.
     *
     * @param outcome {@code success} or the error code of the failure
     */
    public void recordCall(String tool, String operation, String outcome, Duration duration) {
        String key = tool + "|" + operation;
        Timer timer = timerCache.computeIfAbsent(key, k -> Timer.builder("toolrelay.proxy.duration")
                .description("Latency of calls proxied to workers")
                .tag("tool", tool)
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        timer.record(duration);

        String counterKey = "toolrelay.proxy.calls|" + key + "|" + outcome;
        counterCache.computeIfAbsent(counterKey, k -> Counter.builder("toolrelay.proxy.calls")
                .tag("tool", tool)
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(meterRegistry)).increment();

        log.debug("Recorded {} {} call: outcome={}, {}ms", tool, operation, outcome, duration.toMillis());
    }

    private Counter counter(String name, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(name + "|" + tagKey + "=" + tagValue,
                k -> Counter.builder(name).tag(tagKey, tagValue).register(meterRegistry));
    }
}
