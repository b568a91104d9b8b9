package ai.toolrelay.backend.config;

import ai.toolrelay.backend.service.CoordinatorMetrics;
import ai.toolrelay.backend.service.LeastActiveInstancesStrategy;
import ai.toolrelay.backend.service.ToolRoutingService;
import ai.toolrelay.backend.service.WorkerHealthMonitor;
import ai.toolrelay.backend.service.WorkerProxyClient;
import ai.toolrelay.backend.service.WorkerRegistry;
import ai.toolrelay.backend.service.WorkerSelectionStrategy;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the master role: registry, health monitor and routing. Active unless
 * {@code app.master.enabled=false}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ProxyProperties.class)
@ConditionalOnProperty(name = "app.master.enabled", havingValue = "true", matchIfMissing = true)
public class CoordinatorConfig {

    /**
     * Time source for heartbeats and sweeps. Tests replace it with a controllable clock.
     */
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkerSelectionStrategy workerSelectionStrategy() {
        return new LeastActiveInstancesStrategy();
    }

    /**
     * The registry shared by the registration, routing and status endpoints.
     *
     * @param heartbeatTimeout    silence after which a worker is taken OFFLINE
     * @param offlineRetention    how long OFFLINE records stay listed
     * @param instanceIdleTimeout idle time before a binding is dropped, 0 disables it
     */
    @Bean
    public WorkerRegistry workerRegistry(
            Clock clock,
            WorkerSelectionStrategy workerSelectionStrategy,
            @Value("${app.registry.heartbeat-timeout:60s}") Duration heartbeatTimeout,
            @Value("${app.registry.offline-retention:5m}") Duration offlineRetention,
            @Value("${app.registry.instance-idle-timeout:0s}") Duration instanceIdleTimeout) {
        log.info("Worker registry: heartbeat timeout {}s, offline retention {}s, instance idle timeout {}s",
                heartbeatTimeout.toSeconds(), offlineRetention.toSeconds(), instanceIdleTimeout.toSeconds());
        return new WorkerRegistry(clock, workerSelectionStrategy, heartbeatTimeout, offlineRetention,
                instanceIdleTimeout);
    }

    @Bean
    public CoordinatorMetrics coordinatorMetrics(MeterRegistry meterRegistry, WorkerRegistry workerRegistry) {
        return new CoordinatorMetrics(meterRegistry, workerRegistry);
    }

    /**
     * Records the {@code @Timed} request timers on the tool endpoints.
     */
    @Bean
    @ConditionalOnMissingBean
    public TimedAspect timedAspect(MeterRegistry meterRegistry) {
        return new TimedAspect(meterRegistry);
    }

    /**
     * Background sweep; started and stopped with the application context.
     */
    @Bean
    public WorkerHealthMonitor workerHealthMonitor(
            WorkerRegistry workerRegistry,
            CoordinatorMetrics coordinatorMetrics,
            @Value("${app.registry.sweep-interval:5s}") Duration sweepInterval) {
        return new WorkerHealthMonitor(workerRegistry, coordinatorMetrics, sweepInterval);
    }

    @Bean
    public WorkerProxyClient workerProxyClient(ProxyProperties proxyProperties) {
        return new WorkerProxyClient(proxyProperties.getConnectTimeout());
    }

    @Bean
    public ToolRoutingService toolRoutingService(WorkerRegistry workerRegistry,
                                                 WorkerProxyClient workerProxyClient,
                                                 ProxyProperties proxyProperties,
                                                 CoordinatorMetrics coordinatorMetrics) {
        return new ToolRoutingService(workerRegistry, workerProxyClient, proxyProperties, coordinatorMetrics);
    }
}
