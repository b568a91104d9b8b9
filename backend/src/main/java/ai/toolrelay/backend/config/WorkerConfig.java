package ai.toolrelay.backend.config;

import ai.toolrelay.backend.tools.Tool;
import ai.toolrelay.backend.worker.MasterClient;
import ai.toolrelay.backend.worker.RegistrationBackoff;
import ai.toolrelay.backend.worker.ToolCatalog;
import ai.toolrelay.backend.worker.WorkerAgent;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;

/**
 * Wires the worker role. Active when {@code app.worker.enabled=true}; with the
 * master role also enabled the process runs both ("unified" mode).
 */
@Configuration
@ConditionalOnProperty(name = "app.worker.enabled", havingValue = "true")
public class WorkerConfig {

    @Bean
    public ToolCatalog toolCatalog(List<Tool> tools, @Value("${app.worker.tools:}") String enabledTools) {
        return new ToolCatalog(tools, StringUtils.commaDelimitedListToSet(enabledTools.replace(" ", "")));
    }

    @Bean
    public MasterClient masterClient(@Qualifier("master") RestTemplate masterRestTemplate,
                                     @Value("${app.worker.master-url:}") String masterUrl) {
        return new MasterClient(masterRestTemplate, masterUrl);
    }

    @Bean
    public RegistrationBackoff registrationBackoff(
            @Value("${app.worker.registration.initial-delay:1s}") Duration initialDelay,
            @Value("${app.worker.registration.max-delay:30s}") Duration maxDelay,
            @Value("${app.worker.registration.multiplier:2.0}") double multiplier,
            @Value("${app.worker.registration.jitter:0.2}") double jitter) {
        return new RegistrationBackoff(initialDelay, maxDelay, multiplier, jitter);
    }

    @Bean
    public WorkerAgent workerAgent(MasterClient masterClient,
                                   ToolCatalog toolCatalog,
                                   RegistrationBackoff registrationBackoff,
                                   @Value("${app.worker.id:}") String workerId,
                                   @Value("${app.worker.advertised-url:}") String advertisedUrl,
                                   @Value("${app.worker.path-prefix:/worker}") String pathPrefix,
                                   @Value("${app.worker.heartbeat-interval:30s}") Duration heartbeatInterval) {
        return new WorkerAgent(masterClient, toolCatalog, registrationBackoff, workerId, advertisedUrl, pathPrefix,
                heartbeatInterval);
    }
}
