package ai.toolrelay.backend.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client used by a worker to talk to its master. Calls to workers use
 * per-timeout templates owned by {@code WorkerProxyClient}.
 */
@Configuration
@ConditionalOnProperty(name = "app.worker.enabled", havingValue = "true")
public class HttpClientConfig {

    /**
     * @param builder the RestTemplateBuilder provided by Spring Boot
     * @param timeout connect and read timeout for registration and heartbeats
     */
    @Bean
    @Qualifier("master")
    public RestTemplate masterRestTemplate(RestTemplateBuilder builder,
                                           @Value("${app.worker.master-timeout:5s}") Duration timeout) {
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }
}
