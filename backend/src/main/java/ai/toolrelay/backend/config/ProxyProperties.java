package ai.toolrelay.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Timeouts for calls the coordinator proxies to workers.
 */
@Data
@ConfigurationProperties("app.proxy")
public class ProxyProperties {

    private Duration connectTimeout = Duration.ofSeconds(5);

    /**
     * Read timeout for tools without an entry in {@link #toolTimeouts}.
     */
    private Duration defaultTimeout = Duration.ofSeconds(300);

    private Map<String, Duration> toolTimeouts = new LinkedHashMap<>();

    /**
     * Resolves the deadline for one call: request override, then per-tool value, then the default.
     */
    public Duration resolveTimeout(String toolName, Duration override) {
        if (override != null && !override.isZero() && !override.isNegative()) {
            return override;
        }
        return toolTimeouts.getOrDefault(toolName, defaultTimeout);
    }
}
