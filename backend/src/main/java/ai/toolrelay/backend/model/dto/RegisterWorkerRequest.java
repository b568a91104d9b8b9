package ai.toolrelay.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /register}, sent by a worker agent on startup.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RegisterWorkerRequest {

    /**
     * Optional; the coordinator generates one when absent.
     */
    private String workerId;

    @NotBlank(message = "base_url is required")
    @JsonAlias("worker_url")
    private String baseUrl;

    @NotEmpty(message = "supported_tools must not be empty")
    @JsonAlias("tools")
    private List<String> supportedTools;

    private Map<String, Object> hostInfo;
}
