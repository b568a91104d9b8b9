package ai.toolrelay.backend.tools;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * Outcome of one execute step: text for the model, a step reward and free-form metrics.
 */
@Getter
@ToString
@AllArgsConstructor
public class ToolResult {

    @JsonProperty("response")
    private final String response;

    @JsonProperty("reward_score")
    private final double rewardScore;

    @JsonProperty("metrics")
    private final Map<String, Object> metrics;
}
