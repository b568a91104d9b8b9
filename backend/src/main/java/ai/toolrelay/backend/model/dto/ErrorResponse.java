package ai.toolrelay.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Structured error body returned for every failed coordinator request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    /**
     * Error kind, e.g. {@code NoWorkerAvailable}.
     */
    private String error;

    private String message;

    private boolean retryable;

    private Instant timestamp;
}
