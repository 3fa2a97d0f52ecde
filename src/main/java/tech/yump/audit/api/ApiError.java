package tech.yump.audit.api;

import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;

@Schema(description = "Standard error response format")
public record ApiError(
        @Schema(description = "Detailed error message.", example = "Audit log not found.", requiredMode = Schema.RequiredMode.REQUIRED)
        String message,
        @Schema(description = "Timestamp when the error occurred.", requiredMode = Schema.RequiredMode.REQUIRED)
        Instant timestamp
) {
    public ApiError(String message) {
        this(message, Instant.now());
    }
}
