package tech.yump.audit.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(description = "Result of a retention cleanup request")
public record CleanupResponse(
        @Schema(description = "Whether the backend accepted the deletion. Deleted logs may stay visible for a short while.",
                requiredMode = Schema.RequiredMode.REQUIRED)
        boolean accepted,
        @Schema(description = "Logs strictly older than this instant are deleted.", requiredMode = Schema.RequiredMode.REQUIRED)
        Instant before
) {}
