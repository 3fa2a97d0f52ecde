package tech.yump.audit.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Number of audit logs matching a filter")
public record CountResponse(
        @Schema(description = "Matching log count.", example = "42", requiredMode = Schema.RequiredMode.REQUIRED)
        long count
) {}
