package dev.aparikh.emailtriage.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;

@Schema(description = "Priority inbox request")
public record PriorityInboxApiRequest(
        @Schema(description = "Only emails sent on or after this date", example = "last week")
        String dateFrom,

        @Schema(description = "Only unread emails", defaultValue = "false")
        Boolean unreadOnly,

        @Schema(description = "Lowest priority level to return", example = "high",
                allowableValues = {"critical", "high", "medium", "low"})
        String minPriority,

        @Positive(message = "maxResults must be positive")
        @Max(value = 100, message = "maxResults must be at most 100")
        @Schema(description = "Maximum number of emails", example = "20", defaultValue = "20")
        Integer maxResults,

        @Positive(message = "timeoutSeconds must be positive")
        @Schema(description = "Per-email classification timeout in seconds", example = "10")
        Integer timeoutSeconds,

        @Schema(description = "Write category and priority back to the store", defaultValue = "false")
        Boolean persist
) {
}
