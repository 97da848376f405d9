package dev.aparikh.emailtriage.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;

@Schema(description = "Batch categorization request")
public record CategorizeEmailsRequest(
        @Schema(description = "Start of the date window", example = "last week")
        String dateFrom,

        @Schema(description = "End of the date window", example = "today")
        String dateTo,

        @Schema(description = "Keep only emails classified into this category", example = "payment_request_external")
        String category,

        @Positive(message = "maxResults must be positive")
        @Max(value = 200, message = "maxResults must be at most 200")
        @Schema(description = "Maximum number of emails to categorize", example = "50", defaultValue = "50")
        Integer maxResults,

        @Positive(message = "timeoutSeconds must be positive")
        @Schema(description = "Per-email classification timeout in seconds", example = "10")
        Integer timeoutSeconds,

        @Schema(description = "Write the category back to the store", defaultValue = "false")
        Boolean persist
) {
}
