package dev.aparikh.emailtriage.api;

import dev.aparikh.emailtriage.model.EmailDocument;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Response DTO for email search API.
 */
@Schema(description = "Email search response")
public record SearchResponse(
        @Schema(description = "Matching emails, at most maxResults")
        List<EmailDocument> emails,

        @Schema(description = "Number of emails returned", example = "10")
        int count,

        @Schema(description = "Total number of matching emails in the store", example = "42")
        long totalCount
) {
}
