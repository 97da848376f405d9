package dev.aparikh.emailtriage.api;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Number of stored emails matching a search, independent of {@code maxResults}.
 */
@Schema(description = "Count of emails matching the search criteria")
public record HitCountResponse(
        @Schema(description = "Matching emails in the store", example = "42")
        long count
) {
}
