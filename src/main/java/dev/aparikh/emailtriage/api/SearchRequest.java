package dev.aparikh.emailtriage.api;

import dev.aparikh.emailtriage.search.SortOrder;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * Request DTO for email search and count. All filters are optional and AND-ed together.
 */
@Schema(description = "Email search request parameters")
public record SearchRequest(
        @Schema(description = "Free text matched against subject, body and snippet, typo tolerant",
                example = "quarterly invoice")
        String text,

        @Schema(description = "Sender address or display name fragment", example = "acme.com")
        String sender,

        @Schema(description = "Recipient fragment matched against To, Cc and Bcc", example = "billing@")
        String recipient,

        @Schema(description = "Stored category tag", example = "payment_request_external")
        String category,

        @Schema(description = "Start of the date range: yyyy-MM-dd or a phrase such as 'yesterday', 'last week', '3 days ago'",
                example = "last week")
        String dateFrom,

        @Schema(description = "End of the date range (inclusive), same formats as dateFrom", example = "today")
        String dateTo,

        @Schema(description = "Only emails with (true) or without (false) attachments")
        Boolean hasAttachments,

        @Schema(description = "Labels the email must all carry", example = "[\"IMPORTANT\"]")
        List<String> labels,

        @Schema(description = "Only read (true) or unread (false) emails")
        Boolean read,

        @Positive(message = "maxResults must be positive")
        @Max(value = 500, message = "maxResults must be at most 500")
        @Schema(description = "Maximum number of results", example = "10", defaultValue = "10")
        Integer maxResults,

        @Schema(description = "Result order", example = "NEWEST_FIRST", defaultValue = "NEWEST_FIRST")
        SortOrder sort
) {
}
