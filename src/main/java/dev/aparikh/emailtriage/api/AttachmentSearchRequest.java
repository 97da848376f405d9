package dev.aparikh.emailtriage.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

@Schema(description = "Attachment content search request")
public record AttachmentSearchRequest(
        @NotBlank(message = "text must not be blank")
        @Schema(description = "Phrase to find in attachment text or file names", example = "net 30",
                requiredMode = Schema.RequiredMode.REQUIRED)
        String text,

        @Schema(description = "File extension or MIME fragment", example = "pdf")
        String fileType,

        @Schema(description = "Sender address or name fragment", example = "acme.com")
        String sender,

        @Schema(description = "Only emails sent on or after this date (yyyy-MM-dd or a relative phrase)",
                example = "last month")
        String dateFrom,

        @Positive(message = "maxResults must be positive")
        @Max(value = 100, message = "maxResults must be at most 100")
        @Schema(description = "Maximum number of emails", example = "10", defaultValue = "10")
        Integer maxResults,

        @Schema(description = "Also return emails whose subject or body contains the phrase", defaultValue = "false")
        Boolean includeBodyMatches
) {
}
