package dev.aparikh.emailtriage.api;

import dev.aparikh.emailtriage.triage.TriagedEmail;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Categorized, and where requested scored, emails")
public record TriageResponse(
        @Schema(description = "Number of emails returned", example = "5")
        int count,

        @Schema(description = "Emails with their category and priority")
        List<TriagedEmail> emails
) {
    public static TriageResponse of(List<TriagedEmail> emails) {
        return new TriageResponse(emails.size(), emails);
    }
}
