package dev.aparikh.emailtriage.api;

import dev.aparikh.emailtriage.attachment.AttachmentSearchHit;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Attachment content search response")
public record AttachmentSearchResponse(
        @Schema(description = "Phrase searched for", example = "net 30")
        String query,

        @Schema(description = "Number of emails returned", example = "2")
        int count,

        @Schema(description = "Matching emails, content matches first")
        List<AttachmentSearchHit> results
) {
}
