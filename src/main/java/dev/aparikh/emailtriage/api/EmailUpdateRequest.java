package dev.aparikh.emailtriage.api;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Set;

@Schema(description = "Partial update of one email; omitted fields are left unchanged")
public record EmailUpdateRequest(
        @Schema(description = "Mark as read or unread")
        Boolean read,

        @Schema(description = "Star or unstar")
        Boolean starred,

        @Schema(description = "Mark as important or not")
        Boolean important,

        @Schema(description = "Replaces the label set", example = "[\"IMPORTANT\", \"FOLLOW_UP\"]")
        Set<String> labels,

        @Schema(description = "Category tag", example = "service_request")
        String category,

        @Schema(description = "Priority level", example = "high")
        String priority
) {
}
