package dev.aparikh.emailtriage.attachment;

import dev.aparikh.emailtriage.model.EmailDocument;

import java.util.List;

public record AttachmentSearchHit(
        EmailDocument email,
        MatchReason matchReason,
        List<AttachmentMatch> matchingAttachments
) {
}
