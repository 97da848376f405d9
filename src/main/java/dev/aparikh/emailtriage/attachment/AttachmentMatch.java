package dev.aparikh.emailtriage.attachment;

/**
 * One relevant attachment that matched the search phrase. {@code context} is only set for
 * {@link MatchReason#CONTENT} matches.
 */
public record AttachmentMatch(
        String filename,
        String mimeType,
        long size,
        MatchReason matchReason,
        String context
) {
}
