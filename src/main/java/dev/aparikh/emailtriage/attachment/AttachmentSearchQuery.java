package dev.aparikh.emailtriage.attachment;

import java.util.Optional;

/**
 * Attachment search criteria. {@code fileType} is an extension such as "pdf" and also matches
 * against the MIME type. With {@code includeBodyMatches}, emails whose relevant attachments do not
 * match but whose subject or body does are returned with {@link MatchReason#NONE}.
 */
public record AttachmentSearchQuery(
        String text,
        String fileType,
        String sender,
        String dateFrom,
        int maxResults,
        boolean includeBodyMatches
) {
    public static final int DEFAULT_MAX_RESULTS = 10;

    public AttachmentSearchQuery {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("search text must be provided");
        }
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be > 0");
        }
        text = text.trim();
    }

    public AttachmentSearchQuery(String text) {
        this(text, null, null, null, DEFAULT_MAX_RESULTS, false);
    }

    public Optional<String> fileTypeOpt() {
        return Optional.ofNullable(fileType)
                .map(String::trim)
                .map(t -> t.startsWith(".") ? t.substring(1) : t)
                .filter(t -> !t.isEmpty());
    }
}
