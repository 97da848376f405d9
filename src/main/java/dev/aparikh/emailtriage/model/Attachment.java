package dev.aparikh.emailtriage.model;

/**
 * File attached to an email. {@code parsedContent} is the text produced by the extraction step at
 * ingestion time and is null when nothing could be extracted.
 */
public record Attachment(
        String filename,
        String mimeType,
        long size,
        String parsedContent
) {
    public boolean hasParsedContent() {
        return parsedContent != null && !parsedContent.isBlank();
    }
}
