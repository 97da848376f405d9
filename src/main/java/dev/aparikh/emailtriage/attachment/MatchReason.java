package dev.aparikh.emailtriage.attachment;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Why an email came back from an attachment search. Declaration order is ranking order.
 */
public enum MatchReason {
    /** The phrase occurs in an attachment's extracted text. */
    CONTENT,
    /** The phrase occurs in an attachment's filename. */
    FILENAME,
    /** Only the email's own subject or body matched. */
    NONE;

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
