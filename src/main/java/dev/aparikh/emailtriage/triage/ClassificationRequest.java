package dev.aparikh.emailtriage.triage;

import dev.aparikh.emailtriage.model.EmailDocument;

/**
 * What the classifier gets to see of an email. The body is cut to a bounded excerpt to keep the
 * cost of a classification call predictable.
 */
public record ClassificationRequest(
        String sender,
        String senderAddress,
        String subject,
        String snippet,
        String bodyExcerpt
) {
    public static ClassificationRequest from(EmailDocument email, int maxBodyLength) {
        String address = email.from() == null ? "" : email.from();
        String sender = email.fromName() == null || email.fromName().isBlank()
                ? address
                : email.fromName() + " <" + address + ">";
        return new ClassificationRequest(sender, address, nullToEmpty(email.subject()),
                nullToEmpty(email.snippet()), excerpt(email.body(), maxBodyLength));
    }

    static String excerpt(String body, int maxLength) {
        if (body == null) return "";
        return body.length() <= maxLength ? body : body.substring(0, maxLength);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
