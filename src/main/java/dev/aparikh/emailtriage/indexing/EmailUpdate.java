package dev.aparikh.emailtriage.indexing;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import dev.aparikh.emailtriage.model.EmailDocument;

/**
 * Partial update of one stored email. Null components are left untouched.
 */
public record EmailUpdate(
        Boolean read,
        Boolean starred,
        Boolean important,
        Set<String> labels,
        String category,
        String priority
) {
    public static EmailUpdate triage(String category, String priority) {
        return new EmailUpdate(null, null, null, null, category, priority);
    }

    public boolean isEmpty() {
        return read == null && starred == null && important == null && labels == null
                && category == null && priority == null;
    }

    /**
     * Solr field name to new value, in a stable order.
     */
    Map<String, Object> fieldValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        if (read != null) values.put(EmailDocument.FIELD_IS_READ, read);
        if (starred != null) values.put(EmailDocument.FIELD_IS_STARRED, starred);
        if (important != null) values.put(EmailDocument.FIELD_IS_IMPORTANT, important);
        if (labels != null) {
            values.put(EmailDocument.FIELD_LABELS, labels.stream()
                    .filter(l -> l != null && !l.isBlank())
                    .map(l -> l.trim().toUpperCase(Locale.ROOT))
                    .sorted()
                    .toList());
        }
        if (category != null) values.put(EmailDocument.FIELD_CATEGORY, category);
        if (priority != null) values.put(EmailDocument.FIELD_PRIORITY, priority);
        return values;
    }
}
