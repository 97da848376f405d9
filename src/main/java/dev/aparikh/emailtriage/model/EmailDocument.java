package dev.aparikh.emailtriage.model;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Email document to index and fetch from Solr.
 * <p>
 * {@code id} and {@code threadId} are assigned at ingestion and never change. {@code category} and
 * {@code priority} stay null until a triage run writes them back.
 */
public record EmailDocument(
        String id,
        String threadId,
        String from,
        String fromName,
        List<String> to,
        List<String> cc,
        List<String> bcc,
        String subject,
        String body,
        String bodyHtml,
        String snippet,
        Instant sentAt,
        Set<String> labels,
        boolean read,
        boolean starred,
        boolean important,
        List<Attachment> attachments,
        String category,
        String priority
) {
    // Solr field names - centralized constants for use across the application
    public static final String FIELD_ID = "id";
    public static final String FIELD_THREAD_ID = "thread_id";
    public static final String FIELD_SUBJECT = "subject";
    public static final String FIELD_BODY = "body";
    public static final String FIELD_BODY_HTML = "body_html";
    public static final String FIELD_SNIPPET = "snippet";
    public static final String FIELD_FROM = "from_addr";
    public static final String FIELD_FROM_NAME = "from_name";
    public static final String FIELD_TO = "to_addr";
    public static final String FIELD_CC = "cc_addr";
    public static final String FIELD_BCC = "bcc_addr";
    public static final String FIELD_SENT_AT = "sent_at";
    public static final String FIELD_LABELS = "labels";
    public static final String FIELD_IS_READ = "is_read";
    public static final String FIELD_IS_STARRED = "is_starred";
    public static final String FIELD_IS_IMPORTANT = "is_important";
    public static final String FIELD_HAS_ATTACHMENTS = "has_attachments";
    public static final String FIELD_ATTACHMENT_COUNT = "attachment_count";
    public static final String FIELD_ATTACHMENTS_JSON = "attachments_json";
    public static final String FIELD_ATTACHMENT_FILENAME = "att_filename";
    public static final String FIELD_ATTACHMENT_CONTENT = "att_content";
    public static final String FIELD_CATEGORY = "category";
    public static final String FIELD_PRIORITY = "priority";

    public static final String LABEL_IMPORTANT = "IMPORTANT";
    public static final String LABEL_STARRED = "STARRED";
    public static final String LABEL_UNREAD = "UNREAD";

    public EmailDocument {
        to = to == null ? List.of() : List.copyOf(to);
        cc = cc == null ? List.of() : List.copyOf(cc);
        bcc = bcc == null ? List.of() : List.copyOf(bcc);
        labels = labels == null ? Set.of() : Set.copyOf(labels);
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public boolean hasAttachments() {
        return !attachments.isEmpty();
    }

    public boolean hasLabel(String label) {
        return labels.stream().anyMatch(l -> l.equalsIgnoreCase(label));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id).threadId(threadId).from(from).fromName(fromName)
                .to(to).cc(cc).bcc(bcc)
                .subject(subject).body(body).bodyHtml(bodyHtml).snippet(snippet)
                .sentAt(sentAt).labels(labels)
                .read(read).starred(starred).important(important)
                .attachments(attachments).category(category).priority(priority);
    }

    public static class Builder {
        private String id;
        private String threadId;
        private String from;
        private String fromName;
        private List<String> to;
        private List<String> cc;
        private List<String> bcc;
        private String subject;
        private String body;
        private String bodyHtml;
        private String snippet;
        private Instant sentAt;
        private Set<String> labels;
        private boolean read;
        private boolean starred;
        private boolean important;
        private List<Attachment> attachments;
        private String category;
        private String priority;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder threadId(String threadId) {
            this.threadId = threadId;
            return this;
        }

        public Builder from(String from) {
            this.from = from;
            return this;
        }

        public Builder fromName(String fromName) {
            this.fromName = fromName;
            return this;
        }

        public Builder to(List<String> to) {
            this.to = to;
            return this;
        }

        public Builder cc(List<String> cc) {
            this.cc = cc;
            return this;
        }

        public Builder bcc(List<String> bcc) {
            this.bcc = bcc;
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder bodyHtml(String bodyHtml) {
            this.bodyHtml = bodyHtml;
            return this;
        }

        public Builder snippet(String snippet) {
            this.snippet = snippet;
            return this;
        }

        public Builder sentAt(Instant sentAt) {
            this.sentAt = sentAt;
            return this;
        }

        public Builder labels(Set<String> labels) {
            this.labels = labels;
            return this;
        }

        public Builder read(boolean read) {
            this.read = read;
            return this;
        }

        public Builder starred(boolean starred) {
            this.starred = starred;
            return this;
        }

        public Builder important(boolean important) {
            this.important = important;
            return this;
        }

        public Builder attachments(List<Attachment> attachments) {
            this.attachments = attachments;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder priority(String priority) {
            this.priority = priority;
            return this;
        }

        public EmailDocument build() {
            return new EmailDocument(id, threadId, from, fromName, to, cc, bcc, subject, body, bodyHtml,
                    snippet, sentAt, labels, read, starred, important, attachments, category, priority);
        }
    }
}
