package dev.aparikh.emailtriage.search;

import java.util.List;
import java.util.Optional;

/**
 * Search criteria. Every criterion is optional; an empty query matches every email.
 * Optional text is matched fuzzily against subject, body and snippet.
 * Optional sender and recipient are substring matches on addresses.
 * Dates accept the phrases understood by {@link RelativeDateNormalizer} as well as yyyy-MM-dd.
 * Optional labels must all be present on a matching email.
 */
public record SearchQuery(
        String text,
        String sender,
        String recipient,
        String category,
        String dateFrom,
        String dateTo,
        Boolean hasAttachments,
        List<String> labels,
        Boolean read,
        int maxResults,
        SortOrder sort
) {
    public static final int DEFAULT_MAX_RESULTS = 10;

    public SearchQuery {
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be > 0");
        }
        if (sort == null) {
            sort = SortOrder.NEWEST_FIRST;
        }
    }

    public Optional<String> textOpt() {
        return nonBlank(text);
    }

    public Optional<String> senderOpt() {
        return nonBlank(sender);
    }

    public Optional<String> recipientOpt() {
        return nonBlank(recipient);
    }

    public Optional<String> categoryOpt() {
        return nonBlank(category);
    }

    public List<String> labelsNonEmpty() {
        if (labels == null) return List.of();
        return labels.stream()
                .filter(label -> label != null && !label.isBlank())
                .map(String::trim)
                .toList();
    }

    public SearchQuery withMaxResults(int maxResults) {
        return new SearchQuery(text, sender, recipient, category, dateFrom, dateTo, hasAttachments, labels,
                read, maxResults, sort);
    }

    private static Optional<String> nonBlank(String value) {
        return Optional.ofNullable(value).map(String::trim).filter(s -> !s.isEmpty());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String text;
        private String sender;
        private String recipient;
        private String category;
        private String dateFrom;
        private String dateTo;
        private Boolean hasAttachments;
        private List<String> labels;
        private Boolean read;
        private Integer maxResults;
        private SortOrder sort;

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder sender(String sender) {
            this.sender = sender;
            return this;
        }

        public Builder recipient(String recipient) {
            this.recipient = recipient;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder dateFrom(String dateFrom) {
            this.dateFrom = dateFrom;
            return this;
        }

        public Builder dateTo(String dateTo) {
            this.dateTo = dateTo;
            return this;
        }

        public Builder hasAttachments(Boolean hasAttachments) {
            this.hasAttachments = hasAttachments;
            return this;
        }

        public Builder labels(List<String> labels) {
            this.labels = labels;
            return this;
        }

        public Builder read(Boolean read) {
            this.read = read;
            return this;
        }

        public Builder maxResults(Integer maxResults) {
            this.maxResults = maxResults;
            return this;
        }

        public Builder sort(SortOrder sort) {
            this.sort = sort;
            return this;
        }

        public SearchQuery build() {
            int rows = maxResults != null ? maxResults : DEFAULT_MAX_RESULTS;
            return new SearchQuery(text, sender, recipient, category, dateFrom, dateTo, hasAttachments, labels,
                    read, rows, sort);
        }
    }
}
