package dev.aparikh.emailtriage.triage;

import java.time.Duration;

/**
 * Batch categorization over a date window. {@code category} keeps only emails classified into
 * that category; {@code persist} writes the category back to the store.
 */
public record CategorizeRequest(
        String dateFrom,
        String dateTo,
        Category category,
        int maxResults,
        Duration timeout,
        boolean persist
) {
    public static final int DEFAULT_MAX_RESULTS = 50;

    public CategorizeRequest {
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be > 0");
        }
    }

    public CategorizeRequest(String dateFrom, String dateTo, Category category) {
        this(dateFrom, dateTo, category, DEFAULT_MAX_RESULTS, null, false);
    }
}
