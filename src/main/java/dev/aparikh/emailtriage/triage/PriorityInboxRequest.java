package dev.aparikh.emailtriage.triage;

import java.time.Duration;

public record PriorityInboxRequest(
        String dateFrom,
        boolean unreadOnly,
        PriorityLevel minPriority,
        int maxResults,
        Duration timeout,
        boolean persist
) {
    public static final int DEFAULT_MAX_RESULTS = 20;

    public PriorityInboxRequest {
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be > 0");
        }
    }

    public PriorityInboxRequest(String dateFrom) {
        this(dateFrom, false, null, DEFAULT_MAX_RESULTS, null, false);
    }
}
