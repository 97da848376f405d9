package dev.aparikh.emailtriage.triage;

import java.util.Objects;

/**
 * Outcome of categorizing one email. Derived on demand and never treated as ground truth.
 * {@code failureReason} is null unless the classifier failed and the conservative default was used.
 */
public record CategoryResult(
        Category category,
        boolean paymentRequest,
        boolean fromOwnOrganization,
        Urgency urgency,
        boolean needsResponse,
        String rationale,
        String failureReason
) {
    public CategoryResult {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(urgency, "urgency");
    }

    public static CategoryResult of(Category category, boolean paymentRequest, boolean fromOwnOrganization,
                                    Urgency urgency, boolean needsResponse, String rationale) {
        return new CategoryResult(category, paymentRequest, fromOwnOrganization, urgency, needsResponse, rationale, null);
    }

    /**
     * The least alarming classification: general correspondence, no payment request, medium urgency,
     * no response needed.
     */
    public static CategoryResult fallback(boolean fromOwnOrganization, String failureReason) {
        return new CategoryResult(Category.GENERAL_CORRESPONDENCE, false, fromOwnOrganization, Urgency.MEDIUM,
                false, "Classification unavailable; treated as general correspondence.", failureReason);
    }

    public boolean isFallback() {
        return failureReason != null;
    }

    public boolean isExternalPaymentRequest() {
        return paymentRequest && !fromOwnOrganization;
    }
}
