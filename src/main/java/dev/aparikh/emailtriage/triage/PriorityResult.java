package dev.aparikh.emailtriage.triage;

import java.util.List;

/**
 * Score in [0, 100], its level, and the human-readable adjustments that produced it, in the order
 * they were applied.
 */
public record PriorityResult(
        int score,
        PriorityLevel level,
        List<String> reasons
) {
    public PriorityResult {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("score must be within [0, 100]");
        }
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }
}
