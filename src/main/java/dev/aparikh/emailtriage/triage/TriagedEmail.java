package dev.aparikh.emailtriage.triage;

import dev.aparikh.emailtriage.model.EmailDocument;

/**
 * An email with its categorization and, when it has been scored, its priority.
 */
public record TriagedEmail(
        EmailDocument email,
        CategoryResult category,
        PriorityResult priority
) {
    public int score() {
        return priority == null ? 0 : priority.score();
    }
}
