package dev.aparikh.emailtriage.triage;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Discrete urgency tier with fixed lower score bounds.
 */
public enum PriorityLevel {
    CRITICAL(80),
    HIGH(65),
    MEDIUM(40),
    LOW(0);

    private final int minScore;

    PriorityLevel(int minScore) {
        this.minScore = minScore;
    }

    public int minScore() {
        return minScore;
    }

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PriorityLevel fromScore(int score) {
        for (PriorityLevel level : values()) {
            if (score >= level.minScore) return level;
        }
        return LOW;
    }

    public boolean isAtLeast(PriorityLevel other) {
        return minScore >= other.minScore;
    }

    public static Optional<PriorityLevel> fromTag(String value) {
        if (value == null) return Optional.empty();
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(l -> l.name().equals(normalized)).findFirst();
    }
}
