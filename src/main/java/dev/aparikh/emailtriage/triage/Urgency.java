package dev.aparikh.emailtriage.triage;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum Urgency {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Urgency> fromTag(String value) {
        if (value == null) return Optional.empty();
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(u -> u.name().equals(normalized)).findFirst();
    }
}
