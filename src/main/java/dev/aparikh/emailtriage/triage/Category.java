package dev.aparikh.emailtriage.triage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of categories an email can be assigned to. The tag is the value stored in Solr and
 * exchanged with the classifier.
 */
public enum Category {
    PAYMENT_REQUEST_EXTERNAL("payment_request_external"),
    PAYMENT_REQUEST_INTERNAL("payment_request_internal"),
    SERVICE_REQUEST("service_request"),
    GENERAL_CORRESPONDENCE("general_correspondence"),
    PROMOTIONAL("promotional"),
    SPAM("spam"),
    AUTOMATED_NOTIFICATION("automated_notification");

    private final String tag;

    Category(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public boolean isPaymentRequest() {
        return this == PAYMENT_REQUEST_EXTERNAL || this == PAYMENT_REQUEST_INTERNAL;
    }

    /**
     * Mail that rarely needs a human: marketing, spam and machine-generated notices.
     */
    public boolean isLowValue() {
        return this == PROMOTIONAL || this == SPAM || this == AUTOMATED_NOTIFICATION;
    }

    public static List<String> tags() {
        return Arrays.stream(values()).map(Category::tag).toList();
    }

    public static Optional<Category> fromTag(String value) {
        if (value == null) return Optional.empty();
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        return Arrays.stream(values())
                .filter(c -> c.tag.equals(normalized))
                .findFirst();
    }

    @JsonCreator
    public static Category fromJson(String value) {
        return fromTag(value).orElseThrow(() -> new IllegalArgumentException("Unknown category: " + value));
    }
}
