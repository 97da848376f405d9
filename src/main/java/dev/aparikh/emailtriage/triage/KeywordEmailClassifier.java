package dev.aparikh.emailtriage.triage;

import dev.aparikh.emailtriage.config.TriageProperties;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Deterministic classifier for callers that cannot afford a model call: an email is a payment
 * request when its subject or body contains one of a fixed list of payment phrases.
 * <p>
 * Much less precise than {@link LlmEmailClassifier}: it cannot tell a bill from a newsletter that
 * mentions "payment", and it never detects service requests, promotions or notifications.
 */
public class KeywordEmailClassifier implements EmailClassifier {

    static final List<String> PAYMENT_KEYWORDS = List.of(
            "invoice",
            "payment",
            "amount due",
            "balance due",
            "past due",
            "overdue",
            "remittance",
            "bill",
            "statement of account",
            "wire transfer"
    );

    // Whole words, plurals allowed: "bill" matches "bills" but not "billion" or "billboard"
    private static final List<Pattern> KEYWORD_PATTERNS = PAYMENT_KEYWORDS.stream()
            .map(keyword -> Pattern.compile("\\b" + Pattern.quote(keyword) + "s?\\b"))
            .toList();

    private final TriageProperties.OwnOrganization ownOrganization;

    public KeywordEmailClassifier(TriageProperties.OwnOrganization ownOrganization) {
        this.ownOrganization = ownOrganization;
    }

    /**
     * The first payment keyword found in the subject or body, if any.
     */
    public static Optional<String> paymentKeyword(String subject, String body) {
        String text = ((subject == null ? "" : subject) + "\n" + (body == null ? "" : body)).toLowerCase(Locale.ROOT);
        for (int i = 0; i < PAYMENT_KEYWORDS.size(); i++) {
            if (KEYWORD_PATTERNS.get(i).matcher(text).find()) {
                return Optional.of(PAYMENT_KEYWORDS.get(i));
            }
        }
        return Optional.empty();
    }

    @Override
    public CategoryResult classify(ClassificationRequest request) {
        boolean ownOrg = ownOrganization.matchesAddress(request.senderAddress());
        Optional<String> keyword = paymentKeyword(request.subject(), request.bodyExcerpt());
        if (keyword.isEmpty()) {
            return CategoryResult.of(Category.GENERAL_CORRESPONDENCE, false, ownOrg, Urgency.MEDIUM, false,
                    "No payment keyword found.");
        }
        Category category = ownOrg ? Category.PAYMENT_REQUEST_INTERNAL : Category.PAYMENT_REQUEST_EXTERNAL;
        return CategoryResult.of(category, true, ownOrg, Urgency.MEDIUM, true,
                "Mentions '" + keyword.get() + "'.");
    }
}
