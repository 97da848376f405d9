package dev.aparikh.emailtriage.triage;

import dev.aparikh.emailtriage.config.TriageProperties;
import dev.aparikh.emailtriage.model.EmailDocument;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a categorization plus mailbox flags into a bounded urgency score.
 * <p>
 * Starts from the base score and applies independent additive adjustments, each recorded as a
 * reason, then clamps to [0, 100]. Weights come from {@code triage.scoring.*}.
 */
@Component
public class PriorityScorer {

    private final TriageProperties.Scoring weights;

    public PriorityScorer(TriageProperties properties) {
        this.weights = properties.getScoring();
    }

    public PriorityResult score(EmailDocument email, CategoryResult category) {
        List<String> reasons = new ArrayList<>();
        int score = weights.getBase();

        if (category.category() == Category.SERVICE_REQUEST) {
            score += adjust(reasons, weights.getServiceRequest(), "service request");
        }
        if (category.isExternalPaymentRequest()) {
            score += adjust(reasons, weights.getExternalPaymentRequest(), "payment request from an external party");
        }
        if (category.urgency() == Urgency.HIGH) {
            score += adjust(reasons, weights.getHighUrgency(), "high urgency");
        } else if (category.urgency() == Urgency.LOW) {
            score += adjust(reasons, weights.getLowUrgency(), "low urgency");
        }
        if (category.needsResponse()) {
            score += adjust(reasons, weights.getNeedsResponse(), "needs a response");
        }
        if (email.important() || email.hasLabel(EmailDocument.LABEL_IMPORTANT)) {
            score += adjust(reasons, weights.getImportant(), "marked important");
        }
        if (email.starred() || email.hasLabel(EmailDocument.LABEL_STARRED)) {
            score += adjust(reasons, weights.getStarred(), "starred");
        }
        if (!email.read() || email.hasLabel(EmailDocument.LABEL_UNREAD)) {
            score += adjust(reasons, weights.getUnread(), "unread");
        }
        if (category.category().isLowValue()) {
            score += adjust(reasons, weights.getLowValueCategory(), category.category().tag());
        }

        int clamped = Math.max(0, Math.min(100, score));
        return new PriorityResult(clamped, PriorityLevel.fromScore(clamped), reasons);
    }

    private static int adjust(List<String> reasons, int delta, String signal) {
        reasons.add((delta >= 0 ? "+" : "") + delta + " " + signal);
        return delta;
    }
}
