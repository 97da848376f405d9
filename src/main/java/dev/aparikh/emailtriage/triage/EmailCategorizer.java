package dev.aparikh.emailtriage.triage;

import dev.aparikh.emailtriage.config.TriageProperties;
import dev.aparikh.emailtriage.model.EmailDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Assigns each email exactly one {@link Category}.
 * <p>
 * The classifier call is bounded by a timeout. Whatever goes wrong (timeout, exception, malformed
 * answer), the result is {@link CategoryResult#fallback}: general correspondence, never a payment
 * request, so a degraded classifier lowers precision without raising false alarms.
 */
@Service
public class EmailCategorizer {

    private static final Logger log = LoggerFactory.getLogger(EmailCategorizer.class);

    private final EmailClassifier classifier;
    private final TriageProperties.OwnOrganization ownOrganization;
    private final TriageProperties.Classification settings;

    public EmailCategorizer(EmailClassifier classifier, TriageProperties properties) {
        this.classifier = classifier;
        this.ownOrganization = properties.getOwnOrganization();
        this.settings = properties.getClassification();
    }

    public CategoryResult categorize(EmailDocument email) {
        return categorize(email, settings.getTimeout());
    }

    public CategoryResult categorize(EmailDocument email, Duration timeout) {
        return categorizeAsync(email, timeout).block();
    }

    /**
     * Non-blocking variant used for batch fan-out. The returned {@link Mono} always emits exactly one
     * result and never errors.
     */
    public Mono<CategoryResult> categorizeAsync(EmailDocument email, Duration timeout) {
        Duration bound = timeout != null ? timeout : settings.getTimeout();
        ClassificationRequest request = ClassificationRequest.from(email, settings.getBodyExcerptLength());
        return Mono.fromCallable(() -> classifier.classify(request))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(bound)
                .switchIfEmpty(Mono.error(() -> new ClassificationException("Classifier returned no result")))
                .onErrorResume(e -> Mono.just(fallback(email, e)));
    }

    private CategoryResult fallback(EmailDocument email, Throwable cause) {
        String reason = cause instanceof TimeoutException
                ? "Classification timed out"
                : "Classification failed: " + cause.getMessage();
        log.warn("Falling back to default category for email {}: {}", email.id(), reason);
        return CategoryResult.fallback(ownOrganization.matchesAddress(email.from()), reason);
    }
}
