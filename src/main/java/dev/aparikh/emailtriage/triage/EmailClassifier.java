package dev.aparikh.emailtriage.triage;

/**
 * Natural-language classification of a single email.
 * <p>
 * Implementations may be slow or fail; {@link EmailCategorizer} bounds every call with a timeout
 * and replaces failures with a conservative default, so implementations should simply throw.
 */
public interface EmailClassifier {

    /**
     * @throws ClassificationException when no valid result can be produced
     */
    CategoryResult classify(ClassificationRequest request);
}
