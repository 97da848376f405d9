package dev.aparikh.emailtriage.triage;

/**
 * The classifier could not produce a usable result: the call failed, or the answer did not match
 * the expected shape.
 */
public class ClassificationException extends RuntimeException {

    public ClassificationException(String message) {
        super(message);
    }

    public ClassificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
