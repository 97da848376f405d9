package dev.aparikh.emailtriage.search;

/**
 * The Solr core could not serve a request: it is unreachable, it rejected the query, or a stored
 * document could not be mapped back to an email.
 * Callers get no partial results; retrying is their decision.
 */
public class EmailStoreException extends RuntimeException {

    public EmailStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
