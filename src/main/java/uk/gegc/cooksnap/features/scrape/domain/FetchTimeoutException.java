package uk.gegc.cooksnap.features.scrape.domain;

/**
 * Exception thrown when the overall fetch deadline expires, whether during DNS,
 * connect, any redirect hop or the body read.
 */
public class FetchTimeoutException extends LinkFetchException {

    public FetchTimeoutException(String message) {
        super(FetchOutcome.TIMED_OUT, message, null);
    }

    public FetchTimeoutException(String message, Throwable cause) {
        super(FetchOutcome.TIMED_OUT, message, cause);
    }
}
