package uk.gegc.cooksnap.features.scrape.domain;

/**
 * Exception thrown when the inbound request is rejected before any network access:
 * unreadable body, missing URL, malformed URL, wrong scheme or non-standard port.
 */
public class InvalidScrapeRequestException extends LinkFetchException {

    public InvalidScrapeRequestException(String message) {
        super(FetchOutcome.INVALID_INPUT, message, null);
    }

    public InvalidScrapeRequestException(String message, Throwable cause) {
        super(FetchOutcome.INVALID_INPUT, message, cause);
    }
}
