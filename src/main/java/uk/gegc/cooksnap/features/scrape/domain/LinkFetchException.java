package uk.gegc.cooksnap.features.scrape.domain;

/**
 * Base exception thrown when fetching or scraping a link fails.
 * Plain instances describe a transport failure talking to the target host.
 */
public class LinkFetchException extends RuntimeException {

    private final FetchOutcome outcome;

    public LinkFetchException(String message) {
        this(FetchOutcome.UPSTREAM_ERROR, message, null);
    }

    public LinkFetchException(String message, Throwable cause) {
        this(FetchOutcome.UPSTREAM_ERROR, message, cause);
    }

    protected LinkFetchException(FetchOutcome outcome, String message, Throwable cause) {
        super(message, cause);
        this.outcome = outcome;
    }

    public FetchOutcome getOutcome() {
        return outcome;
    }
}
