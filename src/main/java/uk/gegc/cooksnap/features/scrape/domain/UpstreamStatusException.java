package uk.gegc.cooksnap.features.scrape.domain;

/**
 * Exception thrown when the target host answers with a non-success status.
 */
public class UpstreamStatusException extends LinkFetchException {

    private final int status;

    public UpstreamStatusException(int status) {
        super(FetchOutcome.UPSTREAM_ERROR, "HTTP error code: " + status, null);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
