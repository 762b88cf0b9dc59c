package uk.gegc.cooksnap.features.scrape.domain;

/**
 * Exception thrown when fetched content exceeds the configured size limit,
 * either by its declared length or while it is being streamed.
 */
public class ContentTooLargeException extends LinkFetchException {

    private final long limitBytes;

    public ContentTooLargeException(long limitBytes) {
        super(FetchOutcome.TOO_LARGE,
                String.format("Content size exceeds limit of %d bytes", limitBytes), null);
        this.limitBytes = limitBytes;
    }

    public long getLimitBytes() {
        return limitBytes;
    }
}
