package uk.gegc.cooksnap.features.scrape.domain;

/**
 * Exception thrown when a host, address or redirect target fails SSRF protection checks.
 * The message names the rule that fired and is meant for logs only.
 */
public class SsrfProtectionException extends LinkFetchException {

    public SsrfProtectionException(String message) {
        super(FetchOutcome.BLOCKED, message, null);
    }

    public SsrfProtectionException(String message, Throwable cause) {
        super(FetchOutcome.BLOCKED, message, cause);
    }
}
