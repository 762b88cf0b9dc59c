package uk.gegc.cooksnap.shared.exception;

/**
 * Thrown when a caller has used up its request allowance for the current window.
 * The retry hint is reported to clients as a {@code Retry-After} header.
 */
public class RateLimitExceededException extends RuntimeException {

    public static final String DEFAULT_MESSAGE = "Too many requests. Please wait a moment and try again.";

    private final long retryAfterSeconds;

    public RateLimitExceededException(long retryAfterSeconds) {
        super(DEFAULT_MESSAGE);
        this.retryAfterSeconds = Math.max(1, retryAfterSeconds);
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
