package uk.gegc.cooksnap.features.scrape.domain;

/**
 * Terminal outcome of a single scrape request. Exactly one is reached per request.
 */
public enum FetchOutcome {
    SUCCESS,
    UNAUTHENTICATED,
    RATE_LIMITED,
    INVALID_INPUT,
    BLOCKED,
    UPSTREAM_ERROR,
    NOT_HTML,
    TOO_LARGE,
    TIMED_OUT,
    NOT_FOUND,
    FAILED
}
