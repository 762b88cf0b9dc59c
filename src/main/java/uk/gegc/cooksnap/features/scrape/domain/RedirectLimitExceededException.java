package uk.gegc.cooksnap.features.scrape.domain;

public class RedirectLimitExceededException extends SsrfProtectionException {

    public RedirectLimitExceededException(int maxRedirects) {
        super("Too many redirects (max: " + maxRedirects + ")");
    }
}
