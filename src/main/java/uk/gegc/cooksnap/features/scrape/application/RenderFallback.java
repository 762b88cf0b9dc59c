package uk.gegc.cooksnap.features.scrape.application;

import java.util.Optional;

/**
 * Headless-browser rendering of a page whose recipe only appears after client-side scripts run.
 * Implementations enforce their own timeout and report every failure as an empty result.
 */
public interface RenderFallback {

    Optional<String> render(String url);
}
