package uk.gegc.cooksnap.features.scrape.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import uk.gegc.cooksnap.features.scrape.config.LinkFetchConfig;
import uk.gegc.cooksnap.features.scrape.domain.RedirectLimitExceededException;
import uk.gegc.cooksnap.features.scrape.domain.SsrfProtectionException;
import uk.gegc.cooksnap.features.scrape.domain.model.ResolvedHost;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Optional;

/**
 * Fetches a URL with SSRF protection, following redirects by hand.
 * <p>
 * Transport-level redirect handling is off. Every hop, the first one included, has its host
 * resolved and validated by {@link HostGuard} before a connection is opened, and the validated
 * addresses are the only ones the transport may dial. Redirect targets must also keep an
 * http(s) scheme and a standard port. All hops share one {@link FetchDeadline}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LinkFetchService {

    private final LinkFetchConfig config;
    private final HostGuard hostGuard;
    private final HopTransport transport;

    /**
     * Follows the redirect chain from {@code initialUri} and returns the first non-redirect response.
     * The caller owns the returned response and must close it.
     *
     * @throws SsrfProtectionException         when any hop targets a blocked host, scheme or port
     * @throws RedirectLimitExceededException  when the chain is longer than the configured maximum
     * @throws uk.gegc.cooksnap.features.scrape.domain.FetchTimeoutException when the deadline expires
     * @throws IOException                     on transport failure
     */
    public UpstreamResponse fetch(URI initialUri, FetchDeadline deadline) throws IOException {
        URI currentUri = initialUri;

        for (int hop = 0; hop <= config.getMaxRedirects(); hop++) {
            deadline.remaining();
            ResolvedHost resolvedHost = hostGuard.guard(currentUri.getHost(), deadline);

            UpstreamResponse response = transport.send(currentUri, resolvedHost, deadline);
            Optional<String> location = response.header(HttpHeaders.LOCATION)
                    .filter(value -> !value.isBlank());
            if (!isRedirect(response.status()) || location.isEmpty()) {
                log.debug("Fetched {} with status {} after {} redirect(s)", currentUri, response.status(), hop);
                return response;
            }

            URI redirectUri;
            try {
                redirectUri = resolveRedirect(currentUri, location.get());
            } finally {
                response.close();
            }

            log.debug("Redirect {} -> {} ({}/{})", currentUri, redirectUri, hop + 1, config.getMaxRedirects());
            currentUri = redirectUri;
        }

        throw new RedirectLimitExceededException(config.getMaxRedirects());
    }

    private boolean isRedirect(int status) {
        return status >= 300 && status < 400;
    }

    private URI resolveRedirect(URI baseUri, String locationHeader) {
        URI redirectUri;
        try {
            URI locationUri = TargetUrlParser.parse(locationHeader);
            if (!locationUri.isAbsolute()) {
                URI base = baseUri.getRawPath() == null || baseUri.getRawPath().isEmpty()
                        ? baseUri.resolve("/")
                        : baseUri;
                locationUri = base.resolve(locationUri);
            }
            redirectUri = locationUri.normalize();
        } catch (URISyntaxException | IllegalArgumentException ex) {
            throw new SsrfProtectionException("Invalid redirect URL: " + locationHeader, ex);
        }

        String violation = TargetUrlPolicy.findViolation(redirectUri);
        if (violation != null) {
            throw new SsrfProtectionException("Redirect to " + redirectUri + " rejected: " + violation);
        }
        return redirectUri;
    }
}
