package uk.gegc.cooksnap.features.scrape.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.stereotype.Service;
import uk.gegc.cooksnap.features.scrape.api.dto.ScrapeRequest;
import uk.gegc.cooksnap.features.scrape.application.BoundedBodyReader;
import uk.gegc.cooksnap.features.scrape.application.FetchDeadline;
import uk.gegc.cooksnap.features.scrape.application.LinkFetchService;
import uk.gegc.cooksnap.features.scrape.application.RecipeExtractionStrategy;
import uk.gegc.cooksnap.features.scrape.application.ScrapeService;
import uk.gegc.cooksnap.features.scrape.application.TargetUrlParser;
import uk.gegc.cooksnap.features.scrape.application.TargetUrlPolicy;
import uk.gegc.cooksnap.features.scrape.application.UpstreamResponse;
import uk.gegc.cooksnap.features.scrape.config.LinkFetchConfig;
import uk.gegc.cooksnap.features.scrape.domain.FetchOutcome;
import uk.gegc.cooksnap.features.scrape.domain.FetchTimeoutException;
import uk.gegc.cooksnap.features.scrape.domain.InvalidScrapeRequestException;
import uk.gegc.cooksnap.features.scrape.domain.LinkFetchException;
import uk.gegc.cooksnap.features.scrape.domain.NotHtmlContentException;
import uk.gegc.cooksnap.features.scrape.domain.RecipeNotFoundException;
import uk.gegc.cooksnap.features.scrape.domain.UpstreamStatusException;
import uk.gegc.cooksnap.features.scrape.domain.model.ScrapedRecipe;
import uk.gegc.cooksnap.shared.exception.RateLimitExceededException;
import uk.gegc.cooksnap.shared.rate_limit.SlidingWindowRateLimiter;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Entry point of the scrape pipeline. Steps run in a fixed order and the first failure wins:
 * caller identity, rate limit, request body, URL rules, guarded fetch, upstream status,
 * content type, capped body read, extraction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScrapeServiceImpl implements ScrapeService {

    static final String METRIC_NAME = "scrape.requests";

    private final SlidingWindowRateLimiter rateLimiter;
    private final LinkFetchService linkFetchService;
    private final BoundedBodyReader bodyReader;
    private final RecipeExtractionStrategy extractionStrategy;
    private final LinkFetchConfig config;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final ScheduledExecutorService fetchDeadlineScheduler;

    @Override
    public ScrapedRecipe scrape(String callerId, String requestBody) {
        try {
            ScrapedRecipe recipe = doScrape(callerId, requestBody);
            recordOutcome(FetchOutcome.SUCCESS);
            return recipe;
        } catch (LinkFetchException ex) {
            recordOutcome(ex.getOutcome());
            throw ex;
        } catch (RateLimitExceededException ex) {
            recordOutcome(FetchOutcome.RATE_LIMITED);
            throw ex;
        } catch (AuthenticationCredentialsNotFoundException ex) {
            recordOutcome(FetchOutcome.UNAUTHENTICATED);
            throw ex;
        } catch (RuntimeException ex) {
            recordOutcome(FetchOutcome.FAILED);
            throw ex;
        }
    }

    private ScrapedRecipe doScrape(String callerId, String requestBody) {
        if (callerId == null || callerId.isBlank()) {
            throw new AuthenticationCredentialsNotFoundException("Authentication required.");
        }
        if (!rateLimiter.admit(callerId)) {
            throw new RateLimitExceededException(rateLimiter.getRetryAfterSeconds());
        }

        ScrapeRequest request = parseRequest(requestBody);
        URI targetUri = parseAndValidateUrl(request.url());
        log.info("Caller {} scraping {}", callerId, targetUri);

        String html;
        try (FetchDeadline deadline = FetchDeadline.start(
                fetchDeadlineScheduler, clock, Duration.ofMillis(config.getTimeoutMs()))) {
            html = fetchHtml(targetUri, deadline);
        }

        String sourceUrl = targetUri.toString();
        ScrapedRecipe recipe = extractionStrategy.extractRecipe(html, sourceUrl)
                .orElseThrow(() -> new RecipeNotFoundException(sourceUrl));
        log.info("Scraped recipe '{}' from {} ({} ingredients, {} steps)",
                recipe.title(), targetUri, recipe.ingredients().size(), recipe.instructions().size());
        return recipe;
    }

    private ScrapeRequest parseRequest(String requestBody) {
        if (requestBody == null || requestBody.isBlank()) {
            throw new InvalidScrapeRequestException("Invalid request body.");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(requestBody);
        } catch (JsonProcessingException ex) {
            throw new InvalidScrapeRequestException("Invalid request body.", ex);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidScrapeRequestException("Invalid request body.");
        }
        JsonNode url = root.get("url");
        if (url == null || !url.isTextual() || url.asText().isBlank()) {
            throw new InvalidScrapeRequestException("URL is required");
        }
        return new ScrapeRequest(url.asText());
    }

    private URI parseAndValidateUrl(String url) {
        if (url.length() > config.getMaxUrlLength()) {
            throw new InvalidScrapeRequestException(
                    "URL exceeds maximum length of " + config.getMaxUrlLength() + " characters");
        }
        URI uri;
        try {
            uri = TargetUrlParser.parse(url).normalize();
        } catch (URISyntaxException ex) {
            throw new InvalidScrapeRequestException("Invalid URL. Please enter a valid web address.", ex);
        }
        String violation = TargetUrlPolicy.findViolation(uri);
        if (violation != null) {
            throw new InvalidScrapeRequestException(violation);
        }
        return uri;
    }

    private String fetchHtml(URI targetUri, FetchDeadline deadline) {
        try (UpstreamResponse response = linkFetchService.fetch(targetUri, deadline)) {
            int status = response.status();
            if (status < 200 || status >= 300) {
                throw new UpstreamStatusException(status);
            }

            String contentType = response.contentType().orElse("");
            if (!isHtml(contentType)) {
                throw new NotHtmlContentException(contentType);
            }

            byte[] body = bodyReader.readCapped(response, config.getMaxContentSizeBytes());
            return BoundedBodyReader.decode(body, contentType);
        } catch (IOException ex) {
            if (deadline.isExpired() || ex instanceof InterruptedIOException) {
                throw new FetchTimeoutException("Timed out fetching " + targetUri, ex);
            }
            throw new LinkFetchException("Failed to fetch URL: " + ex.getMessage(), ex);
        }
    }

    private boolean isHtml(String contentType) {
        String normalized = contentType.toLowerCase(Locale.ROOT);
        return normalized.contains("text/html") || normalized.contains("application/xhtml+xml");
    }

    private void recordOutcome(FetchOutcome outcome) {
        meterRegistry.counter(METRIC_NAME, "outcome", outcome.name().toLowerCase(Locale.ROOT)).increment();
    }
}
