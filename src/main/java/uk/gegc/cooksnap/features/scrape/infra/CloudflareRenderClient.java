package uk.gegc.cooksnap.features.scrape.infra;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import uk.gegc.cooksnap.features.scrape.application.RenderFallback;
import uk.gegc.cooksnap.features.scrape.config.CloudflareRenderProperties;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Renders JavaScript-heavy pages through Cloudflare Browser Rendering.
 * <p>
 * Returns empty when credentials are missing or the call fails in any way; failures are
 * logged and never propagate into the scrape flow.
 */
@Slf4j
@Component
public class CloudflareRenderClient implements RenderFallback {

    static final String CONTENT_PATH = "/client/v4/accounts/{accountId}/browser-rendering/content";

    private final CloudflareRenderProperties properties;
    private final RestClient restClient;

    public CloudflareRenderClient(CloudflareRenderProperties properties, RestClient.Builder restClientBuilder) {
        this.properties = properties;

        Duration timeout = Duration.ofMillis(properties.getTimeoutMs());
        HttpComponentsClientHttpRequestFactory requestFactory = new HttpComponentsClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);

        this.restClient = restClientBuilder
                .baseUrl(properties.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }

    @Override
    public Optional<String> render(String url) {
        if (!properties.isConfigured()) {
            log.debug("Browser rendering not configured, skipping fallback for {}", url);
            return Optional.empty();
        }

        Map<String, Object> request = Map.of(
                "url", url,
                "rejectResourceTypes", List.of("image", "stylesheet"),
                "gotoOptions", Map.of("waitUntil", "networkidle2"));

        try {
            RenderResponse response = restClient.post()
                    .uri(CONTENT_PATH, properties.getAccountId())
                    .headers(headers -> headers.setBearerAuth(properties.getApiToken()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(RenderResponse.class);

            if (response == null || response.result() == null || response.result().isBlank()) {
                log.warn("Browser rendering returned no content for {}", url);
                return Optional.empty();
            }
            log.info("Browser rendering produced {} chars for {}", response.result().length(), url);
            return Optional.of(response.result());
        } catch (RestClientException e) {
            log.error("Browser rendering failed for {}: {}", url, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("Unexpected browser rendering error for {}", url, e);
            return Optional.empty();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RenderResponse(Boolean success, String result) {
    }
}
