package uk.gegc.cooksnap.features.scrape.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings for the Cloudflare Browser Rendering fallback.
 * The fallback is disabled while either credential is blank.
 */
@Data
@Component
@ConfigurationProperties(prefix = "render.cloudflare")
public class CloudflareRenderProperties {

    private String accountId;

    private String apiToken;

    private String baseUrl = "https://api.cloudflare.com";

    /**
     * Timeout for one render call, enforced by the client itself.
     */
    private long timeoutMs = 45_000;

    public boolean isConfigured() {
        return accountId != null && !accountId.isBlank()
                && apiToken != null && !apiToken.isBlank();
    }
}
