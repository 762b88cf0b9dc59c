package uk.gegc.cooksnap.features.scrape.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for outbound link fetching with security controls.
 * Provides SSRF protection and hard limits for every scrape request.
 */
@Configuration
@ConfigurationProperties(prefix = "scrape.fetch")
@Data
public class LinkFetchConfig {

    /**
     * Wall-clock budget for the whole fetch: DNS, connect, every redirect hop and the body read.
     * Default: 15000 ms
     */
    private long timeoutMs = 15_000;

    /**
     * Maximum content size in bytes.
     * Default: 5242880 bytes (5 MB)
     */
    private long maxContentSizeBytes = 5_242_880;

    /**
     * Maximum number of redirects to follow.
     * Default: 5
     */
    private int maxRedirects = 5;

    /**
     * Maximum accepted length of the submitted URL.
     */
    private int maxUrlLength = 2048;

    /**
     * User agent string for HTTP requests.
     */
    private String userAgent = "Mozilla/5.0 (compatible; CookSnap/1.0; +https://cooksnap.app)";

    /**
     * Accept header sent to the target host.
     */
    private String accept = "text/html,application/xhtml+xml";

    /**
     * Threads available for DNS lookups. Lookups beyond threads plus queue are refused.
     */
    private int dnsLookupThreads = 16;

    private int dnsLookupQueueCapacity = 64;
}
