package uk.gegc.cooksnap.shared.rate_limit;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "scrape.rate-limit")
public class RateLimitProperties {

    /**
     * Requests admitted per caller inside one window.
     */
    @Min(1)
    private int maxRequests = 10;

    /**
     * Length of the trailing window in milliseconds. Also the Retry-After hint.
     */
    @Min(1000)
    private long windowMs = 60_000;

    /**
     * How often idle callers are swept from memory.
     */
    @Min(1000)
    private long sweepIntervalMs = 60_000;
}
