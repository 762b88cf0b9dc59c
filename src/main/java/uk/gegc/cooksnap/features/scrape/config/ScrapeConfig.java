package uk.gegc.cooksnap.features.scrape.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import uk.gegc.cooksnap.shared.rate_limit.RateLimitProperties;
import uk.gegc.cooksnap.shared.rate_limit.SlidingWindowRateLimiter;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;

@Slf4j
@Configuration
public class ScrapeConfig {

    /**
     * Per-caller limiter for scrape requests. Closed with the context, which stops its sweep thread.
     */
    @Bean
    public SlidingWindowRateLimiter scrapeRateLimiter(RateLimitProperties properties, Clock clock) {
        return new SlidingWindowRateLimiter(properties, clock);
    }

    /**
     * Watchdog thread that fires fetch deadlines and cancels whatever request is still in flight.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService fetchDeadlineScheduler() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "fetch-deadline");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Pool for host lookups so request threads can stop waiting when the fetch deadline fires.
     * A full pool refuses new lookups instead of running them on the caller.
     */
    @Bean(name = "dnsLookupExecutor")
    public ThreadPoolTaskExecutor dnsLookupExecutor(LinkFetchConfig config) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getDnsLookupThreads());
        executor.setMaxPoolSize(config.getDnsLookupThreads());
        executor.setQueueCapacity(config.getDnsLookupQueueCapacity());
        executor.setThreadNamePrefix("dns-lookup-");
        executor.setDaemon(true);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();

        log.info("DNS lookup executor configured - Threads: {}, Queue: {}",
                config.getDnsLookupThreads(), config.getDnsLookupQueueCapacity());
        return executor;
    }
}
