package uk.gegc.cooksnap.features.scrape.application;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.cooksnap.features.scrape.domain.FetchTimeoutException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single wall-clock deadline shared by every step of one fetch. When it fires, every
 * registered cancellation runs so in-flight connects and reads are aborted rather than abandoned.
 */
@Slf4j
public final class FetchDeadline implements AutoCloseable {

    private final Clock clock;
    private final Duration timeout;
    private final Instant expiresAt;
    private final AtomicBoolean expired = new AtomicBoolean();
    private final List<Runnable> cancellations = new CopyOnWriteArrayList<>();
    private final ScheduledFuture<?> timer;

    private FetchDeadline(ScheduledExecutorService scheduler, Clock clock, Duration timeout) {
        this.clock = clock;
        this.timeout = timeout;
        this.expiresAt = clock.instant().plus(timeout);
        this.timer = scheduler.schedule(this::expire, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public static FetchDeadline start(ScheduledExecutorService scheduler, Clock clock, Duration timeout) {
        return new FetchDeadline(scheduler, clock, timeout);
    }

    /**
     * Registers an action to run on expiry; runs it immediately when the deadline has already passed.
     */
    public void onExpiry(Runnable cancellation) {
        cancellations.add(cancellation);
        if (expired.get()) {
            runQuietly(cancellation);
        }
    }

    /**
     * Time left before expiry.
     *
     * @throws FetchTimeoutException when nothing is left
     */
    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), expiresAt);
        if (expired.get() || left.isZero() || left.isNegative()) {
            expire();
            throw new FetchTimeoutException("Fetch deadline of " + timeout.toMillis() + " ms exceeded");
        }
        return left;
    }

    public boolean isExpired() {
        return expired.get();
    }

    void expire() {
        if (expired.compareAndSet(false, true)) {
            log.debug("Fetch deadline of {} ms expired, aborting {} in-flight operation(s)",
                    timeout.toMillis(), cancellations.size());
            cancellations.forEach(this::runQuietly);
        }
    }

    private void runQuietly(Runnable cancellation) {
        try {
            cancellation.run();
        } catch (RuntimeException ex) {
            log.warn("Cancellation on deadline expiry failed: {}", ex.getMessage());
        }
    }

    @Override
    public void close() {
        timer.cancel(false);
        cancellations.clear();
    }
}
