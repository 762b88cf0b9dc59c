package uk.gegc.cooksnap.shared.rate_limit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory sliding-window limiter keyed by caller.
 * <p>
 * Each caller keeps the timestamps of its admitted requests inside the trailing window. Admission
 * prunes expired timestamps, compares the remainder against the quota and records the new request
 * in one atomic step per caller. A sweep owned by this instance drops callers whose window has
 * emptied, so memory tracks active callers only.
 * <p>
 * Best effort and single process: nothing is shared between instances and all state is lost on
 * restart. Do not rely on it for strict quota enforcement across a cluster.
 */
@Slf4j
public class SlidingWindowRateLimiter implements AutoCloseable {

    private final Map<String, Deque<Long>> windows = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int maxRequests;
    private final long windowMs;
    private final ScheduledExecutorService sweeper;

    public SlidingWindowRateLimiter(RateLimitProperties properties, Clock clock) {
        this.clock = clock;
        this.maxRequests = properties.getMaxRequests();
        this.windowMs = properties.getWindowMs();
        this.sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "rate-limit-sweep");
            thread.setDaemon(true);
            return thread;
        });
        long interval = properties.getSweepIntervalMs();
        sweeper.scheduleAtFixedRate(this::sweep, interval, interval, TimeUnit.MILLISECONDS);
    }

    /**
     * Admits the request and counts it toward the caller's window, or refuses it without counting.
     */
    public boolean admit(String callerId) {
        long now = clock.millis();
        AtomicBoolean admitted = new AtomicBoolean(false);
        windows.compute(callerId, (key, window) -> {
            Deque<Long> timestamps = window != null ? window : new ArrayDeque<>();
            prune(timestamps, now);
            if (timestamps.size() >= maxRequests) {
                return timestamps;
            }
            timestamps.addLast(now);
            admitted.set(true);
            return timestamps;
        });
        if (!admitted.get()) {
            log.debug("Rate limit reached for caller {}", callerId);
        }
        return admitted.get();
    }

    /**
     * Retry hint handed to refused callers. Fixed at the window length.
     */
    public long getRetryAfterSeconds() {
        return TimeUnit.MILLISECONDS.toSeconds(windowMs);
    }

    /**
     * Drops every caller whose window has fully expired.
     */
    public void sweep() {
        try {
            long now = clock.millis();
            int before = windows.size();
            for (String callerId : windows.keySet()) {
                windows.computeIfPresent(callerId, (key, timestamps) -> {
                    prune(timestamps, now);
                    return timestamps.isEmpty() ? null : timestamps;
                });
            }
            int removed = before - windows.size();
            if (removed > 0) {
                log.debug("Rate limit sweep removed {} idle caller(s), {} tracked", removed, windows.size());
            }
        } catch (RuntimeException ex) {
            log.error("Rate limit sweep failed", ex);
        }
    }

    public int trackedCallers() {
        return windows.size();
    }

    private void prune(Deque<Long> timestamps, long now) {
        while (!timestamps.isEmpty() && now - timestamps.peekFirst() >= windowMs) {
            timestamps.pollFirst();
        }
    }

    @Override
    public void close() {
        sweeper.shutdownNow();
    }
}
