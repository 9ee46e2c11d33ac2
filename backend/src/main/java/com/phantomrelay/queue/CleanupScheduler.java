package com.phantomrelay.queue;

import java.time.Clock;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

/**
 * Periodically evicts queued messages older than the retention window.
 * Only ever touches the {@link OfflineQueue}; accounts and live connections
 * are left alone.
 */
public class CleanupScheduler {

    private static final Logger logger = LoggerFactory.getLogger(CleanupScheduler.class);

    private final OfflineQueue offlineQueue;
    private final Clock clock;
    private final Duration retention;
    private final Duration interval;
    private final Scheduler timer;

    private Disposable ticks;

    public CleanupScheduler(OfflineQueue offlineQueue, Clock clock, Duration retention, Duration interval,
                            Scheduler timer) {
        this.offlineQueue = offlineQueue;
        this.clock = clock;
        this.retention = retention;
        this.interval = interval;
        this.timer = timer;
    }

    public synchronized void start() {
        if (ticks != null && !ticks.isDisposed()) {
            return;
        }
        ticks = Flux.interval(interval, interval, timer)
                .subscribe(tick -> runSweep());
        logger.info("Offline queue cleanup every {} (retention {})", interval, retention);
    }

    public synchronized void stop() {
        if (ticks != null) {
            ticks.dispose();
            ticks = null;
        }
    }

    public synchronized boolean isRunning() {
        return ticks != null && !ticks.isDisposed();
    }

    /**
     * One eviction pass at the current clock time.
     *
     * @return the number of messages evicted
     */
    public int sweep() {
        int evicted = offlineQueue.evictOlderThan(clock.millis(), retention);
        logger.debug("Evicted {} expired message(s)", evicted);
        logger.info("Cleanup complete. Queued messages: {}", offlineQueue.size());
        return evicted;
    }

    // a failed pass must not end the interval subscription
    private void runSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            logger.error("Offline queue cleanup failed", e);
        }
    }
}
