package com.clientsync.source;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps at least {@code minInterval} between consecutive permits, across all callers.
 * Waiting is a timer on the given scheduler, never a blocked thread.
 */
@Slf4j
public class SpacingRateLimiter implements SourceRateLimiter {

    private final long intervalMillis;
    private final Scheduler scheduler;
    private final AtomicLong nextSlot = new AtomicLong(Long.MIN_VALUE);

    public SpacingRateLimiter(Duration minInterval, Scheduler scheduler) {
        this.intervalMillis = Math.max(0, minInterval.toMillis());
        this.scheduler = scheduler;
    }

    @Override
    public Mono<Void> acquire() {
        return Mono.defer(() -> {
            long wait = reserve();
            if (wait <= 0) {
                return Mono.empty();
            }
            log.trace("Waiting {}ms for source rate limit", wait);
            return Mono.delay(Duration.ofMillis(wait), scheduler).then();
        });
    }

    private long reserve() {
        while (true) {
            long now = scheduler.now(TimeUnit.MILLISECONDS);
            long next = nextSlot.get();
            long slot = Math.max(now, next);
            if (nextSlot.compareAndSet(next, slot + intervalMillis)) {
                return slot - now;
            }
        }
    }
}
