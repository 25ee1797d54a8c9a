package com.clientsync.testutil;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Clock that moves forward by a fixed step every time it is read.
 */
public class TickingClock extends Clock {

    private final AtomicReference<Instant> current;
    private final Duration step;

    public TickingClock(Instant start, Duration step) {
        this.current = new AtomicReference<>(start);
        this.step = step;
    }

    public void advance(Duration duration) {
        current.updateAndGet(instant -> instant.plus(duration));
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        return current.getAndUpdate(instant -> instant.plus(step));
    }
}
