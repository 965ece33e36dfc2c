package com.questrail.courier.internal.time;

import java.time.Duration;
import java.time.Instant;

/**
 * Test clock that only moves when told to.
 */
public final class ManualWallClock implements WallClock {
    private Instant now;

    public ManualWallClock(Instant start) {
        this.now = start;
    }

    public ManualWallClock() {
        this(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Override
    public synchronized Instant now() {
        return now;
    }

    public synchronized void advance(Duration duration) {
        now = now.plus(duration);
    }
}
