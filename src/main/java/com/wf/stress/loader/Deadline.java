package com.wf.stress.loader;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock end of a run: start time plus configured duration.
 * Every thread evaluates it independently.
 */
public final class Deadline {

    private final Clock clock;
    private final Instant start;
    private final Instant end;

    private Deadline(Clock clock, Instant start, Duration duration) {
        this.clock = clock;
        this.start = start;
        this.end = start.plus(duration);
    }

    public static Deadline start(Clock clock, Duration duration) {
        return new Deadline(clock, clock.instant(), duration);
    }

    public boolean hasPassed() {
        return !clock.instant().isBefore(end);
    }

    public double elapsedSeconds() {
        return Duration.between(start, clock.instant()).toMillis() / 1000.0;
    }

}
