package dev.ebullient.rpgdm.model;

import java.time.Instant;

/**
 * Inclusive time window. A null bound is open.
 */
public record TimeRange(Instant from, Instant to) {

    public TimeRange {
        if (from != null && to != null && to.isBefore(from)) {
            throw new IllegalArgumentException("Time range ends before it starts: " + from + " > " + to);
        }
    }

    public static TimeRange since(Instant from) {
        return new TimeRange(from, null);
    }

    public static TimeRange until(Instant to) {
        return new TimeRange(null, to);
    }

    public boolean contains(Instant instant) {
        return (from == null || !instant.isBefore(from))
                && (to == null || !instant.isAfter(to));
    }
}
