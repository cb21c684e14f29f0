package com.trainrelay.runtime;

import java.time.Duration;
import java.util.Objects;

public record BackoffPolicy(Duration initialDelay, Duration maxDelay, Duration ceiling) {
    public BackoffPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        Objects.requireNonNull(ceiling, "ceiling");
        if (initialDelay.isNegative() || maxDelay.isNegative() || ceiling.isNegative()) {
            throw new IllegalArgumentException("backoff durations must be >= 0");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
    }

    public static BackoffPolicy ofMillis(long initialDelayMs, long maxDelayMs, long ceilingMs) {
        return new BackoffPolicy(Duration.ofMillis(initialDelayMs), Duration.ofMillis(maxDelayMs), Duration.ofMillis(ceilingMs));
    }

    public Duration next(Duration current) {
        Duration doubled = current.isZero() ? initialDelay : current.multipliedBy(2);
        return doubled.compareTo(maxDelay) > 0 ? maxDelay : doubled;
    }

    public Duration boundedDelay(Duration current, Duration elapsed) {
        Duration remaining = ceiling.minus(elapsed);
        if (remaining.isNegative()) {
            return Duration.ZERO;
        }
        return current.compareTo(remaining) > 0 ? remaining : current;
    }

    public boolean exhausted(Duration elapsed) {
        return elapsed.compareTo(ceiling) >= 0;
    }
}
