package com.heroku.relay.services;

import java.time.Duration;

/**
 * Doubles the delay after every failed attempt, capped at a maximum.
 */
public class BackoffReconnectPolicy implements ReconnectPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;

    public BackoffReconnectPolicy(Duration initialDelay, Duration maxDelay) {
        if (initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("Initial reconnect delay must be positive");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("Maximum reconnect delay must not be below the initial delay");
        }
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public Duration delayAfter(int failedAttempts) {
        if (failedAttempts <= 0) {
            return Duration.ZERO;
        }
        Duration delay = initialDelay;
        for (int i = 1; i < failedAttempts; i++) {
            delay = delay.multipliedBy(2);
            if (delay.compareTo(maxDelay) >= 0) {
                return maxDelay;
            }
        }
        return delay;
    }

    @Override
    public String toString() {
        return "backoff(" + initialDelay.toMillis() + "ms.." + maxDelay.toMillis() + "ms)";
    }
}
