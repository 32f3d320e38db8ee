package com.heroku.relay.services;

import java.time.Duration;

/**
 * What the subscriber does when the upstream channel is found not joined.
 */
public interface ReconnectPolicy {

    /**
     * @return false to only report the unjoined channel
     */
    boolean isEnabled();

    /**
     * Wait before the next attempt, given how many attempts have failed so far.
     */
    Duration delayAfter(int failedAttempts);

    static ReconnectPolicy none() {
        return new ReconnectPolicy() {
            @Override
            public boolean isEnabled() {
                return false;
            }

            @Override
            public Duration delayAfter(int failedAttempts) {
                return Duration.ZERO;
            }

            @Override
            public String toString() {
                return "none";
            }
        };
    }

    static ReconnectPolicy backoff(Duration initialDelay, Duration maxDelay) {
        return new BackoffReconnectPolicy(initialDelay, maxDelay);
    }

    /**
     * @param mode "none" or "backoff"
     * @throws IllegalArgumentException for any other mode
     */
    static ReconnectPolicy fromMode(String mode, Duration initialDelay, Duration maxDelay) {
        String normalized = mode == null ? "none" : mode.trim().toLowerCase();
        switch (normalized) {
            case "none":
                return none();
            case "backoff":
                return backoff(initialDelay, maxDelay);
            default:
                throw new IllegalArgumentException("Unknown relay.upstream.reconnect mode: " + mode);
        }
    }
}
