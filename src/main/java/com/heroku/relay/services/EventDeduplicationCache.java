package com.heroku.relay.services;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Set;

/**
 * Bounded set of recently seen upstream event ids.
 * When the set is full it is cleared in one go before the next id is recorded,
 * so a duplicate arriving right after a reset is passed through as new.
 */
@Service
public class EventDeduplicationCache {

    private static final Logger logger = LoggerFactory.getLogger(EventDeduplicationCache.class);

    private final int capacity;
    private final Set<String> recentEventIds = new HashSet<>();

    public EventDeduplicationCache(@Value("${relay.dedup.capacity:1000}") int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("relay.dedup.capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Tests and records an event id in one step.
     * @param eventId upstream identifier
     * @return true if the id was already present (the notification is a duplicate)
     */
    public synchronized boolean seen(String eventId) {
        if (recentEventIds.contains(eventId)) {
            return true;
        }
        resetIfFull();
        recentEventIds.add(eventId);
        return false;
    }

    private void resetIfFull() {
        if (recentEventIds.size() >= capacity) {
            logger.info("Event id cache reached {} entries, clearing", capacity);
            recentEventIds.clear();
        }
    }

    public synchronized int size() {
        return recentEventIds.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
