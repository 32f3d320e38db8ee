package com.heroku.relay.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heroku.relay.model.ChangeEvent;
import com.heroku.relay.model.OperationType;
import com.heroku.relay.model.RealtimeNotification;
import com.heroku.relay.realtime.ChangeFeedChannel;
import com.heroku.relay.realtime.ChangeFeedSource;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Service that subscribes to every table of one schema on the Supabase Realtime feed,
 * drops re-delivered notifications, and hands normalized events to the broadcaster.
 */
@Service
public class RealtimeSubscriber {

    private static final Logger logger = LoggerFactory.getLogger(RealtimeSubscriber.class);

    static final String ALL = "*";

    private final ChangeFeedSource changeFeedSource;
    private final EventDeduplicationCache deduplicationCache;
    private final ChangeEventBroadcaster broadcaster;
    private final ObjectMapper objectMapper;
    private final ReconnectPolicy reconnectPolicy;
    private final Clock clock;

    @Value("${relay.upstream.enabled:true}")
    private boolean upstreamEnabled = true;

    @Value("${relay.upstream.schema:public}")
    private String schema = "public";

    private volatile ChangeFeedChannel channel;

    // Only touched from the scheduler thread
    private int failedReconnects = 0;
    private Instant nextReconnectAt;

    public RealtimeSubscriber(ChangeFeedSource changeFeedSource,
                              EventDeduplicationCache deduplicationCache,
                              ChangeEventBroadcaster broadcaster,
                              ObjectMapper objectMapper,
                              ReconnectPolicy reconnectPolicy,
                              Clock clock) {
        this.changeFeedSource = changeFeedSource;
        this.deduplicationCache = deduplicationCache;
        this.broadcaster = broadcaster;
        this.objectMapper = objectMapper;
        this.reconnectPolicy = reconnectPolicy;
        this.clock = clock;
    }

    /**
     * Connect and subscribe when the application is ready. A connection failure
     * propagates and aborts startup.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void startSubscription() {
        if (!upstreamEnabled) {
            logger.info("Upstream subscription disabled (relay.upstream.enabled=false)");
            return;
        }
        logger.info("Starting Supabase Realtime subscription for schema {} with reconnect policy {}",
                schema, reconnectPolicy);
        changeFeedSource.connect();
        subscribe();
    }

    private void subscribe() {
        channel = changeFeedSource.subscribe(schema, ALL, ALL, this::handleNotification);
        logger.info("Channel subscription requested on {}", channel.getTopic());
    }

    /**
     * Deduplicate, normalize and broadcast one raw notification. Any failure is
     * logged and confined to this notification.
     */
    public void handleNotification(JsonNode payload) {
        try {
            logger.debug("Database event received: {}", payload);
            RealtimeNotification notification = objectMapper.treeToValue(payload, RealtimeNotification.class);

            String eventId = notification.eventId();
            if (eventId != null && deduplicationCache.seen(eventId)) {
                logger.info("Skipping duplicate event with ID: {}", eventId);
                return;
            }

            ChangeEvent event = toChangeEvent(notification);
            broadcaster.broadcast(event);
        } catch (Exception e) {
            logger.error("Error handling realtime notification: {}", e.getMessage(), e);
        }
    }

    /**
     * Convert the raw payload, taking the row from "record", or from "old_record"
     * when "record" is absent or empty (deletes only carry the old row).
     */
    ChangeEvent toChangeEvent(RealtimeNotification notification) {
        RealtimeNotification.Data data = notification.data;
        if (data == null) {
            throw new IllegalArgumentException("Notification has no data section");
        }
        Map<String, Object> record = data.record;
        if (record == null || record.isEmpty()) {
            record = data.oldRecord;
        }
        return new ChangeEvent(OperationType.fromWire(data.type), data.table, data.schema, record, data.commitTimestamp);
    }

    /**
     * Periodically report whether the channel is still joined. With a reconnect
     * policy enabled, an unjoined channel is re-subscribed with back-off.
     */
    @Scheduled(fixedDelayString = "${relay.upstream.liveness-interval:10000}",
            initialDelayString = "${relay.upstream.liveness-interval:10000}")
    public void checkChannelStatus() {
        ChangeFeedChannel current = channel;
        if (!upstreamEnabled || current == null) {
            return;
        }
        try {
            if (current.isJoined()) {
                logger.debug("Channel {} is joined and listening for events", current.getTopic());
                failedReconnects = 0;
                nextReconnectAt = null;
                return;
            }
            logger.warn("Channel {} is not joined!", current.getTopic());
            if (reconnectPolicy.isEnabled()) {
                attemptReconnect();
            }
        } catch (Exception e) {
            logger.error("Error checking channel status: {}", e.getMessage(), e);
        }
    }

    private void attemptReconnect() {
        Instant now = clock.instant();
        if (nextReconnectAt != null && now.isBefore(nextReconnectAt)) {
            logger.debug("Next reconnect attempt at {}", nextReconnectAt);
            return;
        }
        failedReconnects++;
        nextReconnectAt = now.plus(reconnectPolicy.delayAfter(failedReconnects));
        logger.info("Reconnecting to Supabase Realtime (attempt {})", failedReconnects);
        try {
            changeFeedSource.disconnect();
            changeFeedSource.connect();
            subscribe();
        } catch (RuntimeException e) {
            logger.warn("Reconnect attempt {} failed, next attempt not before {}: {}",
                    failedReconnects, nextReconnectAt, e.getMessage());
        }
    }

    public boolean isChannelJoined() {
        ChangeFeedChannel current = channel;
        return current != null && current.isJoined();
    }

    @PreDestroy
    public void shutdown() {
        logger.info("Shutting down Supabase Realtime subscription...");
        changeFeedSource.disconnect();
    }
}
