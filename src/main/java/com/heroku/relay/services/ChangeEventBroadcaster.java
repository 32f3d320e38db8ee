package com.heroku.relay.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heroku.relay.model.ChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Fans each event out to every registered client queue.
 * A client whose queue is full is evicted.
 */
@Service
public class ChangeEventBroadcaster {

    private static final Logger logger = LoggerFactory.getLogger(ChangeEventBroadcaster.class);

    private final ClientRegistry clientRegistry;
    private final ObjectMapper objectMapper;

    public ChangeEventBroadcaster(ClientRegistry clientRegistry, ObjectMapper objectMapper) {
        this.clientRegistry = clientRegistry;
        this.objectMapper = objectMapper;
    }

    /**
     * Serializes the event once and enqueues it for every connected client.
     * @return number of client queues the payload was placed on
     */
    public int broadcast(ChangeEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + event, e);
        }
        int delivered = broadcastRaw(payload);
        logger.info("Broadcast {} to {} clients", event, delivered);
        return delivered;
    }

    /**
     * Enqueues a payload as-is for every connected client.
     * @return number of client queues the payload was placed on
     */
    public int broadcastRaw(String payload) {
        int delivered = 0;
        for (ClientConnection connection : clientRegistry.snapshot()) {
            if (connection.offer(payload)) {
                delivered++;
                logger.debug("Queued payload for client {}", connection.getId());
            } else if (!connection.isClosed()) {
                evict(connection);
            }
        }
        return delivered;
    }

    private void evict(ClientConnection connection) {
        logger.warn("Queue full for client {}, disconnecting it", connection.getId());
        clientRegistry.deregister(connection);
        connection.close();
    }
}
