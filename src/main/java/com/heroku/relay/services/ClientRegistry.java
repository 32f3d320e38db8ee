package com.heroku.relay.services;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide set of connected streaming clients.
 */
@Service
public class ClientRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ClientRegistry.class);

    private final int queueCapacity;
    private final ConcurrentHashMap<String, ClientConnection> connections = new ConcurrentHashMap<>();

    public ClientRegistry(@Value("${relay.client.queue-capacity:1000}") int queueCapacity) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("relay.client.queue-capacity must be positive, got " + queueCapacity);
        }
        this.queueCapacity = queueCapacity;
    }

    public ClientConnection register() {
        return register(null);
    }

    /**
     * Registers a new connection whose queue already holds the given payload,
     * so no broadcast can be queued ahead of it.
     */
    public ClientConnection register(String initialPayload) {
        ClientConnection connection = new ClientConnection(queueCapacity);
        if (initialPayload != null) {
            connection.offer(initialPayload);
        }
        connections.put(connection.getId(), connection);
        logger.info("Registered client {}, total connected clients: {}", connection.getId(), connections.size());
        return connection;
    }

    /**
     * Removes the connection if it is still registered. Removal is by identity,
     * so calling this twice never removes a different client.
     * @return true if this call removed it
     */
    public boolean deregister(ClientConnection connection) {
        boolean removed = connections.remove(connection.getId(), connection);
        if (removed) {
            logger.info("Removed client {}, remaining clients: {}", connection.getId(), connections.size());
        }
        return removed;
    }

    /**
     * Connections registered at the time of the call.
     */
    public List<ClientConnection> snapshot() {
        return new ArrayList<>(connections.values());
    }

    public boolean isRegistered(ClientConnection connection) {
        return connections.get(connection.getId()) == connection;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public int size() {
        return connections.size();
    }
}
