package com.heroku.relay.services;

import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * One streaming client: an id and its FIFO queue of serialized payloads.
 */
public class ClientConnection {

    // Identity-compared marker that wakes a blocked reader after eviction
    private static final String CLOSED_MARKER = new String("closed");

    private final String id;
    private final BlockingQueue<String> queue;
    private volatile boolean closed = false;

    public ClientConnection(int queueCapacity) {
        this.id = UUID.randomUUID().toString();
        this.queue = new LinkedBlockingQueue<>(queueCapacity);
    }

    /**
     * Enqueues without blocking.
     * @return false if the connection is closed or its queue is full
     */
    public boolean offer(String payload) {
        if (closed) {
            return false;
        }
        return queue.offer(payload);
    }

    /**
     * Blocks until the next payload is available.
     * @return the payload, or null once the connection has been closed
     */
    public String take() throws InterruptedException {
        if (closed) {
            return null;
        }
        String payload = queue.take();
        if (payload == CLOSED_MARKER || closed) {
            return null;
        }
        return payload;
    }

    /**
     * Drops pending payloads and releases a reader blocked in {@link #take()}.
     */
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        queue.clear();
        queue.offer(CLOSED_MARKER);
    }

    public boolean isClosed() {
        return closed;
    }

    public int pendingCount() {
        return closed ? 0 : queue.size();
    }

    public String getId() {
        return id;
    }

    @Override
    public String toString() {
        return "ClientConnection{" + id + "}";
    }
}
