package com.heroku.relay.services;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Runs the lifecycle of one streaming client:
 * CONNECTING (register, queue the acknowledgment), STREAMING (drain the queue onto
 * the transport), CLOSED (deregister). Deregistration happens on every exit path.
 */
@Service
public class ClientStreamHandler {

    private static final Logger logger = LoggerFactory.getLogger(ClientStreamHandler.class);

    public static final String CONNECTION_ESTABLISHED =
            "{\"type\":\"test\",\"message\":\"SSE connection established\"}";

    public enum State {
        CONNECTING,
        STREAMING,
        CLOSED
    }

    private final ClientRegistry clientRegistry;

    public ClientStreamHandler(ClientRegistry clientRegistry) {
        this.clientRegistry = clientRegistry;
    }

    /**
     * Streams to the transport until the client disconnects, a write fails,
     * the connection is evicted or the calling thread is interrupted.
     * Blocks the calling thread for the lifetime of the connection.
     */
    public void stream(StreamTransport transport) {
        State state = State.CONNECTING;
        ClientConnection connection = clientRegistry.register(CONNECTION_ESTABLISHED);
        try {
            state = State.STREAMING;
            logger.info("Starting event stream for client {}", connection.getId());

            while (state == State.STREAMING) {
                if (transport.isDisconnected()) {
                    logger.info("Client {} disconnected", connection.getId());
                    state = State.CLOSED;
                    continue;
                }
                String payload = connection.take();
                if (payload == null) {
                    logger.info("Connection for client {} was closed by the server", connection.getId());
                    state = State.CLOSED;
                    continue;
                }
                // The peer may have left while we were waiting
                if (transport.isDisconnected()) {
                    logger.info("Client {} disconnected", connection.getId());
                    state = State.CLOSED;
                    continue;
                }
                transport.send(payload);
                logger.debug("Sent SSE frame to client {}", connection.getId());
            }
        } catch (InterruptedException e) {
            logger.info("Stream for client {} cancelled", connection.getId());
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            logger.warn("Write to client {} failed: {}", connection.getId(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Error in event stream for client {}: {}", connection.getId(), e.getMessage(), e);
        } finally {
            clientRegistry.deregister(connection);
            connection.close();
            transport.close();
        }
    }
}
