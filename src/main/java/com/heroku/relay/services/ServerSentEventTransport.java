package com.heroku.relay.services;

import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.io.IOException;

/**
 * Bridges a blocking stream handler to a WebFlux SSE response: each payload
 * becomes one "data:" frame on the returned Flux.
 * Frames the HTTP side has not yet taken are buffered up to a fixed capacity;
 * past that, {@link #send(String)} fails and the handler drops the client.
 */
public class ServerSentEventTransport implements StreamTransport {

    private final Sinks.Many<ServerSentEvent<String>> sink;
    private volatile boolean disconnected = false;

    public ServerSentEventTransport(int bufferCapacity) {
        if (bufferCapacity < 1) {
            throw new IllegalArgumentException("bufferCapacity must be positive, got " + bufferCapacity);
        }
        this.sink = Sinks.many().unicast()
                .onBackpressureBuffer(Queues.<ServerSentEvent<String>>get(bufferCapacity).get());
    }

    public Flux<ServerSentEvent<String>> frames() {
        return sink.asFlux();
    }

    /**
     * Called when the HTTP subscriber goes away.
     */
    public void markDisconnected() {
        disconnected = true;
    }

    @Override
    public boolean isDisconnected() {
        return disconnected;
    }

    @Override
    public void send(String payload) throws IOException {
        if (disconnected) {
            throw new IOException("Client disconnected");
        }
        Sinks.EmitResult result = sink.tryEmitNext(ServerSentEvent.builder(payload).build());
        if (result.isFailure()) {
            throw new IOException("Failed to emit SSE frame: " + result);
        }
    }

    @Override
    public void close() {
        sink.tryEmitComplete();
    }
}
