package com.heroku.relay.controllers;

import com.heroku.relay.model.InjectedMessage;
import com.heroku.relay.services.ChangeEventBroadcaster;
import com.heroku.relay.services.ClientRegistry;
import com.heroku.relay.services.ClientStreamHandler;
import com.heroku.relay.services.ServerSentEventTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Server-Sent Events endpoint streaming database changes, plus the
 * administrative endpoint that pushes a raw message to every client.
 */
@RestController
public class StreamController {

    private static final Logger logger = LoggerFactory.getLogger(StreamController.class);

    @Autowired
    private ClientStreamHandler clientStreamHandler;

    @Autowired
    private ChangeEventBroadcaster broadcaster;

    @Autowired
    private ClientRegistry clientRegistry;

    @Autowired
    @Qualifier("streamExecutor")
    private ExecutorService streamExecutor;

    /**
     * Long-lived stream; one "data:" frame per database event
     */
    @GetMapping(path = {"/sse/stream", "/stream"}, produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> stream() {
        logger.info("New client connected to SSE stream");
        ServerSentEventTransport transport = new ServerSentEventTransport(clientRegistry.getQueueCapacity());
        Future<?> handler = streamExecutor.submit(() -> clientStreamHandler.stream(transport));
        return transport.frames()
                .doFinally(signal -> {
                    transport.markDisconnected();
                    handler.cancel(true);
                });
    }

    /**
     * Send a message to all connected SSE clients
     */
    @PostMapping(path = {"/sse/messages", "/messages"})
    public ResponseEntity<Map<String, String>> postMessage(@RequestBody InjectedMessage body) {
        Map<String, String> response = new HashMap<>();
        if (body == null || body.message == null) {
            response.put("error", "message is required");
            return ResponseEntity.badRequest().body(response);
        }
        int delivered = broadcaster.broadcastRaw(body.message);
        logger.info("Injected message queued for {} clients", delivered);
        response.put("status", "sent");
        return ResponseEntity.ok(response);
    }
}
