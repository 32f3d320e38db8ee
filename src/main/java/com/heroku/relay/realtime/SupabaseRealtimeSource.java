package com.heroku.relay.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Change feed backed by Supabase Realtime: a Phoenix channel over a WebSocket,
 * joined with a postgres_changes filter and kept open with periodic heartbeats.
 */
public class SupabaseRealtimeSource implements ChangeFeedSource {

    private static final Logger logger = LoggerFactory.getLogger(SupabaseRealtimeSource.class);

    private final URI endpoint;
    private final String apiKey;
    private final String channelName;
    private final WebSocketClient webSocketClient;
    private final ObjectMapper objectMapper;
    private final Duration connectTimeout;
    private final Duration heartbeatInterval;

    private final AtomicLong refCounter = new AtomicLong();
    private final Map<String, RealtimeChannel> channels = new ConcurrentHashMap<>();

    private volatile Sinks.Many<String> outbound;
    private volatile Disposable connection;
    private volatile Disposable heartbeat;
    private volatile boolean connected = false;

    public SupabaseRealtimeSource(URI endpoint, String apiKey, String channelName,
                                  WebSocketClient webSocketClient, ObjectMapper objectMapper,
                                  Duration connectTimeout, Duration heartbeatInterval) {
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.channelName = channelName;
        this.webSocketClient = webSocketClient;
        this.objectMapper = objectMapper;
        this.connectTimeout = connectTimeout;
        this.heartbeatInterval = heartbeatInterval;
    }

    @Override
    public synchronized void connect() {
        if (connected) {
            return;
        }
        logger.info("Connecting to Supabase Realtime at {}://{}{}", endpoint.getScheme(), endpoint.getHost(), endpoint.getPath());

        Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
        CompletableFuture<Void> opened = new CompletableFuture<>();
        outbound = sink;

        connection = webSocketClient.execute(endpoint, session -> {
                    opened.complete(null);
                    Mono<Void> input = session.receive()
                            .map(WebSocketMessage::getPayloadAsText)
                            .doOnNext(this::handleFrame)
                            .then();
                    Mono<Void> output = session.send(sink.asFlux().map(session::textMessage));
                    return Mono.zip(input, output).then();
                })
                .doFinally(signal -> onConnectionClosed(sink))
                .subscribe(
                        unused -> { },
                        error -> {
                            if (!opened.completeExceptionally(error)) {
                                logger.error("Realtime connection failed: {}", error.getMessage(), error);
                            }
                        });

        try {
            opened.get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            connection.dispose();
            throw new ChangeFeedException("Failed to connect to Supabase Realtime: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            connection.dispose();
            throw new ChangeFeedException("Timed out after " + connectTimeout.toMillis() + "ms connecting to Supabase Realtime", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connection.dispose();
            throw new ChangeFeedException("Interrupted while connecting to Supabase Realtime", e);
        }

        connected = true;
        heartbeat = Flux.interval(heartbeatInterval, heartbeatInterval)
                .subscribe(tick -> sendHeartbeat());
        logger.info("Supabase Realtime connection established");
    }

    @Override
    public ChangeFeedChannel subscribe(String schema, String table, String event, ChangeFeedListener listener) {
        if (!connected) {
            throw new IllegalStateException("Realtime connection is not open");
        }
        String topic = "realtime:" + channelName;
        String ref = nextRef();
        RealtimeChannel channel = new RealtimeChannel(topic, ref, listener);
        channels.put(topic, channel);

        ObjectNode filter = objectMapper.createObjectNode()
                .put("event", event)
                .put("schema", schema)
                .put("table", table);
        ObjectNode config = objectMapper.createObjectNode();
        config.putObject("broadcast").put("ack", false).put("self", false);
        config.putObject("presence").put("key", "");
        ArrayNode postgresChanges = config.putArray("postgres_changes");
        postgresChanges.add(filter);
        config.put("private", false);

        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("config", config);
        payload.put("access_token", apiKey);

        PhoenixMessage join = new PhoenixMessage(topic, PhoenixMessage.JOIN, payload, ref);
        join.joinRef = ref;
        logger.info("Joining channel {} for {} events on {}.{}", topic, event, schema, table);
        send(join);
        return channel;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public synchronized void disconnect() {
        if (heartbeat != null) {
            heartbeat.dispose();
        }
        if (connection != null) {
            connection.dispose();
        }
        onConnectionClosed(outbound);
    }

    /**
     * Dispatches one inbound frame. Failures are logged and never end the connection.
     */
    void handleFrame(String text) {
        PhoenixMessage message;
        try {
            message = objectMapper.readValue(text, PhoenixMessage.class);
        } catch (JsonProcessingException e) {
            logger.warn("Ignoring malformed Realtime frame: {}", e.getOriginalMessage());
            return;
        }
        if (message.event == null) {
            logger.warn("Ignoring Realtime frame without event on topic {}", message.topic);
            return;
        }
        if (PhoenixMessage.PHOENIX_TOPIC.equals(message.topic)) {
            logger.debug("Heartbeat reply {}: {}", message.ref, message.replyStatus());
            return;
        }

        RealtimeChannel channel = message.topic == null ? null : channels.get(message.topic);
        if (channel == null) {
            logger.debug("Frame {} for unknown topic {}", message.event, message.topic);
            return;
        }

        try {
            switch (message.event) {
                case PhoenixMessage.REPLY -> channel.onReply(message);
                case PhoenixMessage.POSTGRES_CHANGES -> channel.deliver(message.payload);
                case PhoenixMessage.CLOSE -> channel.onClosed();
                case PhoenixMessage.ERROR -> channel.onError(message.payload);
                case PhoenixMessage.SYSTEM -> logger.info("Realtime system message on {}: {}", message.topic, message.payload);
                default -> logger.debug("Unhandled Realtime event {} on {}", message.event, message.topic);
            }
        } catch (RuntimeException e) {
            logger.error("Error handling Realtime {} frame: {}", message.event, e.getMessage(), e);
        }
    }

    private void sendHeartbeat() {
        try {
            send(new PhoenixMessage(PhoenixMessage.PHOENIX_TOPIC, PhoenixMessage.HEARTBEAT,
                    objectMapper.createObjectNode(), nextRef()));
        } catch (ChangeFeedException e) {
            logger.warn("Failed to send heartbeat: {}", e.getMessage());
        }
    }

    private synchronized void send(PhoenixMessage message) {
        String text;
        try {
            text = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new ChangeFeedException("Failed to encode " + message.event + " frame", e);
        }
        Sinks.Many<String> sink = outbound;
        if (sink == null) {
            throw new ChangeFeedException("Realtime connection is not open");
        }
        Sinks.EmitResult result = sink.tryEmitNext(text);
        if (result.isFailure()) {
            throw new ChangeFeedException("Failed to send " + message.event + " frame: " + result);
        }
    }

    /**
     * Tears down the state of the connection that owned the given outbound sink.
     * A late signal from a connection that has already been replaced is ignored.
     */
    private synchronized void onConnectionClosed(Sinks.Many<String> sink) {
        if (sink == null || sink != outbound) {
            return;
        }
        boolean wasConnected = connected;
        connected = false;
        sink.tryEmitComplete();
        if (heartbeat != null) {
            heartbeat.dispose();
        }
        channels.values().forEach(RealtimeChannel::onClosed);
        if (wasConnected) {
            logger.warn("Supabase Realtime connection closed");
        }
    }

    private String nextRef() {
        return Long.toString(refCounter.incrementAndGet());
    }

    /**
     * Join state of one topic, updated from server replies.
     */
    static class RealtimeChannel implements ChangeFeedChannel {

        enum State {
            JOINING,
            JOINED,
            CLOSED,
            ERRORED
        }

        private final String topic;
        private final String joinRef;
        private final ChangeFeedListener listener;
        private volatile State state = State.JOINING;

        RealtimeChannel(String topic, String joinRef, ChangeFeedListener listener) {
            this.topic = topic;
            this.joinRef = joinRef;
            this.listener = listener;
        }

        void onReply(PhoenixMessage reply) {
            if (!joinRef.equals(reply.ref)) {
                return;
            }
            if ("ok".equals(reply.replyStatus())) {
                state = State.JOINED;
                logger.info("Channel {} joined", topic);
            } else {
                state = State.ERRORED;
                logger.error("Channel {} join rejected: {}", topic, reply.payload);
            }
        }

        void deliver(JsonNode payload) {
            listener.onNotification(payload);
        }

        void onClosed() {
            state = State.CLOSED;
        }

        void onError(JsonNode payload) {
            state = State.ERRORED;
            logger.warn("Channel {} reported an error: {}", topic, payload);
        }

        State getState() {
            return state;
        }

        @Override
        public String getTopic() {
            return topic;
        }

        @Override
        public boolean isJoined() {
            return state == State.JOINED;
        }
    }
}
