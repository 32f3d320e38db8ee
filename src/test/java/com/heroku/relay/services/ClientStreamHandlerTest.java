package com.heroku.relay.services;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ClientStreamHandler Tests")
class ClientStreamHandlerTest {

    private ClientRegistry registry;
    private ChangeEventBroadcaster broadcaster;
    private ClientStreamHandler handler;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        registry = new ClientRegistry(100);
        broadcaster = new ChangeEventBroadcaster(registry, Jackson2ObjectMapperBuilder.json().build());
        handler = new ClientStreamHandler(registry);
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Should send the connection acknowledgment before any event")
    void shouldAcknowledgeFirst() throws Exception {
        RecordingTransport transport = new RecordingTransport();
        executor.submit(() -> handler.stream(transport));

        assertThat(transport.nextFrame()).isEqualTo(ClientStreamHandler.CONNECTION_ESTABLISHED);
        assertThat(registry.size()).isEqualTo(1);

        broadcaster.broadcastRaw("{\"type\":\"INSERT\"}");
        assertThat(transport.nextFrame()).isEqualTo("{\"type\":\"INSERT\"}");
    }

    @Test
    @DisplayName("Should stop writing and deregister once the client disconnects")
    void shouldDeregisterOnDisconnect() throws Exception {
        RecordingTransport leaving = new RecordingTransport();
        RecordingTransport staying = new RecordingTransport();
        Future<?> leavingHandler = executor.submit(() -> handler.stream(leaving));
        executor.submit(() -> handler.stream(staying));
        leaving.nextFrame();
        staying.nextFrame();
        assertThat(registry.size()).isEqualTo(2);

        // When
        leaving.disconnected = true;
        broadcaster.broadcastRaw("wake-up");
        leavingHandler.get(5, TimeUnit.SECONDS);

        // Then
        assertThat(leaving.frames).isEmpty();
        assertThat(leaving.closed).isTrue();
        assertThat(registry.size()).isEqualTo(1);

        int delivered = broadcaster.broadcastRaw("after-disconnect");
        assertThat(delivered).isEqualTo(1);
        assertThat(staying.nextFrame()).isEqualTo("wake-up");
        assertThat(staying.nextFrame()).isEqualTo("after-disconnect");
        assertThat(leaving.frames).isEmpty();
    }

    @Test
    @DisplayName("Should deregister when a write fails")
    void shouldDeregisterOnWriteError() throws Exception {
        RecordingTransport transport = new RecordingTransport();
        transport.failure = new IOException("broken pipe");

        Future<?> task = executor.submit(() -> handler.stream(transport));
        task.get(5, TimeUnit.SECONDS);

        assertThat(registry.size()).isZero();
        assertThat(transport.closed).isTrue();
    }

    @Test
    @DisplayName("Should deregister when the handler task is cancelled")
    void shouldDeregisterOnCancellation() throws Exception {
        RecordingTransport transport = new RecordingTransport();
        Future<?> task = executor.submit(() -> handler.stream(transport));
        transport.nextFrame();
        assertThat(registry.size()).isEqualTo(1);

        task.cancel(true);

        awaitClosed(transport);
        assertThat(registry.size()).isZero();
    }

    @Test
    @DisplayName("Should end the stream when the server evicts the connection")
    void shouldEndWhenEvicted() throws Exception {
        RecordingTransport transport = new RecordingTransport();
        Future<?> task = executor.submit(() -> handler.stream(transport));
        transport.nextFrame();

        ClientConnection connection = registry.snapshot().get(0);
        registry.deregister(connection);
        connection.close();

        task.get(5, TimeUnit.SECONDS);
        assertThat(transport.closed).isTrue();
        assertThat(registry.size()).isZero();
    }

    @Test
    @DisplayName("Should send the acknowledgment first even when a broadcast races registration")
    void shouldAcknowledgeFirstWhenBroadcastRacesRegistration() throws Exception {
        ChangeEventBroadcaster[] concurrent = new ChangeEventBroadcaster[1];
        ClientRegistry racingRegistry = new ClientRegistry(100) {
            @Override
            public ClientConnection register(String initialPayload) {
                ClientConnection connection = super.register(initialPayload);
                // An upstream event arriving right after the connection became visible
                concurrent[0].broadcastRaw("{\"type\":\"INSERT\"}");
                return connection;
            }
        };
        concurrent[0] = new ChangeEventBroadcaster(racingRegistry, Jackson2ObjectMapperBuilder.json().build());
        RecordingTransport transport = new RecordingTransport();
        executor.submit(() -> new ClientStreamHandler(racingRegistry).stream(transport));

        assertThat(transport.nextFrame()).isEqualTo(ClientStreamHandler.CONNECTION_ESTABLISHED);
        assertThat(transport.nextFrame()).isEqualTo("{\"type\":\"INSERT\"}");
    }

    @Test
    @DisplayName("Should drop a client whose SSE response stops taking frames")
    void shouldDropClientWhenResponseStalls() throws Exception {
        // Nobody subscribes to frames(), as with a peer that stopped reading
        ServerSentEventTransport stalled = new ServerSentEventTransport(2);
        Future<?> task = executor.submit(() -> handler.stream(stalled));
        awaitRegistered(1);

        for (int i = 0; i < 50 && !task.isDone(); i++) {
            broadcaster.broadcastRaw("{\"type\":\"INSERT\",\"n\":" + i + "}");
        }

        task.get(5, TimeUnit.SECONDS);
        assertThat(registry.size()).isZero();
    }

    private void awaitRegistered(int expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (registry.size() < expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(registry.size()).isEqualTo(expected);
    }

    private static void awaitClosed(RecordingTransport transport) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!transport.closed && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(transport.closed).isTrue();
    }

    static class RecordingTransport implements StreamTransport {
        final BlockingQueue<String> frames = new LinkedBlockingQueue<>();
        volatile boolean disconnected = false;
        volatile boolean closed = false;
        volatile IOException failure;

        @Override
        public boolean isDisconnected() {
            return disconnected;
        }

        @Override
        public void send(String payload) throws IOException {
            if (failure != null) {
                throw failure;
            }
            frames.add(payload);
        }

        @Override
        public void close() {
            closed = true;
        }

        String nextFrame() throws InterruptedException {
            String frame = frames.poll(5, TimeUnit.SECONDS);
            assertThat(frame).as("frame within 5s").isNotNull();
            return frame;
        }
    }
}
