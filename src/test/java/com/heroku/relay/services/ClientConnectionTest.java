package com.heroku.relay.services;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ClientConnection Tests")
class ClientConnectionTest {

    @Test
    @DisplayName("Should hand out payloads in the order they were queued")
    void shouldBeFifo() throws Exception {
        ClientConnection connection = new ClientConnection(10);
        connection.offer("first");
        connection.offer("second");

        assertThat(connection.take()).isEqualTo("first");
        assertThat(connection.take()).isEqualTo("second");
    }

    @Test
    @DisplayName("Should refuse payloads once the queue is full")
    void shouldRefuseWhenFull() {
        ClientConnection connection = new ClientConnection(2);

        assertThat(connection.offer("1")).isTrue();
        assertThat(connection.offer("2")).isTrue();
        assertThat(connection.offer("3")).isFalse();
        assertThat(connection.pendingCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should release a blocked reader when closed")
    void shouldReleaseBlockedReaderOnClose() throws Exception {
        ClientConnection connection = new ClientConnection(5);
        CompletableFuture<String> reader = CompletableFuture.supplyAsync(() -> {
            try {
                return connection.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return "interrupted";
            }
        });

        connection.close();

        assertThat(reader.get(5, TimeUnit.SECONDS)).isNull();
        assertThat(connection.isClosed()).isTrue();
        assertThat(connection.offer("late")).isFalse();
    }

    @Test
    @DisplayName("Should drop pending payloads when closed")
    void shouldDropPendingOnClose() throws Exception {
        ClientConnection connection = new ClientConnection(5);
        connection.offer("pending");

        connection.close();

        assertThat(connection.take()).isNull();
        assertThat(connection.pendingCount()).isZero();
    }
}
