package com.heroku.relay;

import com.heroku.relay.realtime.ChangeFeedSource;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
class ChangeRelayApplicationTests {

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private ChangeFeedSource changeFeedSource;

    @Test
    void contextLoadsWithoutUpstream() {
        assertThat(changeFeedSource.isConnected()).isFalse();
    }

    @Test
    void healthReportsHealthy() {
        webTestClient.get().uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("healthy")
                .jsonPath("$.version").isEqualTo("0.1.0");
    }

    @Test
    void rootDescribesTheRelay() {
        webTestClient.get().uri("/")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.upstream_enabled").isEqualTo(false)
                .jsonPath("$.channel_joined").isEqualTo(false)
                .jsonPath("$.connected_clients").isEqualTo(0)
                .jsonPath("$.endpoints['GET /sse/stream']").exists();
    }
}
