package com.heroku.relay.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SupabaseClient Tests")
class SupabaseClientTest {

    @Test
    @DisplayName("Should derive the Realtime WebSocket endpoint from the project URL")
    void shouldBuildRealtimeEndpoint() {
        SupabaseClient client = new SupabaseClient("https://abc.supabase.co/", "secret-key");
        client.validateCredentials();

        URI endpoint = client.realtimeEndpoint();

        assertThat(endpoint.toString())
                .isEqualTo("wss://abc.supabase.co/realtime/v1/websocket?apikey=secret-key&vsn=1.0.0");
        assertThat(client.restUrl()).isEqualTo("https://abc.supabase.co/rest/v1");
    }

    @Test
    @DisplayName("Should use a plain WebSocket for a local http project")
    void shouldUseWsForHttp() {
        SupabaseClient client = new SupabaseClient("http://localhost:54321", "local-key");
        client.validateCredentials();

        URI endpoint = client.realtimeEndpoint();

        assertThat(endpoint.getScheme()).isEqualTo("ws");
        assertThat(endpoint.getPort()).isEqualTo(54321);
        assertThat(endpoint.getPath()).isEqualTo("/realtime/v1/websocket");
    }

    @Test
    @DisplayName("Should refuse to start without credentials")
    void shouldRequireCredentials() {
        assertThatThrownBy(() -> new SupabaseClient("https://abc.supabase.co", null).validateCredentials())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("SUPABASE_SERVICE_ROLE_KEY");
        assertThatThrownBy(() -> new SupabaseClient(" ", "key").validateCredentials())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("SUPABASE_PROJECT_URL");
    }

    @Test
    @DisplayName("Should reject a project URL that is not http(s)")
    void shouldRejectBadScheme() {
        assertThatThrownBy(() -> new SupabaseClient("ftp://abc.supabase.co", "key").validateCredentials())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("http(s)");
    }
}
