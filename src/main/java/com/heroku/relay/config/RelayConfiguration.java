package com.heroku.relay.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.heroku.relay.realtime.ChangeFeedSource;
import com.heroku.relay.realtime.SupabaseRealtimeSource;
import com.heroku.relay.services.ReconnectPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class RelayConfiguration {

    @Bean
    public WebSocketClient realtimeWebSocketClient() {
        return new ReactorNettyWebSocketClient();
    }

    @Bean
    public ChangeFeedSource changeFeedSource(SupabaseClient supabaseClient,
                                             WebSocketClient realtimeWebSocketClient,
                                             ObjectMapper objectMapper,
                                             @Value("${relay.upstream.channel:any_table_events}") String channelName,
                                             @Value("${relay.upstream.connect-timeout:10000}") long connectTimeoutMs,
                                             @Value("${relay.upstream.heartbeat-interval:30000}") long heartbeatIntervalMs) {
        return new SupabaseRealtimeSource(
                supabaseClient.realtimeEndpoint(),
                supabaseClient.getServiceRoleKey(),
                channelName,
                realtimeWebSocketClient,
                objectMapper,
                Duration.ofMillis(connectTimeoutMs),
                Duration.ofMillis(heartbeatIntervalMs));
    }

    @Bean
    public ReconnectPolicy reconnectPolicy(@Value("${relay.upstream.reconnect:none}") String mode,
                                           @Value("${relay.upstream.reconnect.initial-delay:1000}") long initialDelayMs,
                                           @Value("${relay.upstream.reconnect.max-delay:60000}") long maxDelayMs) {
        return ReconnectPolicy.fromMode(mode, Duration.ofMillis(initialDelayMs), Duration.ofMillis(maxDelayMs));
    }

    /**
     * One thread per connected SSE client; each blocks on its own queue.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService streamExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("sse-client-"));
    }

    @Bean
    public RestTemplate tableStoreRestTemplate(SupabaseClient supabaseClient) {
        RestTemplate restTemplate = new RestTemplate(new JdkClientHttpRequestFactory());
        restTemplate.getInterceptors().add((request, body, execution) -> {
            request.getHeaders().set("apikey", supabaseClient.getServiceRoleKey());
            request.getHeaders().setBearerAuth(supabaseClient.getServiceRoleKey());
            return execution.execute(request, body);
        });
        return restTemplate;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
