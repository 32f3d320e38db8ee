package com.heroku.relay.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Supabase project credentials shared by the realtime relay and the table store.
 */
@Component
public class SupabaseClient {

    private static final Logger logger = LoggerFactory.getLogger(SupabaseClient.class);

    static final String REALTIME_PATH = "/realtime/v1/websocket";
    static final String REST_PATH = "/rest/v1";
    static final String PROTOCOL_VERSION = "1.0.0";

    @Value("${SUPABASE_PROJECT_URL:#{null}}")
    private String projectUrl;

    @Value("${SUPABASE_SERVICE_ROLE_KEY:#{null}}")
    private String serviceRoleKey;

    public SupabaseClient() {
    }

    public SupabaseClient(String projectUrl, String serviceRoleKey) {
        this.projectUrl = projectUrl;
        this.serviceRoleKey = serviceRoleKey;
    }

    @PostConstruct
    public void validateCredentials() {
        if (projectUrl == null || projectUrl.isBlank() || serviceRoleKey == null || serviceRoleKey.isBlank()) {
            throw new IllegalStateException(
                    "Missing required environment variables. Please set SUPABASE_PROJECT_URL and SUPABASE_SERVICE_ROLE_KEY");
        }
        URI uri;
        try {
            uri = URI.create(projectUrl.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("SUPABASE_PROJECT_URL is not a valid URL: " + projectUrl, e);
        }
        boolean httpScheme = "https".equalsIgnoreCase(uri.getScheme()) || "http".equalsIgnoreCase(uri.getScheme());
        if (!httpScheme || uri.getHost() == null) {
            throw new IllegalStateException("SUPABASE_PROJECT_URL must be an http(s) URL, got: " + projectUrl);
        }
        projectUrl = projectUrl.trim().replaceAll("/+$", "");
        logger.info("Using Supabase project {}", uri.getHost());
    }

    /**
     * WebSocket endpoint of the Realtime service, authenticated with the service key
     */
    public URI realtimeEndpoint() {
        String scheme = projectUrl.startsWith("https") ? "wss" : "ws";
        return UriComponentsBuilder.fromHttpUrl(projectUrl)
                .scheme(scheme)
                .path(REALTIME_PATH)
                .queryParam("apikey", serviceRoleKey)
                .queryParam("vsn", PROTOCOL_VERSION)
                .build()
                .encode()
                .toUri();
    }

    /**
     * Base URL of the PostgREST API
     */
    public String restUrl() {
        return projectUrl + REST_PATH;
    }

    public String getProjectUrl() {
        return projectUrl;
    }

    public String getServiceRoleKey() {
        return serviceRoleKey;
    }
}
