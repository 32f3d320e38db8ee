package com.heroku.relay.controllers;

import com.heroku.relay.services.ClientRegistry;
import com.heroku.relay.services.RealtimeSubscriber;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Minimal health and monitoring endpoints for Heroku deployment
 * The relay itself runs off the Realtime subscription, not these endpoints
 */
@RestController
public class HealthController {

    @Autowired
    private RealtimeSubscriber realtimeSubscriber;

    @Autowired
    private ClientRegistry clientRegistry;

    @Value("${relay.server.name:supabase-change-relay}")
    private String serverName;

    @Value("${relay.server.version:0.1.0}")
    private String serverVersion;

    @Value("${relay.upstream.enabled:true}")
    private boolean upstreamEnabled;

    /**
     * Health check endpoint for Heroku and monitoring
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        Map<String, String> status = new HashMap<>();
        status.put("status", "healthy");
        status.put("version", serverVersion);
        return ResponseEntity.ok(status);
    }

    /**
     * Display application information
     */
    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> info() {
        Map<String, Object> info = new HashMap<>();
        info.put("name", serverName);
        info.put("version", serverVersion);
        info.put("description", "Relays Supabase database changes to Server-Sent Events clients");
        info.put("architecture", "Supabase Realtime → dedup → fan-out → per-client queue → SSE");
        info.put("upstream_enabled", upstreamEnabled);
        info.put("channel_joined", realtimeSubscriber.isChannelJoined());
        info.put("connected_clients", clientRegistry.size());

        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("GET /health", "Health check");
        endpoints.put("GET /sse/stream", "Server-Sent Events stream of database changes");
        endpoints.put("POST /sse/messages", "Send a message to every connected stream client");
        endpoints.put("POST /api/tables/read", "Read rows from a table");
        endpoints.put("POST /api/tables/create", "Insert records into a table");
        endpoints.put("POST /api/tables/update", "Update records matching filters");
        endpoints.put("POST /api/tables/delete", "Delete records matching filters");
        info.put("endpoints", endpoints);

        return ResponseEntity.ok(info);
    }
}
