package com.heroku.relay.realtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Envelope of every frame exchanged with the Realtime server (Phoenix channels, JSON serializer v1).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PhoenixMessage {

    public static final String PHOENIX_TOPIC = "phoenix";

    public static final String JOIN = "phx_join";
    public static final String REPLY = "phx_reply";
    public static final String CLOSE = "phx_close";
    public static final String ERROR = "phx_error";
    public static final String LEAVE = "phx_leave";
    public static final String HEARTBEAT = "heartbeat";
    public static final String POSTGRES_CHANGES = "postgres_changes";
    public static final String SYSTEM = "system";

    public String topic;
    public String event;
    public JsonNode payload;
    public String ref;
    @JsonProperty("join_ref")
    public String joinRef;

    public PhoenixMessage() {
    }

    public PhoenixMessage(String topic, String event, JsonNode payload, String ref) {
        this.topic = topic;
        this.event = event;
        this.payload = payload;
        this.ref = ref;
    }

    /**
     * Reply status ("ok" or "error"), or null when this is not a reply
     */
    public String replyStatus() {
        if (payload == null || !payload.hasNonNull("status")) {
            return null;
        }
        return payload.get("status").asText();
    }
}
