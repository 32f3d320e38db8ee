package com.heroku.relay.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Raw postgres_changes payload pushed by Supabase Realtime
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RealtimeNotification {
    public Data data;
    public List<String> ids;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Data {
        public String type;
        public String table;
        public String schema;
        public Map<String, Object> record;
        @JsonProperty("old_record")
        public Map<String, Object> oldRecord;
        @JsonProperty("commit_timestamp")
        public String commitTimestamp;
        public List<Map<String, Object>> columns;
        public Object errors;
    }

    /**
     * First entry of "ids", used only to detect re-delivery; null when absent
     */
    public String eventId() {
        if (ids == null || ids.isEmpty()) {
            return null;
        }
        return ids.get(0);
    }
}
