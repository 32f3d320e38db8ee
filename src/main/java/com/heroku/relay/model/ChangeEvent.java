package com.heroku.relay.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized, deduplicated representation of one row-level database change.
 * Serialized to SSE clients as {type, table, schema, record, timestamp}.
 */
@JsonPropertyOrder({"type", "table", "schema", "record", "timestamp"})
public final class ChangeEvent {

    private final OperationType operationType;
    private final String tableName;
    private final String schemaName;
    private final Map<String, Object> record;
    // Commit timestamp exactly as the upstream sent it
    private final String committedAt;

    public ChangeEvent(OperationType operationType, String tableName, String schemaName,
                       Map<String, Object> record, String committedAt) {
        this.operationType = Objects.requireNonNull(operationType, "operationType");
        this.tableName = Objects.requireNonNull(tableName, "tableName");
        this.schemaName = Objects.requireNonNull(schemaName, "schemaName");
        this.record = record == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(record));
        this.committedAt = committedAt;
    }

    @JsonProperty("type")
    public OperationType getOperationType() {
        return operationType;
    }

    @JsonProperty("table")
    public String getTableName() {
        return tableName;
    }

    @JsonProperty("schema")
    public String getSchemaName() {
        return schemaName;
    }

    @JsonProperty("record")
    public Map<String, Object> getRecord() {
        return record;
    }

    @JsonProperty("timestamp")
    public String getCommittedAt() {
        return committedAt;
    }

    @Override
    public String toString() {
        return "ChangeEvent{" + operationType + " " + schemaName + "." + tableName + " at " + committedAt + "}";
    }
}
