package com.heroku.relay.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request models for the table store passthrough.
 * Filters are column-value equality predicates.
 */
public abstract class TableQuery {

    @JsonProperty("table_name")
    public String tableName;

    public static class Read extends TableQuery {
        public List<String> columns;
        public Map<String, Object> filters = new LinkedHashMap<>();
        public Integer limit;
        /** column name to "asc" or "desc" */
        @JsonProperty("order_by")
        public Map<String, String> orderBy = new LinkedHashMap<>();
    }

    public static class Create extends TableQuery {
        public List<Map<String, Object>> records;
    }

    public static class Update extends TableQuery {
        public Map<String, Object> updates;
        public Map<String, Object> filters;
    }

    public static class Delete extends TableQuery {
        public Map<String, Object> filters;
    }
}
