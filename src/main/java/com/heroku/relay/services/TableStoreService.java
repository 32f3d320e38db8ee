package com.heroku.relay.services;

import com.heroku.relay.config.SupabaseClient;
import com.heroku.relay.model.TableQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Passthrough CRUD operations on Supabase tables via PostgREST.
 * Filters are column equality predicates only.
 */
@Service
public class TableStoreService {

    private static final Logger logger = LoggerFactory.getLogger(TableStoreService.class);

    private static final ParameterizedTypeReference<List<Map<String, Object>>> ROWS =
            new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final SupabaseClient supabaseClient;

    public TableStoreService(RestTemplate tableStoreRestTemplate, SupabaseClient supabaseClient) {
        this.restTemplate = tableStoreRestTemplate;
        this.supabaseClient = supabaseClient;
    }

    /**
     * Read rows, optionally restricted to some columns, filtered, ordered and limited
     */
    public List<Map<String, Object>> readRows(TableQuery.Read query) {
        UriComponentsBuilder uri = tableUri(query);
        List<String> columns = query.columns;
        uri.queryParam("select", columns == null || columns.isEmpty() ? "*" : String.join(",", columns));
        applyFilters(uri, query.filters);
        if (query.orderBy != null && !query.orderBy.isEmpty()) {
            StringBuilder order = new StringBuilder();
            for (Map.Entry<String, String> entry : query.orderBy.entrySet()) {
                if (order.length() > 0) {
                    order.append(',');
                }
                String direction = "asc".equalsIgnoreCase(entry.getValue()) ? "asc" : "desc";
                order.append(entry.getKey()).append('.').append(direction);
            }
            uri.queryParam("order", order);
        }
        if (query.limit != null) {
            if (query.limit < 0) {
                throw new IllegalArgumentException("limit must not be negative");
            }
            uri.queryParam("limit", query.limit);
        }
        return exchange("read", query.tableName, HttpMethod.GET, uri, null);
    }

    public List<Map<String, Object>> createRecords(TableQuery.Create query) {
        if (query.records == null || query.records.isEmpty()) {
            throw new IllegalArgumentException("records must contain at least one record");
        }
        return exchange("create", query.tableName, HttpMethod.POST, tableUri(query), query.records);
    }

    public List<Map<String, Object>> updateRecords(TableQuery.Update query) {
        if (query.updates == null || query.updates.isEmpty()) {
            throw new IllegalArgumentException("updates must name at least one column");
        }
        requireFilters(query.filters);
        UriComponentsBuilder uri = tableUri(query);
        applyFilters(uri, query.filters);
        return exchange("update", query.tableName, HttpMethod.PATCH, uri, query.updates);
    }

    public List<Map<String, Object>> deleteRecords(TableQuery.Delete query) {
        requireFilters(query.filters);
        UriComponentsBuilder uri = tableUri(query);
        applyFilters(uri, query.filters);
        return exchange("delete", query.tableName, HttpMethod.DELETE, uri, null);
    }

    private UriComponentsBuilder tableUri(TableQuery query) {
        if (query.tableName == null || query.tableName.isBlank()) {
            throw new IllegalArgumentException("table_name is required");
        }
        return UriComponentsBuilder.fromHttpUrl(supabaseClient.restUrl()).pathSegment(query.tableName);
    }

    // Update and delete without filters would touch the whole table
    private void requireFilters(Map<String, Object> filters) {
        if (filters == null || filters.isEmpty()) {
            throw new IllegalArgumentException("filters are required for update and delete");
        }
    }

    private void applyFilters(UriComponentsBuilder uri, Map<String, Object> filters) {
        if (filters == null) {
            return;
        }
        for (Map.Entry<String, Object> filter : filters.entrySet()) {
            Object value = filter.getValue();
            uri.queryParam(filter.getKey(), value == null ? "is.null" : "eq." + value);
        }
    }

    private List<Map<String, Object>> exchange(String operation, String table, HttpMethod method,
                                               UriComponentsBuilder uriBuilder, Object body) {
        URI uri = uriBuilder.build().encode().toUri();
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (method != HttpMethod.GET) {
            headers.set("Prefer", "return=representation");
        }
        logger.info("Table store {} on {}", operation, table);
        try {
            ResponseEntity<List<Map<String, Object>>> response =
                    restTemplate.exchange(uri, method, new HttpEntity<>(body, headers), ROWS);
            List<Map<String, Object>> rows = response.getBody();
            return rows == null ? Collections.emptyList() : rows;
        } catch (RestClientException e) {
            logger.error("Table store {} on {} failed: {}", operation, table, e.getMessage());
            throw new TableStoreException("Failed to " + operation + " rows in " + table + ": " + e.getMessage(), e);
        }
    }
}
