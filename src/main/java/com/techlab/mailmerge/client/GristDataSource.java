package com.techlab.mailmerge.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.techlab.mailmerge.exception.DataSourceConnectionException;
import com.techlab.mailmerge.exception.ResourceNotFoundException;
import com.techlab.mailmerge.model.Row;
import com.techlab.mailmerge.model.TableRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Grist document accessed through its REST API ({@code /api/docs/{docId}/...}).
 */
@Slf4j
public class GristDataSource implements TabularDataSource {

    private static final String HELPER_COLUMN_PREFIX = "gristHelper_";
    private static final int SMALL_READ_LIMIT = 100;

    private final RestClient restClient;
    private final RestClient largeReadClient;
    private final ObjectMapper objectMapper;
    private final String docId;

    /**
     * @param restClient      client with the default read timeout
     * @param largeReadClient client with the longer read timeout used for full-table reads
     */
    public GristDataSource(RestClient restClient, RestClient largeReadClient, ObjectMapper objectMapper, String docId) {
        this.restClient = restClient;
        this.largeReadClient = largeReadClient;
        this.objectMapper = objectMapper;
        this.docId = docId;
    }

    @Override
    public List<TableRef> listTables() {
        JsonNode body = call("tables of document " + docId, () -> restClient.get()
                .uri("/api/docs/{docId}/tables", docId)
                .retrieve()
                .body(JsonNode.class));

        List<TableRef> tables = new ArrayList<>();
        for (JsonNode table : arrayField(body, "tables")) {
            tables.add(new TableRef(table.path("id").asText()));
        }
        return tables;
    }

    @Override
    public List<String> listColumns(String tableId) {
        JsonNode body = call("columns of table " + tableId, () -> restClient.get()
                .uri("/api/docs/{docId}/tables/{tableId}/columns", docId, tableId)
                .retrieve()
                .body(JsonNode.class));

        List<String> columns = new ArrayList<>();
        for (JsonNode column : arrayField(body, "columns")) {
            // columns arrive either as plain ids or as {"id": ..., "fields": {...}} objects
            String id = column.isTextual() ? column.asText() : column.path("id").asText();
            if (!id.isEmpty() && !id.startsWith(HELPER_COLUMN_PREFIX)) {
                columns.add(id);
            }
        }
        return columns;
    }

    @Override
    public List<Row> listRows(String tableId) {
        return listRows(tableId, null);
    }

    @Override
    public List<Row> listRows(String tableId, Integer limit) {
        RestClient client = limit == null || limit > SMALL_READ_LIMIT ? largeReadClient : restClient;
        JsonNode body = call("records of table " + tableId, () -> client.get()
                .uri(builder -> {
                    builder.path("/api/docs/{docId}/tables/{tableId}/records");
                    if (limit != null && limit > 0) {
                        builder.queryParam("limit", limit);
                    }
                    return builder.build(docId, tableId);
                })
                .retrieve()
                .body(JsonNode.class));

        List<Row> rows = new ArrayList<>();
        for (JsonNode record : arrayField(body, "records")) {
            rows.add(toRow(record.path("fields")));
        }
        log.debug("Fetched {} records from table {}", rows.size(), tableId);
        return rows;
    }

    @Override
    public boolean testConnection() {
        try {
            restClient.get()
                    .uri("/api/docs/{docId}", docId)
                    .retrieve()
                    .toBodilessEntity();
            log.info("Connected to Grist document {}", docId);
            return true;
        } catch (RestClientException e) {
            log.warn("Grist connection test failed for document {}: {}", docId, e.getMessage());
            return false;
        }
    }

    @SuppressWarnings("unchecked")
    private Row toRow(JsonNode fields) {
        if (fields == null || !fields.isObject()) {
            return Row.empty();
        }
        Map<String, Object> values = objectMapper.convertValue(fields, LinkedHashMap.class);
        return Row.of(values);
    }

    private static Iterable<JsonNode> arrayField(JsonNode body, String field) {
        if (body == null || !body.path(field).isArray()) {
            return List.of();
        }
        return body.path(field);
    }

    private static <T> T call(String what, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                throw new ResourceNotFoundException("Not found on data source: " + what, e);
            }
            if (e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()
                    || e.getStatusCode().value() == HttpStatus.FORBIDDEN.value()) {
                throw new DataSourceConnectionException("Data source rejected the credentials while reading " + what, e);
            }
            throw new DataSourceConnectionException("Data source error (" + e.getStatusCode().value() + ") while reading " + what, e);
        } catch (ResourceAccessException e) {
            log.warn("Timeout or I/O error while reading {}: {}", what, e.getMessage());
            throw new DataSourceConnectionException("Data source unreachable while reading " + what, e);
        }
    }
}
