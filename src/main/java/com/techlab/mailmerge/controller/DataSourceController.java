package com.techlab.mailmerge.controller;

import com.techlab.mailmerge.model.DataSourceCredentials;
import com.techlab.mailmerge.model.FilterResult;
import com.techlab.mailmerge.service.DataSourceService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * REST controller browsing the remote data source. Credentials come in the body of each request.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DataSourceController {

    private final DataSourceService dataSourceService;

    @PostMapping("/test-connection")
    public ResponseEntity<Map<String, Object>> testConnection(@Valid @RequestBody DataSourceCredentials credentials) {
        boolean connected = dataSourceService.testConnection(credentials);
        log.info("Connection test for document {}: {}", credentials.getDocId(), connected ? "ok" : "failed");

        Map<String, Object> response = new HashMap<>();
        response.put("success", connected);
        response.put("message", connected ? "Connected to data source" : "Connection to data source failed");
        return ResponseEntity.status(connected ? HttpStatus.OK : HttpStatus.BAD_GATEWAY).body(response);
    }

    @PostMapping("/tables")
    public ResponseEntity<Map<String, Object>> listTables(@Valid @RequestBody DataSourceCredentials credentials) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("tables", dataSourceService.listTables(credentials));
        return ResponseEntity.ok(response);
    }

    @PostMapping("/columns/{tableId}")
    public ResponseEntity<Map<String, Object>> listColumns(@PathVariable String tableId,
                                                           @Valid @RequestBody DataSourceCredentials credentials) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("columns", dataSourceService.listColumns(credentials, tableId));
        return ResponseEntity.ok(response);
    }

    /**
     * Records of a table, restricted to flagged rows when {@code filter=true}
     *
     * POST /api/records/{tableId}?limit=10&filter=true
     */
    @PostMapping("/records/{tableId}")
    public ResponseEntity<Map<String, Object>> listRecords(@PathVariable String tableId,
                                                           @RequestParam(required = false) Integer limit,
                                                           @RequestParam(defaultValue = "false") boolean filter,
                                                           @Valid @RequestBody DataSourceCredentials credentials) {
        FilterResult result = dataSourceService.listRecords(credentials, tableId, limit, filter);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("records", result.getRows());
        response.put("count", result.getFilteredCount());
        response.put("total_count", result.getTotalCount());
        response.put("filtered", filter);
        if (filter) {
            response.put("filter_column", dataSourceService.getFilterColumn());
        }
        return ResponseEntity.ok(response);
    }

    @GetMapping("/config/filter-column")
    public ResponseEntity<Map<String, Object>> filterColumn() {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("filter_column", dataSourceService.getFilterColumn());
        return ResponseEntity.ok(response);
    }
}
