package com.techlab.mailmerge.service;

import com.techlab.mailmerge.client.TabularDataSource;
import com.techlab.mailmerge.client.TabularDataSourceFactory;
import com.techlab.mailmerge.model.DataSourceCredentials;
import com.techlab.mailmerge.model.FilterResult;
import com.techlab.mailmerge.model.FilterSpec;
import com.techlab.mailmerge.model.TableRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Browsing operations on the user's data source: tables, columns and (filtered) records.
 */
@Slf4j
@Service
public class DataSourceService {

    private final TabularDataSourceFactory dataSourceFactory;
    private final FilterEngine filterEngine;
    private final String filterColumn;

    public DataSourceService(TabularDataSourceFactory dataSourceFactory,
                             FilterEngine filterEngine,
                             @Value("${mailmerge.filter.column:Pdf_print}") String filterColumn) {
        this.dataSourceFactory = dataSourceFactory;
        this.filterEngine = filterEngine;
        this.filterColumn = filterColumn;
    }

    public boolean testConnection(DataSourceCredentials credentials) {
        return dataSourceFactory.connect(credentials).testConnection();
    }

    public List<TableRef> listTables(DataSourceCredentials credentials) {
        return dataSourceFactory.connect(credentials).listTables();
    }

    public List<String> listColumns(DataSourceCredentials credentials, String tableId) {
        return dataSourceFactory.connect(credentials).listColumns(tableId);
    }

    public FilterResult listRecords(DataSourceCredentials credentials, String tableId, Integer limit, boolean applyFilter) {
        TabularDataSource dataSource = dataSourceFactory.connect(credentials);
        FilterSpec filter = applyFilter ? FilterSpec.onColumn(filterColumn) : FilterSpec.disabled();
        FilterResult result = filterEngine.apply(dataSource.listRows(tableId, limit), filter);
        if (applyFilter) {
            log.info("Table {}: {}/{} records flagged in {}", tableId, result.getFilteredCount(),
                    result.getTotalCount(), filterColumn);
        }
        return result;
    }

    public String getFilterColumn() {
        return filterColumn;
    }
}
