package com.techlab.mailmerge.client;

import com.techlab.mailmerge.model.Row;
import com.techlab.mailmerge.model.TableRef;

import java.util.List;

/**
 * Remote source of tabular data. Every call may fail with
 * {@link com.techlab.mailmerge.exception.DataSourceConnectionException} or
 * {@link com.techlab.mailmerge.exception.ResourceNotFoundException}; neither is retried.
 */
public interface TabularDataSource {

    List<TableRef> listTables();

    /** Column names, normalized to plain strings. */
    List<String> listColumns(String tableId);

    List<Row> listRows(String tableId);

    /** @param limit maximum number of rows, {@code null} for all */
    List<Row> listRows(String tableId, Integer limit);

    /** Checks that the source is reachable with the current credentials. Never throws. */
    boolean testConnection();
}
