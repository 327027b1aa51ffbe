package com.techlab.mailmerge.model;

import lombok.Value;

/**
 * Batch row filter. When enabled, only rows whose {@code columnName} value is exactly boolean
 * {@code true} or numeric {@code 1} are kept.
 */
@Value
public class FilterSpec {
    boolean enabled;
    String columnName;

    public static FilterSpec disabled() {
        return new FilterSpec(false, null);
    }

    public static FilterSpec onColumn(String columnName) {
        return new FilterSpec(true, columnName);
    }
}
