package com.techlab.mailmerge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One record of the data source: column name to scalar value (string, number, boolean or null),
 * in column order. Read-only; rows from the same table may carry different key sets.
 */
@EqualsAndHashCode
@ToString
public final class Row {

    private static final Row EMPTY = new Row(Collections.emptyMap());

    private final Map<String, Object> values;

    private Row(Map<String, Object> values) {
        this.values = values;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Row of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        // LinkedHashMap keeps column order and tolerates null values
        return new Row(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static Row empty() {
        return EMPTY;
    }

    public Object get(String column) {
        return values.get(column);
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public Set<String> columns() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }
}
