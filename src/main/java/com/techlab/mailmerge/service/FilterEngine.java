package com.techlab.mailmerge.service;

import com.techlab.mailmerge.exception.InvalidInputException;
import com.techlab.mailmerge.model.FilterResult;
import com.techlab.mailmerge.model.FilterSpec;
import com.techlab.mailmerge.model.Row;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Narrows a table's rows to the ones flagged for printing.
 *
 * <p>A row is flagged only when the filter column holds boolean {@code true} or the number
 * {@code 1}. The string "true", 0, false and a missing column all exclude the row: boolean columns
 * reach us either as JSON booleans or as 0/1 depending on the source.
 */
@Component
public class FilterEngine {

    public FilterResult apply(List<Row> rows, FilterSpec spec) {
        List<Row> source = rows != null ? rows : List.of();
        if (spec == null || !spec.isEnabled()) {
            return new FilterResult(List.copyOf(source), source.size(), source.size());
        }
        if (spec.getColumnName() == null || spec.getColumnName().isBlank()) {
            throw new InvalidInputException("Filter column is required when the filter is enabled");
        }

        List<Row> filtered = new ArrayList<>();
        for (Row row : source) {
            if (isFlagged(row.get(spec.getColumnName()))) {
                filtered.add(row);
            }
        }
        return new FilterResult(List.copyOf(filtered), source.size(), filtered.size());
    }

    static boolean isFlagged(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.compareTo(BigDecimal.ONE) == 0;
        }
        if (value instanceof Number number) {
            return number.doubleValue() == 1d;
        }
        return false;
    }
}
