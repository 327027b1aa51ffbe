package com.techlab.mailmerge.service;

import com.techlab.mailmerge.exception.InvalidInputException;
import com.techlab.mailmerge.model.FilterResult;
import com.techlab.mailmerge.model.FilterSpec;
import com.techlab.mailmerge.model.Row;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FilterEngineTest {

    private final FilterEngine filterEngine = new FilterEngine();

    @Test
    public void testKeepsOnlyTrueAndOne() {
        Map<String, Object> nullFlag = new HashMap<>();
        nullFlag.put("Pdf_print", null);
        nullFlag.put("id", 6);

        List<Row> rows = List.of(
                Row.of(Map.of("id", 1, "Pdf_print", true)),
                Row.of(Map.of("id", 2, "Pdf_print", false)),
                Row.of(Map.of("id", 3, "Pdf_print", "true")),
                Row.of(Map.of("id", 4, "Pdf_print", 1)),
                Row.of(Map.of("id", 5, "Pdf_print", 0)),
                Row.of(nullFlag),
                Row.of(Map.of("id", 7)),
                Row.of(Map.of("id", 8, "Pdf_print", 1.0)));

        FilterResult result = filterEngine.apply(rows, FilterSpec.onColumn("Pdf_print"));

        assertThat(result.getRows()).extracting(row -> row.get("id")).containsExactly(1, 4, 8);
        assertThat(result.getTotalCount()).isEqualTo(8);
        assertThat(result.getFilteredCount()).isEqualTo(3);
    }

    @Test
    public void testDisabledFilterKeepsEverythingInOrder() {
        List<Row> rows = List.of(Row.of(Map.of("id", 1)), Row.of(Map.of("id", 2)));

        FilterResult result = filterEngine.apply(rows, FilterSpec.disabled());

        assertThat(result.getRows()).isEqualTo(rows);
        assertThat(result.getFilteredCount()).isEqualTo(2);
    }

    @Test
    public void testEmptyInput() {
        FilterResult result = filterEngine.apply(List.of(), FilterSpec.onColumn("Pdf_print"));

        assertThat(result.getRows()).isEmpty();
        assertThat(result.getTotalCount()).isZero();
    }

    @Test
    public void testEnabledFilterRequiresColumn() {
        assertThatThrownBy(() -> filterEngine.apply(List.of(), new FilterSpec(true, " ")))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    public void testFlagValues() {
        assertThat(FilterEngine.isFlagged(new BigDecimal("1.00"))).isTrue();
        assertThat(FilterEngine.isFlagged(1L)).isTrue();
        assertThat(FilterEngine.isFlagged(2)).isFalse();
        assertThat(FilterEngine.isFlagged("1")).isFalse();
        assertThat(FilterEngine.isFlagged(null)).isFalse();
    }
}
