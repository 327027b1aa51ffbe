package com.techlab.mailmerge.service;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

public class ValueFormatterTest {

    private final ValueFormatter formatter = new ValueFormatter(true, "dd/MM/yyyy", "Europe/Paris");

    @Test
    public void testDisplay() {
        assertThat(formatter.display(null)).isEmpty();
        assertThat(formatter.display(42.0)).isEqualTo("42");
        assertThat(formatter.display(3.5)).isEqualTo("3.5");
        assertThat(formatter.display(new BigDecimal("10.500"))).isEqualTo("10.5");
        assertThat(formatter.display(true)).isEqualTo("true");
        assertThat(formatter.display("texte")).isEqualTo("texte");
    }

    @Test
    public void testTimestampsAreShownAsDatesInDocuments() {
        // 2024-01-15T12:00:00Z
        assertThat(formatter.displayInDocument(1_705_320_000L)).isEqualTo("15/01/2024");
        assertThat(formatter.displayInDocument(1_705_320_000_000L)).isEqualTo("15/01/2024");
        assertThat(formatter.displayInDocument(1_705_320_000.0)).isEqualTo("15/01/2024");
    }

    @Test
    public void testSmallNumbersAndBooleansAreNotTimestamps() {
        assertThat(formatter.displayInDocument(1500)).isEqualTo("1500");
        assertThat(formatter.displayInDocument(true)).isEqualTo("true");
        assertThat(formatter.isTimestamp("1705320000")).isFalse();
    }

    @Test
    public void testTimestampFormattingCanBeDisabled() {
        ValueFormatter raw = new ValueFormatter(false, "dd/MM/yyyy", "Europe/Paris");

        assertThat(raw.displayInDocument(1_705_320_000L)).isEqualTo("1705320000");
    }
}
