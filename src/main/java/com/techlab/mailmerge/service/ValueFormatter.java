package com.techlab.mailmerge.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Converts row values to the text substituted into documents.
 */
@Component
public class ValueFormatter {

    // 2000-01-01T00:00:00Z in seconds, and the upper bound in milliseconds
    private static final long MIN_TIMESTAMP = 946_684_800L;
    private static final long MAX_TIMESTAMP = 4_000_000_000_000L;
    private static final long MILLIS_THRESHOLD = 10_000_000_000L;

    private final boolean timestampDates;
    private final DateTimeFormatter dateFormatter;

    public ValueFormatter(@Value("${mailmerge.merge.timestamp-dates:true}") boolean timestampDates,
                          @Value("${mailmerge.merge.date-pattern:dd/MM/yyyy}") String datePattern,
                          @Value("${mailmerge.merge.zone:Europe/Paris}") String zone) {
        this.timestampDates = timestampDates;
        this.dateFormatter = DateTimeFormatter.ofPattern(datePattern).withZone(ZoneId.of(zone));
    }

    /**
     * Plain display string: null becomes empty, integral decimals lose their trailing ".0".
     */
    public String display(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isFinite(number)) {
                return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
            }
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value);
    }

    /**
     * Display string for document bodies: numbers that look like Unix timestamps are shown as
     * dates when the feature is enabled.
     */
    public String displayInDocument(Object value) {
        if (timestampDates && isTimestamp(value)) {
            return formatTimestamp((Number) value);
        }
        return display(value);
    }

    boolean isTimestamp(Object value) {
        // Boolean is not a Number, so true/false never qualify
        if (!(value instanceof Number number)) {
            return false;
        }
        double raw = number.doubleValue();
        return raw >= MIN_TIMESTAMP && raw <= MAX_TIMESTAMP;
    }

    private String formatTimestamp(Number value) {
        double raw = value.doubleValue();
        long millis = raw > MILLIS_THRESHOLD ? (long) raw : (long) (raw * 1000d);
        return dateFormatter.format(Instant.ofEpochMilli(millis));
    }
}
