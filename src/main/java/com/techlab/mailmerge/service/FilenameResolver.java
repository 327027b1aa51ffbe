package com.techlab.mailmerge.service;

import com.techlab.mailmerge.model.Row;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Resolves output filename patterns such as {@code facture_{Nom}_{index}} into filesystem-safe
 * names (without extension). Never returns an empty string.
 */
@Component
public class FilenameResolver {

    public static final String FALLBACK_NAME = "document";
    static final int MAX_LENGTH = 200;

    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^A-Za-z0-9_-]");
    private static final Pattern PDF_EXTENSION = Pattern.compile("(?i)\\.pdf$");
    private static final String INDEX_TOKEN = "{index}";

    private final FieldResolver fieldResolver;

    public FilenameResolver(ValueFormatter valueFormatter) {
        this.fieldResolver = new FieldResolver(FieldResolver.Syntax.SINGLE_BRACE, valueFormatter::display);
    }

    public String resolve(String pattern, Row row) {
        return resolve(pattern, row, 1);
    }

    /**
     * @param rowNumber 1-based position of the row, substituted for {@code {index}} and used in
     *                  the fallback name
     */
    public String resolve(String pattern, Row row, int rowNumber) {
        String source = pattern == null || pattern.isBlank() ? FALLBACK_NAME : pattern.strip();
        source = PDF_EXTENSION.matcher(source).replaceFirst("");
        source = source.replace(INDEX_TOKEN, String.valueOf(rowNumber));

        String sanitized = UNSAFE_CHARS.matcher(fieldResolver.resolve(source, row)).replaceAll("_");
        if (sanitized.length() > MAX_LENGTH) {
            sanitized = sanitized.substring(0, MAX_LENGTH);
        }
        return sanitized.isEmpty() ? FALLBACK_NAME + "_" + rowNumber : sanitized;
    }
}
