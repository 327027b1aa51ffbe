package com.techlab.mailmerge.service;

import com.techlab.mailmerge.model.Row;

import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes row values into placeholder tokens.
 *
 * <p>The text is scanned once: substituted values are never re-examined, so a value that itself
 * looks like a placeholder is copied as-is. Placeholders with no matching column, and reserved
 * names, are left verbatim.
 */
public class FieldResolver {

    public enum Syntax {
        /** {@code {{name}}}, used in document bodies and stylesheets. */
        DOUBLE_BRACE("\\{\\{([^{}]+)\\}\\}"),
        /** {@code {name}}, used in filename patterns. */
        SINGLE_BRACE("\\{([^{}]+)\\}");

        private final Pattern pattern;

        Syntax(String regex) {
            this.pattern = Pattern.compile(regex);
        }
    }

    private final Pattern pattern;
    private final Function<Object, String> display;
    private final Set<String> reservedNames;

    public FieldResolver(Syntax syntax, Function<Object, String> display, Set<String> reservedNames) {
        this.pattern = syntax.pattern;
        this.display = display;
        this.reservedNames = Set.copyOf(reservedNames);
    }

    public FieldResolver(Syntax syntax, Function<Object, String> display) {
        this(syntax, display, Set.of());
    }

    public String resolve(String text, Row row) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        if (row == null || row.isEmpty()) {
            return text;
        }

        Matcher matcher = pattern.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = row.has(name) && !reservedNames.contains(name)
                    ? display.apply(row.get(name))
                    : matcher.group();
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
