package com.techlab.mailmerge.service;

import com.techlab.mailmerge.model.Assets;
import com.techlab.mailmerge.model.RenderRequest;
import com.techlab.mailmerge.model.Row;
import com.techlab.mailmerge.model.Template;
import org.springframework.stereotype.Component;

/**
 * Assembles the render request for one row. Pure: the same inputs always give an equal request,
 * which keeps previews reproducible.
 *
 * <p>Values placed in the body have their '{' written as the HTML entity {@code &#123;}, so a value
 * can never form a placeholder that the composer would fill in a second time.
 */
@Component
public class MergeContext {

    static final String OPEN_BRACE_ENTITY = "&#123;";

    private final FieldResolver bodyResolver;
    private final FieldResolver cssResolver;
    private final FilenameResolver filenameResolver;

    public MergeContext(ValueFormatter valueFormatter, FilenameResolver filenameResolver) {
        this.bodyResolver = new FieldResolver(FieldResolver.Syntax.DOUBLE_BRACE,
                value -> valueFormatter.displayInDocument(value).replace("{", OPEN_BRACE_ENTITY),
                Assets.RESERVED_PLACEHOLDERS);
        // entities mean nothing inside a stylesheet
        this.cssResolver = new FieldResolver(FieldResolver.Syntax.DOUBLE_BRACE,
                valueFormatter::displayInDocument, Assets.RESERVED_PLACEHOLDERS);
        this.filenameResolver = filenameResolver;
    }

    public RenderRequest build(Template template, Row row, Assets assets, String filenamePattern) {
        return build(template, row, assets, filenamePattern, 1);
    }

    public RenderRequest build(Template template, Row row, Assets assets, String filenamePattern, int rowNumber) {
        Row source = row != null ? row : Row.empty();
        return RenderRequest.builder()
                .rowNumber(rowNumber)
                .body(bodyResolver.resolve(template.getBodyMarkup(), source))
                .css(cssResolver.resolve(template.getCss(), source))
                .row(source)
                .assets(assets != null ? assets : Assets.NONE)
                .filename(filenameResolver.resolve(filenamePattern, source, rowNumber))
                .build();
    }
}
