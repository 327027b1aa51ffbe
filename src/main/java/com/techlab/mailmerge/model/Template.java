package com.techlab.mailmerge.model;

import lombok.Value;

/**
 * Rich-text template: body markup with {{field}} placeholders plus its stylesheet.
 * Two templates are equal when markup and css are equal.
 */
@Value
public class Template {
    String bodyMarkup;
    String css;

    public static Template of(String bodyMarkup, String css) {
        return new Template(bodyMarkup != null ? bodyMarkup : "", css != null ? css : "");
    }
}
