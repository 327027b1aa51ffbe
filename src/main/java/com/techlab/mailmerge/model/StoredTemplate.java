package com.techlab.mailmerge.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A named template as persisted by the template store, with its assets and bound table.
 * Immutable: loaded instances are cached and shared.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StoredTemplate {
    String name;
    String templateContent;
    String templateCss;
    String logo;
    String signature;
    String serviceName;
    String tableId;
    Instant createdAt;
    Instant updatedAt;

    public Template toTemplate() {
        return Template.of(templateContent, templateCss);
    }

    public Assets toAssets() {
        return Assets.builder().logo(logo).signature(signature).serviceName(serviceName).build();
    }
}
