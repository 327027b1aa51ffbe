package com.techlab.mailmerge.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request model for batch generation over every (optionally filtered) row of a table
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BatchGenerationRequest {
    @NotBlank(message = "Template content is required")
    private String templateContent;

    private String templateCss;

    @NotBlank(message = "Table is required")
    private String tableId;

    private String filenamePattern;

    private String logo;
    private String signature;
    private String serviceName;

    private boolean applyFilter;

    @NotBlank(message = "API key is required")
    private String apiKey;

    @NotBlank(message = "Document id is required")
    private String docId;

    public Template toTemplate() {
        return Template.of(templateContent, templateCss);
    }

    public Assets toAssets() {
        return Assets.builder().logo(logo).signature(signature).serviceName(serviceName).build();
    }

    public DataSourceCredentials toCredentials() {
        return new DataSourceCredentials(apiKey, docId);
    }
}
