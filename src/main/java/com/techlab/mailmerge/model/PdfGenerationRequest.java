package com.techlab.mailmerge.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request model for preview and single-document generation
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PdfGenerationRequest {
    @NotBlank(message = "Template content is required")
    private String templateContent;

    private String templateCss;

    private Row recordData;

    // Optional: output filename pattern with {column} tokens
    private String filenamePattern;

    private String logo;
    private String signature;
    private String serviceName;

    public Template toTemplate() {
        return Template.of(templateContent, templateCss);
    }

    public Assets toAssets() {
        return Assets.builder().logo(logo).signature(signature).serviceName(serviceName).build();
    }
}
