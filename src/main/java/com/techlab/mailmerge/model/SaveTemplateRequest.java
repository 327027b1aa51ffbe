package com.techlab.mailmerge.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SaveTemplateRequest {
    @NotBlank(message = "Template name is required")
    private String templateName;

    @NotBlank(message = "Template content is required")
    private String templateContent;

    private String templateCss;
    private String logo;
    private String signature;
    private String serviceName;
    private String tableId;
}
