package com.techlab.mailmerge.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Credentials for the remote tabular data source, supplied with every request.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DataSourceCredentials {
    @ToString.Exclude
    @NotBlank(message = "API key is required")
    private String apiKey;

    @NotBlank(message = "Document id is required")
    private String docId;
}
