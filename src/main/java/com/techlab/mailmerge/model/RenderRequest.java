package com.techlab.mailmerge.model;

import lombok.Builder;
import lombok.Value;

/**
 * Unit of work for the renderer: the template already resolved against one row.
 * Built fresh per row and never modified afterwards.
 */
@Value
@Builder
public class RenderRequest {

    /** 1-based position of the row in the merged sequence. */
    int rowNumber;

    String body;
    String css;
    Row row;
    Assets assets;

    /** Sanitized filename, without extension. */
    String filename;

    public String outputFilename() {
        return filename + ".pdf";
    }
}
