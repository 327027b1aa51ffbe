package com.techlab.mailmerge.service;

import com.techlab.mailmerge.client.TabularDataSource;
import com.techlab.mailmerge.client.TabularDataSourceFactory;
import com.techlab.mailmerge.exception.DocumentGenerationException;
import com.techlab.mailmerge.exception.InvalidInputException;
import com.techlab.mailmerge.model.BatchGenerationRequest;
import com.techlab.mailmerge.model.BatchResult;
import com.techlab.mailmerge.model.FilterSpec;
import com.techlab.mailmerge.model.GeneratedDocument;
import com.techlab.mailmerge.model.PdfGenerationRequest;
import com.techlab.mailmerge.model.RenderRequest;
import com.techlab.mailmerge.model.Row;
import com.techlab.mailmerge.renderer.DocumentComposer;
import com.techlab.mailmerge.renderer.DocumentRenderer;
import com.techlab.mailmerge.renderer.RenderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for the three merge operations: HTML preview for a sample row, one PDF for one row,
 * and a ZIP of PDFs for every (optionally flagged) row of a table.
 */
@Slf4j
@Service
public class PdfGenerationService {

    static final String DEFAULT_SINGLE_PATTERN = "document";
    static final String DEFAULT_BATCH_PATTERN = "document_{index}";

    private final MergeContext mergeContext;
    private final DocumentComposer documentComposer;
    private final DocumentRenderer documentRenderer;
    private final BatchOrchestrator batchOrchestrator;
    private final TabularDataSourceFactory dataSourceFactory;
    private final RenderSlots renderSlots;
    private final String filterColumn;

    public PdfGenerationService(MergeContext mergeContext,
                                DocumentComposer documentComposer,
                                DocumentRenderer documentRenderer,
                                BatchOrchestrator batchOrchestrator,
                                TabularDataSourceFactory dataSourceFactory,
                                RenderSlots renderSlots,
                                @Value("${mailmerge.filter.column:Pdf_print}") String filterColumn) {
        this.mergeContext = mergeContext;
        this.documentComposer = documentComposer;
        this.documentRenderer = documentRenderer;
        this.batchOrchestrator = batchOrchestrator;
        this.dataSourceFactory = dataSourceFactory;
        this.renderSlots = renderSlots;
        this.filterColumn = filterColumn;
    }

    /**
     * Merged HTML for the sample row, exactly as the renderer would receive it.
     */
    public String preview(PdfGenerationRequest request) {
        requireTemplate(request.getTemplateContent());
        RenderRequest renderRequest = mergeContext.build(request.toTemplate(), request.getRecordData(),
                request.toAssets(), patternOrDefault(request.getFilenamePattern(), DEFAULT_SINGLE_PATTERN));
        return documentComposer.compose(renderRequest);
    }

    /**
     * Generate one PDF for the row in the request. The render waits for a free slot, shared with
     * running batches.
     */
    public GeneratedDocument generate(PdfGenerationRequest request) {
        requireTemplate(request.getTemplateContent());
        Row row = request.getRecordData();
        if (row == null || row.isEmpty()) {
            throw new InvalidInputException("No record data provided");
        }

        RenderRequest renderRequest = mergeContext.build(request.toTemplate(), row, request.toAssets(),
                patternOrDefault(request.getFilenamePattern(), DEFAULT_SINGLE_PATTERN));
        renderSlots.acquire();
        try {
            byte[] pdfBytes = documentRenderer.render(renderRequest);
            log.debug("Generated {}: {} bytes", renderRequest.outputFilename(), pdfBytes.length);
            return new GeneratedDocument(pdfBytes, renderRequest.outputFilename());
        } catch (RenderException e) {
            throw new DocumentGenerationException("Error generating " + renderRequest.outputFilename() + ": " + e.getMessage(), e);
        } finally {
            renderSlots.release();
        }
    }

    /**
     * Fetch every row of the table and generate one PDF per row, restricted to the rows flagged in
     * the configured filter column when the request asks for it.
     */
    public BatchResult generateBatch(BatchGenerationRequest request) {
        requireTemplate(request.getTemplateContent());
        if (request.getTableId() == null || request.getTableId().isBlank()) {
            throw new InvalidInputException("Table is required");
        }

        TabularDataSource dataSource = dataSourceFactory.connect(request.toCredentials());
        List<Row> rows = dataSource.listRows(request.getTableId());
        FilterSpec filter = request.isApplyFilter() ? FilterSpec.onColumn(filterColumn) : FilterSpec.disabled();

        log.info("Batch generation for table {}: {} rows fetched, filter {}", request.getTableId(), rows.size(),
                filter.isEnabled() ? "on " + filterColumn : "off");

        return batchOrchestrator.run(rows, request.toTemplate(), request.toAssets(),
                patternOrDefault(request.getFilenamePattern(), DEFAULT_BATCH_PATTERN), filter, documentRenderer);
    }

    private static void requireTemplate(String templateContent) {
        if (templateContent == null || templateContent.isBlank()) {
            throw new InvalidInputException("Template is empty");
        }
    }

    private static String patternOrDefault(String pattern, String defaultPattern) {
        return pattern == null || pattern.isBlank() ? defaultPattern : pattern;
    }
}
