package com.techlab.mailmerge.controller;

import com.techlab.mailmerge.model.BatchGenerationRequest;
import com.techlab.mailmerge.model.BatchResult;
import com.techlab.mailmerge.model.GeneratedDocument;
import com.techlab.mailmerge.model.PdfGenerationRequest;
import com.techlab.mailmerge.model.RowOutcome;
import com.techlab.mailmerge.service.GenerationMetrics;
import com.techlab.mailmerge.service.PdfGenerationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST controller for document generation: preview, single PDF and batch ZIP
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DocumentController {

    static final String HEADER_GENERATED = "X-Documents-Generated";
    static final String HEADER_TOTAL = "X-Documents-Total";
    static final String HEADER_FAILED_ROWS = "X-Documents-Failed-Rows";
    static final String HEADER_PROCESSING_TIME = "X-Processing-Time-Ms";

    private static final long SLOW_GENERATION_MS = 5000;

    private final PdfGenerationService pdfGenerationService;

    private final GenerationMetrics generationMetrics;

    /**
     * Merged HTML for a sample row
     *
     * POST /api/preview
     */
    @PostMapping("/preview")
    public ResponseEntity<Map<String, Object>> preview(@Valid @RequestBody PdfGenerationRequest request) {
        String html = pdfGenerationService.preview(request);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("html", html);
        return ResponseEntity.ok(response);
    }

    /**
     * Generate one PDF for the row in the request
     *
     * POST /api/generate-pdf
     */
    @PostMapping("/generate-pdf")
    public ResponseEntity<byte[]> generatePdf(@Valid @RequestBody PdfGenerationRequest request) {
        long startTime = System.currentTimeMillis();
        GeneratedDocument document;
        try {
            document = pdfGenerationService.generate(request);
        } catch (RuntimeException e) {
            generationMetrics.recordFailure(System.currentTimeMillis() - startTime);
            throw e;
        }

        long duration = System.currentTimeMillis() - startTime;
        generationMetrics.recordSuccess(duration, 1, 0);
        logDuration(duration, document.getFilename(), document.getContent().length);

        HttpHeaders headers = attachmentHeaders(MediaType.APPLICATION_PDF, document.getFilename(), document.getContent().length);
        headers.set(HEADER_PROCESSING_TIME, String.valueOf(duration));
        return new ResponseEntity<>(document.getContent(), headers, HttpStatus.OK);
    }

    /**
     * Generate one PDF per row of a table and return them as a ZIP archive
     *
     * POST /api/generate-multiple
     */
    @PostMapping("/generate-multiple")
    public ResponseEntity<byte[]> generateMultiple(@Valid @RequestBody BatchGenerationRequest request) {
        long startTime = System.currentTimeMillis();
        BatchResult result;
        try {
            result = pdfGenerationService.generateBatch(request);
        } catch (RuntimeException e) {
            generationMetrics.recordFailure(System.currentTimeMillis() - startTime);
            throw e;
        }

        long duration = System.currentTimeMillis() - startTime;
        List<RowOutcome> failures = result.getFailures();
        generationMetrics.recordSuccess(duration, result.getSucceededCount(), failures.size());

        String zipFilename = "publipostage_" + request.getTableId() + "_" + (System.currentTimeMillis() / 1000) + ".zip";
        logDuration(duration, zipFilename, result.getArchive().length);

        HttpHeaders headers = attachmentHeaders(MediaType.parseMediaType("application/zip"), zipFilename, result.getArchive().length);
        headers.set(HEADER_GENERATED, String.valueOf(result.getSucceededCount()));
        headers.set(HEADER_TOTAL, String.valueOf(result.getFilteredCount()));
        headers.set(HEADER_PROCESSING_TIME, String.valueOf(duration));
        if (!failures.isEmpty()) {
            headers.set(HEADER_FAILED_ROWS, failures.stream()
                    .map(failure -> String.valueOf(failure.getRowIndex() + 1))
                    .collect(Collectors.joining(",")));
        }
        return new ResponseEntity<>(result.getArchive(), headers, HttpStatus.OK);
    }

    /**
     * Health check endpoint
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", "Mail merge service is running");
        return ResponseEntity.ok(response);
    }

    @GetMapping("/metrics")
    public ResponseEntity<GenerationMetrics.Snapshot> getMetrics() {
        return ResponseEntity.ok(generationMetrics.snapshot());
    }

    private static void logDuration(long duration, String filename, int size) {
        if (duration > SLOW_GENERATION_MS) {
            log.warn("Slow generation: {} ms for {}", duration, filename);
        } else {
            log.info("{} generated in {} ms, size: {} bytes", filename, duration, size);
        }
    }

    private static HttpHeaders attachmentHeaders(MediaType contentType, String filename, long length) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(contentType);
        headers.setContentDisposition(ContentDisposition.attachment().filename(filename).build());
        headers.setContentLength(length);
        headers.setAccessControlExposeHeaders(List.of(HttpHeaders.CONTENT_DISPOSITION,
                HEADER_GENERATED, HEADER_TOTAL, HEADER_FAILED_ROWS));
        return headers;
    }
}
