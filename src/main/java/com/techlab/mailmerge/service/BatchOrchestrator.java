package com.techlab.mailmerge.service;

import com.techlab.mailmerge.exception.AllRowsFailedException;
import com.techlab.mailmerge.exception.NoRowsException;
import com.techlab.mailmerge.model.Assets;
import com.techlab.mailmerge.model.BatchResult;
import com.techlab.mailmerge.model.FilterResult;
import com.techlab.mailmerge.model.FilterSpec;
import com.techlab.mailmerge.model.RenderRequest;
import com.techlab.mailmerge.model.Row;
import com.techlab.mailmerge.model.RowOutcome;
import com.techlab.mailmerge.model.Template;
import com.techlab.mailmerge.renderer.DocumentRenderer;
import com.techlab.mailmerge.renderer.RenderException;
import com.techlab.mailmerge.renderer.RenderTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Runs a mail merge over many rows: filter, render every row on the worker pool, keep the
 * outcomes in row order and pack the successes into one archive.
 *
 * <p>Every render holds one of the shared {@link RenderSlots}, so batches and single documents
 * together never exceed the worker count. A failed row is recorded and the remaining rows are
 * still rendered.
 */
@Slf4j
@Service
public class BatchOrchestrator {

    private final FilterEngine filterEngine;
    private final MergeContext mergeContext;
    private final ArchivePackager archivePackager;
    private final Executor renderExecutor;
    private final RenderSlots renderSlots;
    private final long renderTimeoutMs;

    public BatchOrchestrator(FilterEngine filterEngine,
                             MergeContext mergeContext,
                             ArchivePackager archivePackager,
                             @Qualifier("renderExecutor") Executor renderExecutor,
                             RenderSlots renderSlots,
                             @Value("${mailmerge.render.timeout-ms:30000}") long renderTimeoutMs) {
        this.filterEngine = filterEngine;
        this.mergeContext = mergeContext;
        this.archivePackager = archivePackager;
        this.renderExecutor = renderExecutor;
        this.renderSlots = renderSlots;
        this.renderTimeoutMs = renderTimeoutMs;
    }

    public BatchResult run(List<Row> rows,
                           Template template,
                           Assets assets,
                           String filenamePattern,
                           FilterSpec filter,
                           DocumentRenderer renderer) {
        FilterResult selection = filterEngine.apply(rows, filter);
        if (selection.getRows().isEmpty()) {
            throw new NoRowsException(filter != null && filter.isEnabled()
                    ? "No row found with " + filter.getColumnName() + " = true"
                    : "No row found");
        }
        log.info("Batch generation: {}/{} rows selected", selection.getFilteredCount(), selection.getTotalCount());

        long startTime = System.currentTimeMillis();
        List<CompletableFuture<RowOutcome>> pending = new ArrayList<>(selection.getRows().size());
        for (int index = 0; index < selection.getRows().size(); index++) {
            pending.add(submit(index, selection.getRows().get(index), template, assets, filenamePattern, renderer));
        }

        // each future is already mapped to an outcome, join never throws
        List<RowOutcome> outcomes = pending.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());

        List<RowOutcome> failures = outcomes.stream()
                .filter(outcome -> !outcome.isSuccess())
                .collect(Collectors.toList());
        int succeeded = outcomes.size() - failures.size();
        log.info("Batch generation finished in {} ms: {}/{} documents generated",
                System.currentTimeMillis() - startTime, succeeded, outcomes.size());

        if (succeeded == 0) {
            throw new AllRowsFailedException(failures);
        }
        return new BatchResult(List.copyOf(outcomes), selection.getTotalCount(), archivePackager.pack(outcomes));
    }

    private CompletableFuture<RowOutcome> submit(int index,
                                                 Row row,
                                                 Template template,
                                                 Assets assets,
                                                 String filenamePattern,
                                                 DocumentRenderer renderer) {
        RenderRequest request;
        try {
            request = mergeContext.build(template, row, assets, filenamePattern, index + 1);
        } catch (RuntimeException e) {
            log.warn("Row {} could not be merged: {}", index + 1, e.getMessage());
            return CompletableFuture.completedFuture(RowOutcome.failure(index, null, describe(e)));
        }

        renderSlots.acquire();
        CompletableFuture<byte[]> render;
        try {
            render = CompletableFuture.supplyAsync(() -> renderRow(renderer, request), renderExecutor);
        } catch (RuntimeException e) {
            renderSlots.release();
            throw e;
        }
        // the slot is held until the render really ends, even when the row already timed out
        render.whenComplete((content, error) -> renderSlots.release());

        CompletableFuture<byte[]> timed = render.copy();
        CompletableFuture.delayedExecutor(renderTimeoutMs, TimeUnit.MILLISECONDS).execute(() ->
                timed.completeExceptionally(new RenderTimeoutException("Render timed out after " + renderTimeoutMs + " ms")));

        return timed.handle((content, error) -> {
                    if (error == null) {
                        log.debug("Row {} rendered: {} ({} bytes)", index + 1, request.outputFilename(), content.length);
                        return RowOutcome.success(index, request.getFilename(), content);
                    }
                    String reason = describe(error);
                    log.warn("Row {} failed ({}): {}", index + 1, request.outputFilename(), reason);
                    return RowOutcome.failure(index, request.getFilename(), reason);
                });
    }

    private static byte[] renderRow(DocumentRenderer renderer, RenderRequest request) {
        try {
            return renderer.render(request);
        } catch (RenderException e) {
            throw new CompletionException(e);
        }
    }

    private static String describe(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RenderException) {
            return cause.getMessage();
        }
        return cause.getClass().getSimpleName() + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
    }
}
