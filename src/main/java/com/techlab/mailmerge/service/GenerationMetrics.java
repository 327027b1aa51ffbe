package com.techlab.mailmerge.service;

import lombok.Builder;
import lombok.Data;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide counters for document generation requests, exposed on the metrics endpoint.
 */
@Component
public class GenerationMetrics {

    private final AtomicLong totalRequests = new AtomicLong(0);
    private final AtomicLong successfulRequests = new AtomicLong(0);
    private final AtomicLong failedRequests = new AtomicLong(0);
    private final AtomicLong documentsGenerated = new AtomicLong(0);
    private final AtomicLong documentsFailed = new AtomicLong(0);
    private final AtomicLong totalProcessingTime = new AtomicLong(0);
    private final AtomicLong maxProcessingTime = new AtomicLong(0);
    private final AtomicLong minProcessingTime = new AtomicLong(Long.MAX_VALUE);

    public void recordSuccess(long durationMs, long documents, long failedDocuments) {
        totalRequests.incrementAndGet();
        successfulRequests.incrementAndGet();
        documentsGenerated.addAndGet(documents);
        documentsFailed.addAndGet(failedDocuments);
        recordDuration(durationMs);
    }

    public void recordFailure(long durationMs) {
        totalRequests.incrementAndGet();
        failedRequests.incrementAndGet();
        recordDuration(durationMs);
    }

    private void recordDuration(long duration) {
        totalProcessingTime.addAndGet(duration);

        long currentMax = maxProcessingTime.get();
        while (duration > currentMax && !maxProcessingTime.compareAndSet(currentMax, duration)) {
            currentMax = maxProcessingTime.get();
        }

        long currentMin = minProcessingTime.get();
        while (duration < currentMin && !minProcessingTime.compareAndSet(currentMin, duration)) {
            currentMin = minProcessingTime.get();
        }
    }

    public Snapshot snapshot() {
        long total = totalRequests.get();
        long successful = successfulRequests.get();
        long minTime = minProcessingTime.get() == Long.MAX_VALUE ? 0 : minProcessingTime.get();

        return Snapshot.builder()
                .totalRequests(total)
                .successfulRequests(successful)
                .failedRequests(failedRequests.get())
                .documentsGenerated(documentsGenerated.get())
                .documentsFailed(documentsFailed.get())
                .successRate(total > 0 ? (double) successful / total * 100 : 0)
                .averageProcessingTimeMs(total > 0 ? (double) totalProcessingTime.get() / total : 0)
                .maxProcessingTimeMs(maxProcessingTime.get())
                .minProcessingTimeMs(minTime)
                .build();
    }

    @Data
    @Builder
    public static class Snapshot {
        private long totalRequests;
        private long successfulRequests;
        private long failedRequests;
        private long documentsGenerated;
        private long documentsFailed;
        private double successRate;
        private double averageProcessingTimeMs;
        private long maxProcessingTimeMs;
        private long minProcessingTimeMs;
    }
}
