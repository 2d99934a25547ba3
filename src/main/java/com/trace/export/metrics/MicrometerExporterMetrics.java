package com.trace.export.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer-based implementation of {@link ExporterMetrics}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics, all tagged with {@code service}:</p>
 * <ul>
 *   <li>{@code trace.exporter.spans.exported}: Counter of spans accepted into the buffer</li>
 *   <li>{@code trace.exporter.spans.dropped}: Counter of spans rejected on overflow or after close</li>
 *   <li>{@code trace.exporter.batches.uploaded}: Counter of successful uploads</li>
 *   <li>{@code trace.exporter.upload.failures}: Counter of failed uploads</li>
 *   <li>{@code trace.exporter.upload.duration}: Timer of successful uploads</li>
 *   <li>{@code trace.exporter.batch.size}: DistributionSummary of spans per uploaded batch</li>
 * </ul>
 */
public class MicrometerExporterMetrics implements ExporterMetrics {

    private final Counter spansExported;
    private final Counter spansDropped;
    private final Counter batchesUploaded;
    private final Counter uploadFailures;
    private final Timer uploadDuration;
    private final DistributionSummary batchSize;

    public MicrometerExporterMetrics(MeterRegistry registry, String serviceName) {
        this.spansExported = Counter.builder("trace.exporter.spans.exported")
                .description("Spans accepted for export")
                .tag("service", serviceName)
                .register(registry);
        this.spansDropped = Counter.builder("trace.exporter.spans.dropped")
                .description("Spans dropped before upload")
                .tag("service", serviceName)
                .register(registry);
        this.batchesUploaded = Counter.builder("trace.exporter.batches.uploaded")
                .description("Batches uploaded successfully")
                .tag("service", serviceName)
                .register(registry);
        this.uploadFailures = Counter.builder("trace.exporter.upload.failures")
                .description("Batch uploads that failed")
                .tag("service", serviceName)
                .register(registry);
        this.uploadDuration = Timer.builder("trace.exporter.upload.duration")
                .description("Duration of successful batch uploads")
                .tag("service", serviceName)
                .register(registry);
        this.batchSize = DistributionSummary.builder("trace.exporter.batch.size")
                .description("Spans per uploaded batch")
                .tag("service", serviceName)
                .register(registry);
    }

    @Override
    public void incrementSpansExported() {
        spansExported.increment();
    }

    @Override
    public void incrementSpansDropped() {
        spansDropped.increment();
    }

    @Override
    public void recordBatchUploaded(int spanCount, Duration duration) {
        batchesUploaded.increment();
        uploadDuration.record(duration);
        batchSize.record(spanCount);
    }

    @Override
    public void incrementUploadFailures() {
        uploadFailures.increment();
    }
}
