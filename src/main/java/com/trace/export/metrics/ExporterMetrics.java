package com.trace.export.metrics;

import java.time.Duration;

/**
 * Interface for recording exporter self-metrics.
 * Implementations can integrate with Micrometer or other metrics systems.
 * The default {@link NoOpExporterMetrics} does nothing, so the exporter works
 * without any metrics dependency on the classpath.
 */
public interface ExporterMetrics {

    void incrementSpansExported();

    void incrementSpansDropped();

    void recordBatchUploaded(int spanCount, Duration duration);

    void incrementUploadFailures();
}
