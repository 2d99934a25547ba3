package com.trace.export.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link ExporterMetrics}.
 */
public class NoOpExporterMetrics implements ExporterMetrics {

    @Override
    public void incrementSpansExported() {
    }

    @Override
    public void incrementSpansDropped() {
    }

    @Override
    public void recordBatchUploaded(int spanCount, Duration duration) {
    }

    @Override
    public void incrementUploadFailures() {
    }
}
