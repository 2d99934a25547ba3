package com.trace.export.exporter;

import java.time.Duration;

/**
 * Creates the {@link Uploader} an exporter sends its batches through.
 * Invoked once, while the exporter is being constructed.
 */
@FunctionalInterface
public interface Endpoint {

    /**
     * @throws ExporterConfigurationException if the uploader cannot be created
     */
    Uploader create();

    /**
     * Endpoint that posts JSON batches to an HTTP collector.
     */
    static Endpoint collector(String collectorUrl) {
        return () -> HttpCollectorUploader.builder()
                .collectorUrl(collectorUrl)
                .build();
    }

    static Endpoint collector(String collectorUrl, Duration timeout) {
        return () -> HttpCollectorUploader.builder()
                .collectorUrl(collectorUrl)
                .timeout(timeout)
                .build();
    }

    /**
     * Endpoint backed by an already-built uploader.
     */
    static Endpoint of(Uploader uploader) {
        return () -> {
            if (uploader == null) {
                throw new ExporterConfigurationException("uploader is required");
            }
            return uploader;
        };
    }
}
