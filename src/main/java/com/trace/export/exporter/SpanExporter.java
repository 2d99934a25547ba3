package com.trace.export.exporter;

import com.trace.export.batch.Bundler;
import com.trace.export.batch.BundlerConfig;
import com.trace.export.batch.BundlerOverflowException;
import com.trace.export.convert.SpanConverter;
import com.trace.export.convert.TagConverter;
import com.trace.export.logging.LogContext;
import com.trace.export.metrics.ExporterMetrics;
import com.trace.export.model.SpanRecord;
import com.trace.export.wire.Batch;
import com.trace.export.wire.Process;
import com.trace.export.wire.WireSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Exports completed spans to a collector in batches.
 *
 * <p>{@link #exportSpan} converts the span and buffers it; it never blocks on I/O and never
 * throws. Batches are uploaded from a single background worker, so uploads for one exporter
 * are serialized and happen in the order the batches were completed. Upload failures go to
 * the configured error hook, or are logged.</p>
 *
 * <pre>
 * SpanExporter exporter = SpanExporter.create(
 *     Endpoint.collector("http://localhost:14268/api/traces"),
 *     ExporterOptions.builder()
 *         .process(ProcessInfo.of("checkout", Attribute.of("region", "eu-west-1")))
 *         .bufferMaxCount(10_000)
 *         .build());
 *
 * exporter.exportSpan(record);
 * ...
 * exporter.close(); // flushes buffered spans
 * </pre>
 */
public class SpanExporter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SpanExporter.class);

    private final Process process;
    private final Uploader uploader;
    private final Consumer<Throwable> onError;
    private final ExporterMetrics metrics;
    private final Bundler<WireSpan> bundler;

    SpanExporter(Uploader uploader, ExporterOptions options) {
        this.uploader = uploader;
        this.metrics = options.getMetrics();
        this.onError = options.getOnError() != null ? options.getOnError() : SpanExporter::logUploadError;
        this.process = new Process(
                options.getProcess().serviceName(),
                TagConverter.toTags(options.getProcess().tags()));

        BundlerConfig bundlerConfig = BundlerConfig.builder()
                .bundleCountThreshold(options.getEffectiveBatchSize())
                .delayThreshold(options.getFlushInterval())
                .bufferedItemLimit(options.getBufferMaxCount())
                .build();
        this.bundler = new Bundler<>(bundlerConfig, this::upload);

        log.info("Span exporter initialized: {}", options);
    }

    /**
     * Creates an exporter. This is the only operation that reports failure to the caller.
     *
     * @param endpoint creates the uploader batches are sent through
     * @param options  exporter options, or {@code null} for defaults
     * @throws ExporterConfigurationException if the uploader cannot be created
     */
    public static SpanExporter create(Endpoint endpoint, ExporterOptions options) {
        if (endpoint == null) {
            throw new ExporterConfigurationException("endpoint is required");
        }

        Uploader uploader;
        try {
            uploader = endpoint.create();
        } catch (ExporterConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExporterConfigurationException("Failed to create uploader: " + e.getMessage(), e);
        }
        if (uploader == null) {
            throw new ExporterConfigurationException("Endpoint returned no uploader");
        }

        return new SpanExporter(uploader, options != null ? options : ExporterOptions.defaults());
    }

    public static SpanExporter create(Endpoint endpoint) {
        return create(endpoint, ExporterOptions.defaults());
    }

    /**
     * Converts and buffers one span. Spans that do not fit in the buffer, or arrive after
     * {@link #close()}, are dropped.
     */
    public void exportSpan(SpanRecord record) {
        if (record == null) {
            return;
        }

        WireSpan span;
        try {
            span = SpanConverter.toWireSpan(record);
        } catch (RuntimeException e) {
            metrics.incrementSpansDropped();
            log.warn("Dropping span {} that could not be converted: {}", record, e.getMessage());
            return;
        }

        try {
            bundler.add(span, 1);
            metrics.incrementSpansExported();
        } catch (BundlerOverflowException e) {
            metrics.incrementSpansDropped();
            log.debug("Dropping span '{}': {}", record.getName(), e.getMessage());
        } catch (IllegalStateException e) {
            metrics.incrementSpansDropped();
            log.debug("Dropping span '{}': exporter is closed", record.getName());
        }
    }

    /**
     * Waits until every span exported before this call has been uploaded or reported to the
     * error hook. Useful before a program exits.
     */
    public void flush() {
        bundler.flush();
    }

    /**
     * Flushes buffered spans and stops the background worker.
     */
    @Override
    public void close() {
        bundler.close();
        log.info("Span exporter for service '{}' closed", process.serviceName());
    }

    public Process getProcess() {
        return process;
    }

    private void upload(List<WireSpan> spans) {
        Batch batch = new Batch(process, spans);
        try (LogContext ctx = LogContext.forUpload(LogContext.generateBatchId(), process.serviceName())) {
            long start = System.nanoTime();
            try {
                uploader.upload(batch);
                metrics.recordBatchUploaded(batch.size(), Duration.ofNanos(System.nanoTime() - start));
                log.debug("batch.uploaded spans={}", batch.size());
            } catch (UploadException | RuntimeException e) {
                metrics.incrementUploadFailures();
                reportError(e);
            }
        }
    }

    private void reportError(Throwable cause) {
        try {
            onError.accept(cause);
        } catch (RuntimeException e) {
            log.error("Upload error hook failed: {}", e.getMessage(), e);
        }
    }

    private static void logUploadError(Throwable cause) {
        log.error("Error when uploading spans to collector: {}", cause.getMessage(), cause);
    }
}
