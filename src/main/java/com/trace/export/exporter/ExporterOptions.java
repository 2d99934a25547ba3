package com.trace.export.exporter;

import com.trace.export.batch.BundlerConfig;
import com.trace.export.metrics.ExporterMetrics;
import com.trace.export.metrics.NoOpExporterMetrics;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Options for {@link SpanExporter}.
 * Configures the upload error hook, process descriptor, buffering and metrics.
 */
public class ExporterOptions {

    private final Consumer<Throwable> onError;
    private final ProcessInfo process;
    private final int bufferMaxCount;
    private final int batchSize;
    private final Duration flushInterval;
    private final ExporterMetrics metrics;

    private ExporterOptions(Builder builder) {
        this.onError = builder.onError;
        this.process = builder.process != null ? builder.process : ProcessInfo.defaults();
        this.bufferMaxCount = builder.bufferMaxCount;
        this.batchSize = builder.batchSize;
        this.flushInterval = builder.flushInterval;
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpExporterMetrics();
    }

    /**
     * Returns the user-supplied upload error hook, or {@code null} to log failures.
     */
    public Consumer<Throwable> getOnError() {
        return onError;
    }

    public ProcessInfo getProcess() {
        return process;
    }

    /**
     * Returns the span buffer capacity; 0 means the bundler's default.
     */
    public int getBufferMaxCount() {
        return bufferMaxCount;
    }

    public int getBatchSize() {
        return batchSize;
    }

    /**
     * Returns the number of spans that completes a batch. Capped by the buffer capacity so a
     * batch can fill before the buffer overflows.
     */
    public int getEffectiveBatchSize() {
        return bufferMaxCount > 0 ? Math.min(batchSize, bufferMaxCount) : batchSize;
    }

    public Duration getFlushInterval() {
        return flushInterval;
    }

    public ExporterMetrics getMetrics() {
        return metrics;
    }

    public static ExporterOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Consumer<Throwable> onError;
        private ProcessInfo process;
        private int bufferMaxCount = 0;
        private int batchSize = BundlerConfig.DEFAULT_BUNDLE_COUNT_THRESHOLD;
        private Duration flushInterval = BundlerConfig.DEFAULT_DELAY_THRESHOLD;
        private ExporterMetrics metrics;

        /**
         * Sets the hook called with the cause of every failed upload.
         * If unset, failures are logged.
         */
        public Builder onError(Consumer<Throwable> onError) {
            this.onError = onError;
            return this;
        }

        public Builder process(ProcessInfo process) {
            this.process = process;
            return this;
        }

        /**
         * Sets the maximum number of spans held in memory; 0 selects the default.
         */
        public Builder bufferMaxCount(int bufferMaxCount) {
            if (bufferMaxCount < 0) throw new IllegalArgumentException("bufferMaxCount must be >= 0");
            this.bufferMaxCount = bufferMaxCount;
            return this;
        }

        public Builder batchSize(int batchSize) {
            if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
            this.batchSize = batchSize;
            return this;
        }

        public Builder flushInterval(Duration flushInterval) {
            if (flushInterval == null || flushInterval.isNegative() || flushInterval.isZero()) {
                throw new IllegalArgumentException("flushInterval must be positive");
            }
            this.flushInterval = flushInterval;
            return this;
        }

        public Builder metrics(ExporterMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public ExporterOptions build() {
            return new ExporterOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ExporterOptions{" +
                "serviceName='" + process.serviceName() + '\'' +
                ", bufferMaxCount=" + bufferMaxCount +
                ", batchSize=" + batchSize +
                ", flushInterval=" + flushInterval +
                ", customErrorHook=" + (onError != null) +
                '}';
    }
}
