package com.trace.export.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExporterMetrics Tests")
class ExporterMetricsTest {

    @Nested
    @DisplayName("NoOpExporterMetrics")
    class NoOp {

        @Test
        @DisplayName("All operations are safe to call")
        void noOp() {
            ExporterMetrics metrics = new NoOpExporterMetrics();
            assertDoesNotThrow(() -> {
                metrics.incrementSpansExported();
                metrics.incrementSpansDropped();
                metrics.recordBatchUploaded(5, Duration.ofMillis(3));
                metrics.incrementUploadFailures();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerExporterMetrics")
    class Micrometer {

        private SimpleMeterRegistry registry;
        private MicrometerExporterMetrics metrics;

        @BeforeEach
        void setUp() {
            registry = new SimpleMeterRegistry();
            metrics = new MicrometerExporterMetrics(registry, "checkout");
        }

        @Test
        @DisplayName("Counts exported and dropped spans")
        void spanCounters() {
            metrics.incrementSpansExported();
            metrics.incrementSpansExported();
            metrics.incrementSpansDropped();

            assertEquals(2.0, registry.get("trace.exporter.spans.exported").tag("service", "checkout").counter().count());
            assertEquals(1.0, registry.get("trace.exporter.spans.dropped").counter().count());
        }

        @Test
        @DisplayName("Records uploads with duration and batch size")
        void uploads() {
            metrics.recordBatchUploaded(4, Duration.ofMillis(20));
            metrics.recordBatchUploaded(6, Duration.ofMillis(40));
            metrics.incrementUploadFailures();

            assertEquals(2.0, registry.get("trace.exporter.batches.uploaded").counter().count());
            assertEquals(1.0, registry.get("trace.exporter.upload.failures").counter().count());
            assertEquals(2, registry.get("trace.exporter.upload.duration").timer().count());
            assertEquals(60.0, registry.get("trace.exporter.upload.duration").timer().totalTime(TimeUnit.MILLISECONDS), 0.001);
            assertEquals(10.0, registry.get("trace.exporter.batch.size").summary().totalAmount());
        }
    }
}
