package com.trace.export.exporter;

import com.trace.export.metrics.NoOpExporterMetrics;
import com.trace.export.model.Attribute;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExporterOptions Tests")
class ExporterOptionsTest {

    @Test
    @DisplayName("Defaults")
    void defaults() {
        ExporterOptions options = ExporterOptions.defaults();

        assertNull(options.getOnError());
        assertEquals(ProcessInfo.DEFAULT_SERVICE_NAME, options.getProcess().serviceName());
        assertEquals(0, options.getBufferMaxCount());
        assertEquals(10, options.getBatchSize());
        assertEquals(10, options.getEffectiveBatchSize());
        assertEquals(Duration.ofSeconds(1), options.getFlushInterval());
        assertInstanceOf(NoOpExporterMetrics.class, options.getMetrics());
    }

    @Test
    @DisplayName("Buffer capacity caps the effective batch size")
    void effectiveBatchSize() {
        assertEquals(2, ExporterOptions.builder().bufferMaxCount(2).build().getEffectiveBatchSize());
        assertEquals(10, ExporterOptions.builder().bufferMaxCount(500).build().getEffectiveBatchSize());
        assertEquals(50, ExporterOptions.builder().batchSize(50).build().getEffectiveBatchSize());
    }

    @Test
    @DisplayName("Rejects invalid values")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> ExporterOptions.builder().bufferMaxCount(-1));
        assertThrows(IllegalArgumentException.class, () -> ExporterOptions.builder().batchSize(0));
        assertThrows(IllegalArgumentException.class, () -> ExporterOptions.builder().flushInterval(null));
        assertThrows(IllegalArgumentException.class,
                () -> ExporterOptions.builder().flushInterval(Duration.ofMillis(-5)));
    }

    @Test
    @DisplayName("Process descriptor defaults a blank service name")
    void processInfo() {
        assertEquals("OpenTelemetry", new ProcessInfo(null, null).serviceName());
        assertEquals(List.of(), new ProcessInfo("", null).tags());

        ProcessInfo info = ProcessInfo.of("billing", Attribute.of("version", "1.4.2"));
        assertEquals("billing", info.serviceName());
        assertEquals(List.of(Attribute.of("version", "1.4.2")), info.tags());
    }
}
