package com.trace.export.exporter;

import com.trace.export.model.Attribute;

import java.util.List;

/**
 * Describes the exporting process: the service name and process-level tags attached to
 * every batch. A blank service name is replaced by {@link #DEFAULT_SERVICE_NAME}.
 *
 * @param serviceName the service name reported to the collector
 * @param tags        process-level attributes; unsupported value types are dropped on export
 */
public record ProcessInfo(String serviceName, List<Attribute> tags) {

    public static final String DEFAULT_SERVICE_NAME = "OpenTelemetry";

    public ProcessInfo {
        serviceName = serviceName == null || serviceName.isBlank() ? DEFAULT_SERVICE_NAME : serviceName;
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public static ProcessInfo defaults() {
        return new ProcessInfo(DEFAULT_SERVICE_NAME, List.of());
    }

    public static ProcessInfo of(String serviceName, Attribute... tags) {
        return new ProcessInfo(serviceName, List.of(tags));
    }
}
