package com.trace.export.exporter;

/**
 * Runtime exception thrown when an exporter or its uploader cannot be constructed.
 */
public class ExporterConfigurationException extends RuntimeException {

    public ExporterConfigurationException(String message) {
        super(message);
    }

    public ExporterConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
