package com.trace.export.exporter;

import com.trace.export.wire.Batch;

/**
 * Transport that delivers one {@link Batch} to a collector.
 *
 * <p>Called from the exporter's worker thread, never concurrently for the same exporter.
 * Failures are reported by throwing {@link UploadException}; they never reach span producers.</p>
 */
@FunctionalInterface
public interface Uploader {

    void upload(Batch batch) throws UploadException;
}
