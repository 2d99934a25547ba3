package com.trace.export.exporter;

/**
 * Checked exception thrown by an {@link Uploader} when a batch could not be delivered.
 */
public class UploadException extends Exception {

    public static final int NO_STATUS = -1;

    private final int statusCode;

    public UploadException(String message) {
        this(message, NO_STATUS);
    }

    public UploadException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public UploadException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_STATUS;
    }

    /**
     * Returns the collector's response status, or {@link #NO_STATUS} if no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
