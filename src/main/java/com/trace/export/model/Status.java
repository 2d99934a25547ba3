package com.trace.export.model;

import java.util.Objects;

/**
 * Outcome of a span: a code plus a human-readable description.
 *
 * @param code        the outcome code
 * @param description free-form message, may be empty
 */
public record Status(StatusCode code, String description) {

    private static final Status OK = new Status(StatusCode.OK, "");

    public Status {
        Objects.requireNonNull(code, "code is required");
        description = description != null ? description : "";
    }

    public static Status ok() {
        return OK;
    }

    public static Status of(StatusCode code) {
        return new Status(code, "");
    }

    public static Status error(StatusCode code, String description) {
        return new Status(code, description);
    }

    public boolean isOk() {
        return code == StatusCode.OK;
    }

    /**
     * Returns the description, or the code's canonical name when no description was given.
     */
    public String message() {
        return description.isEmpty() ? code.displayName() : description;
    }
}
