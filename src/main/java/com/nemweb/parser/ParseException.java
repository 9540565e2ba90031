package com.nemweb.parser;

/**
 * Raised when a bundle cannot be decoded into a series at all.
 * Individual malformed rows never raise this; they are skipped.
 */
public class ParseException extends RuntimeException {

    public enum Reason {
        /** The expected report or one of its required columns is missing. */
        SCHEMA_MISMATCH,
        /** The archive or its CSV content cannot be read. */
        CORRUPT_BUNDLE,
        /** The report is present but holds no usable row for the region. */
        NO_REGION_DATA
    }

    private final Reason reason;

    public ParseException(Reason reason, String message) {
        this(reason, message, null);
    }

    public ParseException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
