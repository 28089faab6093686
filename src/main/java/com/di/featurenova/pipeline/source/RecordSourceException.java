package com.di.featurenova.pipeline.source;

/**
 * A record source could not be read: unreachable, rejected credentials,
 * timed out, or returned a malformed record.
 */
public class RecordSourceException extends RuntimeException {

    public RecordSourceException(String message) {
        super(message);
    }

    public RecordSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
