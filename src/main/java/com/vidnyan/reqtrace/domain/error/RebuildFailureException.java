package com.vidnyan.reqtrace.domain.error;

/**
 * A rebuild was abandoned; the previous snapshot is still live.
 */
public class RebuildFailureException extends Exception {

    public RebuildFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
