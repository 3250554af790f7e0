package com.vidnyan.reqtrace.domain.error;

/**
 * The configuration document is missing or cannot be understood at all.
 * Semantic problems inside a readable document are reported as findings instead.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
