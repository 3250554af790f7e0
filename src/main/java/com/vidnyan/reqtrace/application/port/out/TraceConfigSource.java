package com.vidnyan.reqtrace.application.port.out;

import com.vidnyan.reqtrace.domain.config.TraceConfig;

/**
 * Port for obtaining the configuration document.
 * Implemented by adapters that read from files, classpath, etc.
 */
public interface TraceConfigSource {

    /**
     * Load the current configuration, freshly, on every call.
     * @throws com.vidnyan.reqtrace.domain.error.ConfigException when missing or unreadable
     */
    TraceConfig load();

    /**
     * Where the configuration comes from, for logs and the config view.
     */
    String describe();
}
