package com.vidnyan.reqtrace.domain.config;

import java.util.List;
import java.util.Optional;

/**
 * Parsed configuration document: the specs to track and their implementations.
 * Immutable value object; loading it is the job of a {@code TraceConfigSource}.
 */
public record TraceConfig(List<SpecConfig> specs) {

    public TraceConfig {
        specs = specs == null ? List.of() : List.copyOf(specs);
    }

    public Optional<SpecConfig> spec(String name) {
        return specs.stream()
                .filter(s -> s.name().equals(name))
                .findFirst();
    }
}
