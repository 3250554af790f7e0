package com.vidnyan.reqtrace.domain.config;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Configuration for a single specification.
 *
 * @param name      display name, also the first half of a {@code spec/impl} key
 * @param prefix    annotation prefix, e.g. {@code r} for {@code r[impl auth.login]}
 * @param sourceUrl canonical location of the spec, informational
 * @param include   glob patterns for the markdown documents holding the rules
 * @param impls     implementations of this spec
 */
public record SpecConfig(
    String name,
    String prefix,
    @Nullable String sourceUrl,
    List<String> include,
    List<ImplConfig> impls
) {

    public SpecConfig {
        include = include == null ? List.of() : List.copyOf(include);
        impls = impls == null ? List.of() : List.copyOf(impls);
    }
}
