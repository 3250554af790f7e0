package com.vidnyan.reqtrace.domain.config;

import java.util.List;

/**
 * Configuration for one implementation of a spec.
 * Files matched only by {@code testInclude} are test files: they may verify rules, not implement them.
 */
public record ImplConfig(
    String name,
    List<String> include,
    List<String> exclude,
    List<String> testInclude
) {

    public ImplConfig {
        include = include == null ? List.of() : List.copyOf(include);
        exclude = exclude == null ? List.of() : List.copyOf(exclude);
        testInclude = testInclude == null ? List.of() : List.copyOf(testInclude);
    }

    public static ImplConfig of(String name, List<String> include, List<String> exclude) {
        return new ImplConfig(name, include, exclude, List.of());
    }
}
