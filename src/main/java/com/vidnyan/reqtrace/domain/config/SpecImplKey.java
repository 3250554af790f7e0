package com.vidnyan.reqtrace.domain.config;

import java.util.Comparator;

/**
 * Identifies a (spec, impl) pairing; rendered as {@code spec/impl}.
 */
public record SpecImplKey(String spec, String impl) implements Comparable<SpecImplKey> {

    private static final Comparator<SpecImplKey> ORDER =
            Comparator.comparing(SpecImplKey::spec).thenComparing(SpecImplKey::impl);

    /**
     * Parse {@code spec/impl}. The spec name may itself contain slashes; the last one separates.
     */
    public static SpecImplKey parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("spec/impl must not be null");
        }
        int slash = value.lastIndexOf('/');
        if (slash <= 0 || slash == value.length() - 1) {
            throw new IllegalArgumentException("Expected <spec>/<impl>, got: " + value);
        }
        return new SpecImplKey(value.substring(0, slash), value.substring(slash + 1));
    }

    @Override
    public int compareTo(SpecImplKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return spec + "/" + impl;
    }
}
