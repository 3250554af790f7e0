package com.vidnyan.reqtrace.domain.model;

import org.springframework.lang.Nullable;

/**
 * One annotation occurrence, attributed to a (spec, impl) pair.
 * Immutable value object; links to rules and units are resolved by id at query time.
 */
public record Reference(
    String spec,
    String impl,
    RefVerb verb,
    String ruleId,
    String file,
    int line,
    @Nullable String capturedFingerprint
) {

    public Location location() {
        return Location.at(file, line);
    }

    public boolean hasCapturedFingerprint() {
        return capturedFingerprint != null && !capturedFingerprint.isEmpty();
    }
}
