package com.vidnyan.reqtrace.domain.index;

import com.vidnyan.reqtrace.domain.model.Reference;

/**
 * A reference whose captured fingerprint no longer matches the rule it names.
 */
public record StaleReference(
    Reference reference,
    String currentFingerprint
) {
}
