package com.vidnyan.reqtrace.domain.model;

import java.util.Optional;

/**
 * What an annotation says about the rule it names.
 */
public enum RefVerb {
    IMPL("impl"),
    VERIFY("verify"),
    DEPENDS("depends"),
    RELATED("related");

    private final String token;

    RefVerb(String token) {
        this.token = token;
    }

    /**
     * The word used inside an annotation, e.g. {@code verify}.
     */
    public String token() {
        return token;
    }

    /**
     * Exact, case-sensitive lookup of an annotation verb.
     */
    public static Optional<RefVerb> fromToken(String token) {
        for (RefVerb verb : values()) {
            if (verb.token.equals(token)) {
                return Optional.of(verb);
            }
        }
        return Optional.empty();
    }
}
