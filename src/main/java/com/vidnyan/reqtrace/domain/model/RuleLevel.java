package com.vidnyan.reqtrace.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Requirement level, RFC 2119 style.
 */
public enum RuleLevel {
    MUST,
    SHOULD,
    MAY;

    /**
     * Parse an explicit {@code level=} attribute value.
     */
    public static Optional<RuleLevel> fromAttribute(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "must", "shall", "required" -> Optional.of(MUST);
            case "should", "recommended" -> Optional.of(SHOULD);
            case "may", "optional" -> Optional.of(MAY);
            default -> Optional.empty();
        };
    }
}
