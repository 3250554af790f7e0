package com.vidnyan.reqtrace.domain.model;

import org.springframework.lang.Nullable;

import java.util.regex.Pattern;

/**
 * One declaration of a requirement in a spec document.
 * Immutable value object. Several declarations may share an id (a validation finding).
 *
 * @param id          dot-segmented rule id
 * @param spec        name of the owning spec
 * @param text        rule body, possibly empty
 * @param level       explicit or inferred level, null when undeterminable
 * @param status      optional {@code status=} attribute of the marker
 * @param fingerprint short hash of the normalized text
 * @param location    declaring document and line of the marker
 */
public record Rule(
    String id,
    String spec,
    String text,
    @Nullable RuleLevel level,
    @Nullable String status,
    String fingerprint,
    Location location
) {

    /**
     * Dot-segmented rule id, e.g. {@code auth.login.rate-limit}.
     */
    public static final Pattern ID = Pattern.compile("[A-Za-z0-9_-]+(\\.[A-Za-z0-9_-]+)*");

    public static boolean isValidId(String id) {
        return id != null && ID.matcher(id).matches();
    }

    /**
     * Builder for Rule.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String spec;
        private String text = "";
        private RuleLevel level;
        private String status;
        private String fingerprint;
        private Location location;

        public Builder id(String id) { this.id = id; return this; }
        public Builder spec(String spec) { this.spec = spec; return this; }
        public Builder text(String text) { this.text = text; return this; }
        public Builder level(RuleLevel level) { this.level = level; return this; }
        public Builder status(String status) { this.status = status; return this; }
        public Builder fingerprint(String fingerprint) { this.fingerprint = fingerprint; return this; }
        public Builder location(Location location) { this.location = location; return this; }

        public Rule build() {
            return new Rule(id, spec, text, level, status, fingerprint, location);
        }
    }
}
