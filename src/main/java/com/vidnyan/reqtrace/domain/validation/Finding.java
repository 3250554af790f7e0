package com.vidnyan.reqtrace.domain.validation;

import com.vidnyan.reqtrace.domain.model.Location;
import org.springframework.lang.Nullable;

import java.util.Comparator;
import java.util.List;

/**
 * A reported validation fact.
 * Immutable value object.
 *
 * @param kind      what was found
 * @param message   human readable description
 * @param ruleId    rule concerned, if any
 * @param specImpl  {@code spec/impl} or spec name concerned, if any
 * @param locations every site involved, in declaration order
 */
public record Finding(
    FindingKind kind,
    String message,
    @Nullable String ruleId,
    @Nullable String specImpl,
    List<Location> locations
) {

    /**
     * Deterministic report order: kind, first site, then message.
     */
    public static final Comparator<Finding> ORDER = Comparator
            .comparing(Finding::kind)
            .thenComparing(f -> f.primaryLocation() == null ? "" : f.primaryLocation().filePath())
            .thenComparingInt(f -> f.primaryLocation() == null ? 0 : f.primaryLocation().line())
            .thenComparing(Finding::message);

    public Finding {
        locations = locations == null ? List.of() : List.copyOf(locations);
    }

    @Nullable
    public Location primaryLocation() {
        return locations.isEmpty() ? null : locations.get(0);
    }

    /**
     * Builder for Finding.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private FindingKind kind;
        private String message;
        private String ruleId;
        private String specImpl;
        private List<Location> locations = List.of();

        public Builder kind(FindingKind kind) { this.kind = kind; return this; }
        public Builder message(String message) { this.message = message; return this; }
        public Builder ruleId(String ruleId) { this.ruleId = ruleId; return this; }
        public Builder specImpl(String specImpl) { this.specImpl = specImpl; return this; }
        public Builder location(Location location) { this.locations = List.of(location); return this; }
        public Builder locations(List<Location> locations) { this.locations = locations; return this; }

        public Finding build() {
            return new Finding(kind, message, ruleId, specImpl, locations);
        }
    }
}
