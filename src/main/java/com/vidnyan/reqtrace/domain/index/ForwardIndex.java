package com.vidnyan.reqtrace.domain.index;

import com.vidnyan.reqtrace.domain.model.Rule;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Spec-centric view: spec name to rules and their references.
 * Immutable and thread-safe.
 */
public final class ForwardIndex {

    public static final ForwardIndex EMPTY = new ForwardIndex(List.of());

    private final Map<String, SpecIndex> specs;

    public ForwardIndex(List<SpecIndex> specs) {
        Map<String, SpecIndex> byName = new LinkedHashMap<>();
        specs.forEach(s -> byName.put(s.name(), s));
        this.specs = Collections.unmodifiableMap(byName);
    }

    /**
     * Specs in configuration order.
     */
    public Collection<SpecIndex> specs() {
        return specs.values();
    }

    public Optional<SpecIndex> spec(String name) {
        return Optional.ofNullable(specs.get(name));
    }

    /**
     * Declarations of an id across all specs, spec order then document order.
     */
    public List<Rule> declarationsAnywhere(String ruleId) {
        return specs.values().stream()
                .flatMap(s -> s.declarations(ruleId).stream())
                .toList();
    }

    public int ruleCount() {
        return specs.values().stream().mapToInt(s -> s.ruleIds().size()).sum();
    }
}
