package com.vidnyan.reqtrace.domain.index;

import com.vidnyan.reqtrace.domain.model.Reference;
import com.vidnyan.reqtrace.domain.model.Rule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Forward view of one spec: its rule declarations and, per implementation,
 * the references each rule received.
 * Immutable and thread-safe.
 */
public final class SpecIndex {

    private final String name;
    private final String prefix;
    private final Map<String, List<Rule>> declarations;
    private final Map<String, Map<String, RuleRefs>> refsByImpl;

    private SpecIndex(String name, String prefix,
                      Map<String, List<Rule>> declarations,
                      Map<String, Map<String, RuleRefs>> refsByImpl) {
        this.name = name;
        this.prefix = prefix;
        this.declarations = Collections.unmodifiableMap(declarations);
        this.refsByImpl = Collections.unmodifiableMap(refsByImpl);
    }

    public String name() {
        return name;
    }

    public String prefix() {
        return prefix;
    }

    /**
     * Rule ids in lexical order.
     */
    public List<String> ruleIds() {
        return List.copyOf(declarations.keySet());
    }

    public boolean hasRule(String ruleId) {
        return declarations.containsKey(ruleId);
    }

    /**
     * First declaration of a rule id.
     */
    public Optional<Rule> rule(String ruleId) {
        List<Rule> decls = declarations.get(ruleId);
        return decls == null ? Optional.empty() : Optional.of(decls.get(0));
    }

    /**
     * All declarations of a rule id, duplicates included, in document order.
     */
    public List<Rule> declarations(String ruleId) {
        return declarations.getOrDefault(ruleId, List.of());
    }

    public Map<String, List<Rule>> allDeclarations() {
        return declarations;
    }

    public Set<String> impls() {
        return refsByImpl.keySet();
    }

    public RuleRefs refs(String impl, String ruleId) {
        return refsByImpl.getOrDefault(impl, Map.of()).getOrDefault(ruleId, RuleRefs.EMPTY);
    }

    public static Builder builder(String name, String prefix) {
        return new Builder(name, prefix);
    }

    public static class Builder {
        private final String name;
        private final String prefix;
        private final Map<String, List<Rule>> declarations = new TreeMap<>();
        private final Map<String, Map<String, List<Reference>>> references = new LinkedHashMap<>();

        private Builder(String name, String prefix) {
            this.name = name;
            this.prefix = prefix;
        }

        public Builder declare(Rule rule) {
            declarations.computeIfAbsent(rule.id(), k -> new ArrayList<>()).add(rule);
            return this;
        }

        public Builder impl(String impl) {
            references.computeIfAbsent(impl, k -> new TreeMap<>());
            return this;
        }

        public Builder reference(Reference reference) {
            references.computeIfAbsent(reference.impl(), k -> new TreeMap<>())
                    .computeIfAbsent(reference.ruleId(), k -> new ArrayList<>())
                    .add(reference);
            return this;
        }

        public boolean hasRule(String ruleId) {
            return declarations.containsKey(ruleId);
        }

        public SpecIndex build() {
            Map<String, List<Rule>> decls = new TreeMap<>();
            declarations.forEach((id, list) -> decls.put(id, List.copyOf(list)));

            Map<String, Map<String, RuleRefs>> refs = new LinkedHashMap<>();
            references.forEach((impl, byRule) -> {
                Map<String, RuleRefs> grouped = new TreeMap<>();
                byRule.forEach((ruleId, list) -> grouped.put(ruleId, RuleRefs.of(list)));
                refs.put(impl, Collections.unmodifiableMap(grouped));
            });
            return new SpecIndex(name, prefix, decls, refs);
        }
    }
}
