package com.vidnyan.reqtrace.domain.index;

import com.vidnyan.reqtrace.domain.model.RefVerb;
import com.vidnyan.reqtrace.domain.model.Reference;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * References to one rule from one implementation, grouped by verb.
 * Immutable value object.
 */
public record RuleRefs(
    List<Reference> implRefs,
    List<Reference> verifyRefs,
    List<Reference> dependsRefs,
    List<Reference> relatedRefs
) {

    static final Comparator<Reference> BY_SITE = Comparator
            .comparing(Reference::file)
            .thenComparingInt(Reference::line);

    public static final RuleRefs EMPTY = new RuleRefs(List.of(), List.of(), List.of(), List.of());

    public RuleRefs {
        implRefs = List.copyOf(implRefs);
        verifyRefs = List.copyOf(verifyRefs);
        dependsRefs = List.copyOf(dependsRefs);
        relatedRefs = List.copyOf(relatedRefs);
    }

    public static RuleRefs of(List<Reference> references) {
        Map<RefVerb, List<Reference>> byVerb = new EnumMap<>(RefVerb.class);
        for (RefVerb verb : RefVerb.values()) {
            byVerb.put(verb, new ArrayList<>());
        }
        references.stream()
                .sorted(BY_SITE)
                .forEach(r -> byVerb.get(r.verb()).add(r));
        return new RuleRefs(
                byVerb.get(RefVerb.IMPL),
                byVerb.get(RefVerb.VERIFY),
                byVerb.get(RefVerb.DEPENDS),
                byVerb.get(RefVerb.RELATED));
    }

    public List<Reference> byVerb(RefVerb verb) {
        return switch (verb) {
            case IMPL -> implRefs;
            case VERIFY -> verifyRefs;
            case DEPENDS -> dependsRefs;
            case RELATED -> relatedRefs;
        };
    }

    public boolean isImplemented() {
        return !implRefs.isEmpty();
    }

    public boolean isVerified() {
        return !verifyRefs.isEmpty();
    }

    public List<Reference> all() {
        List<Reference> all = new ArrayList<>(implRefs);
        all.addAll(verifyRefs);
        all.addAll(dependsRefs);
        all.addAll(relatedRefs);
        all.sort(BY_SITE);
        return all;
    }
}
