package com.vidnyan.reqtrace.application.service;

import com.vidnyan.reqtrace.domain.index.ForwardIndex;
import com.vidnyan.reqtrace.domain.index.SpecIndex;
import com.vidnyan.reqtrace.domain.index.StaleReference;
import com.vidnyan.reqtrace.domain.model.Fingerprints;
import com.vidnyan.reqtrace.domain.model.Reference;
import com.vidnyan.reqtrace.domain.model.Rule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Finds references whose captured fingerprint no longer matches the rule text.
 * References without a captured fingerprint are never stale.
 */
@Component
public class StalenessTracker {

    private static final Comparator<StaleReference> BY_SITE = Comparator
            .comparing((StaleReference s) -> s.reference().file())
            .thenComparingInt(s -> s.reference().line())
            .thenComparing(s -> s.reference().impl());

    public List<StaleReference> findStale(ForwardIndex forward) {
        List<StaleReference> stale = new ArrayList<>();
        for (SpecIndex spec : forward.specs()) {
            for (String impl : spec.impls()) {
                for (String ruleId : spec.ruleIds()) {
                    Optional<Rule> rule = spec.rule(ruleId);
                    if (rule.isEmpty()) {
                        continue;
                    }
                    for (Reference ref : spec.refs(impl, ruleId).all()) {
                        if (isStale(ref, rule.get())) {
                            stale.add(new StaleReference(ref, rule.get().fingerprint()));
                        }
                    }
                }
            }
        }
        stale.sort(BY_SITE);
        return stale;
    }

    /**
     * Compared against the first declaration when an id is declared more than once.
     */
    public boolean isStale(Reference ref, Rule rule) {
        return ref.hasCapturedFingerprint() && !Fingerprints.matches(rule.fingerprint(), ref.capturedFingerprint());
    }
}
