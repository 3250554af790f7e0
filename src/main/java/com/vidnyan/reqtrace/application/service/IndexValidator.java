package com.vidnyan.reqtrace.application.service;

import com.vidnyan.reqtrace.application.port.out.SourceScanner.ProblemKind;
import com.vidnyan.reqtrace.domain.config.ImplConfig;
import com.vidnyan.reqtrace.domain.config.SpecConfig;
import com.vidnyan.reqtrace.domain.config.TraceConfig;
import com.vidnyan.reqtrace.domain.index.ForwardIndex;
import com.vidnyan.reqtrace.domain.index.SpecIndex;
import com.vidnyan.reqtrace.domain.index.StaleReference;
import com.vidnyan.reqtrace.domain.model.Location;
import com.vidnyan.reqtrace.domain.model.Reference;
import com.vidnyan.reqtrace.domain.model.Rule;
import com.vidnyan.reqtrace.domain.validation.Finding;
import com.vidnyan.reqtrace.domain.validation.FindingKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns configuration problems and merge issues into findings.
 * Never throws for bad data: everything becomes a finding and the index is still built.
 */
@Slf4j
@Component
public class IndexValidator {

    private static final Pattern PREFIX = Pattern.compile("[A-Za-z0-9_-]+");

    /**
     * Configuration that survived the checks, plus what was reported.
     *
     * @param usable   specs and impls that take part in the rebuild
     * @param findings CONFIG_ERROR findings
     */
    public record ConfigCheck(TraceConfig usable, List<Finding> findings) {}

    public ConfigCheck checkConfig(TraceConfig config) {
        List<Finding> findings = new ArrayList<>();
        List<SpecConfig> usable = new ArrayList<>();
        Set<String> specNames = new HashSet<>();

        for (SpecConfig spec : config.specs()) {
            if (spec.name().isBlank()) {
                findings.add(configError(null, "Spec without a name; spec excluded"));
                continue;
            }
            if (!specNames.add(spec.name())) {
                findings.add(configError(spec.name(), "Duplicate spec name '" + spec.name() + "'; later entry excluded"));
                continue;
            }
            if (spec.prefix().isBlank() || !PREFIX.matcher(spec.prefix()).matches()) {
                findings.add(configError(spec.name(),
                        "Spec '" + spec.name() + "' has an invalid prefix '" + spec.prefix() + "'; spec excluded"));
                continue;
            }
            usable.add(new SpecConfig(spec.name(), spec.prefix(), spec.sourceUrl(), spec.include(),
                    usableImpls(spec, findings)));
        }

        Map<String, List<String>> specsByPrefix = new LinkedHashMap<>();
        usable.forEach(s -> specsByPrefix.computeIfAbsent(s.prefix(), k -> new ArrayList<>()).add(s.name()));
        specsByPrefix.forEach((prefix, names) -> {
            if (names.size() > 1) {
                findings.add(configError(null, "Prefix '" + prefix + "' is shared by specs " + names
                        + "; its annotations cannot be attributed"));
            }
        });

        return new ConfigCheck(new TraceConfig(usable), findings);
    }

    private List<ImplConfig> usableImpls(SpecConfig spec, List<Finding> findings) {
        List<ImplConfig> impls = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (ImplConfig impl : spec.impls()) {
            if (impl.name().isBlank() || impl.name().contains("/")) {
                findings.add(configError(spec.name(), "Spec '" + spec.name()
                        + "' has an implementation with invalid name '" + impl.name() + "'; excluded"));
            } else if (!names.add(impl.name())) {
                findings.add(configError(spec.name() + "/" + impl.name(), "Duplicate implementation name '"
                        + impl.name() + "' in spec '" + spec.name() + "'; later entry excluded"));
            } else {
                impls.add(impl);
            }
        }
        return impls;
    }

    /**
     * All data findings of a merged index, plus the given earlier findings, in report order.
     */
    public List<Finding> validate(List<Finding> earlier, ForwardIndex forward,
                                  MergeIssues issues, List<StaleReference> stale) {
        List<Finding> findings = new ArrayList<>(earlier);

        for (SpecIndex spec : forward.specs()) {
            spec.allDeclarations().forEach((id, declarations) -> {
                if (declarations.size() > 1) {
                    findings.add(Finding.builder()
                            .kind(FindingKind.DUPLICATE_RULE_ID)
                            .ruleId(id)
                            .specImpl(spec.name())
                            .message("Rule '" + id + "' declared " + declarations.size() + " times in spec '"
                                    + spec.name() + "'")
                            .locations(declarations.stream().map(Rule::location).toList())
                            .build());
                }
            });
        }

        for (Reference ref : issues.broken()) {
            findings.add(referenceFinding(FindingKind.BROKEN_REFERENCE, ref,
                    "Rule '" + ref.ruleId() + "' is not declared in spec '" + ref.spec() + "'"));
        }
        for (Reference ref : issues.implInTest()) {
            findings.add(referenceFinding(FindingKind.IMPL_IN_TEST_FILE, ref,
                    "Impl annotation for '" + ref.ruleId() + "' in a test file of " + ref.spec() + "/" + ref.impl()));
        }
        for (MergeIssues.FileProblem fp : issues.problems()) {
            FindingKind kind = fp.problem().kind() == ProblemKind.MALFORMED
                    ? FindingKind.MALFORMED_ANNOTATION
                    : FindingKind.PREFIX_MISMATCH;
            findings.add(Finding.builder()
                    .kind(kind)
                    .message(fp.problem().text() + ": " + fp.problem().reason())
                    .location(Location.at(fp.file(), fp.problem().line()))
                    .build());
        }
        for (StaleReference s : stale) {
            Reference ref = s.reference();
            findings.add(referenceFinding(FindingKind.STALE, ref,
                    "Reference to '" + ref.ruleId() + "' captured @" + ref.capturedFingerprint()
                            + " but the rule is now @" + s.currentFingerprint()));
        }

        findings.sort(Finding.ORDER);
        logSummary(findings);
        return findings;
    }

    private void logSummary(List<Finding> findings) {
        if (findings.isEmpty()) {
            return;
        }
        Map<FindingKind, Integer> counts = new EnumMap<>(FindingKind.class);
        findings.forEach(f -> counts.merge(f.kind(), 1, Integer::sum));
        log.warn("Validation produced {} findings: {}", findings.size(), counts);
    }

    private static Finding referenceFinding(FindingKind kind, Reference ref, String message) {
        return Finding.builder()
                .kind(kind)
                .ruleId(ref.ruleId())
                .specImpl(ref.spec() + "/" + ref.impl())
                .message(message)
                .location(ref.location())
                .build();
    }

    private static Finding configError(String subject, String message) {
        return Finding.builder()
                .kind(FindingKind.CONFIG_ERROR)
                .specImpl(subject)
                .message(message)
                .build();
    }
}
