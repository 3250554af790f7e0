package com.vidnyan.reqtrace.application.service;

import com.vidnyan.reqtrace.application.port.in.CoverageQueryUseCase;
import com.vidnyan.reqtrace.application.port.out.TraceConfigSource;
import com.vidnyan.reqtrace.domain.config.SpecImplKey;
import com.vidnyan.reqtrace.domain.error.NotFoundException;
import com.vidnyan.reqtrace.domain.index.CoverageSnapshot;
import com.vidnyan.reqtrace.domain.index.DirectoryCoverage;
import com.vidnyan.reqtrace.domain.index.FileEntry;
import com.vidnyan.reqtrace.domain.index.ReverseIndex;
import com.vidnyan.reqtrace.domain.index.RuleRefs;
import com.vidnyan.reqtrace.domain.index.SpecIndex;
import com.vidnyan.reqtrace.domain.index.StaleReference;
import com.vidnyan.reqtrace.domain.model.CodeUnit;
import com.vidnyan.reqtrace.domain.model.Reference;
import com.vidnyan.reqtrace.domain.model.Rule;
import com.vidnyan.reqtrace.domain.validation.Finding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Answers coverage questions from the live snapshot.
 * Each call reads the snapshot once, so a concurrent swap never mixes two versions in one answer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CoverageQueryService implements CoverageQueryUseCase {

    public static final int DEFAULT_SEARCH_LIMIT = 50;

    private static final Comparator<Reference> BY_SITE = Comparator
            .comparing(Reference::file)
            .thenComparingInt(Reference::line)
            .thenComparing(Reference::spec)
            .thenComparing(Reference::impl);

    private final ReloadController reloadController;
    private final TraceConfigSource configSource;

    @Override
    public StatusReport status() {
        CoverageSnapshot snapshot = reloadController.snapshot();
        List<ImplStatus> impls = new ArrayList<>();
        for (SpecImplKey key : snapshot.pairs()) {
            Optional<SpecIndex> spec = snapshot.forward().spec(key.spec());
            if (spec.isEmpty()) {
                continue;
            }
            impls.add(implStatus(snapshot, spec.get(), key));
        }
        return new StatusReport(snapshot.version(), snapshot.builtAt(), impls, snapshot.findings().size());
    }

    private ImplStatus implStatus(CoverageSnapshot snapshot, SpecIndex spec, SpecImplKey key) {
        int total = spec.ruleIds().size();
        int implemented = 0;
        int verified = 0;
        for (String id : spec.ruleIds()) {
            RuleRefs refs = spec.refs(key.impl(), id);
            if (refs.isImplemented()) {
                implemented++;
            }
            if (refs.isVerified()) {
                verified++;
            }
        }
        int stale = (int) snapshot.stale().stream().filter(s -> belongsTo(s.reference(), key)).count();
        DirectoryCoverage units = snapshot.reverse().coverage("", key);
        return new ImplStatus(key.spec(), key.impl(), total, implemented, verified, stale,
                percent(implemented, total), percent(verified, total),
                units.totalUnits(), units.coveredUnits());
    }

    @Override
    public List<RuleSummary> uncovered(@Nullable String specImpl, @Nullable String prefix) {
        return rulesWhere(specImpl, prefix, refs -> !refs.isImplemented());
    }

    @Override
    public List<RuleSummary> untested(@Nullable String specImpl, @Nullable String prefix) {
        return rulesWhere(specImpl, prefix, refs -> !refs.isVerified());
    }

    private List<RuleSummary> rulesWhere(String specImpl, String prefix, Predicate<RuleRefs> condition) {
        CoverageSnapshot snapshot = reloadController.snapshot();
        List<RuleSummary> result = new ArrayList<>();
        for (SpecImplKey key : pairs(snapshot, specImpl)) {
            SpecIndex spec = snapshot.forward().spec(key.spec()).orElse(null);
            if (spec == null) {
                continue;
            }
            for (String id : spec.ruleIds()) {
                if (matchesPrefix(id, prefix) && condition.test(spec.refs(key.impl(), id))) {
                    Rule rule = spec.rule(id).orElseThrow();
                    result.add(new RuleSummary(key.spec(), key.impl(), id, rule.level(), rule.text(), rule.location()));
                }
            }
        }
        return result;
    }

    @Override
    public List<StaleEntry> stale(@Nullable String specImpl, @Nullable String prefix) {
        CoverageSnapshot snapshot = reloadController.snapshot();
        Set<SpecImplKey> pairs = pairs(snapshot, specImpl);
        return snapshot.stale().stream()
                .filter(s -> pairs.contains(new SpecImplKey(s.reference().spec(), s.reference().impl())))
                .filter(s -> matchesPrefix(s.reference().ruleId(), prefix))
                .map(CoverageQueryService::staleEntry)
                .toList();
    }

    @Override
    public UnmappedReport unmapped(@Nullable String specImpl, @Nullable String path) {
        CoverageSnapshot snapshot = reloadController.snapshot();
        SpecImplKey key = specImpl == null ? null : pairs(snapshot, specImpl).iterator().next();
        String scope = ReverseIndex.normalizeScope(path);
        if (!scope.isEmpty() && snapshot.reverse().filesUnder(scope, e -> true).isEmpty()) {
            throw NotFoundException.path(scope);
        }

        List<UnmappedUnit> units = new ArrayList<>();
        for (FileEntry file : snapshot.reverse().filesUnder(scope, ReverseIndex.countedFor(key))) {
            for (CodeUnit unit : file.units()) {
                if (!unit.isCovered()) {
                    units.add(new UnmappedUnit(file.path(), unit.startLine(), unit.endLine(), unit.kind(), unit.name()));
                }
            }
        }
        return new UnmappedReport(scope, snapshot.reverse().coverage(scope, key), units);
    }

    @Override
    public FileDetail fileDetail(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("File path must not be blank");
        }
        String normalized = ReverseIndex.normalizeScope(path);
        FileEntry file = reloadController.snapshot().reverse().file(normalized)
                .orElseThrow(() -> NotFoundException.file(normalized));

        List<FileUnit> units = file.units().stream()
                .map(u -> new FileUnit(u.startLine(), u.endLine(), u.kind(), u.name(), List.copyOf(u.ruleRefs())))
                .toList();
        return new FileDetail(file.path(), file.isTestOnly(),
                file.sourceOwners().stream().map(SpecImplKey::toString).toList(),
                file.testOwners().stream().map(SpecImplKey::toString).toList(),
                file.totalUnits(), file.coveredUnits(), units);
    }

    @Override
    public RuleDetail ruleDetail(String ruleId) {
        CoverageSnapshot snapshot = reloadController.snapshot();
        List<Rule> declarations = snapshot.forward().declarationsAnywhere(ruleId);
        if (declarations.isEmpty()) {
            throw NotFoundException.rule(ruleId);
        }

        List<Reference> impl = new ArrayList<>();
        List<Reference> verify = new ArrayList<>();
        List<Reference> depends = new ArrayList<>();
        List<Reference> related = new ArrayList<>();
        for (SpecIndex spec : snapshot.forward().specs()) {
            if (!spec.hasRule(ruleId)) {
                continue;
            }
            for (String implName : spec.impls()) {
                RuleRefs refs = spec.refs(implName, ruleId);
                impl.addAll(refs.implRefs());
                verify.addAll(refs.verifyRefs());
                depends.addAll(refs.dependsRefs());
                related.addAll(refs.relatedRefs());
            }
        }
        List<StaleEntry> stale = snapshot.stale().stream()
                .filter(s -> s.reference().ruleId().equals(ruleId))
                .map(CoverageQueryService::staleEntry)
                .toList();
        return new RuleDetail(ruleId, declarations, sorted(impl), sorted(verify), sorted(depends), sorted(related), stale);
    }

    @Override
    public List<Finding> validate(@Nullable String specImpl) {
        CoverageSnapshot snapshot = reloadController.snapshot();
        if (specImpl == null) {
            return snapshot.findings();
        }
        SpecImplKey key = pairs(snapshot, specImpl).iterator().next();
        return snapshot.findings().stream()
                .filter(f -> concerns(snapshot, f, key))
                .toList();
    }

    /**
     * Findings about the pair, its spec, or a file the pair includes.
     */
    private static boolean concerns(CoverageSnapshot snapshot, Finding finding, SpecImplKey key) {
        if (finding.specImpl() != null) {
            return finding.specImpl().equals(key.toString()) || finding.specImpl().equals(key.spec());
        }
        if (finding.primaryLocation() == null) {
            return false;
        }
        return snapshot.reverse().file(finding.primaryLocation().filePath())
                .map(e -> e.sourceOwners().contains(key) || e.testOwners().contains(key))
                .orElse(false);
    }

    @Override
    public List<SearchHit> search(String query, int limit) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Search query must not be blank");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("Search limit must be at least 1, got " + limit);
        }
        return SourceSearch.search(reloadController.snapshot(), query, limit);
    }

    @Override
    public ConfigView config() {
        CoverageSnapshot snapshot = reloadController.snapshot();
        List<SpecView> specs = snapshot.config().specs().stream()
                .map(s -> new SpecView(s.name(), s.prefix(), s.sourceUrl(), s.include(), s.impls()))
                .toList();
        return new ConfigView(snapshot.projectRoot(), configSource.describe(), specs);
    }

    @Override
    public long version() {
        return reloadController.version();
    }

    /**
     * The pairs a query covers: all of them, or the one named.
     */
    private static Set<SpecImplKey> pairs(CoverageSnapshot snapshot, String specImpl) {
        if (specImpl == null) {
            return snapshot.pairs();
        }
        SpecImplKey key = SpecImplKey.parse(specImpl);
        if (!snapshot.pairs().contains(key)) {
            throw NotFoundException.specImpl(specImpl);
        }
        return Set.of(key);
    }

    /**
     * Rule id equals the prefix or lies below it; a prefix ending in '.' matches by plain string prefix.
     */
    static boolean matchesPrefix(String ruleId, String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            return true;
        }
        if (prefix.endsWith(".")) {
            return ruleId.startsWith(prefix);
        }
        return ruleId.equals(prefix) || ruleId.startsWith(prefix + ".");
    }

    static double percent(int covered, int total) {
        return total == 0 ? 0.0 : covered * 100.0 / total;
    }

    private static boolean belongsTo(Reference ref, SpecImplKey key) {
        return ref.spec().equals(key.spec()) && ref.impl().equals(key.impl());
    }

    private static StaleEntry staleEntry(StaleReference s) {
        Reference ref = s.reference();
        return new StaleEntry(ref.spec(), ref.impl(), ref.ruleId(), ref.location(),
                ref.capturedFingerprint(), s.currentFingerprint());
    }

    private static List<Reference> sorted(List<Reference> refs) {
        List<Reference> copy = new ArrayList<>(refs);
        copy.sort(BY_SITE);
        return copy;
    }
}
