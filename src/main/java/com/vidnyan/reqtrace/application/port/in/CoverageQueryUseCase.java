package com.vidnyan.reqtrace.application.port.in;

import com.vidnyan.reqtrace.domain.config.ImplConfig;
import com.vidnyan.reqtrace.domain.index.DirectoryCoverage;
import com.vidnyan.reqtrace.domain.model.Location;
import com.vidnyan.reqtrace.domain.model.Reference;
import com.vidnyan.reqtrace.domain.model.Rule;
import com.vidnyan.reqtrace.domain.model.RuleLevel;
import com.vidnyan.reqtrace.domain.model.UnitKind;
import com.vidnyan.reqtrace.domain.validation.Finding;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Read-only questions about the current coverage snapshot.
 * Every front-end (HTTP, CLI, assistant tools) goes through this interface.
 * All operations are deterministic functions of the snapshot and their arguments.
 *
 * <p>{@code specImpl} arguments take the form {@code spec/impl}; null means every pairing.
 * Unknown pairings, rule ids and paths raise
 * {@link com.vidnyan.reqtrace.domain.error.NotFoundException}.
 */
public interface CoverageQueryUseCase {

    /**
     * Coverage totals per (spec, impl) pairing.
     */
    StatusReport status();

    /**
     * Rules without implementation references.
     */
    List<RuleSummary> uncovered(@Nullable String specImpl, @Nullable String prefix);

    /**
     * Rules without verification references.
     */
    List<RuleSummary> untested(@Nullable String specImpl, @Nullable String prefix);

    /**
     * References whose captured fingerprint no longer matches the rule.
     */
    List<StaleEntry> stale(@Nullable String specImpl, @Nullable String prefix);

    /**
     * Code units without rule references, with the coverage tree of the scope.
     */
    UnmappedReport unmapped(@Nullable String specImpl, @Nullable String path);

    /**
     * One scanned file with all of its units and the rule ids each unit carries.
     */
    FileDetail fileDetail(String path);

    /**
     * Every declaration of a rule and all references to it.
     */
    RuleDetail ruleDetail(String ruleId);

    /**
     * Current validation findings.
     */
    List<Finding> validate(@Nullable String specImpl);

    /**
     * Ranked matches over rule text and source units.
     */
    List<SearchHit> search(String query, int limit);

    /**
     * The configuration the snapshot was built from.
     */
    ConfigView config();

    /**
     * Version of the snapshot currently served.
     */
    long version();

    record StatusReport(
        long version,
        Instant builtAt,
        List<ImplStatus> impls,
        int findingCount
    ) {}

    record ImplStatus(
        String spec,
        String impl,
        int totalRules,
        int implementedRules,
        int verifiedRules,
        int staleReferences,
        double implPercent,
        double verifyPercent,
        int totalUnits,
        int coveredUnits
    ) {}

    record RuleSummary(
        String spec,
        String impl,
        String id,
        @Nullable RuleLevel level,
        String text,
        Location location
    ) {}

    record StaleEntry(
        String spec,
        String impl,
        String ruleId,
        Location location,
        String capturedFingerprint,
        String currentFingerprint
    ) {}

    record UnmappedReport(
        String scope,
        DirectoryCoverage coverage,
        List<UnmappedUnit> units
    ) {}

    record UnmappedUnit(
        String file,
        int startLine,
        int endLine,
        UnitKind kind,
        @Nullable String name
    ) {}

    /**
     * @param testOnly     file is included only as a test file and does not count toward unit coverage
     * @param sourceOwners pairings including the file as source, as {@code spec/impl}
     * @param testOwners   pairings including the file as a test file
     */
    record FileDetail(
        String path,
        boolean testOnly,
        List<String> sourceOwners,
        List<String> testOwners,
        int totalUnits,
        int coveredUnits,
        List<FileUnit> units
    ) {}

    record FileUnit(
        int startLine,
        int endLine,
        UnitKind kind,
        @Nullable String name,
        List<String> ruleRefs
    ) {}

    record RuleDetail(
        String id,
        List<Rule> declarations,
        List<Reference> implRefs,
        List<Reference> verifyRefs,
        List<Reference> dependsRefs,
        List<Reference> relatedRefs,
        List<StaleEntry> stale
    ) {}

    enum HitKind {
        RULE,
        SOURCE
    }

    /**
     * @param id          rule id, or file path for source hits
     * @param line        declaring line, or matched source line
     * @param matchLength length of the matched text; shorter wins ties
     */
    record SearchHit(
        HitKind kind,
        String id,
        int line,
        String snippet,
        double score,
        int matchLength
    ) {}

    record ConfigView(
        String projectRoot,
        String source,
        List<SpecView> specs
    ) {}

    record SpecView(
        String name,
        String prefix,
        @Nullable String sourceUrl,
        List<String> include,
        List<ImplConfig> impls
    ) {}
}
