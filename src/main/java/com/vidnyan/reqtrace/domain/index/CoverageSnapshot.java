package com.vidnyan.reqtrace.domain.index;

import com.vidnyan.reqtrace.domain.config.SpecImplKey;
import com.vidnyan.reqtrace.domain.config.TraceConfig;
import com.vidnyan.reqtrace.domain.validation.Finding;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The complete, queryable result of one rebuild.
 * Immutable aggregate root; replaced wholesale on the next rebuild.
 *
 * @param version     monotonic counter, bumped once per swapped rebuild
 * @param builtAt     completion time of the rebuild
 * @param projectRoot absolute project root the paths are relative to
 * @param config      configuration the snapshot was built from
 * @param pairs       (spec, impl) pairings that survived configuration checks
 * @param forward     rule-centric view
 * @param reverse     file-centric view
 * @param findings    all validation findings, sorted
 * @param stale       stale references, sorted by site
 */
public record CoverageSnapshot(
    long version,
    Instant builtAt,
    String projectRoot,
    TraceConfig config,
    SortedSet<SpecImplKey> pairs,
    ForwardIndex forward,
    ReverseIndex reverse,
    List<Finding> findings,
    List<StaleReference> stale
) {

    public CoverageSnapshot {
        pairs = Collections.unmodifiableSortedSet(new TreeSet<>(pairs));
        findings = List.copyOf(findings);
        stale = List.copyOf(stale);
    }

    /**
     * Placeholder served before the first successful rebuild.
     */
    public static CoverageSnapshot empty(String projectRoot) {
        return new CoverageSnapshot(0L, Instant.EPOCH, projectRoot, new TraceConfig(List.of()),
                new TreeSet<>(), ForwardIndex.EMPTY, ReverseIndex.EMPTY, List.of(), List.of());
    }

    /**
     * Same content under a new version number.
     */
    public CoverageSnapshot withVersion(long newVersion) {
        return new CoverageSnapshot(newVersion, builtAt, projectRoot, config, pairs,
                forward, reverse, findings, stale);
    }
}
