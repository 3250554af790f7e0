package com.vidnyan.reqtrace.application.port.out;

import com.vidnyan.reqtrace.domain.config.SpecImplKey;
import com.vidnyan.reqtrace.domain.config.TraceConfig;
import com.vidnyan.reqtrace.domain.validation.Finding;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Port for expanding configured glob patterns into concrete file lists.
 */
public interface FileSetResolver {

    /**
     * Resolve every spec's documents and every (spec, impl) pair's files.
     * Pairings or specs whose pattern sets are unusable are left out and reported as findings.
     *
     * @param projectRoot directory the patterns are relative to
     * @param config      the configuration to resolve
     * @return sorted, deterministic file sets
     * @throws IOException when the project tree cannot be walked
     */
    Resolution resolve(Path projectRoot, TraceConfig config) throws IOException;

    /**
     * Resolution result.
     *
     * @param specDocuments spec name to sorted document paths, usable specs only
     * @param implFiles     usable pairings to their files
     * @param findings      configuration findings raised while resolving
     */
    record Resolution(
        Map<String, List<String>> specDocuments,
        SortedMap<SpecImplKey, ImplFiles> implFiles,
        List<Finding> findings
    ) {}

    /**
     * Files of one pairing, both lists sorted, disjoint.
     */
    record ImplFiles(
        List<String> sources,
        List<String> tests
    ) {}
}
