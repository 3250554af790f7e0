package com.vidnyan.reqtrace.domain.index;

import com.vidnyan.reqtrace.domain.config.SpecImplKey;
import com.vidnyan.reqtrace.domain.model.CodeUnit;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Reverse-index entry for one scanned file.
 *
 * @param path        project-relative path
 * @param units       code units ordered by start line, then widest first
 * @param sourceOwners pairs that include this file as implementation source
 * @param testOwners  pairs that include this file only as a test file
 * @param lines       file content, kept for source search
 */
public record FileEntry(
    String path,
    List<CodeUnit> units,
    SortedSet<SpecImplKey> sourceOwners,
    SortedSet<SpecImplKey> testOwners,
    List<String> lines
) {

    public FileEntry {
        units = List.copyOf(units);
        sourceOwners = Collections.unmodifiableSortedSet(new TreeSet<>(sourceOwners));
        testOwners = Collections.unmodifiableSortedSet(new TreeSet<>(testOwners));
        lines = List.copyOf(lines);
    }

    /**
     * A test-only file verifies rules but does not count toward unit coverage.
     */
    public boolean isTestOnly() {
        return sourceOwners.isEmpty();
    }

    public boolean isSourceOf(SpecImplKey key) {
        return sourceOwners.contains(key);
    }

    public int totalUnits() {
        return units.size();
    }

    public int coveredUnits() {
        return (int) units.stream().filter(CodeUnit::isCovered).count();
    }
}
