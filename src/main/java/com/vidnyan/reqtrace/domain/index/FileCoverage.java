package com.vidnyan.reqtrace.domain.index;

/**
 * Unit coverage of one file.
 */
public record FileCoverage(
    String path,
    int totalUnits,
    int coveredUnits
) {

    public static FileCoverage of(FileEntry entry) {
        return new FileCoverage(entry.path(), entry.totalUnits(), entry.coveredUnits());
    }
}
