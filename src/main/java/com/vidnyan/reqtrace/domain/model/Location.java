package com.vidnyan.reqtrace.domain.model;

/**
 * Source location: project-relative path (always '/' separated) and 1-based line.
 */
public record Location(
    String filePath,
    int line
) {

    public static Location at(String filePath, int line) {
        return new Location(filePath, line);
    }

    /**
     * Format as readable string.
     */
    public String format() {
        return filePath + ":" + line;
    }
}
