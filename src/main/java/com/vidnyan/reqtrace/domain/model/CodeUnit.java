package com.vidnyan.reqtrace.domain.model;

import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A contiguous, inclusive line range of one file used as the coverage granule.
 * Immutable value object.
 */
public record CodeUnit(
    String file,
    int startLine,
    int endLine,
    UnitKind kind,
    @Nullable String name,
    SortedSet<String> ruleRefs
) {

    public CodeUnit {
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException(
                    "Invalid unit span " + startLine + "-" + endLine + " in " + file);
        }
        ruleRefs = Collections.unmodifiableSortedSet(new TreeSet<>(ruleRefs));
    }

    public static CodeUnit of(String file, int startLine, int endLine, UnitKind kind, String name) {
        return new CodeUnit(file, startLine, endLine, kind, name, new TreeSet<>());
    }

    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }

    public int span() {
        return endLine - startLine + 1;
    }

    public boolean isCovered() {
        return !ruleRefs.isEmpty();
    }

    /**
     * Copy of this unit carrying the given rule ids.
     */
    public CodeUnit withRuleRefs(Set<String> ids) {
        return new CodeUnit(file, startLine, endLine, kind, name, new TreeSet<>(ids));
    }
}
