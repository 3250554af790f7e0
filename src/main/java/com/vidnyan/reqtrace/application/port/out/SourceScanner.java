package com.vidnyan.reqtrace.application.port.out;

import com.vidnyan.reqtrace.domain.model.CodeUnit;
import com.vidnyan.reqtrace.domain.model.RefVerb;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Set;

/**
 * Port for lexically scanning one source file for annotations and code units.
 * Implementations must be free of shared mutable state: files are scanned in parallel.
 */
public interface SourceScanner {

    /**
     * Scan a file.
     *
     * @param path          project-relative path, used to pick the language
     * @param content       raw file text
     * @param ownedPrefixes prefixes of the specs whose implementations include this file
     */
    ScannedFile scan(String path, String content, Set<String> ownedPrefixes);

    /**
     * Scan output. Units carry no rule refs yet; the index builder fills them.
     *
     * @param path        project-relative path
     * @param language    tag of the language profile used
     * @param lines       file content split into lines
     * @param units       detected and synthesized units, ordered by start line then widest first
     * @param annotations well-formed annotations, in line order
     * @param problems    malformed or mismatched annotation candidates
     */
    record ScannedFile(
        String path,
        String language,
        List<String> lines,
        List<CodeUnit> units,
        List<ScannedAnnotation> annotations,
        List<AnnotationProblem> problems
    ) {}

    /**
     * A well-formed annotation.
     *
     * @param unitIndex index into {@link ScannedFile#units()} of the innermost unit holding it
     */
    record ScannedAnnotation(
        String prefix,
        RefVerb verb,
        String ruleId,
        @Nullable String fingerprint,
        int line,
        int unitIndex
    ) {}

    /**
     * An annotation candidate that could not be accepted.
     */
    record AnnotationProblem(
        ProblemKind kind,
        String prefix,
        String text,
        int line,
        String reason
    ) {}

    enum ProblemKind {
        MALFORMED,
        PREFIX_MISMATCH
    }
}
