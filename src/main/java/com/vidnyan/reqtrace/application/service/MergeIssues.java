package com.vidnyan.reqtrace.application.service;

import com.vidnyan.reqtrace.application.port.out.SourceScanner.AnnotationProblem;
import com.vidnyan.reqtrace.domain.model.Reference;

import java.util.List;

/**
 * Problems met while attaching scanned annotations to the forward index.
 *
 * @param broken     references to rule ids their spec does not declare
 * @param implInTest impl references found in test files, not attached
 * @param problems   malformed or mismatched annotation candidates
 */
public record MergeIssues(
    List<Reference> broken,
    List<Reference> implInTest,
    List<FileProblem> problems
) {

    public MergeIssues {
        broken = List.copyOf(broken);
        implInTest = List.copyOf(implInTest);
        problems = List.copyOf(problems);
    }

    public record FileProblem(String file, AnnotationProblem problem) {}
}
