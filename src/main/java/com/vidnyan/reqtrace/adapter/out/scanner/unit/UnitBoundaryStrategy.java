package com.vidnyan.reqtrace.adapter.out.scanner.unit;

import com.vidnyan.reqtrace.adapter.out.scanner.LexedLine;
import com.vidnyan.reqtrace.domain.model.CodeUnit;

import java.util.List;

/**
 * Finds declaration units in a lexed file.
 * Results may nest but never partially overlap.
 */
public interface UnitBoundaryStrategy {

    List<CodeUnit> detect(String path, List<LexedLine> lines);
}
