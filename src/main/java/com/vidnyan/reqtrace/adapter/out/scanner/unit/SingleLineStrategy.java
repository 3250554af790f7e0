package com.vidnyan.reqtrace.adapter.out.scanner.unit;

import com.vidnyan.reqtrace.adapter.out.scanner.LexedLine;
import com.vidnyan.reqtrace.domain.model.CodeUnit;

import java.util.List;

/**
 * For languages without recognizable declarations; every annotation gets a synthesized line unit.
 */
public class SingleLineStrategy implements UnitBoundaryStrategy {

    @Override
    public List<CodeUnit> detect(String path, List<LexedLine> lines) {
        return List.of();
    }
}
