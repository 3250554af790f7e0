package com.vidnyan.reqtrace.domain.model;

/**
 * Best-effort classification of a code unit.
 */
public enum UnitKind {
    FUNCTION,
    TYPE,
    BLOCK,
    LINE    // synthesized around an annotation with no enclosing unit
}
