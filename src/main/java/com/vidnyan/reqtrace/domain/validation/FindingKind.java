package com.vidnyan.reqtrace.domain.validation;

/**
 * Kinds of non-fatal facts reported about the index.
 */
public enum FindingKind {
    CONFIG_ERROR,           // pattern set empty or unmatched, duplicate names, shared prefix
    BROKEN_REFERENCE,       // rule id not declared in the spec owning the prefix
    DUPLICATE_RULE_ID,      // id declared more than once in one spec
    PREFIX_MISMATCH,        // prefix owned by no spec of the file, or by several
    MALFORMED_ANNOTATION,   // unknown verb, empty or invalid id, bad fingerprint
    IMPL_IN_TEST_FILE,      // impl annotation in a file matched only by testInclude
    STALE                   // captured fingerprint no longer matches the rule text
}
