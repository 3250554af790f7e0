package com.vidnyan.reqtrace.domain.error;

/**
 * A query named a rule id, path or spec/impl that the current snapshot does not contain.
 * An expected outcome of exploratory queries, not a fault.
 */
public class NotFoundException extends RuntimeException {

    private final String subject;

    public NotFoundException(String subject, String message) {
        super(message);
        this.subject = subject;
    }

    public static NotFoundException rule(String ruleId) {
        return new NotFoundException(ruleId, "Rule not found: " + ruleId);
    }

    public static NotFoundException specImpl(String specImpl) {
        return new NotFoundException(specImpl, "Unknown spec/impl: " + specImpl);
    }

    public static NotFoundException path(String path) {
        return new NotFoundException(path, "No scanned file under path: " + path);
    }

    public static NotFoundException file(String path) {
        return new NotFoundException(path, "File not scanned: " + path);
    }

    public String getSubject() {
        return subject;
    }
}
