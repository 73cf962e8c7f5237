package com.polyglot.translationGateway.translation.exception;

import com.polyglot.translationGateway.translation.model.UnitFailure;

import java.util.List;

/**
 * Exception thrown when no unit of a batch could be translated.
 */
public class TotalFailureException extends RuntimeException {

    private final List<UnitFailure> failures;

    public TotalFailureException(List<UnitFailure> failures) {
        super("All " + failures.size() + " units failed");
        this.failures = List.copyOf(failures);
    }

    public List<UnitFailure> getFailures() {
        return failures;
    }

    /**
     * Whether retrying the whole batch may succeed.
     */
    public boolean isRetryable() {
        return failures.stream().anyMatch(UnitFailure::isRetryable);
    }
}
