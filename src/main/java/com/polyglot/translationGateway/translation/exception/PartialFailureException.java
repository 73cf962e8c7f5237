package com.polyglot.translationGateway.translation.exception;

import com.polyglot.translationGateway.translation.model.UnitFailure;
import com.polyglot.translationGateway.translation.model.UnitOutcome;

import java.util.List;

/**
 * Exception thrown when some units of a batch were translated and others failed.
 * Carries every outcome, index-aligned with the request, so callers can retry only the failed indices.
 */
public class PartialFailureException extends RuntimeException {

    private final List<UnitOutcome> outcomes;

    public PartialFailureException(List<UnitOutcome> outcomes) {
        super("Batch partially failed: " + outcomes.stream().filter(o -> !o.isSuccess()).count()
                + " of " + outcomes.size() + " units failed");
        this.outcomes = List.copyOf(outcomes);
    }

    public List<UnitOutcome> getOutcomes() {
        return outcomes;
    }

    public List<UnitOutcome> getSuccesses() {
        return outcomes.stream().filter(UnitOutcome::isSuccess).toList();
    }

    public List<UnitFailure> getFailures() {
        return outcomes.stream()
                .filter(outcome -> !outcome.isSuccess())
                .map(UnitOutcome::getFailure)
                .toList();
    }
}
