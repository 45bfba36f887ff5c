package io.eventmatch.core.model;

import io.eventmatch.core.error.RuleEvaluationException;
import java.util.List;
import java.util.Map;

/**
 * Outcome of matching one event against a rule set.
 *
 * @param matched  ids of rules whose expression evaluated to {@code true}, in rule order
 * @param disabled ids of rules skipped because the configuration disables them
 * @param failures rules that could not be evaluated against this event, by id
 */
public record MatchReport(List<Long> matched, List<Long> disabled, Map<Long, RuleEvaluationException> failures) {

    public MatchReport {
        matched = List.copyOf(matched);
        disabled = List.copyOf(disabled);
        failures = Map.copyOf(failures);
    }

    /** Returns {@code true} if at least one rule matched. */
    public boolean anyMatched() {
        return !matched.isEmpty();
    }
}
