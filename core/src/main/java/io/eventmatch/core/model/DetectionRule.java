package io.eventmatch.core.model;

import java.util.Objects;

/**
 * A detection rule: a boolean expression evaluated against each incoming event.
 *
 * @param id         numeric rule identifier, used by the disabled-rules configuration
 * @param name       human-readable rule name
 * @param expression the rule body
 */
public record DetectionRule(long id, String name, String expression) {

    public DetectionRule {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
    }
}
