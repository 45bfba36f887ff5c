package io.eventmatch.core.error;

import java.util.Map;

/**
 * Thrown when caller-supplied declarations cannot be merged into the evaluation environment
 * (invalid identifier, missing kind, conflicting declarations, or a host value whose kind differs
 * from its declaration).
 */
public final class EnvironmentBuildException extends RuleEvaluationException {

    private static final long serialVersionUID = 1L;

    private final String variable;

    public EnvironmentBuildException(String message, String variable, String expression) {
        super(message, expression, Stage.ENVIRONMENT);
        this.variable = variable;
    }

    /** The offending variable name, or {@code null} if not attributable to one. */
    public String variable() {
        return variable;
    }

    @Override
    protected void contributeContext(Map<String, Object> context) {
        if (variable != null) {
            context.put("variable", variable);
        }
    }
}
